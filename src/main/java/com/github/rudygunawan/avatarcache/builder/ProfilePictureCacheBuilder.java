package com.github.rudygunawan.avatarcache.builder;

import com.github.rudygunawan.avatarcache.api.ProfileLookup;
import com.github.rudygunawan.avatarcache.impl.DefaultProfilePictureCache;
import com.github.rudygunawan.avatarcache.listener.RemovalListener;
import com.github.rudygunawan.avatarcache.policy.EvictionPolicy;
import com.github.rudygunawan.avatarcache.time.Ticker;

import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link DefaultProfilePictureCache} instances.
 *
 * <p>Every setting has a default, so {@code ProfilePictureCacheBuilder.newBuilder().build()}
 * yields a working cache: at most 100 entries, a 5 minute TTL, segmented LRU eviction, and
 * background refresh enabled but with nothing to refresh from until a {@link ProfileLookup} is
 * supplied.
 *
 * <p>Usage example:
 * <pre>{@code
 * DefaultProfilePictureCache avatars = ProfilePictureCacheBuilder.newBuilder()
 *     .maximumSize(100)
 *     .expireAfterWrite(5, TimeUnit.MINUTES)
 *     .profileLookup(userId -> profileClient.fetchPhotoUrl(userId))
 *     .refreshInterval(30, TimeUnit.SECONDS)
 *     .build();
 * }</pre>
 */
public class ProfilePictureCacheBuilder {
    private static final int DEFAULT_MAXIMUM_SIZE = 100;
    private static final long DEFAULT_EXPIRE_AFTER_WRITE_NANOS = TimeUnit.MINUTES.toNanos(5);
    private static final long UNSET_INT = -1;

    private int maximumSize = DEFAULT_MAXIMUM_SIZE;
    private long expireAfterWriteNanos = DEFAULT_EXPIRE_AFTER_WRITE_NANOS;
    private EvictionPolicy evictionPolicy = EvictionPolicy.SEGMENTED_LRU;
    private Ticker ticker = Ticker.systemTicker();
    private ProfileLookup profileLookup;
    private Executor refreshExecutor;
    private long refreshIntervalNanos = UNSET_INT;
    private ScheduledExecutorService scheduler;
    private boolean backgroundRefreshEnabled = true;
    private Executor notificationExecutor;
    private int notificationBufferSize = Flow.defaultBufferSize();
    private RemovalListener removalListener;

    private ProfilePictureCacheBuilder() {
    }

    /**
     * Constructs a new {@code ProfilePictureCacheBuilder} instance with default settings.
     */
    public static ProfilePictureCacheBuilder newBuilder() {
        return new ProfilePictureCacheBuilder();
    }

    /**
     * Specifies the maximum number of entries the cache may hold. Defaults to 100.
     *
     * @throws IllegalArgumentException if {@code maximumSize} is not positive
     */
    public ProfilePictureCacheBuilder maximumSize(int maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximum size must be positive");
        }
        this.maximumSize = maximumSize;
        return this;
    }

    /**
     * Specifies how long after its last authoritative write an entry is considered fresh.
     * Stale entries are still served; they are only queued for refresh. Defaults to 5 minutes.
     *
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public ProfilePictureCacheBuilder expireAfterWrite(long duration, TimeUnit unit) {
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive: " + duration + " " + unit);
        }
        this.expireAfterWriteNanos = unit.toNanos(duration);
        return this;
    }

    /**
     * Specifies the policy used to pick victims when the cache is over its maximum size.
     * Defaults to {@link EvictionPolicy#SEGMENTED_LRU}.
     */
    public ProfilePictureCacheBuilder evictionPolicy(EvictionPolicy evictionPolicy) {
        if (evictionPolicy == null) {
            throw new NullPointerException("evictionPolicy cannot be null");
        }
        this.evictionPolicy = evictionPolicy;
        return this;
    }

    /**
     * Specifies the time source for staleness and access ordering. Mainly for tests.
     */
    public ProfilePictureCacheBuilder ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Specifies the authoritative source used by background refresh. Without one, stale users
     * are still queued and counted, but never refreshed.
     */
    public ProfilePictureCacheBuilder profileLookup(ProfileLookup profileLookup) {
        if (profileLookup == null) {
            throw new NullPointerException("profileLookup cannot be null");
        }
        this.profileLookup = profileLookup;
        return this;
    }

    /**
     * Specifies the executor that runs profile lookups. Defaults to
     * {@link ForkJoinPool#commonPool()}.
     */
    public ProfilePictureCacheBuilder refreshExecutor(Executor refreshExecutor) {
        if (refreshExecutor == null) {
            throw new NullPointerException("refreshExecutor cannot be null");
        }
        this.refreshExecutor = refreshExecutor;
        return this;
    }

    /**
     * Drains the refresh queue periodically on a background daemon thread. Off by default, in
     * which case the queue is only drained through {@code drainRefreshQueue()}.
     *
     * @throws IllegalArgumentException if {@code interval} is not positive
     */
    public ProfilePictureCacheBuilder refreshInterval(long interval, TimeUnit unit) {
        if (interval <= 0) {
            throw new IllegalArgumentException("refresh interval must be positive: " + interval + " " + unit);
        }
        this.refreshIntervalNanos = unit.toNanos(interval);
        return this;
    }

    /**
     * Specifies the scheduler for the periodic drain instead of a cache-owned daemon thread.
     * A supplied scheduler is not shut down by the cache.
     */
    public ProfilePictureCacheBuilder scheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new NullPointerException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Sets whether stale entries are queued for refresh at start-up. Defaults to true.
     */
    public ProfilePictureCacheBuilder backgroundRefreshEnabled(boolean backgroundRefreshEnabled) {
        this.backgroundRefreshEnabled = backgroundRefreshEnabled;
        return this;
    }

    /**
     * Specifies the executor that delivers snapshots to subscribers.
     */
    public ProfilePictureCacheBuilder notificationExecutor(Executor notificationExecutor) {
        if (notificationExecutor == null) {
            throw new NullPointerException("notificationExecutor cannot be null");
        }
        this.notificationExecutor = notificationExecutor;
        return this;
    }

    /**
     * Specifies how many snapshots may wait for one subscriber before further snapshots are
     * dropped for it. Defaults to {@link Flow#defaultBufferSize()}.
     *
     * @throws IllegalArgumentException if {@code bufferSize} is not positive
     */
    public ProfilePictureCacheBuilder notificationBufferSize(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("notification buffer size must be positive");
        }
        this.notificationBufferSize = bufferSize;
        return this;
    }

    /**
     * Specifies a listener notified whenever an entry leaves the cache.
     */
    public ProfilePictureCacheBuilder removalListener(RemovalListener removalListener) {
        if (removalListener == null) {
            throw new NullPointerException("removalListener cannot be null");
        }
        this.removalListener = removalListener;
        return this;
    }

    /**
     * Builds a cache with the current settings.
     *
     * @throws IllegalStateException if a refresh interval was set without a profile lookup
     */
    public DefaultProfilePictureCache build() {
        if (refreshIntervalNanos > 0 && profileLookup == null) {
            throw new IllegalStateException("refreshInterval requires a profileLookup");
        }
        return new DefaultProfilePictureCache(this);
    }

    public int getMaximumSize() {
        return maximumSize;
    }

    public long getExpireAfterWriteNanos() {
        return expireAfterWriteNanos;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public ProfileLookup getProfileLookup() {
        return profileLookup;
    }

    public Executor getRefreshExecutor() {
        return refreshExecutor != null ? refreshExecutor : ForkJoinPool.commonPool();
    }

    public long getRefreshIntervalNanos() {
        return refreshIntervalNanos;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public boolean isBackgroundRefreshEnabled() {
        return backgroundRefreshEnabled;
    }

    public Executor getNotificationExecutor() {
        return notificationExecutor;
    }

    public int getNotificationBufferSize() {
        return notificationBufferSize;
    }

    public RemovalListener getRemovalListener() {
        return removalListener;
    }
}
