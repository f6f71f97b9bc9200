package com.github.rudygunawan.avatarcache.impl;

import com.github.rudygunawan.avatarcache.api.ProfilePictureCache;
import com.github.rudygunawan.avatarcache.builder.ProfilePictureCacheBuilder;
import com.github.rudygunawan.avatarcache.listener.ChangeNotifier;
import com.github.rudygunawan.avatarcache.listener.ProfilePictureListener;
import com.github.rudygunawan.avatarcache.listener.ProfilePictureSubscription;
import com.github.rudygunawan.avatarcache.listener.RemovalListener;
import com.github.rudygunawan.avatarcache.metrics.ProfilePictureCacheMetrics;
import com.github.rudygunawan.avatarcache.model.CacheEntry;
import com.github.rudygunawan.avatarcache.model.CacheStatistics;
import com.github.rudygunawan.avatarcache.policy.EvictionPolicy;
import com.github.rudygunawan.avatarcache.policy.RemovalCause;
import com.github.rudygunawan.avatarcache.refresh.RefreshResult;
import com.github.rudygunawan.avatarcache.refresh.RefreshScheduler;
import com.github.rudygunawan.avatarcache.time.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Profile picture cache guarded by a single lock, with size-bounded eviction, stale-while-refresh
 * reads, and snapshot broadcasting.
 *
 * <p>Every read, write and scan of the store happens under one {@link ReentrantLock}. The store
 * holds at most a few hundred entries, so each operation is short even when it scans. Eviction
 * runs inside the critical section of the write that triggered it. Profile lookups for
 * background refresh never run under the lock; only applying their results does.
 *
 * <p>Logging: This class uses java.util.logging. Logger name:
 * "com.github.rudygunawan.avatarcache.ProfilePictureCache"
 *
 * <p>Log levels used:
 * <ul>
 *   <li>WARNING: Failed lookups, listener exceptions, dropped notifications</li>
 *   <li>FINE: Evictions, refreshes, configuration changes</li>
 *   <li>FINER: Entry-level operations (update, invalidate, clear)</li>
 * </ul>
 */
public class DefaultProfilePictureCache implements ProfilePictureCache, ProfilePictureCacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.avatarcache.ProfilePictureCache");

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> store = new LinkedHashMap<>();
    private final int maximumSize;
    private final long expireAfterWriteNanos;
    private final EvictionPolicy evictionPolicy;
    private final Ticker ticker;
    private final RefreshScheduler refreshScheduler;
    private final ChangeNotifier notifier;
    private final RemovalListener removalListener;
    private final boolean defaultBackgroundRefresh;

    // Guarded by lock. Stamps every write and read so LRU order is total.
    private long accessSequence;

    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);
    private final AtomicLong refreshSuccessCount = new AtomicLong(0);
    private final AtomicLong refreshFailureCount = new AtomicLong(0);

    // Periodic drain, only when a refresh interval is configured
    private final ScheduledExecutorService refreshTimer;
    private final boolean ownsRefreshTimer;
    private final ScheduledFuture<?> refreshTask;

    public DefaultProfilePictureCache(ProfilePictureCacheBuilder builder) {
        this.maximumSize = builder.getMaximumSize();
        this.expireAfterWriteNanos = builder.getExpireAfterWriteNanos();
        this.evictionPolicy = builder.getEvictionPolicy();
        this.ticker = builder.getTicker();
        this.removalListener = builder.getRemovalListener();
        this.defaultBackgroundRefresh = builder.isBackgroundRefreshEnabled();
        this.refreshScheduler = new RefreshScheduler(
                builder.getProfileLookup(),
                builder.getRefreshExecutor(),
                builder.isBackgroundRefreshEnabled());
        this.notifier = new ChangeNotifier(
                builder.getNotificationExecutor() != null ? builder.getNotificationExecutor() : ChangeNotifier.defaultExecutor(),
                builder.getNotificationBufferSize());

        long refreshIntervalNanos = builder.getRefreshIntervalNanos();
        if (refreshIntervalNanos > 0) {
            this.ownsRefreshTimer = builder.getScheduler() == null;
            this.refreshTimer = ownsRefreshTimer
                    ? Executors.newSingleThreadScheduledExecutor(r -> {
                        Thread t = new Thread(r, "avatar-cache-refresh");
                        t.setDaemon(true);
                        return t;
                    })
                    : builder.getScheduler();
            this.refreshTask = refreshTimer.scheduleAtFixedRate(
                    this::drainInBackground,
                    refreshIntervalNanos,
                    refreshIntervalNanos,
                    TimeUnit.NANOSECONDS);
        } else {
            this.ownsRefreshTimer = false;
            this.refreshTimer = null;
            this.refreshTask = null;
        }
    }

    @Override
    public Optional<String> getProfilePictureFromCache(String userId) {
        Objects.requireNonNull(userId, "userId cannot be null");

        lock.lock();
        try {
            CacheEntry entry = store.get(userId);
            if (entry == null) {
                missCount.incrementAndGet();
                return Optional.empty();
            }

            long now = ticker.read();
            Optional<String> value = entry.recordAccess(now, ++accessSequence);
            hitCount.incrementAndGet();

            if (entry.isStale(now, expireAfterWriteNanos)) {
                refreshScheduler.enqueue(userId, true);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateProfilePictureGlobally(String userId, Optional<String> url) {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(url, "url cannot be null, use Optional.empty() for no avatar");

        lock.lock();
        try {
            putInternal(userId, url);
            notifier.publish(snapshotInternal());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidateCacheForUser(String userId) {
        Objects.requireNonNull(userId, "userId cannot be null");

        lock.lock();
        try {
            CacheEntry entry = store.get(userId);
            if (entry == null) {
                return;
            }
            entry.invalidate();
            refreshScheduler.enqueueInvalidated(userId);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Invalidated entry: userId=" + userId + ", queued=" + refreshScheduler.contains(userId));
            }
            notifier.publish(snapshotInternal());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearCacheForUser(String userId) {
        Objects.requireNonNull(userId, "userId cannot be null");

        lock.lock();
        try {
            refreshScheduler.remove(userId);
            CacheEntry removed = store.remove(userId);
            if (removed == null) {
                return;
            }
            fireRemovalEvent(userId, removed, RemovalCause.EXPLICIT);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Cleared entry: userId=" + userId + ", size=" + store.size());
            }
            notifier.publish(snapshotInternal());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearAllCache() {
        lock.lock();
        try {
            clearInternal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            clearInternal();
            refreshScheduler.setEnabled(defaultBackgroundRefresh);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Optional<String>> getCachedProfilePictures() {
        lock.lock();
        try {
            return snapshotInternal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStatistics getCacheStatistics() {
        lock.lock();
        try {
            long now = ticker.read();
            int expired = 0;
            long accesses = 0;
            for (CacheEntry entry : store.values()) {
                if (entry.isStale(now, expireAfterWriteNanos)) {
                    expired++;
                }
                accesses += entry.getAccessCount();
            }
            return new CacheStatistics(
                    store.size(),
                    expired,
                    accesses,
                    refreshScheduler.size(),
                    refreshScheduler.isEnabled());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setBackgroundRefreshEnabled(boolean enabled) {
        refreshScheduler.setEnabled(enabled);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Background refresh " + (enabled ? "enabled" : "disabled"));
        }
    }

    @Override
    public boolean isBackgroundRefreshEnabled() {
        return refreshScheduler.isEnabled();
    }

    @Override
    public CompletableFuture<List<RefreshResult>> drainRefreshQueue() {
        List<String> batch;
        lock.lock();
        try {
            batch = refreshScheduler.beginDrain();
        } finally {
            lock.unlock();
        }

        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Draining refresh queue: batchSize=" + batch.size());
        }

        List<CompletableFuture<RefreshResult>> refreshes = new ArrayList<>(batch.size());
        for (String userId : batch) {
            CompletableFuture<RefreshResult> lookup;
            try {
                lookup = CompletableFuture.supplyAsync(() -> refreshScheduler.refresh(userId), refreshScheduler.executor());
            } catch (RejectedExecutionException e) {
                lookup = CompletableFuture.completedFuture(RefreshResult.failure(userId, e));
            }
            refreshes.add(lookup.thenApply(this::applyRefresh));
        }

        return CompletableFuture.allOf(refreshes.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> refreshes.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()));
    }

    @Override
    public Flow.Publisher<Map<String, Optional<String>>> profilePictureUpdates() {
        return notifier.publisher();
    }

    @Override
    public ProfilePictureSubscription subscribe(ProfilePictureListener listener) {
        return notifier.subscribe(listener);
    }

    @Override
    public void shutdown() {
        if (refreshTask != null) {
            refreshTask.cancel(false);
        }
        if (ownsRefreshTimer) {
            refreshTimer.shutdown();
        }
        notifier.close();
    }

    /**
     * Returns the number of subscribers currently registered for snapshots.
     */
    public int subscriberCount() {
        return notifier.subscriberCount();
    }

    // Callers hold the lock.
    private void putInternal(String userId, Optional<String> url) {
        long now = ticker.read();
        long sequence = ++accessSequence;

        CacheEntry entry = store.get(userId);
        if (entry == null) {
            store.put(userId, new CacheEntry(url, now, sequence));
        } else {
            entry.overwrite(url, now, sequence);
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Updated entry: userId=" + userId + ", hasAvatar=" + url.isPresent() + ", size=" + store.size());
        }

        evictIfNecessary(sequence);
    }

    private void evictIfNecessary(long batchStartSequence) {
        while (store.size() > maximumSize) {
            Optional<String> victim = evictionPolicy.selectVictim(store, batchStartSequence);
            if (victim.isEmpty()) {
                break;
            }
            String userId = victim.get();
            CacheEntry removed = store.remove(userId);
            refreshScheduler.remove(userId);
            evictionCount.incrementAndGet();
            fireRemovalEvent(userId, removed, RemovalCause.SIZE);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry due to size limit: userId=" + userId
                        + ", policy=" + evictionPolicy + ", size=" + store.size());
            }
        }
    }

    private void clearInternal() {
        if (removalListener != null) {
            for (Map.Entry<String, CacheEntry> entry : store.entrySet()) {
                fireRemovalEvent(entry.getKey(), entry.getValue(), RemovalCause.CLEARED);
            }
        }
        int cleared = store.size();
        store.clear();
        refreshScheduler.clear();
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Cleared all entries: count=" + cleared);
        }
        notifier.publish(Collections.emptyMap());
    }

    private Map<String, Optional<String>> snapshotInternal() {
        Map<String, Optional<String>> snapshot = new LinkedHashMap<>();
        for (Map.Entry<String, CacheEntry> entry : store.entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().getValue());
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Applies a finished lookup. A successful result is written even if the user was cleared
     * while the lookup was in flight, since the lookup is the source of truth. If the user was
     * invalidated while the lookup was in flight, the entry is left stale and queued again.
     */
    private RefreshResult applyRefresh(RefreshResult result) {
        String userId = result.userId();
        lock.lock();
        try {
            boolean stillQueued = refreshScheduler.complete(userId);
            boolean invalidatedInFlight = refreshScheduler.takeInvalidatedInFlight(userId);
            if (result.isSuccess()) {
                putInternal(userId, result.value());
                refreshSuccessCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Refreshed entry in background: userId=" + userId
                            + (stillQueued ? "" : " (cleared while in flight, re-created)"));
                }
            } else {
                refreshFailureCount.incrementAndGet();
                LOGGER.log(Level.WARNING, "Background refresh failed for userId=" + userId
                        + ", keeping stale value", result.failure().orElse(null));
            }

            CacheEntry entry = store.get(userId);
            if (invalidatedInFlight && entry != null) {
                entry.invalidate();
                refreshScheduler.enqueue(userId, true);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Entry invalidated during refresh, kept stale: userId=" + userId
                            + ", queued=" + refreshScheduler.contains(userId));
                }
            }
            if (result.isSuccess()) {
                notifier.publish(snapshotInternal());
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    private void drainInBackground() {
        try {
            drainRefreshQueue();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task.
            LOGGER.log(Level.WARNING, "Periodic refresh drain failed", e);
        }
    }

    private void fireRemovalEvent(String userId, CacheEntry entry, RemovalCause cause) {
        if (removalListener != null) {
            try {
                removalListener.onRemoval(userId, entry.getValue(), cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for userId: " + userId
                        + ", cause: " + cause, e);
            }
        }
    }

    // ProfilePictureCacheMetrics interface implementation for Micrometer integration

    @Override
    public long size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long expiredCount() {
        return getCacheStatistics().expiredEntries();
    }

    @Override
    public long totalAccessCount() {
        return getCacheStatistics().totalAccessCount();
    }

    @Override
    public long refreshQueueSize() {
        lock.lock();
        try {
            return refreshScheduler.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    @Override
    public long refreshSuccessCount() {
        return refreshSuccessCount.get();
    }

    @Override
    public long refreshFailureCount() {
        return refreshFailureCount.get();
    }
}
