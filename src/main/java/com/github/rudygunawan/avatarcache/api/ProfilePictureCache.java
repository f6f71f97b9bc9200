package com.github.rudygunawan.avatarcache.api;

import com.github.rudygunawan.avatarcache.listener.ProfilePictureListener;
import com.github.rudygunawan.avatarcache.listener.ProfilePictureSubscription;
import com.github.rudygunawan.avatarcache.model.CacheStatistics;
import com.github.rudygunawan.avatarcache.refresh.RefreshResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * An in-memory cache of user avatar URLs that serves stale values immediately, refreshes them
 * in the background, and broadcasts every change.
 *
 * <p>A user id maps to one of three states:
 * <ul>
 *   <li>unknown - no entry; reads return {@link Optional#empty()}
 *   <li>known with an avatar - reads return the URL
 *   <li>known without an avatar - an entry exists whose value is empty; reads also return
 *       {@link Optional#empty()}, but the user appears in snapshots
 * </ul>
 *
 * <p>Entries become stale once their TTL has passed or after
 * {@link #invalidateCacheForUser(String)}. Stale entries keep being served while a refresh is
 * queued; they never turn into misses on their own.
 *
 * <p>Implementations of this interface are thread-safe. No method throws for ordinary input;
 * every non-null user id, the empty string included, is a valid key.
 */
public interface ProfilePictureCache {

    /**
     * Returns the cached avatar URL for {@code userId}. If the entry is stale, a background
     * refresh is queued (when enabled) and the stale value is returned anyway. Never blocks on
     * the refresh.
     *
     * @param userId the user whose avatar is wanted
     * @return the cached URL, or empty if the user is unknown or known to have no avatar
     */
    Optional<String> getProfilePictureFromCache(String userId);

    /**
     * Stores an authoritative avatar value, typically right after fetching a profile. Evicts the
     * least recently used entries if the cache grows past its maximum size, then notifies
     * subscribers.
     *
     * @param userId the user whose avatar changed
     * @param url the avatar URL, or empty if the user has no avatar
     */
    void updateProfilePictureGlobally(String userId, Optional<String> url);

    /**
     * Marks the user's entry stale without removing it and queues a background refresh when
     * enabled. Does nothing if the user has no entry.
     *
     * @param userId the user whose avatar is known to be out of date
     */
    void invalidateCacheForUser(String userId);

    /**
     * Removes the user's entry and any queued refresh for it.
     *
     * @param userId the user to forget
     */
    void clearCacheForUser(String userId);

    /**
     * Removes every entry and empties the refresh queue. Subscribers receive an empty snapshot.
     */
    void clearAllCache();

    /**
     * Returns a copy of every cached user id and its avatar value.
     *
     * @return an unmodifiable snapshot; later cache changes are not reflected
     */
    Map<String, Optional<String>> getCachedProfilePictures();

    /**
     * Computes statistics by scanning the cache.
     */
    CacheStatistics getCacheStatistics();

    /**
     * Turns background refresh on or off. Affects later invalidations and stale reads only;
     * users already queued stay queued.
     */
    void setBackgroundRefreshEnabled(boolean enabled);

    boolean isBackgroundRefreshEnabled();

    /**
     * Looks up every queued user that is not already being refreshed and stores the results.
     * Lookups run on the refresh executor without holding the cache lock. A failed lookup
     * leaves the stale entry as it was.
     *
     * @return a future completed with one result per user refreshed by this call
     */
    CompletableFuture<List<RefreshResult>> drainRefreshQueue();

    /**
     * Returns the publisher of cache snapshots. Each subscriber receives an unmodifiable
     * snapshot after every later mutation; nothing is replayed.
     */
    Flow.Publisher<Map<String, Optional<String>>> profilePictureUpdates();

    /**
     * Registers a listener on {@link #profilePictureUpdates()}.
     *
     * @return a handle that stops delivery when cancelled
     */
    ProfilePictureSubscription subscribe(ProfilePictureListener listener);

    /**
     * Clears the cache and restores the background refresh setting the cache was built with.
     */
    void reset();

    /**
     * Stops the periodic refresh task, if any, and completes all subscriptions. The cache still
     * answers reads and writes afterwards but no longer notifies anyone.
     */
    void shutdown();
}
