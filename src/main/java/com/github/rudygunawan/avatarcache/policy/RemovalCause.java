package com.github.rudygunawan.avatarcache.policy;

/**
 * The reason why a profile picture entry left the cache.
 */
public enum RemovalCause {
    /**
     * The entry was removed for one user through {@code clearCacheForUser}.
     */
    EXPLICIT,

    /**
     * The entry was dropped by {@code clearAllCache} or {@code reset}.
     */
    CLEARED,

    /**
     * The entry was evicted because the cache exceeded its maximum size.
     */
    SIZE;

    /**
     * Returns {@code true} if the removal was decided by the cache rather than requested by a
     * caller.
     */
    public boolean wasEvicted() {
        return this == SIZE;
    }
}
