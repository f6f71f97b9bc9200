package com.github.rudygunawan.avatarcache.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerProfilePictureCacheMetrics to collect and expose metrics.
 */
public interface ProfilePictureCacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    /**
     * Returns the number of entries that are currently stale.
     */
    long expiredCount();

    /**
     * Returns the sum of read counts over resident entries.
     */
    long totalAccessCount();

    /**
     * Returns the number of user ids waiting for a background refresh.
     */
    long refreshQueueSize();

    /**
     * Returns the total number of reads that found an entry.
     */
    long hitCount();

    /**
     * Returns the total number of reads that found no entry.
     */
    long missCount();

    /**
     * Returns the total number of size-based evictions.
     */
    long evictionCount();

    /**
     * Returns the total number of background refreshes that stored a fresh value.
     */
    long refreshSuccessCount();

    /**
     * Returns the total number of background refreshes whose lookup failed.
     */
    long refreshFailureCount();
}
