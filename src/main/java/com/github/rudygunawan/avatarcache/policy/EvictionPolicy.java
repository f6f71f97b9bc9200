package com.github.rudygunawan.avatarcache.policy;

import com.github.rudygunawan.avatarcache.model.CacheEntry;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * Eviction policy for choosing which profile picture to drop when the cache grows past its
 * maximum size.
 *
 * <p>Available policies:
 * <ul>
 *   <li>{@link #LRU} - Least Recently Used
 *   <li>{@link #SEGMENTED_LRU} - LRU with a protected segment for entries that have been read
 * </ul>
 *
 * <p>Both policies order entries by {@link CacheEntry#getLastAccessed()} and break ties with
 * {@link CacheEntry#getAccessSequence()}, so victim selection is deterministic even when the
 * ticker does not advance between operations. The access count is never consulted.
 */
public enum EvictionPolicy {
    /**
     * Least Recently Used - evicts the entry whose last write or read is oldest.
     */
    LRU {
        @Override
        public Optional<String> selectVictim(Map<String, CacheEntry> entries, long batchStartSequence) {
            return entries.entrySet().stream()
                    .filter(candidate -> candidate.getValue().getAccessSequence() < batchStartSequence)
                    .min(Map.Entry.comparingByValue(RECENCY))
                    .map(Map.Entry::getKey);
        }
    },

    /**
     * Segmented LRU - entries that have been read since their last write form a protected
     * segment; entries that were written but never read form a probation segment.
     *
     * <p>The victim is the least recently used probationary entry. Protected entries are only
     * evicted, again in LRU order, once probation is empty. This keeps the avatars a screen is
     * actually displaying resident while a burst of prefetch writes streams through the cache.
     * This is the default policy.
     */
    SEGMENTED_LRU {
        @Override
        public Optional<String> selectVictim(Map<String, CacheEntry> entries, long batchStartSequence) {
            String probationVictim = null;
            CacheEntry probationEntry = null;
            String protectedVictim = null;
            CacheEntry protectedEntry = null;

            for (Map.Entry<String, CacheEntry> candidate : entries.entrySet()) {
                CacheEntry entry = candidate.getValue();
                if (entry.getAccessSequence() >= batchStartSequence) {
                    continue;
                }
                if (entry.isReadSinceWrite()) {
                    if (protectedEntry == null || RECENCY.compare(entry, protectedEntry) < 0) {
                        protectedVictim = candidate.getKey();
                        protectedEntry = entry;
                    }
                } else if (probationEntry == null || RECENCY.compare(entry, probationEntry) < 0) {
                    probationVictim = candidate.getKey();
                    probationEntry = entry;
                }
            }

            return Optional.ofNullable(probationVictim != null ? probationVictim : protectedVictim);
        }
    };

    private static final Comparator<CacheEntry> RECENCY = Comparator
            .comparingLong(CacheEntry::getLastAccessed)
            .thenComparingLong(CacheEntry::getAccessSequence);

    /**
     * Chooses the entry to evict next.
     *
     * <p>Entries written or read at or after {@code batchStartSequence} belong to the operation
     * that triggered the eviction pass and are never chosen.
     *
     * @param entries the resident entries; not modified
     * @param batchStartSequence the first access sequence number of the triggering operation
     * @return the user id to evict, or empty if no entry is eligible
     */
    public abstract Optional<String> selectVictim(Map<String, CacheEntry> entries, long batchStartSequence);
}
