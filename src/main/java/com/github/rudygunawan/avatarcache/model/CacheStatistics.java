package com.github.rudygunawan.avatarcache.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A point-in-time view of a profile picture cache, computed by scanning the store. Instances of
 * this class are immutable.
 *
 * <ul>
 *   <li>{@code totalEntries} counts every resident entry, stale or fresh.
 *   <li>{@code expiredEntries} counts entries that were stale at the moment of the scan, whether
 *       through TTL expiry or explicit invalidation.
 *   <li>{@code totalAccessCount} sums the read counts of resident entries. A write resets the
 *       count of the entry it replaces.
 *   <li>{@code refreshQueueSize} counts user ids waiting for, or in the middle of, a background
 *       refresh.
 * </ul>
 */
public class CacheStatistics {
    private final int totalEntries;
    private final int expiredEntries;
    private final long totalAccessCount;
    private final int refreshQueueSize;
    private final boolean backgroundRefreshEnabled;

    public CacheStatistics(
            int totalEntries,
            int expiredEntries,
            long totalAccessCount,
            int refreshQueueSize,
            boolean backgroundRefreshEnabled) {
        this.totalEntries = totalEntries;
        this.expiredEntries = expiredEntries;
        this.totalAccessCount = totalAccessCount;
        this.refreshQueueSize = refreshQueueSize;
        this.backgroundRefreshEnabled = backgroundRefreshEnabled;
    }

    public int totalEntries() {
        return totalEntries;
    }

    public int expiredEntries() {
        return expiredEntries;
    }

    public long totalAccessCount() {
        return totalAccessCount;
    }

    public int refreshQueueSize() {
        return refreshQueueSize;
    }

    public boolean backgroundRefreshEnabled() {
        return backgroundRefreshEnabled;
    }

    /**
     * Returns the statistics keyed by name, for debug endpoints and log lines that want a flat
     * structure.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalEntries", totalEntries);
        map.put("expiredEntries", expiredEntries);
        map.put("totalAccessCount", totalAccessCount);
        map.put("refreshQueueSize", refreshQueueSize);
        map.put("backgroundRefreshEnabled", backgroundRefreshEnabled);
        return map;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalEntries, expiredEntries, totalAccessCount, refreshQueueSize, backgroundRefreshEnabled);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStatistics)) {
            return false;
        }
        CacheStatistics other = (CacheStatistics) obj;
        return totalEntries == other.totalEntries
                && expiredEntries == other.expiredEntries
                && totalAccessCount == other.totalAccessCount
                && refreshQueueSize == other.refreshQueueSize
                && backgroundRefreshEnabled == other.backgroundRefreshEnabled;
    }

    @Override
    public String toString() {
        return "CacheStatistics{"
                + "totalEntries=" + totalEntries
                + ", expiredEntries=" + expiredEntries
                + ", totalAccessCount=" + totalAccessCount
                + ", refreshQueueSize=" + refreshQueueSize
                + ", backgroundRefreshEnabled=" + backgroundRefreshEnabled
                + '}';
    }
}
