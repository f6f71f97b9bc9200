package com.github.rudygunawan.avatarcache.model;

import java.util.Optional;

/**
 * A cached avatar reference plus the bookkeeping needed for staleness, LRU ordering and
 * statistics.
 *
 * <p>Entries are mutable and not thread-safe. They are only ever touched while the owning
 * cache holds its lock, and are never handed out to callers.
 */
public class CacheEntry {
    private String url;
    private long lastUpdated;
    private long lastAccessed;
    private long accessSequence;
    private long accessCount;
    private boolean invalidated;
    private boolean readSinceWrite;

    /**
     * Creates a fresh entry as written by an authoritative source.
     *
     * @param value the avatar URL, or empty when the user is known to have no avatar
     * @param now the ticker reading at write time
     * @param sequence the cache-wide access sequence number at write time
     */
    public CacheEntry(Optional<String> value, long now, long sequence) {
        overwrite(value, now, sequence);
    }

    /**
     * Replaces the value with a new authoritative write. Resets the access count and clears any
     * forced staleness.
     */
    public void overwrite(Optional<String> value, long now, long sequence) {
        this.url = value.orElse(null);
        this.lastUpdated = now;
        this.lastAccessed = now;
        this.accessSequence = sequence;
        this.accessCount = 0;
        this.invalidated = false;
        this.readSinceWrite = false;
    }

    /**
     * Records a successful read and returns the value.
     */
    public Optional<String> recordAccess(long now, long sequence) {
        this.lastAccessed = now;
        this.accessSequence = sequence;
        this.accessCount++;
        this.readSinceWrite = true;
        return Optional.ofNullable(url);
    }

    /**
     * Forces the entry stale until the next {@link #overwrite}.
     */
    public void invalidate() {
        this.invalidated = true;
    }

    /**
     * Returns true if the entry was invalidated or its age has reached {@code ttlNanos}.
     */
    public boolean isStale(long now, long ttlNanos) {
        return invalidated || now - lastUpdated >= ttlNanos;
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(url);
    }

    public long getLastUpdated() {
        return lastUpdated;
    }

    public long getLastAccessed() {
        return lastAccessed;
    }

    /**
     * Cache-wide monotonic stamp of the last write or read, used to order entries whose
     * {@link #getLastAccessed()} readings are equal.
     */
    public long getAccessSequence() {
        return accessSequence;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public boolean isInvalidated() {
        return invalidated;
    }

    /**
     * Returns true if the entry has been read at least once since it was last written.
     */
    public boolean isReadSinceWrite() {
        return readSinceWrite;
    }
}
