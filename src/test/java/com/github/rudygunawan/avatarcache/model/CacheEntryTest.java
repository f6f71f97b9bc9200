package com.github.rudygunawan.avatarcache.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CacheEntryTest {

    private static final long TTL = 100;

    @Test
    void testReadDoesNotMoveLastUpdated() {
        CacheEntry entry = new CacheEntry(Optional.of("https://cdn.example.com/a.png"), 10, 1);

        assertEquals(Optional.of("https://cdn.example.com/a.png"), entry.recordAccess(50, 2));

        assertEquals(10, entry.getLastUpdated());
        assertEquals(50, entry.getLastAccessed());
        assertEquals(2, entry.getAccessSequence());
        assertEquals(1, entry.getAccessCount());
        assertTrue(entry.isReadSinceWrite());
        assertFalse(entry.isStale(10 + TTL - 1, TTL));
        assertTrue(entry.isStale(10 + TTL, TTL));
    }

    @Test
    void testInvalidateForcesStalenessUntilOverwrite() {
        CacheEntry entry = new CacheEntry(Optional.empty(), 0, 1);
        entry.recordAccess(5, 2);

        entry.invalidate();
        assertTrue(entry.isInvalidated());
        assertTrue(entry.isStale(0, TTL));
        assertEquals(Optional.empty(), entry.getValue());

        entry.overwrite(Optional.of("https://cdn.example.com/b.png"), 20, 3);

        assertFalse(entry.isInvalidated());
        assertFalse(entry.isStale(20, TTL));
        assertEquals(20, entry.getLastUpdated());
        assertEquals(0, entry.getAccessCount());
        assertFalse(entry.isReadSinceWrite());
        assertEquals(Optional.of("https://cdn.example.com/b.png"), entry.getValue());
    }
}
