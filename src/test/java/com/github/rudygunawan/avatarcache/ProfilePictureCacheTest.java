package com.github.rudygunawan.avatarcache;

import com.github.rudygunawan.avatarcache.builder.ProfilePictureCacheBuilder;
import com.github.rudygunawan.avatarcache.impl.DefaultProfilePictureCache;
import com.github.rudygunawan.avatarcache.model.CacheStatistics;
import com.github.rudygunawan.avatarcache.policy.RemovalCause;
import com.github.rudygunawan.avatarcache.time.FakeTicker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProfilePictureCacheTest {

    private static final String ALICE_URL = "https://cdn.example.com/alice.png";

    @Test
    void testUpdateAndGet() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();

        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        assertEquals(Optional.of(ALICE_URL), cache.getProfilePictureFromCache("alice"));

        // Unknown user
        assertEquals(Optional.empty(), cache.getProfilePictureFromCache("bob"));
        assertEquals(1, cache.getCacheStatistics().totalEntries());

        // Overwrite
        cache.updateProfilePictureGlobally("alice", Optional.of("https://cdn.example.com/alice-2.png"));
        assertEquals(Optional.of("https://cdn.example.com/alice-2.png"), cache.getProfilePictureFromCache("alice"));
        assertEquals(1, cache.getCacheStatistics().totalEntries());
    }

    @Test
    void testKnownUserWithoutAvatar() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();

        cache.updateProfilePictureGlobally("carol", Optional.empty());

        assertEquals(Optional.empty(), cache.getProfilePictureFromCache("carol"));
        Map<String, Optional<String>> snapshot = cache.getCachedProfilePictures();
        assertTrue(snapshot.containsKey("carol"));
        assertEquals(Optional.empty(), snapshot.get("carol"));
        assertEquals(1, cache.getCacheStatistics().totalEntries());
    }

    @Test
    void testEmptyUserIdIsAValidKey() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();

        cache.updateProfilePictureGlobally("", Optional.of(ALICE_URL));

        assertEquals(Optional.of(ALICE_URL), cache.getProfilePictureFromCache(""));
        cache.invalidateCacheForUser("");
        assertEquals(1, cache.getCacheStatistics().refreshQueueSize());
    }

    @Test
    void testNullArgumentsRejected() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();

        assertThrows(NullPointerException.class, () -> cache.getProfilePictureFromCache(null));
        assertThrows(NullPointerException.class, () -> cache.updateProfilePictureGlobally(null, Optional.empty()));
        assertThrows(NullPointerException.class, () -> cache.updateProfilePictureGlobally("alice", null));
        assertThrows(NullPointerException.class, () -> cache.invalidateCacheForUser(null));
        assertThrows(NullPointerException.class, () -> cache.clearCacheForUser(null));
    }

    @Test
    void testInvalidateUnknownUserIsNoOp() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();

        cache.invalidateCacheForUser("ghost");
        cache.invalidateCacheForUser("ghost");

        CacheStatistics stats = cache.getCacheStatistics();
        assertEquals(0, stats.totalEntries());
        assertEquals(0, stats.refreshQueueSize());
        assertEquals(Optional.empty(), cache.getProfilePictureFromCache("ghost"));
    }

    @Test
    void testStaleValueServedAfterInvalidation() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        assertEquals(0, cache.getCacheStatistics().refreshQueueSize());

        cache.invalidateCacheForUser("alice");

        assertEquals(Optional.of(ALICE_URL), cache.getProfilePictureFromCache("alice"));
        CacheStatistics stats = cache.getCacheStatistics();
        assertEquals(1, stats.totalEntries());
        assertEquals(1, stats.expiredEntries());
        assertEquals(1, stats.refreshQueueSize());
    }

    @Test
    void testRepeatedStaleReadsEnqueueOnce() {
        FakeTicker ticker = new FakeTicker();
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
                .ticker(ticker)
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .build();

        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        ticker.advance(6, TimeUnit.MINUTES);

        for (int i = 0; i < 5; i++) {
            assertEquals(Optional.of(ALICE_URL), cache.getProfilePictureFromCache("alice"));
        }
        cache.invalidateCacheForUser("alice");

        assertEquals(1, cache.getCacheStatistics().refreshQueueSize());
    }

    @Test
    void testTtlBoundary() {
        FakeTicker ticker = new FakeTicker();
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
                .ticker(ticker)
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .build();

        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));

        ticker.advance(TimeUnit.MINUTES.toNanos(5) - 1);
        assertEquals(0, cache.getCacheStatistics().expiredEntries());
        cache.getProfilePictureFromCache("alice");
        assertEquals(0, cache.getCacheStatistics().refreshQueueSize());

        // Reading does not extend freshness
        ticker.advance(1);
        assertEquals(1, cache.getCacheStatistics().expiredEntries());
        cache.getProfilePictureFromCache("alice");
        assertEquals(1, cache.getCacheStatistics().refreshQueueSize());
    }

    @Test
    void testUpdateMakesEntryFreshAgain() {
        FakeTicker ticker = new FakeTicker();
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
                .ticker(ticker)
                .build();

        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        cache.updateProfilePictureGlobally("bob", Optional.empty());
        cache.invalidateCacheForUser("alice");
        ticker.advance(10, TimeUnit.MINUTES);
        assertEquals(2, cache.getCacheStatistics().expiredEntries());

        cache.updateProfilePictureGlobally("alice", Optional.of("https://cdn.example.com/alice-2.png"));

        assertEquals(1, cache.getCacheStatistics().expiredEntries());
    }

    @Test
    void testAccessCountResetByUpdate() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        cache.updateProfilePictureGlobally("bob", Optional.of("https://cdn.example.com/bob.png"));

        cache.getProfilePictureFromCache("alice");
        cache.getProfilePictureFromCache("alice");
        cache.getProfilePictureFromCache("bob");
        cache.getProfilePictureFromCache("nobody");
        assertEquals(3, cache.getCacheStatistics().totalAccessCount());

        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        assertEquals(1, cache.getCacheStatistics().totalAccessCount());

        assertEquals(3, cache.hitCount());
        assertEquals(1, cache.missCount());
    }

    @Test
    void testClearCacheForUser() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        cache.updateProfilePictureGlobally("bob", Optional.empty());
        cache.invalidateCacheForUser("alice");
        assertEquals(1, cache.getCacheStatistics().refreshQueueSize());

        cache.clearCacheForUser("alice");

        assertEquals(Optional.empty(), cache.getProfilePictureFromCache("alice"));
        assertFalse(cache.getCachedProfilePictures().containsKey("alice"));
        CacheStatistics stats = cache.getCacheStatistics();
        assertEquals(1, stats.totalEntries());
        assertEquals(0, stats.refreshQueueSize());

        // Unknown user
        cache.clearCacheForUser("nobody");
        assertEquals(1, cache.getCacheStatistics().totalEntries());
    }

    @Test
    void testClearAllResetsStatistics() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
        for (int i = 0; i < 10; i++) {
            cache.updateProfilePictureGlobally("user" + i, Optional.of("https://cdn.example.com/" + i + ".png"));
            cache.invalidateCacheForUser("user" + i);
        }
        assertEquals(10, cache.getCacheStatistics().refreshQueueSize());

        cache.clearAllCache();

        CacheStatistics stats = cache.getCacheStatistics();
        assertEquals(0, stats.totalEntries());
        assertEquals(0, stats.expiredEntries());
        assertEquals(0, stats.totalAccessCount());
        assertEquals(0, stats.refreshQueueSize());
        assertTrue(stats.backgroundRefreshEnabled());
        assertTrue(cache.getCachedProfilePictures().isEmpty());
    }

    @Test
    void testEndToEndScenario() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();

        cache.updateProfilePictureGlobally("user123", Optional.of("https://x/a.jpg"));
        for (int i = 0; i < 3; i++) {
            assertEquals(Optional.of("https://x/a.jpg"), cache.getProfilePictureFromCache("user123"));
        }

        CacheStatistics stats = cache.getCacheStatistics();
        assertEquals(1, stats.totalEntries());
        assertTrue(stats.totalAccessCount() >= 3);

        cache.invalidateCacheForUser("user123");
        assertEquals(Optional.of("https://x/a.jpg"), cache.getProfilePictureFromCache("user123"));

        stats = cache.getCacheStatistics();
        assertTrue(stats.expiredEntries() >= 1);
        assertEquals(1, stats.refreshQueueSize());
    }

    @Test
    void testStatisticsMap() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
                .backgroundRefreshEnabled(false)
                .build();
        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        cache.getProfilePictureFromCache("alice");

        Map<String, Object> map = cache.getCacheStatistics().toMap();

        assertEquals(List.of("totalEntries", "expiredEntries", "totalAccessCount", "refreshQueueSize",
                "backgroundRefreshEnabled"), new ArrayList<>(map.keySet()));
        assertEquals(1, map.get("totalEntries"));
        assertEquals(1L, map.get("totalAccessCount"));
        assertEquals(false, map.get("backgroundRefreshEnabled"));
        assertEquals(cache.getCacheStatistics(), cache.getCacheStatistics());
    }

    @Test
    void testSnapshotIsACopy() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));

        Map<String, Optional<String>> snapshot = cache.getCachedProfilePictures();
        cache.updateProfilePictureGlobally("bob", Optional.empty());

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("eve", Optional.empty()));
        assertEquals(2, cache.getCachedProfilePictures().size());
    }

    @Test
    void testResetRestoresConfiguredRefreshSetting() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));
        cache.invalidateCacheForUser("alice");
        cache.setBackgroundRefreshEnabled(false);

        cache.reset();

        CacheStatistics stats = cache.getCacheStatistics();
        assertEquals(0, stats.totalEntries());
        assertEquals(0, stats.refreshQueueSize());
        assertTrue(stats.backgroundRefreshEnabled());
        assertTrue(cache.isBackgroundRefreshEnabled());
    }

    @Test
    void testRemovalListenerCauses() {
        List<String> events = new CopyOnWriteArrayList<>();
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
                .maximumSize(2)
                .removalListener((userId, url, cause) -> events.add(userId + ":" + cause))
                .build();

        cache.updateProfilePictureGlobally("a", Optional.of("https://cdn.example.com/a.png"));
        cache.updateProfilePictureGlobally("b", Optional.empty());
        cache.updateProfilePictureGlobally("c", Optional.empty());
        assertEquals(List.of("a:" + RemovalCause.SIZE), events);

        cache.clearCacheForUser("b");
        assertEquals("b:" + RemovalCause.EXPLICIT, events.get(1));

        cache.clearAllCache();
        assertEquals("c:" + RemovalCause.CLEARED, events.get(2));
        assertEquals(3, events.size());
        assertEquals(1, cache.evictionCount());
        assertTrue(RemovalCause.SIZE.wasEvicted());
        assertFalse(RemovalCause.EXPLICIT.wasEvicted());
    }

    @Test
    void testRemovalListenerExceptionDoesNotBreakCache() {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
                .removalListener((userId, url, cause) -> {
                    throw new IllegalStateException("listener failure");
                })
                .build();
        cache.updateProfilePictureGlobally("alice", Optional.of(ALICE_URL));

        assertDoesNotThrow(() -> cache.clearCacheForUser("alice"));
        assertEquals(0, cache.getCacheStatistics().totalEntries());
    }

    @Test
    @Timeout(10)
    void testConcurrentAccess() throws Exception {
        DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                int offset = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        String userId = "user" + ((offset * 500 + i) % 300);
                        switch (i % 4) {
                            case 0:
                                cache.updateProfilePictureGlobally(userId, Optional.of("https://cdn.example.com/" + i));
                                break;
                            case 1:
                                cache.getProfilePictureFromCache(userId);
                                break;
                            case 2:
                                cache.invalidateCacheForUser(userId);
                                break;
                            default:
                                cache.getCacheStatistics();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        CacheStatistics stats = cache.getCacheStatistics();
        assertTrue(stats.totalEntries() <= 100);
        assertTrue(stats.refreshQueueSize() <= stats.totalEntries());
    }
}
