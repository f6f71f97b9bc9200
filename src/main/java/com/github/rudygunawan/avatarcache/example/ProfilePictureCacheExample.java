package com.github.rudygunawan.avatarcache.example;

import com.github.rudygunawan.avatarcache.api.LookupException;
import com.github.rudygunawan.avatarcache.api.ProfileLookup;
import com.github.rudygunawan.avatarcache.builder.ProfilePictureCacheBuilder;
import com.github.rudygunawan.avatarcache.impl.DefaultProfilePictureCache;
import com.github.rudygunawan.avatarcache.listener.ProfilePictureSubscription;
import com.github.rudygunawan.avatarcache.metrics.MicrometerProfilePictureCacheMetrics;
import com.github.rudygunawan.avatarcache.model.CacheStatistics;
import com.github.rudygunawan.avatarcache.refresh.RefreshResult;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Example usage of the profile picture cache: a chat screen that prefetches avatars, reacts to
 * a profile change, and refreshes stale entries from a profile service.
 */
public class ProfilePictureCacheExample {

    public static void main(String[] args) throws Exception {
        System.out.println("=== Profile Picture Cache Example ===\n");

        ProfileService profileService = new ProfileService();
        profileService.setAvatar("alice", "https://cdn.example.com/alice-v1.png");
        profileService.setAvatar("bob", "https://cdn.example.com/bob-v1.png");

        DefaultProfilePictureCache avatars = ProfilePictureCacheBuilder.newBuilder()
                .maximumSize(100)
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .profileLookup(profileService)
                .removalListener((userId, url, cause) -> {
                    if (cause.wasEvicted()) {
                        System.out.println("  [evicted] " + userId);
                    }
                })
                .build();

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerProfilePictureCacheMetrics.monitor(registry, avatars, "avatars");

        ProfilePictureSubscription subscription = avatars.subscribe(snapshot ->
                System.out.println("  [update] " + snapshot.size() + " avatar(s) cached"));

        // Prefetch: the profile screen loaded, store what we know
        for (String userId : List.of("alice", "bob", "carol")) {
            avatars.updateProfilePictureGlobally(userId, profileService.fetch(userId));
        }

        System.out.println("alice -> " + avatars.getProfilePictureFromCache("alice").orElse("<none>"));
        System.out.println("carol -> " + avatars.getProfilePictureFromCache("carol").orElse("<none>"));
        System.out.println("dave  -> " + avatars.getProfilePictureFromCache("dave").orElse("<unknown>"));

        // alice uploads a new picture somewhere else; we only hear that it changed
        profileService.setAvatar("alice", "https://cdn.example.com/alice-v2.png");
        avatars.invalidateCacheForUser("alice");
        System.out.println("\nAfter invalidation, still serving: "
                + avatars.getProfilePictureFromCache("alice").orElse("<none>"));

        List<RefreshResult> refreshed = avatars.drainRefreshQueue().get(5, TimeUnit.SECONDS);
        System.out.println("Refreshed: " + refreshed);
        System.out.println("alice -> " + avatars.getProfilePictureFromCache("alice").orElse("<none>"));

        CacheStatistics stats = avatars.getCacheStatistics();
        System.out.println("\nStatistics: " + stats.toMap());
        System.out.println("Hits counted by Micrometer: " + registry.get("avatar.cache.hits").functionCounter().count());

        // Give the asynchronous listener a moment before leaving
        Thread.sleep(100);
        subscription.cancel();
        avatars.shutdown();
    }

    /**
     * Stand-in for a remote profile service.
     */
    static class ProfileService implements ProfileLookup {
        private final Map<String, String> avatars = new ConcurrentHashMap<>();

        void setAvatar(String userId, String url) {
            avatars.put(userId, url);
        }

        @Override
        public Optional<String> fetch(String userId) throws LookupException {
            if (userId.isEmpty()) {
                throw new LookupException("user id must not be empty");
            }
            return Optional.ofNullable(avatars.get(userId));
        }
    }
}
