package com.github.rudygunawan.avatarcache.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for profile picture cache metrics.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>avatar.cache.size - Current number of entries
 *   <li>avatar.cache.expired - Entries currently stale
 *   <li>avatar.cache.access.total - Sum of read counts over resident entries
 *   <li>avatar.cache.refresh.queue - User ids waiting for a background refresh
 *   <li>avatar.cache.hits - Reads that found an entry
 *   <li>avatar.cache.misses - Reads that found no entry
 *   <li>avatar.cache.evictions - Size-based evictions
 *   <li>avatar.cache.refreshes - Background refreshes, tagged {@code result=success|failure}
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * DefaultProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder().build();
 *
 * MicrometerProfilePictureCacheMetrics.monitor(registry, cache, "avatars");
 * }</pre>
 */
public class MicrometerProfilePictureCacheMetrics implements MeterBinder {

    private final ProfilePictureCacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    public MicrometerProfilePictureCacheMetrics(ProfilePictureCacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Binds the metrics of {@code cache} to {@code registry}.
     *
     * @return the cache (for chaining)
     */
    public static <C extends ProfilePictureCacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Binds the metrics of {@code cache} to {@code registry} with additional tags.
     *
     * @return the cache (for chaining)
     */
    public static <C extends ProfilePictureCacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerProfilePictureCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("avatar.cache.size", cache, ProfilePictureCacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("avatar.cache.expired", cache, ProfilePictureCacheMetrics::expiredCount)
                .tags(allTags)
                .description("Number of entries that are stale and still served")
                .register(registry);

        Gauge.builder("avatar.cache.access.total", cache, ProfilePictureCacheMetrics::totalAccessCount)
                .tags(allTags)
                .description("Sum of read counts over resident entries")
                .register(registry);

        Gauge.builder("avatar.cache.refresh.queue", cache, ProfilePictureCacheMetrics::refreshQueueSize)
                .tags(allTags)
                .description("Number of user ids waiting for a background refresh")
                .register(registry);

        FunctionCounter.builder("avatar.cache.hits", cache, ProfilePictureCacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of reads that found an entry")
                .register(registry);

        FunctionCounter.builder("avatar.cache.misses", cache, ProfilePictureCacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of reads that found no entry")
                .register(registry);

        FunctionCounter.builder("avatar.cache.evictions", cache, ProfilePictureCacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of size-based evictions")
                .register(registry);

        FunctionCounter.builder("avatar.cache.refreshes", cache, ProfilePictureCacheMetrics::refreshSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Background refreshes that stored a fresh value")
                .register(registry);

        FunctionCounter.builder("avatar.cache.refreshes", cache, ProfilePictureCacheMetrics::refreshFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Background refreshes whose lookup failed")
                .register(registry);
    }
}
