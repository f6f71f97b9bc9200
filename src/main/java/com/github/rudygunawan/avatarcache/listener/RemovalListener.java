package com.github.rudygunawan.avatarcache.listener;

import com.github.rudygunawan.avatarcache.policy.RemovalCause;

import java.util.Optional;

/**
 * A listener that receives notification when a profile picture entry leaves the cache.
 *
 * <p>Called synchronously while the cache holds its lock, so implementations must be fast and
 * must not call back into the cache. Exceptions are logged and swallowed.
 *
 * <p>Usage example:
 * <pre>{@code
 * ProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
 *     .removalListener((userId, url, cause) -> {
 *         if (cause.wasEvicted()) {
 *             thumbnailCache.release(userId);
 *         }
 *     })
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface RemovalListener {

    /**
     * Notifies the listener that an entry was removed.
     *
     * @param userId the user id of the removed entry
     * @param value the avatar URL the entry held, or empty if the user had no avatar
     * @param cause the reason for the removal
     */
    void onRemoval(String userId, Optional<String> value, RemovalCause cause);
}
