package com.github.rudygunawan.avatarcache.api;

import java.util.Optional;

/**
 * The authoritative source of profile pictures, consulted only by background refresh.
 *
 * <p>Implementations typically call a remote profile service. They may block; the cache always
 * invokes them on its refresh executor and never while holding its lock. Timeouts are the
 * implementation's responsibility.
 *
 * <p>Usage example:
 * <pre>{@code
 * ProfileLookup lookup = userId -> {
 *     try {
 *         return Optional.ofNullable(profileClient.fetchProfile(userId).getPhotoUrl());
 *     } catch (IOException e) {
 *         throw new LookupException("profile fetch failed for " + userId, e);
 *     }
 * };
 * }</pre>
 */
@FunctionalInterface
public interface ProfileLookup {

    /**
     * Fetches the current avatar URL for a user.
     *
     * @param userId the user whose profile to look up
     * @return the avatar URL, or empty if the user has no avatar
     * @throws LookupException if the lookup could not be completed
     */
    Optional<String> fetch(String userId) throws LookupException;
}
