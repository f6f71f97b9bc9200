package com.github.rudygunawan.avatarcache.listener;

/**
 * Handle returned when registering a {@link ProfilePictureListener}.
 */
public interface ProfilePictureSubscription {

    /**
     * Stops delivery to the listener. Snapshots already being delivered may still arrive.
     * Calling this more than once has no further effect.
     */
    void cancel();

    /**
     * Returns true once {@link #cancel()} has been called or the cache has shut down.
     */
    boolean isCancelled();
}
