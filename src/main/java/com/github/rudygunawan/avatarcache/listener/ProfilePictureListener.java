package com.github.rudygunawan.avatarcache.listener;

import java.util.Map;
import java.util.Optional;

/**
 * Receives the full contents of a profile picture cache after every mutation.
 *
 * <p>Each listener is fed from its own buffer on the cache's notification executor, so a slow
 * listener delays only itself. Snapshots arrive in mutation order. If a listener falls so far
 * behind that its buffer fills up, further snapshots are dropped for that listener until it
 * catches up; since every snapshot is complete, the next one delivered supersedes the ones lost.
 *
 * <p>Exceptions thrown by the listener are logged and swallowed.
 *
 * <p>Usage example:
 * <pre>{@code
 * ProfilePictureSubscription subscription = cache.subscribe(snapshot ->
 *     avatarView.render(snapshot.getOrDefault(userId, Optional.empty())));
 *
 * // when the screen goes away
 * subscription.cancel();
 * }</pre>
 */
@FunctionalInterface
public interface ProfilePictureListener {

    /**
     * Called with an unmodifiable snapshot of user id to avatar URL. A present key with an empty
     * value means the user is known to have no avatar.
     *
     * @param snapshot the cache contents right after the mutation
     */
    void onUpdate(Map<String, Optional<String>> snapshot);
}
