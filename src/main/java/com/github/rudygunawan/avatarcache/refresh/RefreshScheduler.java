package com.github.rudygunawan.avatarcache.refresh;

import com.github.rudygunawan.avatarcache.api.ProfileLookup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deduplicating queue of user ids waiting for a background refresh.
 *
 * <p>An id stays in the queue from the moment it is enqueued until its refresh completes, so it
 * can never be queued or in flight twice at the same time. Ids are handed out by
 * {@link #beginDrain()} and retired by {@link #complete(String)} whether the lookup succeeded or
 * failed; a failed id is re-enqueued only when a later read finds the entry stale again.
 *
 * <p>The queue methods are not synchronized. The owning cache calls them while holding its
 * lock. {@link #refresh(String)} performs the lookup and must be called without that lock.
 */
public class RefreshScheduler {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.avatarcache.ProfilePictureCache");

    private final ProfileLookup lookup;
    private final Executor executor;
    private final Set<String> pending = new LinkedHashSet<>();
    private final Set<String> inFlight = new HashSet<>();
    // In-flight ids invalidated after their lookup started; the result they get is already old.
    private final Set<String> invalidatedInFlight = new HashSet<>();
    private volatile boolean enabled;

    /**
     * Creates a scheduler.
     *
     * @param lookup the authoritative profile source, or null if this cache never refreshes
     * @param executor the executor that runs lookups
     * @param enabled the initial background refresh setting
     */
    public RefreshScheduler(ProfileLookup lookup, Executor executor, boolean enabled) {
        this.lookup = lookup;
        this.executor = executor;
        this.enabled = enabled;
    }

    /**
     * Queues a user for refresh.
     *
     * @param userId the user whose entry went stale
     * @param hasEntry whether the cache currently holds an entry for the user
     * @return true if the id was added, false if refresh is disabled, there is nothing to
     *         refresh, or the id was already queued
     */
    public boolean enqueue(String userId, boolean hasEntry) {
        if (!enabled || !hasEntry) {
            return false;
        }
        boolean added = pending.add(userId);
        if (added && LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Queued background refresh: userId=" + userId + ", queueSize=" + pending.size());
        }
        return added;
    }

    /**
     * Queues a user whose entry was explicitly invalidated. If a lookup for the user is already
     * in flight, its result predates the invalidation; this is remembered so that
     * {@link #takeInvalidatedInFlight(String)} reports it when the lookup completes.
     *
     * @return true if the id was added to the queue
     */
    public boolean enqueueInvalidated(String userId) {
        if (inFlight.contains(userId)) {
            invalidatedInFlight.add(userId);
        }
        return enqueue(userId, true);
    }

    /**
     * Drops a user from the queue. An in-flight lookup for the user still completes, and the id
     * is not handed out again until it does.
     */
    public void remove(String userId) {
        pending.remove(userId);
        invalidatedInFlight.remove(userId);
    }

    /**
     * Drops every queued id. In-flight lookups still complete.
     */
    public void clear() {
        pending.clear();
        invalidatedInFlight.clear();
    }

    public boolean contains(String userId) {
        return pending.contains(userId);
    }

    /**
     * Returns the number of queued ids, including those whose lookup is in flight.
     */
    public int size() {
        return pending.size();
    }

    /**
     * Marks every queued id that is not already in flight as in flight and returns them.
     * Returns nothing when no lookup is configured, leaving the ids queued.
     */
    public List<String> beginDrain() {
        if (lookup == null) {
            return List.of();
        }
        List<String> batch = new ArrayList<>();
        for (String userId : pending) {
            if (inFlight.add(userId)) {
                batch.add(userId);
            }
        }
        return batch;
    }

    /**
     * Retires an id after its lookup finished.
     *
     * @return true if the id was still queued, false if it was removed while in flight
     */
    public boolean complete(String userId) {
        inFlight.remove(userId);
        return pending.remove(userId);
    }

    /**
     * Returns true, once, if the user was invalidated while its lookup was in flight.
     */
    public boolean takeInvalidatedInFlight(String userId) {
        return invalidatedInFlight.remove(userId);
    }

    /**
     * Calls the lookup for one user. Any failure, checked or not, is returned as a failed
     * result rather than thrown.
     */
    public RefreshResult refresh(String userId) {
        if (lookup == null) {
            return RefreshResult.failure(userId, new IllegalStateException("no ProfileLookup configured"));
        }
        try {
            Optional<String> value = lookup.fetch(userId);
            if (value == null) {
                return RefreshResult.failure(userId, new NullPointerException("ProfileLookup returned null for " + userId));
            }
            return RefreshResult.success(userId, value);
        } catch (Exception e) {
            return RefreshResult.failure(userId, e);
        }
    }

    public Executor executor() {
        return executor;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Changes whether stale entries get queued. Ids already queued are kept.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
