package com.github.rudygunawan.avatarcache.refresh;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one background refresh: either the fresh avatar URL returned by the lookup, or the
 * failure that prevented it. Instances of this class are immutable.
 */
public final class RefreshResult {
    private final String userId;
    private final Optional<String> value;
    private final Throwable failure;

    private RefreshResult(String userId, Optional<String> value, Throwable failure) {
        this.userId = userId;
        this.value = value;
        this.failure = failure;
    }

    public static RefreshResult success(String userId, Optional<String> value) {
        return new RefreshResult(
                Objects.requireNonNull(userId, "userId cannot be null"),
                Objects.requireNonNull(value, "value cannot be null"),
                null);
    }

    public static RefreshResult failure(String userId, Throwable failure) {
        return new RefreshResult(
                Objects.requireNonNull(userId, "userId cannot be null"),
                Optional.empty(),
                Objects.requireNonNull(failure, "failure cannot be null"));
    }

    public String userId() {
        return userId;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Returns the refreshed avatar URL. Always empty for a failed refresh; use
     * {@link #isSuccess()} to tell "no avatar" from "lookup failed".
     */
    public Optional<String> value() {
        return value;
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "RefreshResult{userId=" + userId + ", value=" + value.orElse(null) + '}'
                : "RefreshResult{userId=" + userId + ", failure=" + failure + '}';
    }
}
