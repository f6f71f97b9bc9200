package com.github.rudygunawan.avatarcache.api;

/**
 * Thrown by a {@link ProfileLookup} when the authoritative profile source cannot answer.
 *
 * <p>The cache never inspects the cause; any failure leaves the stale entry in place.
 */
public class LookupException extends Exception {
    private static final long serialVersionUID = 1L;

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
