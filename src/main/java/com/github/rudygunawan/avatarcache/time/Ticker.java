package com.github.rudygunawan.avatarcache.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Staleness and LRU ordering are both computed from ticker readings, so tests can drive
 * TTL expiry by supplying a ticker they control instead of sleeping:
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * ProfilePictureCache cache = ProfilePictureCacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .expireAfterWrite(5, TimeUnit.MINUTES)
 *     .build();
 *
 * cache.updateProfilePictureGlobally("user1", Optional.of("https://cdn/a.jpg"));
 * ticker.advance(6, TimeUnit.MINUTES);
 *
 * // still returned, but now counted as expired and queued for refresh
 * cache.getProfilePictureFromCache("user1");
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     * Must be monotonic, like {@link System#nanoTime()}.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
