package org.nostrpool.relay;

import java.util.Random;

/**
 * Exponential reconnect delay: {@code base * multiplier^(attempt-1)}, capped,
 * optionally randomized into {@code [delay/2, delay]}.
 * Not thread-safe; owned by one connection task.
 */
public class ReconnectBackoff {

    /** Lowest success ratio {@link #adjustBase} divides by, so the base grows at most tenfold. */
    static final double MIN_SUCCESS_RATIO = 0.1;

    private final long baseMillis;
    private final long maxMillis;
    private final double multiplier;
    private final boolean jitter;
    private final Random random;
    private int attempts;

    public ReconnectBackoff(RelayOptions options) {
        this(options, new Random());
    }

    ReconnectBackoff(RelayOptions options, Random random) {
        this.baseMillis = options.getReconnectInterval().toMillis();
        this.maxMillis = options.getMaxReconnectInterval().toMillis();
        this.multiplier = options.getBackoffMultiplier();
        this.jitter = options.isJitter();
        this.random = random;
    }

    /**
     * Count one more failed attempt and return the delay before the next one.
     */
    public long nextDelayMillis() {
        return nextDelayMillis(baseMillis);
    }

    /**
     * As {@link #nextDelayMillis()}, growing from the given base instead of the configured one.
     */
    public long nextDelayMillis(long baseMillis) {
        attempts++;
        double raw = baseMillis * Math.pow(multiplier, attempts - 1);
        long delay = (long) Math.min(raw, maxMillis);
        if (jitter && delay > 1) {
            long half = delay / 2;
            delay = half + (long) (random.nextDouble() * (delay - half + 1));
            delay = Math.min(delay, maxMillis);
        }
        return delay;
    }

    /**
     * Stretch a base interval for a relay that often fails to connect: the
     * base is divided by the ratio of successful connections to attempts.
     *
     * @return the base unchanged before the first attempt or for a relay that always connected
     */
    public static long adjustBase(long baseMillis, long attempts, long successes) {
        if (attempts <= 0 || successes >= attempts) {
            return baseMillis;
        }
        double ratio = Math.max((double) successes / attempts, MIN_SUCCESS_RATIO);
        return Math.round(baseMillis / ratio);
    }

    /**
     * Back to the minimum delay, after a successful connection.
     */
    public void reset() {
        attempts = 0;
    }

    public int getAttempts() {
        return attempts;
    }
}
