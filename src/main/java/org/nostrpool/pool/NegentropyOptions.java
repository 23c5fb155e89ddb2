package org.nostrpool.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for reconciliation and sync. Use {@link #builder()} to create instances.
 */
public final class NegentropyOptions {

    /** default time to wait for each relay reply */
    public static final Duration DEFAULT_INITIAL_TIMEOUT = Duration.ofSeconds(10);

    /** default cap on message rounds per session */
    public static final int DEFAULT_MAX_ROUNDS = 64;

    /** default timeout of each fetch issued by a sync */
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);

    private final Duration initialTimeout;
    private final NegentropyDirection direction;
    private final boolean fallbackToFetch;
    private final int maxRounds;
    private final Duration fetchTimeout;

    private NegentropyOptions(Builder builder) {
        this.initialTimeout = builder.initialTimeout;
        this.direction = builder.direction;
        this.fallbackToFetch = builder.fallbackToFetch;
        this.maxRounds = builder.maxRounds;
        this.fetchTimeout = builder.fetchTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static NegentropyOptions defaults() {
        return builder().build();
    }

    /** How long to wait for the relay's reply to each message before aborting. */
    public Duration getInitialTimeout() {
        return initialTimeout;
    }

    public NegentropyDirection getDirection() {
        return direction;
    }

    /** Whether sync falls back to a plain filter fetch on relays that aborted. */
    public boolean isFallbackToFetch() {
        return fallbackToFetch;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public static final class Builder {
        private Duration initialTimeout = DEFAULT_INITIAL_TIMEOUT;
        private NegentropyDirection direction = NegentropyDirection.DOWN;
        private boolean fallbackToFetch = false;
        private int maxRounds = DEFAULT_MAX_ROUNDS;
        private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;

        private Builder() {
        }

        public Builder initialTimeout(Duration initialTimeout) {
            this.initialTimeout = Objects.requireNonNull(initialTimeout, "initialTimeout");
            return this;
        }

        public Builder direction(NegentropyDirection direction) {
            this.direction = Objects.requireNonNull(direction, "direction");
            return this;
        }

        public Builder fallbackToFetch(boolean fallbackToFetch) {
            this.fallbackToFetch = fallbackToFetch;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
            return this;
        }

        public NegentropyOptions build() {
            if (initialTimeout.isNegative() || initialTimeout.isZero()) {
                throw new IllegalArgumentException("initialTimeout must be positive");
            }
            if (maxRounds < 1) {
                throw new IllegalArgumentException("maxRounds must be positive");
            }
            return new NegentropyOptions(this);
        }
    }
}
