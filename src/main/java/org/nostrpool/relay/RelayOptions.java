package org.nostrpool.relay;

import java.time.Duration;
import java.util.Objects;

/**
 * Per relay configuration. Use {@link #builder()} to create instances.
 */
public final class RelayOptions {

    /** default initial reconnect delay */
    public static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofSeconds(1);

    /** default cap for the reconnect delay */
    public static final Duration DEFAULT_MAX_RECONNECT_INTERVAL = Duration.ofSeconds(30);

    /** default growth factor between reconnect attempts */
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    /** default number of messages waiting to be written */
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final boolean read;
    private final boolean write;
    private final boolean reconnect;
    private final Duration reconnectInterval;
    private final Duration maxReconnectInterval;
    private final double backoffMultiplier;
    private final boolean jitter;
    private final boolean adjustRetryInterval;
    private final int queueCapacity;

    private RelayOptions(Builder builder) {
        this.read = builder.read;
        this.write = builder.write;
        this.reconnect = builder.reconnect;
        this.reconnectInterval = builder.reconnectInterval;
        this.maxReconnectInterval = builder.maxReconnectInterval;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.jitter = builder.jitter;
        this.adjustRetryInterval = builder.adjustRetryInterval;
        this.queueCapacity = builder.queueCapacity;
    }

    /**
     * Creates a new builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options with every default.
     */
    public static RelayOptions defaults() {
        return builder().build();
    }

    /** Whether the relay is picked for subscriptions targeting all relays. */
    public boolean isRead() {
        return read;
    }

    /** Whether the relay is picked for publishes targeting all relays. */
    public boolean isWrite() {
        return write;
    }

    /** Whether a lost or failed connection is retried automatically. */
    public boolean isReconnect() {
        return reconnect;
    }

    public Duration getReconnectInterval() {
        return reconnectInterval;
    }

    public Duration getMaxReconnectInterval() {
        return maxReconnectInterval;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    /** Whether reconnect delays are randomized between half and all of the computed delay. */
    public boolean isJitter() {
        return jitter;
    }

    /**
     * Whether the reconnect interval grows for relays whose connection
     * attempts often fail, based on {@link RelayStats}.
     */
    public boolean isAdjustRetryInterval() {
        return adjustRetryInterval;
    }

    /** Messages accepted for sending but not yet written; the oldest is dropped beyond this. */
    public int getQueueCapacity() {
        return queueCapacity;
    }

    /**
     * Builder for RelayOptions.
     */
    public static final class Builder {
        private boolean read = true;
        private boolean write = true;
        private boolean reconnect = true;
        private Duration reconnectInterval = DEFAULT_RECONNECT_INTERVAL;
        private Duration maxReconnectInterval = DEFAULT_MAX_RECONNECT_INTERVAL;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private boolean jitter = true;
        private boolean adjustRetryInterval = true;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;

        private Builder() {
        }

        public Builder read(boolean read) {
            this.read = read;
            return this;
        }

        public Builder write(boolean write) {
            this.write = write;
            return this;
        }

        public Builder reconnect(boolean reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        public Builder reconnectInterval(Duration reconnectInterval) {
            this.reconnectInterval = Objects.requireNonNull(reconnectInterval, "reconnectInterval");
            return this;
        }

        public Builder maxReconnectInterval(Duration maxReconnectInterval) {
            this.maxReconnectInterval = Objects.requireNonNull(maxReconnectInterval, "maxReconnectInterval");
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder adjustRetryInterval(boolean adjustRetryInterval) {
            this.adjustRetryInterval = adjustRetryInterval;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the backoff settings are inconsistent
         */
        public RelayOptions build() {
            if (reconnectInterval.isNegative() || reconnectInterval.isZero()) {
                throw new IllegalArgumentException("reconnectInterval must be positive");
            }
            if (maxReconnectInterval.compareTo(reconnectInterval) < 0) {
                throw new IllegalArgumentException("maxReconnectInterval must not be below reconnectInterval");
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be at least 1");
            }
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("queueCapacity must be positive");
            }
            return new RelayOptions(this);
        }
    }
}
