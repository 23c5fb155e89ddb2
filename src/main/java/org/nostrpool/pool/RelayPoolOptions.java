package org.nostrpool.pool;

import org.nostrpool.crypto.EventVerifier;
import org.nostrpool.crypto.SchnorrEventVerifier;
import org.nostrpool.protocol.JsonMessageCodec;
import org.nostrpool.protocol.MessageCodec;
import org.nostrpool.relay.RelayOptions;
import org.nostrpool.store.EventStore;
import org.nostrpool.transport.RelayTransportFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Pool-wide configuration. Use {@link #builder()} to create instances.
 */
public final class RelayPoolOptions {

    /** default number of event ids remembered for deduplication */
    public static final int DEFAULT_SEEN_CAPACITY = SeenEventIndex.DEFAULT_CAPACITY;

    /** default buffer size of each event stream consumer */
    public static final int DEFAULT_STREAM_CAPACITY = 4096;

    /** default buffer size of each notification consumer */
    public static final int DEFAULT_NOTIFICATION_CAPACITY = 4096;

    /** default time to wait for a relay's OK */
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(10);

    /** default time to wait for CLOSED acknowledgements */
    public static final Duration DEFAULT_UNSUBSCRIBE_GRACE = Duration.ofSeconds(5);

    private final int seenCapacity;
    private final int streamCapacity;
    private final int notificationCapacity;
    private final OverflowPolicy overflowPolicy;
    private final Duration sendTimeout;
    private final Duration unsubscribeGrace;
    private final boolean verifyEvents;
    private final Clock clock;
    private final EventStore store;
    private final EventVerifier verifier;
    private final MessageCodec codec;
    private final RelayTransportFactory transportFactory;
    private final RelayOptions defaultRelayOptions;

    private RelayPoolOptions(Builder builder) {
        this.seenCapacity = builder.seenCapacity;
        this.streamCapacity = builder.streamCapacity;
        this.notificationCapacity = builder.notificationCapacity;
        this.overflowPolicy = builder.overflowPolicy;
        this.sendTimeout = builder.sendTimeout;
        this.unsubscribeGrace = builder.unsubscribeGrace;
        this.verifyEvents = builder.verifyEvents;
        this.clock = builder.clock;
        this.store = builder.store;
        this.verifier = builder.verifier;
        this.codec = builder.codec;
        this.transportFactory = builder.transportFactory;
        this.defaultRelayOptions = builder.defaultRelayOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RelayPoolOptions defaults() {
        return builder().build();
    }

    public int getSeenCapacity() { return seenCapacity; }
    public int getStreamCapacity() { return streamCapacity; }
    public int getNotificationCapacity() { return notificationCapacity; }
    public OverflowPolicy getOverflowPolicy() { return overflowPolicy; }
    public Duration getSendTimeout() { return sendTimeout; }
    public Duration getUnsubscribeGrace() { return unsubscribeGrace; }
    public boolean isVerifyEvents() { return verifyEvents; }
    public Clock getClock() { return clock; }

    /** Local store, or null for none. */
    public EventStore getStore() { return store; }

    public EventVerifier getVerifier() { return verifier; }
    public MessageCodec getCodec() { return codec; }

    /** Transport factory, or null to let the pool create (and own) an OkHttp one. */
    public RelayTransportFactory getTransportFactory() { return transportFactory; }

    /** Options for relays added without their own. */
    public RelayOptions getDefaultRelayOptions() { return defaultRelayOptions; }

    /**
     * Builder for RelayPoolOptions.
     */
    public static final class Builder {
        private int seenCapacity = DEFAULT_SEEN_CAPACITY;
        private int streamCapacity = DEFAULT_STREAM_CAPACITY;
        private int notificationCapacity = DEFAULT_NOTIFICATION_CAPACITY;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
        private Duration sendTimeout = DEFAULT_SEND_TIMEOUT;
        private Duration unsubscribeGrace = DEFAULT_UNSUBSCRIBE_GRACE;
        private boolean verifyEvents = true;
        private Clock clock = Clock.systemUTC();
        private EventStore store;
        private EventVerifier verifier = new SchnorrEventVerifier();
        private MessageCodec codec = new JsonMessageCodec();
        private RelayTransportFactory transportFactory;
        private RelayOptions defaultRelayOptions = RelayOptions.defaults();

        private Builder() {
        }

        public Builder seenCapacity(int seenCapacity) {
            this.seenCapacity = seenCapacity;
            return this;
        }

        public Builder streamCapacity(int streamCapacity) {
            this.streamCapacity = streamCapacity;
            return this;
        }

        public Builder notificationCapacity(int notificationCapacity) {
            this.notificationCapacity = notificationCapacity;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
            return this;
        }

        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
            return this;
        }

        public Builder unsubscribeGrace(Duration unsubscribeGrace) {
            this.unsubscribeGrace = Objects.requireNonNull(unsubscribeGrace, "unsubscribeGrace");
            return this;
        }

        /**
         * Check ids and signatures of inbound events. Disable only for trusted relays.
         */
        public Builder verifyEvents(boolean verifyEvents) {
            this.verifyEvents = verifyEvents;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder store(EventStore store) {
            this.store = store;
            return this;
        }

        public Builder verifier(EventVerifier verifier) {
            this.verifier = Objects.requireNonNull(verifier, "verifier");
            return this;
        }

        public Builder codec(MessageCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        public Builder transportFactory(RelayTransportFactory transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder defaultRelayOptions(RelayOptions defaultRelayOptions) {
            this.defaultRelayOptions = Objects.requireNonNull(defaultRelayOptions, "defaultRelayOptions");
            return this;
        }

        public RelayPoolOptions build() {
            if (seenCapacity < 1 || streamCapacity < 1 || notificationCapacity < 1) {
                throw new IllegalArgumentException("capacities must be positive");
            }
            if (sendTimeout.isNegative() || sendTimeout.isZero()) {
                throw new IllegalArgumentException("sendTimeout must be positive");
            }
            if (unsubscribeGrace.isNegative()) {
                throw new IllegalArgumentException("unsubscribeGrace must not be negative");
            }
            return new RelayPoolOptions(this);
        }
    }
}
