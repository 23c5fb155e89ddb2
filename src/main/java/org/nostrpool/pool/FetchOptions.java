package org.nostrpool.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * When a one-shot fetch stops collecting, besides its overall timeout.
 */
public final class FetchOptions {

    public enum Mode {
        /** Stop once every targeted relay has sent EOSE. */
        EXIT_ON_EOSE,
        /** After every EOSE, wait for a number of further events. */
        WAIT_FOR_EVENTS_AFTER_EOSE,
        /** After every EOSE, keep collecting for a fixed duration. */
        WAIT_DURATION_AFTER_EOSE
    }

    private static final FetchOptions EXIT_ON_EOSE = new FetchOptions(Mode.EXIT_ON_EOSE, 0, Duration.ZERO);

    private final Mode mode;
    private final int eventsAfterEose;
    private final Duration durationAfterEose;

    private FetchOptions(Mode mode, int eventsAfterEose, Duration durationAfterEose) {
        this.mode = mode;
        this.eventsAfterEose = eventsAfterEose;
        this.durationAfterEose = durationAfterEose;
    }

    public static FetchOptions exitOnEose() {
        return EXIT_ON_EOSE;
    }

    public static FetchOptions waitForEventsAfterEose(int events) {
        if (events < 0) {
            throw new IllegalArgumentException("events must not be negative");
        }
        return new FetchOptions(Mode.WAIT_FOR_EVENTS_AFTER_EOSE, events, Duration.ZERO);
    }

    public static FetchOptions waitDurationAfterEose(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
        return new FetchOptions(Mode.WAIT_DURATION_AFTER_EOSE, 0, duration);
    }

    public Mode getMode() {
        return mode;
    }

    public int getEventsAfterEose() {
        return eventsAfterEose;
    }

    public Duration getDurationAfterEose() {
        return durationAfterEose;
    }

    @Override
    public String toString() {
        switch (mode) {
            case WAIT_FOR_EVENTS_AFTER_EOSE:
                return mode + "(" + eventsAfterEose + ")";
            case WAIT_DURATION_AFTER_EOSE:
                return mode + "(" + durationAfterEose + ")";
            default:
                return mode.toString();
        }
    }
}
