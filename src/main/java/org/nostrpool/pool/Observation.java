package org.nostrpool.pool;

/**
 * Result of offering an event to the {@link EventDeduplicator}.
 */
public enum Observation {
    /** First sighting; the event goes to the unified stream. */
    DELIVERED,
    /** Seen before; only the confirming relay is recorded. */
    DUPLICATE
}
