package org.nostrpool.pool;

/**
 * Per relay outcome of a publish.
 */
public enum PublishStatus {
    /** Relay answered OK true. */
    ACCEPTED,
    /** Relay answered OK false; the outcome carries its reason. */
    REJECTED,
    /** Relay was not connected, nothing was sent. */
    NOT_ATTEMPTED,
    /** Sent, but the connection dropped or no OK arrived within the send timeout. */
    FAILED
}
