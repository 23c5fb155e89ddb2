package org.nostrpool.pool;

/**
 * Per relay result of issuing a subscription.
 */
public enum SubscribeStatus {
    /** REQ handed to a connected relay. */
    SENT,
    /** Relay not connected; the REQ goes out on its next CONNECTED transition. */
    PENDING_CONNECTION
}
