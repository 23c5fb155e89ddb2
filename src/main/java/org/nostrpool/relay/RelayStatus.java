package org.nostrpool.relay;

/**
 * Lifecycle state of a relay connection.
 * INITIALIZED -> CONNECTING -> CONNECTED -> DISCONNECTED -> CONNECTING ...;
 * any state -> TERMINATED, which is final.
 */
public enum RelayStatus {
    /** Added to the pool, never connected */
    INITIALIZED,
    /** Transport open in progress */
    CONNECTING,
    /** Handshake done; outbound queue is drained */
    CONNECTED,
    /** Transport lost; a reconnect may be pending */
    DISCONNECTED,
    /** Stopped for good */
    TERMINATED;

    public boolean isTerminal() {
        return this == TERMINATED;
    }
}
