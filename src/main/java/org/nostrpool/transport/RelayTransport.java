package org.nostrpool.transport;

/**
 * One open (or opening) message channel to a relay.
 */
public interface RelayTransport {

    /**
     * Queue a text frame for sending.
     *
     * @return false if the channel is closing or already closed
     */
    boolean send(String text);

    /**
     * Start a graceful close.
     */
    void close(int code, String reason);

    /**
     * Drop the channel immediately without a close handshake.
     */
    void cancel();
}
