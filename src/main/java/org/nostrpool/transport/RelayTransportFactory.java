package org.nostrpool.transport;

import org.nostrpool.relay.RelayUrl;

/**
 * Opens transports to relays. Opening is asynchronous: the outcome is reported
 * through {@link TransportListener#onOpen()} or {@link TransportListener#onFailure(Throwable)}.
 */
public interface RelayTransportFactory extends AutoCloseable {

    /**
     * Start opening a channel to the relay.
     *
     * @param url relay endpoint
     * @param listener receives the channel's lifecycle and inbound messages
     * @return handle for sending and closing
     * @throws org.nostrpool.errors.TransportException if the open cannot even be attempted
     */
    RelayTransport open(RelayUrl url, TransportListener listener);

    /**
     * Release resources shared by all transports of this factory.
     */
    @Override
    default void close() {
    }
}
