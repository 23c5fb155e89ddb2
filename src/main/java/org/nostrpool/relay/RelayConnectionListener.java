package org.nostrpool.relay;

import org.nostrpool.errors.ProtocolException;
import org.nostrpool.protocol.RelayMessage;

/**
 * Receives everything a connection reports. All callbacks run on the
 * connection's own task thread, in order.
 */
public interface RelayConnectionListener {

    /**
     * A state transition happened. For CONNECTED this runs after the outbound
     * queue has been flushed.
     */
    void onStatusChanged(RelayConnection connection, RelayStatus previous, RelayStatus current, String reason);

    /** A decoded inbound message. */
    void onMessage(RelayConnection connection, RelayMessage message);

    /** Inbound text that could not be decoded. */
    void onProtocolError(RelayConnection connection, String text, ProtocolException error);

    /**
     * The outbound queue was full and its oldest message was dropped.
     *
     * @param droppedTotal messages dropped on this connection so far
     */
    void onOutboundOverflow(RelayConnection connection, long droppedTotal);
}
