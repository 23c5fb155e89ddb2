package org.nostrpool.protocol;

import org.nostrpool.errors.ProtocolException;

/**
 * Wire encoding of protocol messages between the pool and its relays.
 * Implementations must be thread-safe: every relay connection shares one codec.
 */
public interface MessageCodec {

    /**
     * Encode a client message for the wire.
     *
     * @param message message to encode
     * @return wire text
     * @throws ProtocolException if the message cannot be serialized
     */
    String encode(ClientMessage message);

    /**
     * Decode a message received from a relay.
     *
     * @param text wire text
     * @return decoded message
     * @throws ProtocolException if the text is not a well-formed relay message
     */
    RelayMessage decode(String text);
}
