package org.nostrpool.errors;

/**
 * Thrown when a relay sends a malformed or unexpected protocol message.
 * Never fatal to the connection it came from.
 */
public class ProtocolException extends RelayPoolException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
