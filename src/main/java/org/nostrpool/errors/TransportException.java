package org.nostrpool.errors;

/**
 * Thrown when a relay transport cannot be opened or written to.
 * Recovered by the connection's reconnect backoff.
 */
public class TransportException extends RelayPoolException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
