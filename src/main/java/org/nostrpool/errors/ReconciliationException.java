package org.nostrpool.errors;

/**
 * Thrown when a negentropy exchange cannot continue: malformed message,
 * unsupported protocol version, or a relay that aborted the session.
 */
public class ReconciliationException extends RelayPoolException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
