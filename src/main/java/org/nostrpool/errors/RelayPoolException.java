package org.nostrpool.errors;

/**
 * Base exception for all relay pool errors.
 */
public class RelayPoolException extends RuntimeException {

    /**
     * Creates a new RelayPoolException.
     *
     * @param message the error message
     */
    public RelayPoolException(String message) {
        super(message);
    }

    /**
     * Creates a new RelayPoolException with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public RelayPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
