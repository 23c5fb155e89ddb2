package org.nostrpool.errors;

/**
 * Thrown when an operation names a relay that is not part of the pool.
 */
public class RelayNotFoundException extends RelayPoolException {

    /**
     * Creates a new RelayNotFoundException.
     *
     * @param relayUrl the relay that could not be found
     */
    public RelayNotFoundException(String relayUrl) {
        super("relay not found in pool: " + relayUrl);
    }
}
