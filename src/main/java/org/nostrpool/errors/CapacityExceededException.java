package org.nostrpool.errors;

/**
 * A bounded buffer was full and an item was dropped to make room.
 */
public class CapacityExceededException extends RelayPoolException {

    /**
     * Creates a new CapacityExceededException.
     *
     * @param message what overflowed
     */
    public CapacityExceededException(String message) {
        super(message);
    }
}
