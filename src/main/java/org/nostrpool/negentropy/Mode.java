package org.nostrpool.negentropy;

import org.nostrpool.errors.ReconciliationException;

/**
 * How a range is described on the wire.
 */
enum Mode {
    SKIP(0),
    FINGERPRINT(1),
    ID_LIST(2);

    private final int value;

    Mode(int value) {
        this.value = value;
    }

    int getValue() {
        return value;
    }

    static Mode fromValue(long value) {
        for (Mode mode : values()) {
            if (mode.value == value) {
                return mode;
            }
        }
        throw new ReconciliationException("Unexpected range mode: " + value);
    }
}
