package org.nostrpool.negentropy;

import org.nostrpool.errors.ReconciliationException;

import java.util.Arrays;

/**
 * Upper end of a range: a timestamp plus the shortest id prefix that separates
 * it from the previous item. The prefix compares as if zero-padded to 32 bytes.
 */
final class Bound {

    static final long MAX_TIMESTAMP = Long.MAX_VALUE;
    static final Bound MAX = new Bound(MAX_TIMESTAMP, new byte[0]);
    static final Bound MIN = new Bound(0, new byte[0]);

    private final long timestamp;
    private final byte[] idPrefix;

    Bound(long timestamp, byte[] idPrefix) {
        if (idPrefix.length > Item.ID_SIZE) {
            throw new ReconciliationException("Bound key too long: " + idPrefix.length);
        }
        this.timestamp = timestamp;
        this.idPrefix = idPrefix;
    }

    long getTimestamp() {
        return timestamp;
    }

    byte[] getIdPrefix() {
        return idPrefix;
    }

    /**
     * Negative if the item sorts before this bound.
     */
    int compareItem(Item item) {
        int byTime = Long.compare(item.getTimestamp(), timestamp);
        if (byTime != 0) {
            return byTime;
        }
        byte[] padded = Arrays.copyOf(idPrefix, Item.ID_SIZE);
        return Arrays.compareUnsigned(item.getId(), padded);
    }

    /**
     * Smallest bound that is above {@code prev} and not above {@code curr}.
     */
    static Bound between(Item prev, Item curr) {
        if (curr.getTimestamp() != prev.getTimestamp()) {
            return new Bound(curr.getTimestamp(), new byte[0]);
        }
        byte[] currId = curr.getId();
        byte[] prevId = prev.getId();
        int shared = 0;
        while (shared < Item.ID_SIZE && currId[shared] == prevId[shared]) {
            shared++;
        }
        return new Bound(curr.getTimestamp(), Arrays.copyOf(currId, Math.min(shared + 1, Item.ID_SIZE)));
    }
}
