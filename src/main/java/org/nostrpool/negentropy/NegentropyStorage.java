package org.nostrpool.negentropy;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sorted (created_at, id) items of the local side of a reconciliation.
 * Insert everything, then {@link #seal()} before handing it to {@link Negentropy}.
 */
public final class NegentropyStorage {

    private final List<Item> items = new ArrayList<>();
    private boolean sealed;

    /**
     * @param createdAt event timestamp in seconds
     * @param idHex 64 character hex event id
     * @throws IllegalArgumentException on a malformed id or negative timestamp
     * @throws IllegalStateException once sealed
     */
    public void insert(long createdAt, String idHex) {
        byte[] id;
        try {
            id = Hex.decodeHex(idHex);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid event id: " + idHex, e);
        }
        insert(createdAt, id);
    }

    public void insert(long createdAt, byte[] id) {
        if (sealed) {
            throw new IllegalStateException("Storage already sealed");
        }
        if (createdAt < 0) {
            throw new IllegalArgumentException("Negative timestamp: " + createdAt);
        }
        items.add(new Item(createdAt, id));
    }

    /**
     * Sort items and drop exact duplicates. Further inserts are rejected.
     */
    public void seal() {
        if (sealed) {
            throw new IllegalStateException("Storage already sealed");
        }
        Collections.sort(items);
        for (int i = items.size() - 1; i > 0; i--) {
            if (items.get(i).equals(items.get(i - 1))) {
                items.remove(i);
            }
        }
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int size() {
        return items.size();
    }

    Item getItem(int index) {
        return items.get(index);
    }

    /**
     * Index of the first item in [begin, end) that is not below the bound, or end.
     */
    int findLowerBound(int begin, int end, Bound bound) {
        int low = begin;
        int high = end;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (bound.compareItem(items.get(mid)) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    byte[] fingerprint(int begin, int end) {
        Accumulator accumulator = new Accumulator();
        for (int i = begin; i < end; i++) {
            accumulator.add(items.get(i).getId());
        }
        return accumulator.fingerprint(end - begin);
    }
}
