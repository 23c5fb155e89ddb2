package org.nostrpool.negentropy;

import java.util.Arrays;

/**
 * A (created_at, id) pair. Items sort by timestamp, then by id bytes (unsigned).
 */
final class Item implements Comparable<Item> {

    static final int ID_SIZE = 32;

    private final long timestamp;
    private final byte[] id;

    Item(long timestamp, byte[] id) {
        if (id.length != ID_SIZE) {
            throw new IllegalArgumentException("Item id must be " + ID_SIZE + " bytes");
        }
        this.timestamp = timestamp;
        this.id = id.clone();
    }

    long getTimestamp() {
        return timestamp;
    }

    byte[] getId() {
        return id;
    }

    @Override
    public int compareTo(Item other) {
        int byTime = Long.compare(timestamp, other.timestamp);
        return byTime != 0 ? byTime : Arrays.compareUnsigned(id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item)) return false;
        Item item = (Item) o;
        return timestamp == item.timestamp && Arrays.equals(id, item.id);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(timestamp) + Arrays.hashCode(id);
    }
}
