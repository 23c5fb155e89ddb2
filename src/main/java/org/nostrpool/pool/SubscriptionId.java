package org.nostrpool.pool;

import java.util.Objects;

/**
 * Opaque subscription identifier, unique within a pool and never reused.
 */
public final class SubscriptionId {

    private final String value;

    public SubscriptionId(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Subscription id must not be empty");
        }
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionId)) return false;
        return value.equals(((SubscriptionId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
