package org.nostrpool.pool;

import org.nostrpool.relay.RelayUrl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded map from event id to the relays that have sent that event.
 * Entries are evicted oldest-inserted first; adding a confirmation does not
 * refresh an entry.
 */
public class SeenEventIndex {

    public static final int DEFAULT_CAPACITY = 100_000;

    private final int capacity;
    private final Map<String, Set<RelayUrl>> entries;

    public SeenEventIndex() {
        this(DEFAULT_CAPACITY);
    }

    public SeenEventIndex(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<String, Set<RelayUrl>>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Set<RelayUrl>> eldest) {
                return size() > SeenEventIndex.this.capacity;
            }
        };
    }

    /**
     * Record that {@code relay} sent the event.
     *
     * @return true if the id was not in the index before
     */
    public synchronized boolean record(String eventId, RelayUrl relay) {
        Set<RelayUrl> relays = entries.get(eventId);
        if (relays != null) {
            relays.add(relay);
            return false;
        }
        relays = ConcurrentHashMap.newKeySet();
        relays.add(relay);
        entries.put(eventId, relays);
        return true;
    }

    public synchronized boolean contains(String eventId) {
        return entries.containsKey(eventId);
    }

    /**
     * Live read-only view of the relays that confirmed the event; empty if unknown or evicted.
     */
    public synchronized Set<RelayUrl> confirmations(String eventId) {
        Set<RelayUrl> relays = entries.get(eventId);
        return relays != null ? Collections.unmodifiableSet(relays) : Collections.<RelayUrl>emptySet();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
