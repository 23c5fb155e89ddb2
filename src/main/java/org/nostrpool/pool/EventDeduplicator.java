package org.nostrpool.pool;

import org.nostrpool.protocol.Event;
import org.nostrpool.relay.RelayUrl;

import java.util.Set;

/**
 * Decides whether an event reaches the unified stream: only its first
 * sighting across all relays does.
 */
public class EventDeduplicator {

    private final SeenEventIndex index;

    public EventDeduplicator(SeenEventIndex index) {
        this.index = index;
    }

    public Observation observe(Event event, RelayUrl relay) {
        return index.record(event.getId(), relay) ? Observation.DELIVERED : Observation.DUPLICATE;
    }

    public Set<RelayUrl> confirmations(String eventId) {
        return index.confirmations(eventId);
    }

    public SeenEventIndex getIndex() {
        return index;
    }
}
