package org.nostrpool.store;

import org.nostrpool.protocol.Event;
import org.nostrpool.protocol.Filter;

import java.util.List;

/**
 * Local event storage. Backs the local side of negentropy reconciliation and
 * receives every event the pool delivers. Implementations must be thread-safe.
 */
public interface EventStore {

    /**
     * Save an event.
     *
     * @return true if the event was new and kept, false if it was already
     *         present or superseded by a newer replaceable event
     */
    boolean store(Event event);

    /**
     * Events matching the filter, newest first, truncated to the filter's limit.
     */
    List<Event> query(Filter filter);

    /**
     * @return the event with this id, or null if not stored
     */
    Event get(String id);

    int size();
}
