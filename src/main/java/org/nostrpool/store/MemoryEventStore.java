package org.nostrpool.store;

import org.nostrpool.protocol.Event;
import org.nostrpool.protocol.EventKinds;
import org.nostrpool.protocol.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link EventStore}. Replaceable and parameterized replaceable
 * events keep only the latest version per key (newest created_at, lowest id
 * on a tie).
 */
public class MemoryEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(MemoryEventStore.class);

    private static final Comparator<Event> NEWEST_FIRST = Comparator
            .comparingLong(Event::getCreatedAt).reversed()
            .thenComparing(Event::getId);

    private final Map<String, Event> events = new HashMap<>();
    private final Map<String, String> latestByKey = new HashMap<>();

    @Override
    public synchronized boolean store(Event event) {
        if (event.getId() == null) {
            throw new IllegalArgumentException("Event without id");
        }
        if (events.containsKey(event.getId())) {
            return false;
        }

        String key = EventKinds.coordinate(event);
        if (key != null) {
            String currentId = latestByKey.get(key);
            Event current = currentId != null ? events.get(currentId) : null;
            if (current != null) {
                if (NEWEST_FIRST.compare(current, event) <= 0) {
                    logger.debug("Ignoring superseded replaceable event {}", event.getId());
                    return false;
                }
                events.remove(current.getId());
            }
            latestByKey.put(key, event.getId());
        }
        events.put(event.getId(), event);
        return true;
    }

    @Override
    public synchronized List<Event> query(Filter filter) {
        List<Event> matched = new ArrayList<>();
        for (Event event : events.values()) {
            if (filter.matches(event)) {
                matched.add(event);
            }
        }
        matched.sort(NEWEST_FIRST);
        Integer limit = filter.getLimit();
        if (limit != null && matched.size() > limit) {
            return new ArrayList<>(matched.subList(0, limit));
        }
        return matched;
    }

    @Override
    public synchronized Event get(String id) {
        return events.get(id);
    }

    @Override
    public synchronized int size() {
        return events.size();
    }
}
