package org.nostrpool.pool;

import org.nostrpool.relay.RelayUrl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Result of {@link RelayPool#publish}: one outcome per targeted relay.
 */
public final class PublishOutput {

    private final String eventId;
    private final Map<RelayUrl, PublishOutcome> outcomes;

    PublishOutput(String eventId, Map<RelayUrl, PublishOutcome> outcomes) {
        this.eventId = eventId;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public String getEventId() {
        return eventId;
    }

    public Map<RelayUrl, PublishOutcome> getOutcomes() {
        return outcomes;
    }

    public PublishOutcome getOutcome(RelayUrl url) {
        return outcomes.get(url);
    }

    /** Relays that accepted the event. */
    public Set<RelayUrl> getAccepted() {
        return withStatus(PublishStatus.ACCEPTED);
    }

    public Set<RelayUrl> withStatus(PublishStatus status) {
        Set<RelayUrl> urls = new LinkedHashSet<>();
        for (Map.Entry<RelayUrl, PublishOutcome> entry : outcomes.entrySet()) {
            if (entry.getValue().getStatus() == status) {
                urls.add(entry.getKey());
            }
        }
        return urls;
    }

    /** True if at least one relay accepted the event. */
    public boolean isAccepted() {
        return !getAccepted().isEmpty();
    }

    @Override
    public String toString() {
        return "PublishOutput{eventId=" + eventId + ", outcomes=" + outcomes + '}';
    }
}
