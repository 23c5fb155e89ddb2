package org.nostrpool.pool;

import org.nostrpool.protocol.Event;
import org.nostrpool.relay.RelayUrl;

import java.util.Set;

/**
 * An event on the unified stream, with where it came from.
 */
public final class PooledEvent {

    private final Event event;
    private final SubscriptionId subscriptionId;
    private final RelayUrl relayUrl;
    private final Set<RelayUrl> confirmations;

    PooledEvent(Event event, SubscriptionId subscriptionId, RelayUrl relayUrl, Set<RelayUrl> confirmations) {
        this.event = event;
        this.subscriptionId = subscriptionId;
        this.relayUrl = relayUrl;
        this.confirmations = confirmations;
    }

    public Event getEvent() {
        return event;
    }

    public SubscriptionId getSubscriptionId() {
        return subscriptionId;
    }

    /** The relay that delivered the event first. */
    public RelayUrl getRelayUrl() {
        return relayUrl;
    }

    /**
     * Every relay that has sent this event so far. A live view: it keeps
     * growing as duplicates arrive, until the id is evicted from the seen index.
     */
    public Set<RelayUrl> getConfirmations() {
        return confirmations;
    }

    @Override
    public String toString() {
        return "PooledEvent{id=" + event.getId() + ", subscription=" + subscriptionId + ", relay=" + relayUrl + '}';
    }
}
