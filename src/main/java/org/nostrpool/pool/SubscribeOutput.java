package org.nostrpool.pool;

import org.nostrpool.relay.RelayUrl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of {@link RelayPool#subscribe}: the new id and what happened on each target relay.
 */
public final class SubscribeOutput {

    private final SubscriptionId id;
    private final Map<RelayUrl, SubscribeStatus> statuses;

    SubscribeOutput(SubscriptionId id, Map<RelayUrl, SubscribeStatus> statuses) {
        this.id = id;
        this.statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public SubscriptionId getId() {
        return id;
    }

    public Map<RelayUrl, SubscribeStatus> getStatuses() {
        return statuses;
    }

    public SubscribeStatus getStatus(RelayUrl url) {
        return statuses.get(url);
    }

    @Override
    public String toString() {
        return "SubscribeOutput{id=" + id + ", statuses=" + statuses + '}';
    }
}
