package org.nostrpool.pool;

import org.nostrpool.relay.RelayUrl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Result of {@link RelayPool#sync}.
 */
public final class SyncOutput {

    private final Map<RelayUrl, ReconciliationResult> results;
    private final Set<String> received;
    private final Set<String> sent;

    SyncOutput(Map<RelayUrl, ReconciliationResult> results, Set<String> received, Set<String> sent) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.received = Collections.unmodifiableSet(new LinkedHashSet<>(received));
        this.sent = Collections.unmodifiableSet(new LinkedHashSet<>(sent));
    }

    /** Reconciliation outcome per relay. */
    public Map<RelayUrl, ReconciliationResult> getResults() {
        return results;
    }

    /** Ids of events fetched from relays. */
    public Set<String> getReceived() {
        return received;
    }

    /** Ids of local events accepted by at least one relay. */
    public Set<String> getSent() {
        return sent;
    }

    @Override
    public String toString() {
        return "SyncOutput{relays=" + results.keySet() + ", received=" + received.size()
                + ", sent=" + sent.size() + '}';
    }
}
