package org.nostrpool.pool;

import org.nostrpool.protocol.Filter;
import org.nostrpool.relay.RelayUrl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A pool-level subscription. The served-on, EOSE and close bookkeeping is
 * owned by {@link SubscriptionRegistry} and only touched under its lock.
 */
public final class Subscription {

    private final SubscriptionId id;
    private final EventCollector collector;
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private volatile List<Filter> filters;
    private volatile Set<RelayUrl> targets;
    private volatile boolean closed;

    final Set<RelayUrl> servedOn = new HashSet<>();
    final Set<RelayUrl> eoseFrom = new HashSet<>();
    final Set<RelayUrl> pendingCloseAcks = new HashSet<>();
    // relays that may still send events for the previous filters, until they EOSE the new REQ
    final Set<RelayUrl> replacing = new HashSet<>();

    Subscription(SubscriptionId id, List<Filter> filters, Set<RelayUrl> targets, EventCollector collector) {
        this.id = id;
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        this.targets = Collections.unmodifiableSet(new LinkedHashSet<>(targets));
        this.collector = collector;
    }

    public SubscriptionId getId() {
        return id;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public Set<RelayUrl> getTargets() {
        return targets;
    }

    public boolean isClosed() {
        return closed;
    }

    EventCollector getCollector() {
        return collector;
    }

    CompletableFuture<Void> getCloseFuture() {
        return closeFuture;
    }

    void setFilters(List<Filter> filters) {
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
    }

    void setTargets(Set<RelayUrl> targets) {
        this.targets = Collections.unmodifiableSet(new LinkedHashSet<>(targets));
    }

    void markClosed() {
        this.closed = true;
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", filters=" + filters + ", targets=" + targets
                + (closed ? ", closed" : "") + '}';
    }
}
