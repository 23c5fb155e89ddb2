package org.nostrpool.pool;

import org.apache.commons.codec.binary.Hex;
import org.nostrpool.errors.SubscriptionClosedException;
import org.nostrpool.protocol.Filter;
import org.nostrpool.relay.RelayUrl;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Every subscription of a pool and, per subscription, the relays it is
 * currently served on.
 *
 * <p>The served-on flag is what makes resubscription exactly-once: both the
 * subscribe path and the reconnect path only send a REQ when
 * {@link #markServed} returns true, and a lost connection clears the flag
 * through {@link #relayLost}. All methods are short synchronized sections;
 * no I/O happens here.
 */
public class SubscriptionRegistry {

    private final String idPrefix;
    private final AtomicLong counter = new AtomicLong();
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    public SubscriptionRegistry() {
        byte[] random = new byte[4];
        new SecureRandom().nextBytes(random);
        this.idPrefix = Hex.encodeHexString(random);
    }

    /**
     * Allocate an id that has never been handed out by this registry.
     */
    public SubscriptionId nextId() {
        return new SubscriptionId(idPrefix + "-" + counter.incrementAndGet());
    }

    public Subscription open(List<Filter> filters, Set<RelayUrl> targets) {
        return open(filters, targets, null);
    }

    synchronized Subscription open(List<Filter> filters, Set<RelayUrl> targets, EventCollector collector) {
        if (filters.isEmpty()) {
            throw new IllegalArgumentException("At least one filter is required");
        }
        Subscription subscription = new Subscription(nextId(), filters, targets, collector);
        subscriptions.put(subscription.getId().getValue(), subscription);
        return subscription;
    }

    /**
     * @return the subscription, closed or open, or null if unknown or fully removed
     */
    public synchronized Subscription get(String id) {
        return subscriptions.get(id);
    }

    public Subscription get(SubscriptionId id) {
        return get(id.getValue());
    }

    /**
     * Open subscription or exception.
     *
     * @throws SubscriptionClosedException if unknown or closed
     */
    public synchronized Subscription require(SubscriptionId id) {
        Subscription subscription = subscriptions.get(id.getValue());
        if (subscription == null || subscription.isClosed()) {
            throw new SubscriptionClosedException(id.getValue());
        }
        return subscription;
    }

    /**
     * Claim the right to send the REQ for this subscription to this relay.
     *
     * @return true exactly once per relay until {@link #relayLost} or {@link #markNotServed}
     */
    public synchronized boolean markServed(SubscriptionId id, RelayUrl relay) {
        Subscription subscription = subscriptions.get(id.getValue());
        if (subscription == null || subscription.isClosed() || !subscription.getTargets().contains(relay)) {
            return false;
        }
        return subscription.servedOn.add(relay);
    }

    /**
     * Mark the subscription served on the relay, whether or not it already was.
     *
     * @return true if the subscription is open and targets the relay
     */
    public synchronized boolean ensureServed(SubscriptionId id, RelayUrl relay) {
        Subscription subscription = subscriptions.get(id.getValue());
        if (subscription == null || subscription.isClosed() || !subscription.getTargets().contains(relay)) {
            return false;
        }
        subscription.servedOn.add(relay);
        return true;
    }

    public synchronized void markNotServed(SubscriptionId id, RelayUrl relay) {
        Subscription subscription = subscriptions.get(id.getValue());
        if (subscription != null) {
            subscription.servedOn.remove(relay);
            subscription.eoseFrom.remove(relay);
            subscription.replacing.remove(relay);
        }
    }

    public synchronized boolean isServed(SubscriptionId id, RelayUrl relay) {
        Subscription subscription = subscriptions.get(id.getValue());
        return subscription != null && subscription.servedOn.contains(relay);
    }

    public synchronized Set<RelayUrl> servedOn(SubscriptionId id) {
        Subscription subscription = subscriptions.get(id.getValue());
        return subscription != null ? new LinkedHashSet<>(subscription.servedOn) : new LinkedHashSet<RelayUrl>();
    }

    /**
     * Open subscriptions whose target set contains the relay.
     */
    public synchronized List<Subscription> openTargeting(RelayUrl relay) {
        List<Subscription> result = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            if (!subscription.isClosed() && subscription.getTargets().contains(relay)) {
                result.add(subscription);
            }
        }
        return result;
    }

    /**
     * The relay's connection went away: nothing is served there any more.
     *
     * @return every subscription, open or closing, that was served on the relay
     */
    public synchronized List<Subscription> relayLost(RelayUrl relay) {
        List<Subscription> affected = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            boolean served = subscription.servedOn.remove(relay);
            subscription.eoseFrom.remove(relay);
            subscription.replacing.remove(relay);
            if (served || subscription.pendingCloseAcks.contains(relay)) {
                affected.add(subscription);
            }
        }
        return affected;
    }

    /**
     * @return true if this is the first EOSE from the relay since the REQ was last sent
     */
    public synchronized boolean markEose(String id, RelayUrl relay) {
        Subscription subscription = subscriptions.get(id);
        if (subscription == null || subscription.isClosed()) {
            return false;
        }
        subscription.replacing.remove(relay);
        return subscription.eoseFrom.add(relay);
    }

    /**
     * Whether the relay was serving the subscription when its filters were
     * replaced and has not yet sent EOSE for the new REQ. Events matching only
     * the previous filters are expected from it until then.
     */
    public synchronized boolean isReplacing(SubscriptionId id, RelayUrl relay) {
        Subscription subscription = subscriptions.get(id.getValue());
        return subscription != null && subscription.replacing.contains(relay);
    }

    public synchronized boolean hasEose(SubscriptionId id, RelayUrl relay) {
        Subscription subscription = subscriptions.get(id.getValue());
        return subscription != null && subscription.eoseFrom.contains(relay);
    }

    /**
     * Close a subscription. Its relays are now owed a CLOSE; each one is
     * recorded as pending until acknowledged.
     *
     * @return the relays the subscription was served on
     * @throws SubscriptionClosedException if unknown or already closed
     */
    public synchronized Set<RelayUrl> close(SubscriptionId id) {
        Subscription subscription = require(id);
        subscription.markClosed();
        Set<RelayUrl> served = new LinkedHashSet<>(subscription.servedOn);
        subscription.pendingCloseAcks.addAll(served);
        subscription.servedOn.clear();
        subscription.eoseFrom.clear();
        subscription.replacing.clear();
        if (served.isEmpty()) {
            subscriptions.remove(id.getValue());
        }
        return served;
    }

    /**
     * A relay acknowledged (or can no longer acknowledge) a CLOSE.
     *
     * @return true if this was the last outstanding acknowledgement and the
     *         subscription has now been removed
     */
    public synchronized boolean acknowledgeClose(Subscription subscription, RelayUrl relay) {
        if (!subscription.isClosed()) {
            return false;
        }
        subscription.pendingCloseAcks.remove(relay);
        if (subscription.pendingCloseAcks.isEmpty()) {
            return subscriptions.remove(subscription.getId().getValue(), subscription);
        }
        return false;
    }

    /**
     * Drop a closed subscription regardless of outstanding acknowledgements.
     *
     * @return true if it was still registered
     */
    public synchronized boolean forget(Subscription subscription) {
        subscription.pendingCloseAcks.clear();
        return subscriptions.remove(subscription.getId().getValue(), subscription);
    }

    /**
     * @throws SubscriptionClosedException if unknown or closed
     */
    public synchronized Subscription updateFilters(SubscriptionId id, List<Filter> filters) {
        if (filters.isEmpty()) {
            throw new IllegalArgumentException("At least one filter is required");
        }
        Subscription subscription = require(id);
        subscription.setFilters(filters);
        subscription.eoseFrom.clear();
        subscription.replacing.addAll(subscription.servedOn);
        return subscription;
    }

    /**
     * Replace the target set.
     *
     * @return relays dropped from the targets on which the subscription was served
     * @throws SubscriptionClosedException if unknown or closed
     */
    public synchronized Set<RelayUrl> updateTargets(SubscriptionId id, Set<RelayUrl> targets) {
        Subscription subscription = require(id);
        Set<RelayUrl> dropped = new LinkedHashSet<>();
        for (RelayUrl relay : subscription.getTargets()) {
            if (!targets.contains(relay) && subscription.servedOn.remove(relay)) {
                subscription.eoseFrom.remove(relay);
                subscription.replacing.remove(relay);
                dropped.add(relay);
            }
        }
        subscription.setTargets(targets);
        return dropped;
    }

    /**
     * Drop relays from one subscription's targets, for relays that left the
     * pool while the subscription was being opened or retargeted.
     */
    public synchronized void removeTargets(SubscriptionId id, Set<RelayUrl> relays) {
        Subscription subscription = subscriptions.get(id.getValue());
        if (subscription == null) {
            return;
        }
        Set<RelayUrl> remaining = new LinkedHashSet<>(subscription.getTargets());
        remaining.removeAll(relays);
        subscription.setTargets(remaining);
        subscription.servedOn.removeAll(relays);
        subscription.eoseFrom.removeAll(relays);
        subscription.replacing.removeAll(relays);
    }

    /**
     * The relay left the pool: drop it from every target set.
     *
     * @return the subscriptions that targeted the relay or were awaiting its close acknowledgement
     */
    public synchronized List<Subscription> removeRelay(RelayUrl relay) {
        List<Subscription> affected = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            boolean targeted = subscription.getTargets().contains(relay);
            if (targeted) {
                Set<RelayUrl> remaining = new LinkedHashSet<>(subscription.getTargets());
                remaining.remove(relay);
                subscription.setTargets(remaining);
            }
            subscription.servedOn.remove(relay);
            subscription.eoseFrom.remove(relay);
            subscription.replacing.remove(relay);
            if (targeted || subscription.pendingCloseAcks.contains(relay)) {
                affected.add(subscription);
            }
        }
        return affected;
    }

    /**
     * Remove everything.
     *
     * @return what was registered
     */
    public synchronized List<Subscription> clear() {
        List<Subscription> all = new ArrayList<>(subscriptions.values());
        for (Subscription subscription : all) {
            subscription.markClosed();
        }
        subscriptions.clear();
        return all;
    }

    public synchronized List<Subscription> snapshot() {
        return new ArrayList<>(subscriptions.values());
    }

    public synchronized int size() {
        return subscriptions.size();
    }
}
