package org.nostrpool.pool;

import org.nostrpool.negentropy.Negentropy;
import org.nostrpool.negentropy.NegentropyStorage;
import org.nostrpool.protocol.Event;
import org.nostrpool.protocol.Filter;
import org.nostrpool.protocol.RelayMessage;
import org.nostrpool.relay.RelayConnection;
import org.nostrpool.relay.RelayUrl;
import org.nostrpool.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs negentropy sessions against relays, with the local side taken from
 * the event store, and routes NEG-MSG / NEG-ERR replies to them.
 */
public class ReconciliationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final EventStore store;
    private final ScheduledExecutorService scheduler;
    private final Supplier<SubscriptionId> ids;
    private final Consumer<PoolNotification> notifications;
    private final ConcurrentMap<String, ReconciliationSession> sessions = new ConcurrentHashMap<>();

    /**
     * @param store local events; null reconciles an empty local set
     */
    public ReconciliationEngine(EventStore store, ScheduledExecutorService scheduler,
                                Supplier<SubscriptionId> ids, Consumer<PoolNotification> notifications) {
        this.store = store;
        this.scheduler = scheduler;
        this.ids = ids;
        this.notifications = notifications;
    }

    /**
     * Reconcile the local events matching {@code filter} with the relay.
     * The future never fails: an interrupted exchange completes with a
     * partial, incomplete result.
     */
    public CompletableFuture<ReconciliationResult> reconcile(RelayConnection connection, Filter filter,
                                                             NegentropyOptions options) {
        if (!connection.isConnected()) {
            return CompletableFuture.completedFuture(new ReconciliationResult(connection.getUrl(),
                    Collections.<String>emptySet(), Collections.<String>emptySet(), false,
                    "relay not connected", 0));
        }

        ReconciliationSession session = new ReconciliationSession(ids.get().getValue(), connection, filter,
                options, new Negentropy(localItems(filter)), scheduler, this::finished);
        sessions.put(session.getId(), session);
        session.start();
        return session.getResult();
    }

    /**
     * Route a NEG-MSG or NEG-ERR from a relay.
     */
    public void onMessage(RelayUrl relay, RelayMessage message) {
        ReconciliationSession session = sessions.get(message.getSubscriptionId());
        if (session == null || !session.getRelayUrl().equals(relay)) {
            logger.debug("Ignoring {} for unknown negentropy session {} from {}",
                    message.getType(), message.getSubscriptionId(), relay);
            return;
        }
        if (message.getType() == RelayMessage.Type.NEG_ERR) {
            session.onError(message.getMessage());
        } else {
            session.onMessage(message.getMessage());
        }
    }

    /**
     * Abort every session running against the relay.
     */
    public void abortRelay(RelayUrl relay, String reason) {
        for (ReconciliationSession session : new ArrayList<>(sessions.values())) {
            if (session.getRelayUrl().equals(relay)) {
                session.abort(reason);
            }
        }
    }

    public void abortAll(String reason) {
        for (ReconciliationSession session : new ArrayList<>(sessions.values())) {
            session.abort(reason);
        }
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public List<ReconciliationSession> getActiveSessions() {
        return new ArrayList<>(sessions.values());
    }

    private NegentropyStorage localItems(Filter filter) {
        NegentropyStorage storage = new NegentropyStorage();
        if (store != null) {
            for (Event event : store.query(filter.toBuilder().removeLimit().build())) {
                try {
                    storage.insert(event.getCreatedAt(), event.getId());
                } catch (IllegalArgumentException e) {
                    logger.warn("Skipping stored event with unusable id {}: {}", event.getId(), e.getMessage());
                }
            }
        }
        storage.seal();
        return storage;
    }

    private void finished(ReconciliationSession session, ReconciliationResult result) {
        sessions.remove(session.getId(), session);
        if (result.isComplete()) {
            logger.info("Reconciled with {}: {} needed, {} to send", result.getRelayUrl(),
                    result.getNeedIds().size(), result.getHaveIds().size());
        } else {
            logger.info("Reconciliation with {} aborted: {}", result.getRelayUrl(), result.getAbortReason());
            notifications.accept(PoolNotification.reconciliationAborted(result.getRelayUrl(), session.getId(),
                    result.getAbortReason()));
        }
    }
}
