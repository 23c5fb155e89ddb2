package org.nostrpool.pool;

import org.nostrpool.crypto.EventVerifier;
import org.nostrpool.errors.ProtocolException;
import org.nostrpool.errors.RelayNotFoundException;
import org.nostrpool.errors.SubscriptionClosedException;
import org.nostrpool.protocol.ClientMessage;
import org.nostrpool.protocol.Event;
import org.nostrpool.protocol.EventKinds;
import org.nostrpool.protocol.Filter;
import org.nostrpool.protocol.MessageCodec;
import org.nostrpool.protocol.RelayMessage;
import org.nostrpool.relay.RelayConnection;
import org.nostrpool.relay.RelayConnectionListener;
import org.nostrpool.relay.RelayOptions;
import org.nostrpool.relay.RelayStatus;
import org.nostrpool.relay.RelayUrl;
import org.nostrpool.store.EventStore;
import org.nostrpool.transport.OkHttpTransportFactory;
import org.nostrpool.transport.RelayTransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Many relays behind one API: publish to several relays at once, subscribe
 * across relays with a single deduplicated event stream, and reconcile a
 * local store with relays using negentropy.
 *
 * <pre>{@code
 * try (RelayPool pool = new RelayPool()) {
 *     pool.addRelay("wss://relay.damus.io");
 *     pool.addRelay("wss://nos.lol");
 *     pool.connect();
 *
 *     StreamConsumer<PooledEvent> events = pool.events();
 *     pool.subscribe(Collections.singletonList(Filter.builder().kinds(1).limit(20).build()));
 *     for (PooledEvent event : events) {
 *         System.out.println(event.getEvent().getContent());
 *     }
 * }
 * }</pre>
 *
 * <p>Each relay runs on its own connection thread; a slow or failing relay
 * never delays another. All methods are thread-safe.
 */
public class RelayPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RelayPool.class);
    private static final int SYNC_FETCH_BATCH_SIZE = 50;
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final RelayPoolOptions options;
    private final RelayTransportFactory transportFactory;
    private final boolean ownsTransportFactory;
    private final MessageCodec codec;
    private final EventVerifier verifier;
    private final EventStore store;

    private final Map<RelayUrl, RelayConnection> relays = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<PublishOutcome>> pendingOks = new ConcurrentHashMap<>();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final EventDeduplicator deduplicator;
    private final BroadcastChannel<PooledEvent> events;
    private final BroadcastChannel<PoolNotification> notifications;
    private final ReconciliationEngine reconciliation;
    private final ScheduledExecutorService scheduler;
    private final ConnectionHandler connectionHandler = new ConnectionHandler();
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private final ThreadLocal<Boolean> reportingNotificationOverflow = new ThreadLocal<>();

    /**
     * Create a pool with default options and an OkHttp transport.
     */
    public RelayPool() {
        this(RelayPoolOptions.defaults());
    }

    /**
     * Create a pool.
     *
     * @param options pool configuration
     */
    public RelayPool(RelayPoolOptions options) {
        this.options = options;
        if (options.getTransportFactory() != null) {
            this.transportFactory = options.getTransportFactory();
            this.ownsTransportFactory = false;
        } else {
            this.transportFactory = new OkHttpTransportFactory();
            this.ownsTransportFactory = true;
        }
        this.codec = options.getCodec();
        this.verifier = options.getVerifier();
        this.store = options.getStore();
        this.deduplicator = new EventDeduplicator(new SeenEventIndex(options.getSeenCapacity()));
        this.notifications = new BroadcastChannel<>(options.getNotificationCapacity(), options.getOverflowPolicy(),
                this::notificationConsumerOverflowed);
        this.events = new BroadcastChannel<>(options.getStreamCapacity(), options.getOverflowPolicy(),
                this::eventConsumerOverflowed);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "relay-pool-timer");
            thread.setDaemon(true);
            return thread;
        });
        this.reconciliation = new ReconciliationEngine(store, scheduler, registry::nextId, notifications::publish);
    }

    // ------------------------------------------------------------------
    // Relays
    // ------------------------------------------------------------------

    /**
     * Add a relay with the pool's default relay options. Does not connect.
     *
     * @param url relay WebSocket URL (ws:// or wss://)
     * @return the relay's connection, existing or new
     * @throws IllegalArgumentException if the url is not a valid relay url
     */
    public RelayConnection addRelay(String url) {
        return addRelay(RelayUrl.parse(url), options.getDefaultRelayOptions());
    }

    /**
     * Add a relay. Adding a relay that is already in the pool returns the
     * existing connection and ignores {@code relayOptions}.
     *
     * @param url relay URL
     * @param relayOptions options for this relay
     * @return the relay's connection, existing or new
     */
    public RelayConnection addRelay(RelayUrl url, RelayOptions relayOptions) {
        ensureRunning();
        return relays.computeIfAbsent(url, u -> {
            logger.info("Adding relay {}", u);
            return newConnection(u, relayOptions);
        });
    }

    /**
     * Remove a relay: terminate its connection and drop it from every
     * subscription, pending publish and reconciliation.
     *
     * @param url relay URL
     * @return completes once the connection has processed its termination
     * @throws RelayNotFoundException if the relay is not in the pool
     */
    public CompletableFuture<Void> removeRelay(RelayUrl url) {
        RelayConnection connection = relays.remove(url);
        if (connection == null) {
            throw new RelayNotFoundException(url.toString());
        }
        logger.info("Removing relay {}", url);
        for (Subscription subscription : registry.removeRelay(url)) {
            relayFinished(subscription, url);
        }
        failPendingPublishes(url, "relay removed");
        reconciliation.abortRelay(url, "relay removed");
        return connection.terminate();
    }

    public CompletableFuture<Void> removeRelay(String url) {
        return removeRelay(RelayUrl.parse(url));
    }

    /**
     * Start connecting every relay that is not connected yet. Returns
     * immediately; watch {@link #notifications()} or {@link #status()} for progress.
     */
    public void connect() {
        ensureRunning();
        for (RelayUrl url : new ArrayList<>(relays.keySet())) {
            connectRelay(url);
        }
    }

    /**
     * Connect one relay. A relay disconnected with {@link #disconnectRelay}
     * gets a fresh connection.
     *
     * @param url relay URL
     * @return completes when the relay is connected; fails if it gets
     *         terminated first or cannot connect with reconnect disabled
     * @throws RelayNotFoundException if the relay is not in the pool
     */
    public CompletableFuture<Void> connectRelay(RelayUrl url) {
        ensureRunning();
        RelayConnection connection = relay(url);
        if (connection.getStatus() == RelayStatus.TERMINATED) {
            RelayConnection replacement = relays.computeIfPresent(url, (u, current) ->
                    current.getStatus() == RelayStatus.TERMINATED ? newConnection(u, current.getOptions()) : current);
            if (replacement == null) {
                throw new RelayNotFoundException(url.toString());
            }
            if (replacement != connection) {
                logger.info("Reopening terminated relay {}", url);
                // The old connection's own TERMINATED callback is ignored once replaced
                connectionLost(url, "relay reopened");
            }
            connection = replacement;
        }
        return connection.connect();
    }

    /**
     * Terminate a relay's connection but keep the relay in the pool.
     * Subscriptions targeting it are re-issued if it is connected again.
     *
     * @param url relay URL
     * @return completes once the connection has processed its termination
     * @throws RelayNotFoundException if the relay is not in the pool
     */
    public CompletableFuture<Void> disconnectRelay(RelayUrl url) {
        return relay(url).terminate();
    }

    /**
     * @throws RelayNotFoundException if the relay is not in the pool
     */
    public RelayConnection relay(RelayUrl url) {
        RelayConnection connection = relays.get(url);
        if (connection == null) {
            throw new RelayNotFoundException(url.toString());
        }
        return connection;
    }

    public Map<RelayUrl, RelayConnection> relays() {
        return Collections.unmodifiableMap(new TreeMap<>(relays));
    }

    /**
     * Snapshot of every relay's connection status.
     */
    public Map<RelayUrl, RelayStatus> status() {
        Map<RelayUrl, RelayStatus> snapshot = new TreeMap<>();
        for (Map.Entry<RelayUrl, RelayConnection> entry : relays.entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().getStatus());
        }
        return snapshot;
    }

    // ------------------------------------------------------------------
    // Publish
    // ------------------------------------------------------------------

    /**
     * Publish to every relay with the write flag.
     *
     * @see #publish(Event, RelayTargets)
     */
    public CompletableFuture<PublishOutput> publish(Event event) {
        return publish(event, RelayTargets.all());
    }

    /**
     * Send a signed event to the target relays. Relays that are not
     * connected are reported NOT_ATTEMPTED; nothing is kept for later.
     *
     * @param event signed event
     * @param targets relays to publish to
     * @return completes once every attempted relay answered OK, failed or timed out
     * @throws RelayNotFoundException if an explicit target is not in the pool
     * @throws ProtocolException if the event cannot be encoded
     */
    public CompletableFuture<PublishOutput> publish(Event event, RelayTargets targets) {
        ensureRunning();
        if (event.getId() == null) {
            throw new IllegalArgumentException("Event must be signed before publishing");
        }
        List<RelayConnection> connections = resolve(targets, false);
        Map<RelayUrl, CompletableFuture<PublishOutcome>> outcomes = new LinkedHashMap<>();
        for (RelayConnection connection : connections) {
            outcomes.put(connection.getUrl(), publishTo(connection, event));
        }
        logger.debug("Published event {} to {} relays", event.getId(), outcomes.size());

        return CompletableFuture.allOf(outcomes.values().toArray(new CompletableFuture<?>[0])).thenApply(v -> {
            Map<RelayUrl, PublishOutcome> result = new LinkedHashMap<>();
            for (Map.Entry<RelayUrl, CompletableFuture<PublishOutcome>> entry : outcomes.entrySet()) {
                result.put(entry.getKey(), entry.getValue().join());
            }
            return new PublishOutput(event.getId(), result);
        });
    }

    private CompletableFuture<PublishOutcome> publishTo(RelayConnection connection, Event event) {
        if (!connection.isConnected()) {
            return CompletableFuture.completedFuture(PublishOutcome.notAttempted("not connected"));
        }
        String key = pendingKey(event.getId(), connection.getUrl());
        CompletableFuture<PublishOutcome> outcome = new CompletableFuture<>();
        CompletableFuture<PublishOutcome> previous = pendingOks.put(key, outcome);
        if (previous != null) {
            // Same event published again before the relay answered: one OK settles both
            outcome.thenAccept(previous::complete);
        }

        long timeoutMillis = options.getSendTimeout().toMillis();
        schedule(() -> {
            if (pendingOks.remove(key, outcome)) {
                logger.warn("No OK from {} for event {} within {}ms", connection.getUrl(), event.getId(), timeoutMillis);
                outcome.complete(PublishOutcome.failed("no OK within " + timeoutMillis + "ms"));
            }
        }, options.getSendTimeout());

        connection.send(ClientMessage.event(event)).whenComplete((sent, error) -> {
            if (error != null) {
                if (pendingOks.remove(key, outcome)) {
                    outcome.complete(PublishOutcome.failed(error.getMessage()));
                }
            } else if (!sent && pendingOks.remove(key, outcome)) {
                outcome.complete(PublishOutcome.notAttempted("not connected"));
            }
        });
        return outcome;
    }

    // ------------------------------------------------------------------
    // Subscriptions
    // ------------------------------------------------------------------

    /**
     * Subscribe on every relay with the read flag.
     *
     * @see #subscribe(List, RelayTargets)
     */
    public SubscribeOutput subscribe(List<Filter> filters) {
        return subscribe(filters, RelayTargets.all());
    }

    /**
     * Open a subscription on the target relays. Matching events arrive on
     * {@link #events()}. Relays that are not connected receive the REQ when
     * they connect, and every relay receives it again after a reconnect.
     *
     * @param filters one or more filters
     * @param targets relays to subscribe on
     * @return the new id and per relay status
     * @throws IllegalArgumentException if {@code filters} is empty
     * @throws RelayNotFoundException if an explicit target is not in the pool
     */
    public SubscribeOutput subscribe(List<Filter> filters, RelayTargets targets) {
        ensureRunning();
        return subscribe(filters, resolve(targets, true), null);
    }

    /**
     * Open a subscription on already resolved connections. Connections that
     * left the pool in the meantime are dropped from the targets and have no
     * status in the result.
     */
    SubscribeOutput subscribe(List<Filter> filters, List<RelayConnection> connections, EventCollector collector) {
        Subscription subscription = registry.open(filters, urlsOf(connections), collector);
        Map<RelayUrl, SubscribeStatus> statuses = new LinkedHashMap<>();
        for (RelayConnection connection : retainCurrent(subscription.getId(), connections)) {
            statuses.put(connection.getUrl(), issue(connection, subscription, false));
        }
        logger.debug("Opened subscription {} on {}", subscription.getId(), statuses);
        return new SubscribeOutput(subscription.getId(), statuses);
    }

    /**
     * Close a subscription. CLOSE goes to every relay serving it; events that
     * still arrive for it are dropped.
     *
     * @param id subscription to close
     * @return completes when every relay acknowledged with CLOSED, or after
     *         the unsubscribe grace period
     * @throws SubscriptionClosedException if the subscription is unknown or already closed
     */
    public CompletableFuture<Void> unsubscribe(SubscriptionId id) {
        Subscription subscription = registry.require(id);
        Set<RelayUrl> served = registry.close(id);
        if (subscription.getCollector() != null) {
            subscription.getCollector().finish();
        }
        CompletableFuture<Void> done = subscription.getCloseFuture();
        if (served.isEmpty()) {
            done.complete(null);
            return done;
        }

        for (RelayUrl url : served) {
            RelayConnection connection = relays.get(url);
            if (connection == null) {
                acknowledgeClose(subscription, url);
                continue;
            }
            connection.send(ClientMessage.close(id.getValue())).whenComplete((sent, error) -> {
                if (error != null || !sent) {
                    acknowledgeClose(subscription, url);
                }
            });
        }
        schedule(() -> {
            if (registry.forget(subscription)) {
                logger.debug("Unsubscribe grace elapsed for {}", id);
            }
            done.complete(null);
        }, options.getUnsubscribeGrace());
        return done;
    }

    /**
     * Replace a subscription's filters. The REQ is re-sent with the same id
     * to every connected target.
     *
     * @param id open subscription
     * @param filters new filters
     * @return per relay status
     * @throws SubscriptionClosedException if the subscription is unknown or closed
     */
    public SubscribeOutput updateFilters(SubscriptionId id, List<Filter> filters) {
        ensureRunning();
        return reissue(registry.updateFilters(id, filters));
    }

    /**
     * Replace a subscription's filters and target relays. Relays no longer
     * targeted receive a CLOSE.
     *
     * @throws SubscriptionClosedException if the subscription is unknown or closed
     * @throws RelayNotFoundException if an explicit target is not in the pool
     */
    public SubscribeOutput updateFilters(SubscriptionId id, List<Filter> filters, RelayTargets targets) {
        ensureRunning();
        return updateFilters(id, filters, resolve(targets, true));
    }

    /**
     * Retarget onto already resolved connections; those that left the pool in
     * the meantime are dropped from the targets.
     */
    SubscribeOutput updateFilters(SubscriptionId id, List<Filter> filters, List<RelayConnection> connections) {
        if (filters.isEmpty()) {
            throw new IllegalArgumentException("At least one filter is required");
        }
        Set<RelayUrl> dropped = registry.updateTargets(id, urlsOf(connections));
        retainCurrent(id, connections);
        Subscription subscription = registry.updateFilters(id, filters);
        for (RelayUrl url : dropped) {
            RelayConnection connection = relays.get(url);
            if (connection != null) {
                connection.send(ClientMessage.close(id.getValue()));
            }
        }
        return reissue(subscription);
    }

    /**
     * The connections that are still the pool's own. The subscription is
     * registered before this runs, so a concurrent {@link #removeRelay}
     * either sees it or is seen here; relays seen gone are dropped from its targets.
     */
    private List<RelayConnection> retainCurrent(SubscriptionId id, List<RelayConnection> connections) {
        List<RelayConnection> current = new ArrayList<>();
        Set<RelayUrl> gone = new LinkedHashSet<>();
        for (RelayConnection connection : connections) {
            if (relays.get(connection.getUrl()) == connection) {
                current.add(connection);
            } else {
                gone.add(connection.getUrl());
            }
        }
        if (!gone.isEmpty()) {
            logger.debug("Relays {} left the pool before subscription {} was issued", gone, id);
            registry.removeTargets(id, gone);
        }
        return current;
    }

    private SubscribeOutput reissue(Subscription subscription) {
        Map<RelayUrl, SubscribeStatus> statuses = new LinkedHashMap<>();
        for (RelayUrl url : subscription.getTargets()) {
            RelayConnection connection = relays.get(url);
            if (connection != null) {
                statuses.put(url, issue(connection, subscription, true));
            }
        }
        return new SubscribeOutput(subscription.getId(), statuses);
    }

    private SubscribeStatus issue(RelayConnection connection, Subscription subscription, boolean replace) {
        if (!connection.isConnected()) {
            return SubscribeStatus.PENDING_CONNECTION;
        }
        SubscriptionId id = subscription.getId();
        RelayUrl url = connection.getUrl();
        connection.sendIf(() -> replace ? registry.ensureServed(id, url) : registry.markServed(id, url),
                ClientMessage.req(id.getValue(), subscription.getFilters())).whenComplete((sent, error) -> {
            if (error != null) {
                logger.warn("REQ for {} to {} dropped: {}", id, url, error.getMessage());
            }
            boolean unanswered = error != null || (!sent && !registry.isServed(id, url));
            if (unanswered && subscription.getCollector() != null) {
                subscription.getCollector().onRelayGone(url);
            }
        });
        return SubscribeStatus.SENT;
    }

    /**
     * New consumer of the unified, deduplicated event stream. It sees events
     * delivered from now on. Close it when done.
     */
    public StreamConsumer<PooledEvent> events() {
        ensureRunning();
        return events.subscribe();
    }

    /**
     * New consumer of pool notifications. Close it when done.
     */
    public StreamConsumer<PoolNotification> notifications() {
        ensureRunning();
        return notifications.subscribe();
    }

    /**
     * @return the subscription if it is still registered, open or closing
     */
    public Subscription subscription(SubscriptionId id) {
        return registry.get(id);
    }

    public List<Subscription> subscriptions() {
        return registry.snapshot();
    }

    // ------------------------------------------------------------------
    // Fetch
    // ------------------------------------------------------------------

    /**
     * Fetch from every relay with the read flag until each has sent EOSE.
     *
     * @see #fetchEvents(List, RelayTargets, Duration, FetchOptions)
     */
    public CompletableFuture<List<Event>> fetchEvents(List<Filter> filters, Duration timeout) {
        return fetchEvents(filters, RelayTargets.all(), timeout, FetchOptions.exitOnEose());
    }

    /**
     * One-shot query: subscribe, collect the matching events, unsubscribe.
     * Events are deduplicated within the fetch and returned in arrival order.
     * They also pass through the unified stream and the store like any other.
     *
     * @param filters one or more filters
     * @param targets relays to query
     * @param timeout upper bound on the whole fetch
     * @param fetchOptions when to stop after EOSE
     * @return the events; never fails for relay-side reasons, a timeout just
     *         returns what arrived so far
     */
    public CompletableFuture<List<Event>> fetchEvents(List<Filter> filters, RelayTargets targets, Duration timeout,
                                                      FetchOptions fetchOptions) {
        ensureRunning();
        List<RelayConnection> connections = resolve(targets, true);
        EventCollector collector = new EventCollector(fetchOptions, urlsOf(connections), scheduler);
        SubscribeOutput output = subscribe(filters, connections, collector);
        for (RelayConnection connection : connections) {
            if (output.getStatus(connection.getUrl()) != SubscribeStatus.SENT) {
                // Not connected or no longer in the pool: no EOSE will come from it
                collector.onRelayGone(connection.getUrl());
            }
        }
        collector.start();
        schedule(collector::finish, timeout);

        return collector.getResult().whenComplete((collected, error) -> {
            try {
                unsubscribe(output.getId());
            } catch (SubscriptionClosedException e) {
                logger.debug("Fetch subscription {} already closed", output.getId());
            }
        });
    }

    // ------------------------------------------------------------------
    // Reconciliation
    // ------------------------------------------------------------------

    /**
     * Run negentropy reconciliation against one connected relay.
     *
     * @param url relay URL
     * @param filter which events to reconcile
     * @param negentropyOptions timeout, direction and round limit
     * @return the difference; incomplete if the session was aborted
     * @throws RelayNotFoundException if the relay is not in the pool
     */
    public CompletableFuture<ReconciliationResult> reconcile(RelayUrl url, Filter filter,
                                                             NegentropyOptions negentropyOptions) {
        ensureRunning();
        return reconciliation.reconcile(relay(url), filter, negentropyOptions);
    }

    /**
     * Reconcile with every target relay concurrently, then move the
     * difference: fetch missing events (in batches of 50 ids) and, when the
     * direction uploads, publish local events the relay lacks.
     *
     * @param filter which events to sync
     * @param targets relays to sync with
     * @param negentropyOptions direction, timeouts and fallback behaviour
     * @return per relay results plus what was received and sent
     * @throws RelayNotFoundException if an explicit target is not in the pool
     */
    public CompletableFuture<SyncOutput> sync(Filter filter, RelayTargets targets,
                                              NegentropyOptions negentropyOptions) {
        ensureRunning();
        List<RelayConnection> connections = resolve(targets, true);
        Map<RelayUrl, ReconciliationResult> results = new ConcurrentHashMap<>();
        Set<String> received = ConcurrentHashMap.newKeySet();
        Set<String> sent = ConcurrentHashMap.newKeySet();

        List<CompletableFuture<Void>> work = new ArrayList<>();
        for (RelayConnection connection : connections) {
            RelayUrl url = connection.getUrl();
            work.add(reconciliation.reconcile(connection, filter, negentropyOptions)
                    .thenCompose(result -> {
                        results.put(url, result);
                        return transfer(url, filter, result, negentropyOptions, received, sent);
                    })
                    .exceptionally(e -> {
                        logger.warn("Sync with {} failed: {}", url, e.getMessage());
                        return null;
                    }));
        }

        return CompletableFuture.allOf(work.toArray(new CompletableFuture<?>[0])).thenApply(v -> {
            Map<RelayUrl, ReconciliationResult> ordered = new LinkedHashMap<>();
            for (RelayConnection connection : connections) {
                ReconciliationResult result = results.get(connection.getUrl());
                if (result != null) {
                    ordered.put(connection.getUrl(), result);
                }
            }
            return new SyncOutput(ordered, received, sent);
        });
    }

    private CompletableFuture<Void> transfer(RelayUrl url, Filter filter, ReconciliationResult result,
                                             NegentropyOptions negentropyOptions,
                                             Set<String> received, Set<String> sent) {
        List<CompletableFuture<Void>> steps = new ArrayList<>();
        RelayTargets only = RelayTargets.of(url);
        Duration fetchTimeout = negentropyOptions.getFetchTimeout();

        if (negentropyOptions.getDirection().isDownload()) {
            List<String> need = new ArrayList<>(result.getNeedIds());
            for (int i = 0; i < need.size(); i += SYNC_FETCH_BATCH_SIZE) {
                List<String> batch = need.subList(i, Math.min(i + SYNC_FETCH_BATCH_SIZE, need.size()));
                Filter byIds = Filter.builder().ids(batch).build();
                steps.add(fetchEvents(Collections.singletonList(byIds), only, fetchTimeout, FetchOptions.exitOnEose())
                        .thenAccept(fetched -> addIds(fetched, received)));
            }
            if (!result.isComplete() && negentropyOptions.isFallbackToFetch()) {
                logger.info("Reconciliation with {} aborted, falling back to a filter fetch", url);
                steps.add(fetchEvents(Collections.singletonList(filter), only, fetchTimeout, FetchOptions.exitOnEose())
                        .thenAccept(fetched -> addIds(fetched, received)));
            }
        }

        if (negentropyOptions.getDirection().isUpload() && store != null) {
            for (String id : result.getHaveIds()) {
                Event event = store.get(id);
                if (event == null) {
                    continue;
                }
                steps.add(publish(event, only).thenAccept(output -> {
                    if (output.isAccepted()) {
                        sent.add(id);
                    }
                }));
            }
        }
        return CompletableFuture.allOf(steps.toArray(new CompletableFuture<?>[0]));
    }

    private static void addIds(List<Event> fetched, Set<String> ids) {
        for (Event event : fetched) {
            ids.add(event.getId());
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Terminate every connection, fail pending publishes, abort
     * reconciliations and close both streams. Idempotent; returns once every
     * connection thread has stopped.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down relay pool ({} relays)", relays.size());

        List<RelayConnection> connections = new ArrayList<>(relays.values());
        for (RelayConnection connection : connections) {
            connection.terminate();
        }
        reconciliation.abortAll("pool shut down");
        for (String key : new ArrayList<>(pendingOks.keySet())) {
            CompletableFuture<PublishOutcome> pending = pendingOks.remove(key);
            if (pending != null) {
                pending.complete(PublishOutcome.failed("pool shut down"));
            }
        }
        for (Subscription subscription : registry.clear()) {
            if (subscription.getCollector() != null) {
                subscription.getCollector().finish();
            }
            subscription.getCloseFuture().complete(null);
        }

        for (RelayConnection connection : connections) {
            try {
                if (!connection.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Connection to {} did not stop within {}s", connection.getUrl(), SHUTDOWN_WAIT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for {} to stop", connection.getUrl());
                break;
            }
        }
        relays.clear();
        scheduler.shutdownNow();
        events.close();
        notifications.close();
        if (ownsTransportFactory) {
            transportFactory.close();
        }
        logger.info("Relay pool shut down");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private RelayConnection newConnection(RelayUrl url, RelayOptions relayOptions) {
        return new RelayConnection(url, relayOptions, transportFactory, codec, connectionHandler, options.getClock());
    }

    private List<RelayConnection> resolve(RelayTargets targets, boolean forRead) {
        List<RelayConnection> resolved = new ArrayList<>();
        if (targets.isAll()) {
            for (RelayConnection connection : new TreeMap<>(relays).values()) {
                RelayOptions relayOptions = connection.getOptions();
                if (forRead ? relayOptions.isRead() : relayOptions.isWrite()) {
                    resolved.add(connection);
                }
            }
            return resolved;
        }
        for (RelayUrl url : targets.getUrls()) {
            resolved.add(relay(url));
        }
        return resolved;
    }

    private static Set<RelayUrl> urlsOf(List<RelayConnection> connections) {
        Set<RelayUrl> urls = new LinkedHashSet<>();
        for (RelayConnection connection : connections) {
            urls.add(connection.getUrl());
        }
        return urls;
    }

    private static String pendingKey(String eventId, RelayUrl url) {
        return eventId + ' ' + url;
    }

    private void failPendingPublishes(RelayUrl url, String reason) {
        String suffix = " " + url;
        for (String key : new ArrayList<>(pendingOks.keySet())) {
            if (key.endsWith(suffix)) {
                CompletableFuture<PublishOutcome> pending = pendingOks.remove(key);
                if (pending != null) {
                    pending.complete(PublishOutcome.failed(reason));
                }
            }
        }
    }

    private void acknowledgeClose(Subscription subscription, RelayUrl url) {
        if (registry.acknowledgeClose(subscription, url)) {
            subscription.getCloseFuture().complete(null);
        }
    }

    /**
     * The relay will send nothing more for this subscription.
     */
    private void relayFinished(Subscription subscription, RelayUrl url) {
        if (subscription.isClosed()) {
            acknowledgeClose(subscription, url);
        } else if (subscription.getCollector() != null) {
            subscription.getCollector().onRelayGone(url);
        }
    }

    private void connectionLost(RelayUrl url, String reason) {
        for (Subscription subscription : registry.relayLost(url)) {
            relayFinished(subscription, url);
        }
        failPendingPublishes(url, reason);
        reconciliation.abortRelay(url, reason);
    }

    private void resubscribe(RelayConnection connection) {
        RelayUrl url = connection.getUrl();
        List<Subscription> targeting = registry.openTargeting(url);
        for (Subscription subscription : targeting) {
            issue(connection, subscription, false);
        }
        if (!targeting.isEmpty()) {
            logger.info("Re-issuing {} subscriptions on {}", targeting.size(), url);
        }
    }

    private void handleEvent(RelayUrl url, String subscriptionId, Event event) {
        Subscription subscription = registry.get(subscriptionId);
        if (subscription == null || subscription.isClosed()) {
            logger.debug("Dropping event {} for closed subscription {} from {}", event.getId(), subscriptionId, url);
            return;
        }
        if (!Filter.matchesAny(subscription.getFilters(), event)) {
            if (registry.isReplacing(subscription.getId(), url)) {
                logger.debug("Dropping event {} from {} sent under the previous filters of {}",
                        event.getId(), url, subscriptionId);
                return;
            }
            logger.warn("Relay {} sent event {} not matching subscription {}", url, event.getId(), subscriptionId);
            notifications.publish(PoolNotification.protocolError(url,
                    "event " + event.getId() + " does not match subscription " + subscriptionId));
            return;
        }
        if (options.isVerifyEvents() && !verifier.verify(event)) {
            logger.warn("Relay {} sent event {} with invalid id or signature", url, event.getId());
            notifications.publish(PoolNotification.protocolError(url,
                    "invalid id or signature on event " + event.getId()));
            return;
        }

        if (store != null && !EventKinds.isEphemeral(event.getKind())) {
            store.store(event);
        }
        if (subscription.getCollector() != null) {
            subscription.getCollector().onEvent(event);
        }
        if (deduplicator.observe(event, url) == Observation.DELIVERED) {
            events.publish(new PooledEvent(event, subscription.getId(), url,
                    deduplicator.confirmations(event.getId())));
        }
    }

    private void handleOk(RelayUrl url, RelayMessage message) {
        CompletableFuture<PublishOutcome> pending = pendingOks.remove(pendingKey(message.getEventId(), url));
        if (pending == null) {
            logger.debug("Unexpected OK from {} for event {}", url, message.getEventId());
            return;
        }
        if (message.isAccepted()) {
            pending.complete(PublishOutcome.accepted(message.getMessage()));
        } else {
            logger.info("Relay {} rejected event {}: {}", url, message.getEventId(), message.getMessage());
            pending.complete(PublishOutcome.rejected(message.getMessage()));
        }
    }

    private void handleClosed(RelayUrl url, RelayMessage message) {
        Subscription subscription = registry.get(message.getSubscriptionId());
        if (subscription == null) {
            logger.debug("CLOSED from {} for unknown subscription {}", url, message.getSubscriptionId());
            return;
        }
        if (subscription.isClosed()) {
            acknowledgeClose(subscription, url);
            return;
        }
        logger.warn("Relay {} closed subscription {}: {}", url, subscription.getId(), message.getMessage());
        registry.markNotServed(subscription.getId(), url);
        notifications.publish(PoolNotification.subscriptionRejected(url, subscription.getId().getValue(),
                message.getMessage()));
        if (subscription.getCollector() != null) {
            subscription.getCollector().onRelayGone(url);
        }
    }

    private void handleEose(RelayUrl url, String subscriptionId) {
        if (!registry.markEose(subscriptionId, url)) {
            return;
        }
        logger.debug("EOSE from {} for {}", url, subscriptionId);
        Subscription subscription = registry.get(subscriptionId);
        if (subscription != null && subscription.getCollector() != null) {
            subscription.getCollector().onEose(url);
        }
    }

    private void eventConsumerOverflowed(StreamConsumer<PooledEvent> consumer, boolean disconnected, long dropped) {
        if (disconnected) {
            logger.warn("Event consumer disconnected after {} dropped events", dropped);
            notifications.publish(PoolNotification.consumerDisconnected(dropped));
        } else {
            logger.debug("Event consumer lagging, {} events dropped", dropped);
            notifications.publish(PoolNotification.consumerLagged(dropped));
        }
    }

    private void notificationConsumerOverflowed(StreamConsumer<PoolNotification> consumer, boolean disconnected,
                                                long dropped) {
        if (disconnected) {
            logger.warn("Notification consumer disconnected after {} dropped notifications", dropped);
        } else {
            logger.debug("Notification consumer lagging, {} notifications dropped", dropped);
        }
        // A consumer overflowing on the report itself is only counted; its next report carries the total
        if (Boolean.TRUE.equals(reportingNotificationOverflow.get())) {
            return;
        }
        reportingNotificationOverflow.set(Boolean.TRUE);
        try {
            notifications.publish(disconnected
                    ? PoolNotification.notificationConsumerDisconnected(dropped)
                    : PoolNotification.notificationConsumerLagged(dropped));
        } finally {
            reportingNotificationOverflow.remove();
        }
    }

    private void schedule(Runnable task, Duration delay) {
        try {
            scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Pool scheduler stopped, running task now");
            task.run();
        }
    }

    private void ensureRunning() {
        if (shutdown.get()) {
            throw new IllegalStateException("Relay pool is shut down");
        }
    }

    /**
     * Routes everything the connections report. Runs on the reporting
     * connection's thread.
     */
    private final class ConnectionHandler implements RelayConnectionListener {

        @Override
        public void onStatusChanged(RelayConnection connection, RelayStatus previous, RelayStatus current,
                                    String reason) {
            RelayUrl url = connection.getUrl();
            notifications.publish(PoolNotification.relayStatusChanged(url, previous, current, reason));
            if (relays.get(url) != connection) {
                return;
            }
            if (current == RelayStatus.CONNECTED) {
                resubscribe(connection);
            } else if (current == RelayStatus.DISCONNECTED || current == RelayStatus.TERMINATED) {
                connectionLost(url, reason != null ? "connection lost: " + reason : "connection lost");
            }
        }

        @Override
        public void onMessage(RelayConnection connection, RelayMessage message) {
            RelayUrl url = connection.getUrl();
            if (relays.get(url) != connection) {
                return;
            }
            switch (message.getType()) {
                case EVENT:
                    handleEvent(url, message.getSubscriptionId(), message.getEvent());
                    break;
                case EOSE:
                    handleEose(url, message.getSubscriptionId());
                    break;
                case OK:
                    handleOk(url, message);
                    break;
                case CLOSED:
                    handleClosed(url, message);
                    break;
                case NOTICE:
                    logger.info("Relay notice from {}: {}", url, message.getMessage());
                    notifications.publish(PoolNotification.relayNotice(url, message.getMessage()));
                    break;
                case NEG_MSG:
                case NEG_ERR:
                    reconciliation.onMessage(url, message);
                    break;
                case AUTH:
                    logger.debug("Ignoring AUTH challenge from {}", url);
                    break;
                default:
                    logger.debug("Unhandled message type from {}: {}", url, message.getType());
            }
        }

        @Override
        public void onProtocolError(RelayConnection connection, String text, ProtocolException error) {
            notifications.publish(PoolNotification.protocolError(connection.getUrl(), error.getMessage()));
        }

        @Override
        public void onOutboundOverflow(RelayConnection connection, long droppedTotal) {
            notifications.publish(PoolNotification.outboundOverflow(connection.getUrl(), droppedTotal));
        }
    }
}
