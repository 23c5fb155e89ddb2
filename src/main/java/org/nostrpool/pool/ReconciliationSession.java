package org.nostrpool.pool;

import org.nostrpool.errors.ReconciliationException;
import org.nostrpool.negentropy.Negentropy;
import org.nostrpool.protocol.ClientMessage;
import org.nostrpool.protocol.Filter;
import org.nostrpool.relay.RelayConnection;
import org.nostrpool.relay.RelayUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * One negentropy exchange with one relay, from NEG-OPEN to NEG-CLOSE.
 * Replies arrive on the relay's connection thread and timeouts on the pool
 * scheduler, so every step is synchronized on the session.
 */
public final class ReconciliationSession {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationSession.class);

    private final String id;
    private final RelayConnection connection;
    private final Filter filter;
    private final NegentropyOptions options;
    private final Negentropy negentropy;
    private final ScheduledExecutorService scheduler;
    private final BiConsumer<ReconciliationSession, ReconciliationResult> onFinish;
    private final CompletableFuture<ReconciliationResult> result = new CompletableFuture<>();
    private final Set<String> haveIds = new LinkedHashSet<>();
    private final Set<String> needIds = new LinkedHashSet<>();
    private ScheduledFuture<?> timeout;
    private int rounds;
    private boolean terminated;

    ReconciliationSession(String id, RelayConnection connection, Filter filter, NegentropyOptions options,
                          Negentropy negentropy, ScheduledExecutorService scheduler,
                          BiConsumer<ReconciliationSession, ReconciliationResult> onFinish) {
        this.id = id;
        this.connection = connection;
        this.filter = filter;
        this.options = options;
        this.negentropy = negentropy;
        this.scheduler = scheduler;
        this.onFinish = onFinish;
    }

    public String getId() {
        return id;
    }

    public RelayUrl getRelayUrl() {
        return connection.getUrl();
    }

    public Filter getFilter() {
        return filter;
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }

    public CompletableFuture<ReconciliationResult> getResult() {
        return result;
    }

    synchronized void start() {
        String initial = negentropy.initiate();
        logger.debug("Opening negentropy session {} with {}", id, getRelayUrl());
        armTimeout();
        connection.send(ClientMessage.negOpen(id, filter, initial)).whenComplete((sent, error) -> {
            if (error != null) {
                abort("NEG-OPEN not sent: " + error.getMessage());
            } else if (!sent) {
                abort("relay not connected");
            }
        });
    }

    synchronized void onMessage(String message) {
        if (terminated) {
            return;
        }
        cancelTimeout();
        rounds++;
        if (rounds > options.getMaxRounds()) {
            logger.warn("Negentropy session {} with {} exceeded {} rounds", id, getRelayUrl(), options.getMaxRounds());
            closeRemote();
            finish(false, "exceeded " + options.getMaxRounds() + " rounds");
            return;
        }

        List<String> have = new ArrayList<>();
        List<String> need = new ArrayList<>();
        String next;
        try {
            next = negentropy.reconcile(message, have, need);
        } catch (ReconciliationException e) {
            logger.warn("Bad negentropy message from {}: {}", getRelayUrl(), e.getMessage());
            closeRemote();
            finish(false, e.getMessage());
            return;
        }
        haveIds.addAll(have);
        needIds.addAll(need);

        if (next == null) {
            closeRemote();
            finish(true, null);
            return;
        }
        armTimeout();
        connection.send(ClientMessage.negMsg(id, next)).whenComplete((sent, error) -> {
            if (error != null) {
                abort("NEG-MSG not sent: " + error.getMessage());
            } else if (!sent) {
                abort("connection lost");
            }
        });
    }

    synchronized void onError(String reason) {
        if (terminated) {
            return;
        }
        // The relay already dropped the session, no NEG-CLOSE needed
        finish(false, "relay error: " + reason);
    }

    synchronized void abort(String reason) {
        if (terminated) {
            return;
        }
        closeRemote();
        finish(false, reason);
    }

    private void closeRemote() {
        if (connection.isConnected()) {
            connection.send(ClientMessage.negClose(id));
        }
    }

    private void finish(boolean complete, String abortReason) {
        terminated = true;
        cancelTimeout();
        Set<String> reportedHave = options.getDirection().isUpload() ? haveIds : Collections.<String>emptySet();
        ReconciliationResult outcome = new ReconciliationResult(getRelayUrl(), needIds, reportedHave,
                complete, abortReason, rounds);
        onFinish.accept(this, outcome);
        result.complete(outcome);
    }

    private void armTimeout() {
        long millis = options.getInitialTimeout().toMillis();
        try {
            timeout = scheduler.schedule(() -> abort("no reply within " + millis + "ms"), millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Scheduler stopped, session {} runs without timeout", id);
        }
    }

    private void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel(false);
            timeout = null;
        }
    }
}
