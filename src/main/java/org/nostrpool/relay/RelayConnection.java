package org.nostrpool.relay;

import org.nostrpool.errors.CapacityExceededException;
import org.nostrpool.errors.ProtocolException;
import org.nostrpool.errors.TransportException;
import org.nostrpool.protocol.ClientMessage;
import org.nostrpool.protocol.MessageCodec;
import org.nostrpool.protocol.RelayMessage;
import org.nostrpool.transport.RelayTransport;
import org.nostrpool.transport.RelayTransportFactory;
import org.nostrpool.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Connection state machine for one relay.
 *
 * <p>Every connection runs its own single-threaded task. Transport callbacks,
 * outbound writes, reconnect timers and listener notifications are all
 * serialized onto it, so the fields below the "task-confined" marker need no
 * locking and messages leave and arrive in order. One slow relay never holds
 * up another.
 *
 * <p>Outbound messages pass through a bounded FIFO queue. Callers on any
 * thread add to it; the connection's task drains it, and only while
 * CONNECTED. Messages still queued when the relay is not connected are
 * discarded. When the queue is full the oldest message is dropped and
 * reported through {@link RelayConnectionListener#onOutboundOverflow}.
 *
 * <p>The reconnect flag and the base reconnect interval start from
 * {@link RelayOptions} and can be changed on a live connection.
 */
public class RelayConnection {

    private static final Logger logger = LoggerFactory.getLogger(RelayConnection.class);
    private static final int NORMAL_CLOSURE = 1000;

    private final RelayUrl url;
    private final RelayOptions options;
    private final RelayTransportFactory transportFactory;
    private final MessageCodec codec;
    private final RelayConnectionListener listener;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor executor;
    private final RelayStats stats = new RelayStats();

    private volatile RelayStatus status = RelayStatus.INITIALIZED;
    private volatile boolean reconnect;
    private volatile long reconnectIntervalMillis;
    private volatile boolean adjustRetryInterval;

    private final Object outboundLock = new Object();
    // guarded by outboundLock
    private final Deque<Outbound> outbound = new ArrayDeque<>();
    private boolean drainScheduled;
    private long droppedCount;

    // task-confined
    private final ReconnectBackoff backoff;
    private final List<CompletableFuture<Void>> connectWaiters = new ArrayList<>();
    private RelayTransport transport;
    private long generation;
    private ScheduledFuture<?> pendingReconnect;

    public RelayConnection(RelayUrl url, RelayOptions options, RelayTransportFactory transportFactory,
                           MessageCodec codec, RelayConnectionListener listener, Clock clock) {
        this.url = url;
        this.options = options;
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.listener = listener;
        this.clock = clock;
        this.reconnect = options.isReconnect();
        this.reconnectIntervalMillis = options.getReconnectInterval().toMillis();
        this.adjustRetryInterval = options.isAdjustRetryInterval();
        this.backoff = new ReconnectBackoff(options);
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "relay-" + url.getHost());
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public RelayUrl getUrl() {
        return url;
    }

    public RelayOptions getOptions() {
        return options;
    }

    public RelayStats getStats() {
        return stats;
    }

    public RelayStatus getStatus() {
        return status;
    }

    public boolean isConnected() {
        return status == RelayStatus.CONNECTED;
    }

    /**
     * Start connecting (INITIALIZED or DISCONNECTED -> CONNECTING). A pending
     * reconnect timer is skipped.
     *
     * @return completes at the next CONNECTED transition; fails if the
     *         connection is terminated first, or if the attempt fails and
     *         reconnect is disabled
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        boolean submitted = submit(() -> {
            if (status == RelayStatus.CONNECTED) {
                future.complete(null);
                return;
            }
            if (status == RelayStatus.TERMINATED) {
                future.completeExceptionally(new IllegalStateException("Connection terminated: " + url));
                return;
            }
            connectWaiters.add(future);
            doConnect();
        });
        if (!submitted) {
            future.completeExceptionally(new IllegalStateException("Connection terminated: " + url));
        }
        return future;
    }

    /**
     * Queue a message for writing.
     *
     * @return completes with true once handed to the transport, false if the
     *         relay was not connected when the message reached the head of the
     *         queue; fails with {@link CapacityExceededException} if the
     *         message was dropped from a full queue
     * @throws ProtocolException if the message cannot be encoded
     */
    public CompletableFuture<Boolean> send(ClientMessage message) {
        return sendIf(null, message);
    }

    /**
     * Queue a message that is written only if {@code condition} holds at the
     * time it is drained. The condition is evaluated on the connection's
     * thread, ordered with status transitions, and only while connected.
     *
     * @param condition checked right before writing; null always writes
     * @return as for {@link #send(ClientMessage)}
     * @throws ProtocolException if the message cannot be encoded
     */
    public CompletableFuture<Boolean> sendIf(BooleanSupplier condition, ClientMessage message) {
        Outbound entry = new Outbound(codec.encode(message), condition);
        Outbound evicted = null;
        long droppedTotal = 0;
        boolean scheduleDrain = false;
        synchronized (outboundLock) {
            if (outbound.size() >= options.getQueueCapacity()) {
                evicted = outbound.pollFirst();
                droppedTotal = ++droppedCount;
            }
            outbound.addLast(entry);
            if (!drainScheduled) {
                drainScheduled = true;
                scheduleDrain = true;
            }
        }
        if (evicted != null) {
            logger.warn("Outbound queue full for {}, dropped oldest message", url);
            Outbound dropped = evicted;
            long total = droppedTotal;
            // Completed on the connection thread, away from whatever lock the caller holds
            if (!submit(() -> overflowed(dropped, total))) {
                overflowed(dropped, total);
            }
        }
        if (scheduleDrain && !submit(this::drain)) {
            discardQueued();
        }
        return entry.result;
    }

    /** Messages accepted by {@link #send} and not yet drained. */
    public int getQueuedCount() {
        synchronized (outboundLock) {
            return outbound.size();
        }
    }

    public boolean isReconnect() {
        return reconnect;
    }

    /**
     * Turn automatic reconnect on or off. Turning it off cancels a pending
     * reconnect; turning it on while disconnected schedules one.
     */
    public void updateReconnect(boolean reconnect) {
        this.reconnect = reconnect;
        submit(() -> {
            if (!this.reconnect) {
                cancelPendingReconnect();
            } else if (status == RelayStatus.DISCONNECTED && pendingReconnect == null) {
                scheduleReconnect();
            }
        });
    }

    public Duration getReconnectInterval() {
        return Duration.ofMillis(reconnectIntervalMillis);
    }

    /**
     * Change the base reconnect interval. Applies from the next scheduled reconnect.
     *
     * @throws IllegalArgumentException if the interval is not positive
     */
    public void updateReconnectInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("reconnectInterval must be positive");
        }
        this.reconnectIntervalMillis = interval.toMillis();
    }

    public boolean isAdjustRetryInterval() {
        return adjustRetryInterval;
    }

    /**
     * Whether the base reconnect interval is stretched for relays that often fail to connect.
     */
    public void updateAdjustRetryInterval(boolean adjustRetryInterval) {
        this.adjustRetryInterval = adjustRetryInterval;
    }

    /**
     * Stop for good: close the transport, cancel any reconnect and release the task thread.
     *
     * @return completes once the TERMINATED transition has been processed
     */
    public CompletableFuture<Void> terminate() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!submit(() -> {
            doTerminate();
            done.complete(null);
        })) {
            done.complete(null);
        }
        executor.shutdown();
        return done;
    }

    /**
     * Wait for the task thread to finish after {@link #terminate()}.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    private void doConnect() {
        if (status == RelayStatus.CONNECTED || status == RelayStatus.CONNECTING
                || status == RelayStatus.TERMINATED) {
            return;
        }
        cancelPendingReconnect();
        transition(RelayStatus.CONNECTING, null);
        stats.recordAttempt();
        long attempt = ++generation;

        logger.info("Connecting to relay: {}", url);
        try {
            transport = transportFactory.open(url, new Callbacks(attempt));
        } catch (TransportException e) {
            logger.warn("Could not open transport to {}: {}", url, e.getMessage());
            loseConnection(attempt, e.getMessage());
        }
    }

    private void handleOpen(long attempt) {
        if (attempt != generation || status != RelayStatus.CONNECTING) {
            return;
        }
        RelayStatus previous = status;
        status = RelayStatus.CONNECTED;
        backoff.reset();
        stats.recordSuccess(clock.instant());
        logger.info("Connected to relay: {}", url);

        drain();
        notifyStatus(previous, RelayStatus.CONNECTED, null);

        for (CompletableFuture<Void> waiter : connectWaiters) {
            waiter.complete(null);
        }
        connectWaiters.clear();
    }

    private void handleText(long attempt, String text) {
        if (attempt != generation || status != RelayStatus.CONNECTED) {
            return;
        }
        stats.recordReceived(text);
        RelayMessage message;
        try {
            message = codec.decode(text);
        } catch (ProtocolException e) {
            logger.warn("Malformed message from {}: {}", url, e.getMessage());
            try {
                listener.onProtocolError(this, text, e);
            } catch (RuntimeException listenerError) {
                logger.error("Error in protocol error handler for {}", url, listenerError);
            }
            return;
        }
        try {
            listener.onMessage(this, message);
        } catch (RuntimeException e) {
            logger.error("Error handling relay message from {}", url, e);
        }
    }

    private void loseConnection(long attempt, String reason) {
        if (attempt != generation || status == RelayStatus.TERMINATED
                || status == RelayStatus.DISCONNECTED) {
            return;
        }
        // Invalidate callbacks still in flight from the dead transport
        generation++;
        if (transport != null) {
            transport.cancel();
            transport = null;
        }
        discardQueued();
        transition(RelayStatus.DISCONNECTED, reason);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!reconnect) {
            failWaiters(new TransportException("Connection to " + url + " lost and reconnect is disabled"));
            return;
        }
        long base = reconnectIntervalMillis;
        if (adjustRetryInterval) {
            base = ReconnectBackoff.adjustBase(base, stats.getAttempts(), stats.getSuccesses());
        }
        long delay = backoff.nextDelayMillis(base);
        logger.info("Scheduling reconnect to {} in {}ms (attempt {})", url, delay, backoff.getAttempts());
        try {
            pendingReconnect = executor.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Not reconnecting to {}, connection is shutting down", url);
        }
    }

    private void reconnect() {
        pendingReconnect = null;
        try {
            doConnect();
        } catch (RuntimeException e) {
            logger.error("Reconnect to {} failed unexpectedly", url, e);
        }
    }

    private void doTerminate() {
        if (status == RelayStatus.TERMINATED) {
            return;
        }
        cancelPendingReconnect();
        generation++;
        if (transport != null) {
            transport.close(NORMAL_CLOSURE, "Client disconnect");
            transport = null;
        }
        transition(RelayStatus.TERMINATED, "terminated");
        discardQueued();
        failWaiters(new IllegalStateException("Connection terminated: " + url));
        logger.info("Terminated connection to relay: {}", url);
    }

    private void drain() {
        List<Outbound> batch;
        synchronized (outboundLock) {
            drainScheduled = false;
            batch = new ArrayList<>(outbound);
            outbound.clear();
        }
        for (Outbound entry : batch) {
            write(entry);
        }
    }

    private void write(Outbound entry) {
        if (status != RelayStatus.CONNECTED || transport == null) {
            entry.result.complete(false);
            return;
        }
        try {
            if (entry.condition != null && !entry.condition.getAsBoolean()) {
                entry.result.complete(false);
                return;
            }
        } catch (RuntimeException e) {
            logger.error("Send condition for {} failed", url, e);
            entry.result.completeExceptionally(e);
            return;
        }
        if (!transport.send(entry.text)) {
            logger.warn("Transport to {} refused message", url);
            entry.result.complete(false);
            return;
        }
        stats.recordSent();
        entry.result.complete(true);
    }

    private void discardQueued() {
        List<Outbound> discarded;
        synchronized (outboundLock) {
            drainScheduled = false;
            discarded = new ArrayList<>(outbound);
            outbound.clear();
        }
        if (!discarded.isEmpty()) {
            logger.info("Discarding {} queued messages for {}", discarded.size(), url);
        }
        for (Outbound entry : discarded) {
            entry.result.complete(false);
        }
    }

    private void overflowed(Outbound dropped, long droppedTotal) {
        dropped.result.completeExceptionally(new CapacityExceededException("outbound queue for " + url + " is full"));
        try {
            listener.onOutboundOverflow(this, droppedTotal);
        } catch (RuntimeException e) {
            logger.error("Error in overflow listener for {}", url, e);
        }
    }

    private void transition(RelayStatus next, String reason) {
        RelayStatus previous = status;
        if (previous == next || previous == RelayStatus.TERMINATED) {
            return;
        }
        status = next;
        logger.debug("Relay {} status {} -> {}", url, previous, next);
        notifyStatus(previous, next, reason);
    }

    private void notifyStatus(RelayStatus previous, RelayStatus current, String reason) {
        try {
            listener.onStatusChanged(this, previous, current, reason);
        } catch (RuntimeException e) {
            logger.error("Error in status listener for {}", url, e);
        }
    }

    private void failWaiters(Throwable error) {
        for (CompletableFuture<Void> waiter : connectWaiters) {
            waiter.completeExceptionally(error);
        }
        connectWaiters.clear();
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private boolean submit(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Unexpected error in connection task for {}", url, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("Connection task for {} already stopped", url);
            return false;
        }
    }

    private static final class Outbound {
        final String text;
        final BooleanSupplier condition;
        final CompletableFuture<Boolean> result = new CompletableFuture<>();

        Outbound(String text, BooleanSupplier condition) {
            this.text = text;
            this.condition = condition;
        }
    }

    /**
     * Transport callbacks tagged with the attempt that opened the transport.
     */
    private final class Callbacks implements TransportListener {
        private final long attempt;

        Callbacks(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen() {
            submit(() -> handleOpen(attempt));
        }

        @Override
        public void onMessage(String text) {
            submit(() -> handleText(attempt, text));
        }

        @Override
        public void onClosed(int code, String reason) {
            submit(() -> {
                logger.info("Relay closed: {} - {} (code: {})", url, reason, code);
                loseConnection(attempt, reason != null && !reason.isEmpty() ? reason : "Connection closed");
            });
        }

        @Override
        public void onFailure(Throwable error) {
            submit(() -> {
                String reason = error != null && error.getMessage() != null
                        ? error.getMessage() : "Unknown error";
                if (status == RelayStatus.CONNECTED) {
                    logger.warn("Relay connection failed: {} ({})", url, reason);
                } else {
                    logger.info("Could not connect to relay {}: {}", url, reason);
                }
                loseConnection(attempt, reason);
            });
        }
    }

    @Override
    public String toString() {
        return "RelayConnection{" + url + ", " + status + '}';
    }
}
