package org.nostrpool.pool;

import org.nostrpool.protocol.Event;
import org.nostrpool.relay.RelayUrl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Gathers the events of one fetch. Relays that disconnect, are removed or
 * reject the subscription count as finished, so a fetch never waits on them
 * past its timeout.
 */
final class EventCollector {

    private final FetchOptions options;
    private final ScheduledExecutorService scheduler;
    private final Set<RelayUrl> awaitingEose;
    private final Map<String, Event> events = new LinkedHashMap<>();
    private final CompletableFuture<List<Event>> result = new CompletableFuture<>();
    private boolean started;
    private boolean allEose;
    private int afterEose;

    EventCollector(FetchOptions options, Collection<RelayUrl> relays, ScheduledExecutorService scheduler) {
        this.options = options;
        this.scheduler = scheduler;
        this.awaitingEose = new HashSet<>(relays);
    }

    CompletableFuture<List<Event>> getResult() {
        return result;
    }

    /**
     * Begin evaluating the exit condition; called once the subscription is issued.
     */
    synchronized void start() {
        started = true;
        checkAllEose();
    }

    synchronized void onEvent(Event event) {
        if (result.isDone() || events.putIfAbsent(event.getId(), event) != null) {
            return;
        }
        if (allEose && options.getMode() == FetchOptions.Mode.WAIT_FOR_EVENTS_AFTER_EOSE
                && ++afterEose >= options.getEventsAfterEose()) {
            finish();
        }
    }

    synchronized void onEose(RelayUrl relay) {
        awaitingEose.remove(relay);
        checkAllEose();
    }

    synchronized void onRelayGone(RelayUrl relay) {
        onEose(relay);
    }

    synchronized void finish() {
        result.complete(new ArrayList<>(events.values()));
    }

    private void checkAllEose() {
        if (!started || allEose || !awaitingEose.isEmpty()) {
            return;
        }
        allEose = true;
        switch (options.getMode()) {
            case WAIT_FOR_EVENTS_AFTER_EOSE:
                if (options.getEventsAfterEose() == 0) {
                    finish();
                }
                break;
            case WAIT_DURATION_AFTER_EOSE:
                try {
                    scheduler.schedule(this::finish, options.getDurationAfterEose().toMillis(),
                            TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    finish();
                }
                break;
            default:
                finish();
        }
    }
}
