package org.nostrpool.pool;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostrpool.errors.RelayNotFoundException;
import org.nostrpool.errors.SubscriptionClosedException;
import org.nostrpool.protocol.ClientMessage;
import org.nostrpool.protocol.Event;
import org.nostrpool.protocol.EventKinds;
import org.nostrpool.protocol.Filter;
import org.nostrpool.protocol.RelayMessage;
import org.nostrpool.relay.RelayConnection;
import org.nostrpool.relay.RelayOptions;
import org.nostrpool.relay.RelayStatus;
import org.nostrpool.relay.RelayUrl;
import org.nostrpool.store.MemoryEventStore;
import org.nostrpool.testing.Await;
import org.nostrpool.testing.FakeRelay;
import org.nostrpool.testing.FakeRelayNetwork;
import org.nostrpool.testing.TestEvents;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * End to end pool behaviour against in-memory relays.
 */
public class RelayPoolTest {

    private static final RelayUrl URL_A = RelayUrl.parse("wss://a.test");
    private static final RelayUrl URL_B = RelayUrl.parse("wss://b.test");
    private static final List<Filter> NOTES =
            Collections.singletonList(Filter.builder().kinds(EventKinds.TEXT_NOTE).build());

    private FakeRelayNetwork network;
    private FakeRelay relayA;
    private FakeRelay relayB;
    private MemoryEventStore store;
    private RelayPool pool;

    @Before
    public void setUp() {
        network = new FakeRelayNetwork();
        relayA = network.relay("wss://a.test");
        relayB = network.relay("wss://b.test");
        store = new MemoryEventStore();
    }

    @After
    public void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private RelayPool newPool() {
        return newPool(RelayPoolOptions.builder());
    }

    private RelayPool newPool(RelayPoolOptions.Builder builder) {
        pool = new RelayPool(builder
                .transportFactory(network)
                .store(store)
                .defaultRelayOptions(RelayOptions.builder()
                        .reconnectInterval(Duration.ofMillis(20))
                        .maxReconnectInterval(Duration.ofMillis(100))
                        .jitter(false)
                        .build())
                .build());
        return pool;
    }

    private void connectBoth() throws Exception {
        pool.addRelay(URL_A.toString());
        pool.addRelay(URL_B.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        pool.connectRelay(URL_B).get(5, TimeUnit.SECONDS);
    }

    private static List<PooledEvent> take(StreamConsumer<PooledEvent> consumer, int count) throws Exception {
        List<PooledEvent> taken = new ArrayList<>();
        while (taken.size() < count) {
            PooledEvent event = consumer.poll(5, TimeUnit.SECONDS);
            assertNotNull("Expected " + count + " events, got " + taken.size(), event);
            taken.add(event);
        }
        return taken;
    }

    private static PoolNotification awaitNotification(StreamConsumer<PoolNotification> consumer,
                                                      PoolNotification.Type type) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            PoolNotification notification = consumer.poll(100, TimeUnit.MILLISECONDS);
            if (notification != null && notification.getType() == type) {
                return notification;
            }
        }
        fail("No " + type + " notification");
        return null;
    }

    @Test
    public void testDuplicateEventsDeliveredOnce() throws Exception {
        Event shared = TestEvents.note(1000, "shared");
        Event onlyB = TestEvents.note(1001, "only b");
        relayA.store(shared);
        relayB.store(shared, onlyB);
        newPool();
        connectBoth();
        StreamConsumer<PooledEvent> events = pool.events();

        SubscribeOutput output = pool.subscribe(NOTES);
        assertEquals(SubscribeStatus.SENT, output.getStatus(URL_A));
        assertEquals(SubscribeStatus.SENT, output.getStatus(URL_B));

        List<PooledEvent> delivered = take(events, 2);
        Set<String> ids = new HashSet<>();
        PooledEvent sharedDelivery = null;
        for (PooledEvent event : delivered) {
            ids.add(event.getEvent().getId());
            assertEquals(output.getId(), event.getSubscriptionId());
            if (event.getEvent().equals(shared)) {
                sharedDelivery = event;
            }
        }
        assertEquals(2, ids.size());
        assertNotNull(sharedDelivery);

        final PooledEvent confirmed = sharedDelivery;
        Await.until("both relays confirm the shared event", () -> confirmed.getConfirmations().size() == 2);
        assertTrue(confirmed.getConfirmations().contains(URL_A));
        assertTrue(confirmed.getConfirmations().contains(URL_B));
        assertNull(events.poll(200, TimeUnit.MILLISECONDS));
        assertEquals(2, store.size());
    }

    @Test
    public void testSubscribeBeforeConnectIsPending() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());

        SubscribeOutput output = pool.subscribe(NOTES);
        assertEquals(SubscribeStatus.PENDING_CONNECTION, output.getStatus(URL_A));
        assertEquals(0, relayA.received(ClientMessage.Type.REQ).size());

        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        String id = output.getId().getValue();
        Await.until("REQ sent on connect", () -> relayA.count(ClientMessage.Type.REQ, id) == 1);
    }

    @Test
    public void testExplicitTargetsOnly() throws Exception {
        newPool();
        connectBoth();

        SubscribeOutput output = pool.subscribe(NOTES, RelayTargets.of(URL_A));
        assertEquals(Collections.singleton(URL_A), output.getStatuses().keySet());

        String id = output.getId().getValue();
        Await.until("REQ on a", () -> relayA.count(ClientMessage.Type.REQ, id) == 1);
        Thread.sleep(100);
        assertTrue(relayB.received(ClientMessage.Type.REQ).isEmpty());
    }

    @Test
    public void testRelayAddedAfterSubscribeGetsNoReq() throws Exception {
        newPool();
        connectBoth();
        SubscribeOutput output = pool.subscribe(NOTES);
        String id = output.getId().getValue();
        Await.until("REQ on a and b", () -> relayA.count(ClientMessage.Type.REQ, id) == 1
                && relayB.count(ClientMessage.Type.REQ, id) == 1);

        FakeRelay relayC = network.relay("wss://c.test");
        RelayUrl urlC = RelayUrl.parse("wss://c.test");
        pool.addRelay(urlC.toString());
        pool.connectRelay(urlC).get(5, TimeUnit.SECONDS);

        Thread.sleep(100);
        assertTrue(relayC.received(ClientMessage.Type.REQ).isEmpty());
        assertFalse(pool.subscription(output.getId()).getTargets().contains(urlC));
    }

    @Test
    public void testRelayRemovedWhileSubscribingIsDroppedFromTargets() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        RelayConnection resolved = pool.relay(URL_A);

        // The relay leaves the pool between target resolution and registration
        pool.removeRelay(URL_A).get(5, TimeUnit.SECONDS);
        SubscribeOutput output = pool.subscribe(NOTES, Collections.singletonList(resolved), null);

        assertTrue(output.getStatuses().isEmpty());
        assertTrue(pool.subscription(output.getId()).getTargets().isEmpty());

        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        Thread.sleep(100);
        assertEquals(0, relayA.count(ClientMessage.Type.REQ, output.getId().getValue()));
    }

    @Test
    public void testRelayRemovedWhileRetargetingIsDroppedFromTargets() throws Exception {
        newPool();
        connectBoth();
        SubscriptionId id = pool.subscribe(NOTES, RelayTargets.of(URL_B)).getId();
        Await.until("REQ on b", () -> relayB.count(ClientMessage.Type.REQ, id.getValue()) == 1);
        RelayConnection resolved = pool.relay(URL_A);

        pool.removeRelay(URL_A).get(5, TimeUnit.SECONDS);
        SubscribeOutput output = pool.updateFilters(id, NOTES, Collections.singletonList(resolved));

        assertTrue(output.getStatuses().isEmpty());
        assertTrue(pool.subscription(id).getTargets().isEmpty());
        Await.until("CLOSE on b", () -> relayB.count(ClientMessage.Type.CLOSE, id.getValue()) == 1);

        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        Thread.sleep(100);
        assertEquals(0, relayA.count(ClientMessage.Type.REQ, id.getValue()));
    }

    @Test(expected = RelayNotFoundException.class)
    public void testUnknownTargetRejected() {
        newPool();
        pool.subscribe(NOTES, RelayTargets.ofUrls("wss://unknown.test"));
    }

    @Test
    public void testReadFlagLimitsAllTargets() throws Exception {
        newPool();
        pool.addRelay(URL_A, RelayOptions.builder().read(false).build());
        pool.addRelay(URL_B.toString());

        SubscribeOutput output = pool.subscribe(NOTES);
        assertEquals(Collections.singleton(URL_B), output.getStatuses().keySet());

        // explicit targets ignore the flag
        SubscribeOutput explicit = pool.subscribe(NOTES, RelayTargets.of(URL_A));
        assertEquals(SubscribeStatus.PENDING_CONNECTION, explicit.getStatus(URL_A));
    }

    @Test
    public void testResubscribesExactlyOnceAfterReconnect() throws Exception {
        Event note = TestEvents.note(1000, "hello");
        relayA.store(note);
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PooledEvent> events = pool.events();

        String id = pool.subscribe(NOTES).getId().getValue();
        take(events, 1);
        assertEquals(1, relayA.count(ClientMessage.Type.REQ, id));

        relayA.drop();
        Await.until("reconnected", () -> relayA.getConnectionCount() == 2
                && pool.relay(URL_A).getStatus() == RelayStatus.CONNECTED);
        Await.until("REQ re-issued", () -> relayA.count(ClientMessage.Type.REQ, id) == 2);
        Thread.sleep(200);
        assertEquals(2, relayA.count(ClientMessage.Type.REQ, id));

        // the stored event comes again but was already seen
        assertNull(events.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testPublishOutcomes() throws Exception {
        newPool();
        connectBoth();
        pool.disconnectRelay(URL_B).get(5, TimeUnit.SECONDS);
        Event note = TestEvents.note(1000, "publish me");

        PublishOutput output = pool.publish(note).get(5, TimeUnit.SECONDS);

        assertEquals(note.getId(), output.getEventId());
        assertEquals(PublishStatus.ACCEPTED, output.getOutcome(URL_A).getStatus());
        assertEquals(PublishStatus.NOT_ATTEMPTED, output.getOutcome(URL_B).getStatus());
        assertTrue(output.isAccepted());
        assertEquals(Collections.singleton(URL_A), output.getAccepted());
        assertTrue(relayA.hasEvent(note.getId()));
        assertFalse(relayB.hasEvent(note.getId()));
    }

    @Test
    public void testPublishRejected() throws Exception {
        relayA.setRejectReason("blocked: spam");
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        PublishOutput output = pool.publish(TestEvents.note(1000, "spam")).get(5, TimeUnit.SECONDS);

        PublishOutcome outcome = output.getOutcome(URL_A);
        assertEquals(PublishStatus.REJECTED, outcome.getStatus());
        assertEquals("blocked: spam", outcome.getMessage());
        assertFalse(output.isAccepted());
    }

    @Test
    public void testPublishWithoutOkFailsAfterTimeout() throws Exception {
        relayA.setAnswerOk(false);
        newPool(RelayPoolOptions.builder().sendTimeout(Duration.ofMillis(200)));
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        PublishOutput output = pool.publish(TestEvents.note(1000, "silent")).get(5, TimeUnit.SECONDS);

        assertEquals(PublishStatus.FAILED, output.getOutcome(URL_A).getStatus());
    }

    @Test
    public void testPublishFailsWhenConnectionDrops() throws Exception {
        relayA.setAnswerOk(false);
        newPool();
        pool.addRelay(URL_A, RelayOptions.builder().reconnect(false).build());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        CompletableFuture<PublishOutput> pending = pool.publish(TestEvents.note(1000, "lost"));
        Await.until("event sent", () -> relayA.received(ClientMessage.Type.EVENT).size() == 1);
        relayA.drop();

        assertEquals(PublishStatus.FAILED, pending.get(5, TimeUnit.SECONDS).getOutcome(URL_A).getStatus());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPublishUnsignedEventRejected() {
        newPool();
        pool.publish(new Event(null, "ab", 1000, EventKinds.TEXT_NOTE, null, "", null));
    }

    @Test
    public void testPublishFailsWhenOutboundQueueOverflows() throws Exception {
        newPool();
        pool.addRelay(URL_A, RelayOptions.builder().queueCapacity(1).jitter(false).build());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PoolNotification> notifications = pool.notifications();
        Event first = TestEvents.note(1000, "first");
        Event second = TestEvents.note(1001, "second");
        Event third = TestEvents.note(1002, "third");

        relayA.pauseWrites();
        CompletableFuture<PublishOutput> firstOutput = pool.publish(first, RelayTargets.of(URL_A));
        Await.until("first write held", relayA::isWriteBlocked);
        CompletableFuture<PublishOutput> secondOutput = pool.publish(second, RelayTargets.of(URL_A));
        CompletableFuture<PublishOutput> thirdOutput = pool.publish(third, RelayTargets.of(URL_A));
        relayA.resumeWrites();

        assertEquals(PublishStatus.FAILED, secondOutput.get(5, TimeUnit.SECONDS).getOutcome(URL_A).getStatus());
        assertEquals(PublishStatus.ACCEPTED, firstOutput.get(5, TimeUnit.SECONDS).getOutcome(URL_A).getStatus());
        assertEquals(PublishStatus.ACCEPTED, thirdOutput.get(5, TimeUnit.SECONDS).getOutcome(URL_A).getStatus());
        assertFalse(relayA.hasEvent(second.getId()));
        PoolNotification overflow = awaitNotification(notifications, PoolNotification.Type.OUTBOUND_OVERFLOW);
        assertEquals(URL_A, overflow.getRelayUrl());
        assertEquals(1, overflow.getDropped());
    }

    @Test
    public void testUnsubscribeCompletesOnClosedAck() throws Exception {
        newPool(RelayPoolOptions.builder().unsubscribeGrace(Duration.ofSeconds(30)));
        connectBoth();
        SubscriptionId id = pool.subscribe(NOTES).getId();
        Await.until("REQ on both", () -> relayA.count(ClientMessage.Type.REQ, id.getValue()) == 1
                && relayB.count(ClientMessage.Type.REQ, id.getValue()) == 1);

        pool.unsubscribe(id).get(5, TimeUnit.SECONDS);

        assertEquals(1, relayA.count(ClientMessage.Type.CLOSE, id.getValue()));
        assertEquals(1, relayB.count(ClientMessage.Type.CLOSE, id.getValue()));
        assertNull(pool.subscription(id));
    }

    @Test
    public void testUnsubscribeCompletesAfterGraceWithoutAck() throws Exception {
        relayA.setAckClose(false);
        newPool(RelayPoolOptions.builder().unsubscribeGrace(Duration.ofMillis(200)));
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PooledEvent> events = pool.events();
        SubscriptionId id = pool.subscribe(NOTES).getId();
        Await.until("REQ sent", () -> relayA.count(ClientMessage.Type.REQ, id.getValue()) == 1);

        CompletableFuture<Void> done = pool.unsubscribe(id);
        // events after the close are dropped
        relayA.sendEvent(id.getValue(), TestEvents.note(1000, "late"));

        done.get(5, TimeUnit.SECONDS);
        assertNull(pool.subscription(id));
        assertNull(events.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test(expected = SubscriptionClosedException.class)
    public void testUnsubscribeTwiceFails() throws Exception {
        newPool();
        SubscriptionId id = pool.subscribe(NOTES).getId();
        pool.unsubscribe(id).get(5, TimeUnit.SECONDS);
        pool.unsubscribe(id);
    }

    @Test
    public void testUpdateFiltersResendsSameId() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        SubscriptionId id = pool.subscribe(NOTES).getId();
        Await.until("first REQ", () -> relayA.count(ClientMessage.Type.REQ, id.getValue()) == 1);

        List<Filter> reactions = Collections.singletonList(Filter.builder().kinds(EventKinds.REACTION).build());
        SubscribeOutput output = pool.updateFilters(id, reactions);

        assertEquals(id, output.getId());
        assertEquals(SubscribeStatus.SENT, output.getStatus(URL_A));
        Await.until("second REQ", () -> relayA.count(ClientMessage.Type.REQ, id.getValue()) == 2);
        assertEquals(reactions, relayA.getSubscription(id.getValue()));
        assertEquals(reactions, pool.subscription(id).getFilters());
    }

    @Test
    public void testUpdateTargetsClosesDroppedRelays() throws Exception {
        newPool();
        connectBoth();
        SubscriptionId id = pool.subscribe(NOTES).getId();
        Await.until("REQ on b", () -> relayB.count(ClientMessage.Type.REQ, id.getValue()) == 1);

        pool.updateFilters(id, NOTES, RelayTargets.of(URL_A));

        Await.until("CLOSE on b", () -> relayB.count(ClientMessage.Type.CLOSE, id.getValue()) == 1);
        assertEquals(Collections.singleton(URL_A), pool.subscription(id).getTargets());
    }

    @Test
    public void testRemoveRelay() throws Exception {
        newPool();
        connectBoth();
        SubscriptionId id = pool.subscribe(NOTES).getId();

        pool.removeRelay(URL_B).get(5, TimeUnit.SECONDS);

        assertFalse(pool.status().containsKey(URL_B));
        assertFalse(pool.subscription(id).getTargets().contains(URL_B));
        assertFalse(relayB.isConnected());
        try {
            pool.removeRelay(URL_B);
            fail("Expected RelayNotFoundException");
        } catch (RelayNotFoundException e) {
            // expected
        }
    }

    @Test
    public void testReconnectAfterDisconnectRelay() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        String id = pool.subscribe(NOTES).getId().getValue();

        pool.disconnectRelay(URL_A).get(5, TimeUnit.SECONDS);
        assertEquals(RelayStatus.TERMINATED, pool.status().get(URL_A));

        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        assertEquals(RelayStatus.CONNECTED, pool.status().get(URL_A));
        Await.until("subscription re-issued", () -> relayA.count(ClientMessage.Type.REQ, id) == 2);
    }

    @Test
    public void testNonMatchingEventReportedAndDropped() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PooledEvent> events = pool.events();
        StreamConsumer<PoolNotification> notifications = pool.notifications();
        String id = pool.subscribe(NOTES).getId().getValue();

        relayA.sendEvent(id, TestEvents.ofKind(EventKinds.REACTION, 1000, "+"));

        PoolNotification notification = awaitNotification(notifications, PoolNotification.Type.PROTOCOL_ERROR);
        assertEquals(URL_A, notification.getRelayUrl());
        assertNull(events.poll(100, TimeUnit.MILLISECONDS));
        assertEquals(0, store.size());
    }

    @Test
    public void testEventsUnderReplacedFiltersDroppedQuietly() throws Exception {
        relayA.setAnswerReq(false);
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PooledEvent> events = pool.events();
        StreamConsumer<PoolNotification> notifications = pool.notifications();
        SubscriptionId id = pool.subscribe(NOTES).getId();
        Await.until("first REQ", () -> relayA.count(ClientMessage.Type.REQ, id.getValue()) == 1);

        pool.updateFilters(id, Collections.singletonList(Filter.builder().kinds(EventKinds.REACTION).build()));
        Await.until("second REQ", () -> relayA.count(ClientMessage.Type.REQ, id.getValue()) == 2);
        Event stale = TestEvents.note(1000, "sent before the new REQ was seen");
        relayA.sendEvent(id.getValue(), stale);
        relayA.send(RelayMessage.eose(id.getValue()));
        Event late = TestEvents.note(1001, "sent after EOSE");
        relayA.sendEvent(id.getValue(), late);

        PoolNotification notification = awaitNotification(notifications, PoolNotification.Type.PROTOCOL_ERROR);
        assertTrue(notification.getMessage().contains(late.getId()));
        assertNull(events.poll(100, TimeUnit.MILLISECONDS));
        assertEquals(0, store.size());
    }

    @Test
    public void testInvalidSignatureReportedAndDropped() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PooledEvent> events = pool.events();
        StreamConsumer<PoolNotification> notifications = pool.notifications();
        String id = pool.subscribe(NOTES).getId().getValue();

        Event original = TestEvents.note(1000, "original");
        Event tampered = new Event(original.getId(), original.getPubkey(), original.getCreatedAt(),
                original.getKind(), original.getTags(), "tampered", original.getSig());
        relayA.sendEvent(id, tampered);

        PoolNotification notification = awaitNotification(notifications, PoolNotification.Type.PROTOCOL_ERROR);
        assertTrue(notification.getMessage().contains(original.getId()));
        assertNull(events.poll(100, TimeUnit.MILLISECONDS));

        // the genuine event is still delivered
        relayA.sendEvent(id, original);
        assertEquals(original, take(events, 1).get(0).getEvent());
    }

    @Test
    public void testMalformedMessageReported() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PoolNotification> notifications = pool.notifications();

        relayA.sendRaw("[\"EVENT\"");

        awaitNotification(notifications, PoolNotification.Type.PROTOCOL_ERROR);
        assertEquals(RelayStatus.CONNECTED, pool.status().get(URL_A));
    }

    @Test
    public void testRelayClosedSubscription() throws Exception {
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PoolNotification> notifications = pool.notifications();
        SubscriptionId id = pool.subscribe(NOTES).getId();

        relayA.send(RelayMessage.closed(id.getValue(), "auth-required: sign in first"));

        PoolNotification notification = awaitNotification(notifications, PoolNotification.Type.SUBSCRIPTION_REJECTED);
        assertEquals(id.getValue(), notification.getSubscriptionId());
        assertEquals("auth-required: sign in first", notification.getMessage());
        assertFalse(pool.subscription(id).isClosed());

        // retried when the relay reconnects
        relayA.drop();
        Await.until("REQ re-issued", () -> relayA.count(ClientMessage.Type.REQ, id.getValue()) == 2);
    }

    @Test
    public void testNoticeAndStatusNotifications() throws Exception {
        newPool();
        StreamConsumer<PoolNotification> notifications = pool.notifications();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        PoolNotification status = awaitNotification(notifications, PoolNotification.Type.RELAY_STATUS_CHANGED);
        assertEquals(RelayStatus.INITIALIZED, status.getPreviousStatus());
        assertEquals(RelayStatus.CONNECTING, status.getStatus());

        relayA.send(RelayMessage.notice("rate limited"));
        PoolNotification notice = awaitNotification(notifications, PoolNotification.Type.RELAY_NOTICE);
        assertEquals("rate limited", notice.getMessage());
    }

    @Test
    public void testSlowConsumerReportedAsLagging() throws Exception {
        relayA.store(TestEvents.note(1000, "one"), TestEvents.note(1001, "two"), TestEvents.note(1002, "three"));
        newPool(RelayPoolOptions.builder().streamCapacity(1));
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PoolNotification> notifications = pool.notifications();
        StreamConsumer<PooledEvent> events = pool.events();

        pool.subscribe(NOTES);

        PoolNotification lagged = awaitNotification(notifications, PoolNotification.Type.CONSUMER_LAGGED);
        assertTrue(lagged.getDropped() >= 1);
        Await.until("two events dropped", () -> events.getDropped() == 2);
        assertEquals(1, events.size());
    }

    @Test
    public void testSlowNotificationConsumerReportedToOthers() throws Exception {
        newPool(RelayPoolOptions.builder().notificationCapacity(2));
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);
        StreamConsumer<PoolNotification> slow = pool.notifications();
        StreamConsumer<PoolNotification> watcher = pool.notifications();

        List<PoolNotification.Type> seen = new ArrayList<>();
        PoolNotification lagged = null;
        for (int i = 0; i < 3; i++) {
            relayA.send(RelayMessage.notice("notice " + i));
            PoolNotification notification;
            do {
                notification = watcher.poll(5, TimeUnit.SECONDS);
                assertNotNull("Expected notice " + i, notification);
                seen.add(notification.getType());
                if (notification.getType() == PoolNotification.Type.CONSUMER_LAGGED) {
                    lagged = notification;
                }
            } while (notification.getType() != PoolNotification.Type.RELAY_NOTICE);
        }

        assertEquals(Arrays.asList(PoolNotification.Type.RELAY_NOTICE, PoolNotification.Type.RELAY_NOTICE,
                PoolNotification.Type.CONSUMER_LAGGED, PoolNotification.Type.RELAY_NOTICE), seen);
        assertEquals(1, lagged.getDropped());
        assertTrue(lagged.getMessage().startsWith("Notification consumer"));
        assertEquals(2, slow.getDropped());
        assertEquals(0, watcher.getDropped());
    }

    @Test
    public void testFetchEventsDeduplicated() throws Exception {
        Event first = TestEvents.note(1000, "first");
        Event second = TestEvents.note(1001, "second");
        Event third = TestEvents.note(1002, "third");
        relayA.store(first, second);
        relayB.store(second, third);
        newPool();
        connectBoth();

        List<Event> fetched = pool.fetchEvents(NOTES, Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        assertEquals(3, fetched.size());
        assertEquals(new HashSet<>(Arrays.asList(first, second, third)), new HashSet<>(fetched));
        Await.until("fetch subscription removed", () -> pool.subscriptions().isEmpty());
    }

    @Test
    public void testFetchTimeoutReturnsPartialResult() throws Exception {
        Event fromB = TestEvents.note(1000, "from b");
        relayA.setAnswerReq(false);
        relayB.store(fromB);
        newPool();
        connectBoth();

        long start = System.currentTimeMillis();
        List<Event> fetched = pool.fetchEvents(NOTES, Duration.ofMillis(300)).get(5, TimeUnit.SECONDS);

        assertTrue(System.currentTimeMillis() - start >= 250);
        assertEquals(Collections.singletonList(fromB), fetched);
    }

    @Test
    public void testFetchWaitsForEventsAfterEose() throws Exception {
        Event stored = TestEvents.note(1000, "stored");
        Event live = TestEvents.note(1001, "live");
        relayA.store(stored);
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        CompletableFuture<List<Event>> fetch = pool.fetchEvents(NOTES, RelayTargets.of(URL_A),
                Duration.ofSeconds(5), FetchOptions.waitForEventsAfterEose(1));
        Await.until("fetch subscribed", () -> !relayA.getSubscriptions().isEmpty());
        Thread.sleep(100);
        assertFalse(fetch.isDone());

        String id = relayA.getSubscriptions().keySet().iterator().next();
        relayA.sendEvent(id, live);

        assertEquals(Arrays.asList(stored, live), fetch.get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testFetchWithNoRelays() throws Exception {
        newPool();
        assertTrue(pool.fetchEvents(NOTES, Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    public void testFetchSkipsRelaysNotConnected() throws Exception {
        Event note = TestEvents.note(1000, "from a");
        relayA.store(note);
        newPool();
        pool.addRelay(URL_A.toString());
        pool.addRelay(URL_B.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        long started = System.currentTimeMillis();
        List<Event> fetched = pool.fetchEvents(NOTES, Duration.ofSeconds(3)).get(5, TimeUnit.SECONDS);
        long elapsed = System.currentTimeMillis() - started;

        assertEquals(Collections.singletonList(note), fetched);
        assertTrue("fetch took " + elapsed + "ms", elapsed < 1000);
        assertTrue(relayB.received(ClientMessage.Type.REQ).isEmpty());
    }

    @Test
    public void testSyncMovesDifferenceBothWays() throws Exception {
        Event localOnly = TestEvents.note(1000, "local");
        Event remoteOnly = TestEvents.note(1001, "remote");
        Event shared = TestEvents.note(1002, "shared");
        store.store(localOnly);
        store.store(shared);
        relayA.store(remoteOnly, shared);
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        NegentropyOptions options = NegentropyOptions.builder().direction(NegentropyDirection.BOTH).build();
        SyncOutput output = pool.sync(NOTES.get(0), RelayTargets.of(URL_A), options).get(10, TimeUnit.SECONDS);

        ReconciliationResult result = output.getResults().get(URL_A);
        assertTrue(result.isComplete());
        assertEquals(Collections.singleton(remoteOnly.getId()), result.getNeedIds());
        assertEquals(Collections.singleton(localOnly.getId()), result.getHaveIds());
        assertEquals(Collections.singleton(remoteOnly.getId()), output.getReceived());
        assertEquals(Collections.singleton(localOnly.getId()), output.getSent());
        assertNotNull(store.get(remoteOnly.getId()));
        assertTrue(relayA.hasEvent(localOnly.getId()));
    }

    @Test
    public void testSyncDownOnlyPublishesNothing() throws Exception {
        Event localOnly = TestEvents.note(1000, "local");
        store.store(localOnly);
        relayA.store(TestEvents.note(1001, "remote"));
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        SyncOutput output = pool.sync(NOTES.get(0), RelayTargets.of(URL_A), NegentropyOptions.defaults())
                .get(10, TimeUnit.SECONDS);

        assertEquals(1, output.getReceived().size());
        assertTrue(output.getSent().isEmpty());
        assertTrue(relayA.received(ClientMessage.Type.EVENT).isEmpty());
        assertFalse(relayA.hasEvent(localOnly.getId()));
    }

    @Test
    public void testSyncFallsBackToFetch() throws Exception {
        Event remote = TestEvents.note(1000, "remote");
        relayA.store(remote);
        relayA.setNegentropyError("blocked: negentropy disabled");
        newPool();
        pool.addRelay(URL_A.toString());
        pool.connectRelay(URL_A).get(5, TimeUnit.SECONDS);

        NegentropyOptions options = NegentropyOptions.builder().fallbackToFetch(true).build();
        SyncOutput output = pool.sync(NOTES.get(0), RelayTargets.of(URL_A), options).get(10, TimeUnit.SECONDS);

        ReconciliationResult result = output.getResults().get(URL_A);
        assertFalse(result.isComplete());
        assertEquals(Collections.singleton(remote.getId()), output.getReceived());
        assertNotNull(store.get(remote.getId()));
    }

    @Test
    public void testShutdownIsIdempotent() throws Exception {
        newPool();
        connectBoth();
        StreamConsumer<PooledEvent> events = pool.events();
        SubscriptionId id = pool.subscribe(NOTES).getId();
        CompletableFuture<Void> closed = pool.subscription(id).getCloseFuture();

        pool.shutdown();
        pool.shutdown();

        assertTrue(pool.isShutdown());
        assertTrue(events.isClosed());
        assertTrue(closed.isDone());
        assertTrue(pool.status().isEmpty());
        assertFalse(relayA.isConnected());
        assertFalse(relayB.isConnected());
        try {
            pool.subscribe(NOTES);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            pool.addRelay("wss://c.test");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
    }
}
