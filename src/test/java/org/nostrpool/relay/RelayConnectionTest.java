package org.nostrpool.relay;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostrpool.errors.CapacityExceededException;
import org.nostrpool.errors.ProtocolException;
import org.nostrpool.errors.TransportException;
import org.nostrpool.protocol.ClientMessage;
import org.nostrpool.protocol.Event;
import org.nostrpool.protocol.Filter;
import org.nostrpool.protocol.JsonMessageCodec;
import org.nostrpool.protocol.RelayMessage;
import org.nostrpool.testing.Await;
import org.nostrpool.testing.FakeRelay;
import org.nostrpool.testing.FakeRelayNetwork;
import org.nostrpool.testing.TestEvents;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * Unit tests for the per relay connection state machine.
 */
public class RelayConnectionTest {

    private static final String URL = "wss://relay.test";

    private FakeRelayNetwork network;
    private RecordingListener listener;
    private final List<RelayConnection> connections = new ArrayList<>();

    @Before
    public void setUp() {
        network = new FakeRelayNetwork();
        listener = new RecordingListener();
    }

    @After
    public void tearDown() throws Exception {
        for (RelayConnection connection : connections) {
            connection.terminate();
            connection.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private RelayConnection connection(String url, RelayOptions options) {
        RelayConnection connection = new RelayConnection(RelayUrl.parse(url), options, network,
                new JsonMessageCodec(), listener, Clock.systemUTC());
        connections.add(connection);
        return connection;
    }

    private static RelayOptions fastReconnect() {
        return RelayOptions.builder()
                .reconnectInterval(Duration.ofMillis(20))
                .maxReconnectInterval(Duration.ofMillis(100))
                .jitter(false)
                .build();
    }

    @Test
    public void testConnect() throws Exception {
        network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());

        assertEquals(RelayStatus.INITIALIZED, connection.getStatus());
        connection.connect().get(5, TimeUnit.SECONDS);

        assertTrue(connection.isConnected());
        assertEquals(1, connection.getStats().getAttempts());
        assertEquals(1, connection.getStats().getSuccesses());
        assertNotNull(connection.getStats().getConnectedAt());
        Await.until("CONNECTED notification", () -> listener.statuses.contains(RelayStatus.CONNECTED));
        assertEquals(RelayStatus.CONNECTING, listener.statuses.get(0));
    }

    @Test
    public void testConnectWhenAlreadyConnected() throws Exception {
        network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);

        connection.connect().get(5, TimeUnit.SECONDS);

        assertEquals(1, network.relay(URL).getConnectionCount());
    }

    @Test
    public void testSendRequiresConnection() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        ClientMessage req = ClientMessage.req("sub-1", Collections.singletonList(Filter.builder().kinds(1).build()));

        assertFalse(connection.send(req).get(5, TimeUnit.SECONDS));

        connection.connect().get(5, TimeUnit.SECONDS);
        assertTrue(connection.send(req).get(5, TimeUnit.SECONDS));
        assertEquals(1, relay.count(ClientMessage.Type.REQ, "sub-1"));
    }

    @Test
    public void testSendIfEvaluatesCondition() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);

        assertFalse(connection.sendIf(() -> false, ClientMessage.close("sub-1")).get(5, TimeUnit.SECONDS));
        assertTrue(connection.sendIf(() -> true, ClientMessage.close("sub-2")).get(5, TimeUnit.SECONDS));

        assertEquals(0, relay.count(ClientMessage.Type.CLOSE, "sub-1"));
        assertEquals(1, relay.count(ClientMessage.Type.CLOSE, "sub-2"));
    }

    @Test
    public void testMessagesWrittenInOrder() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);
        Event first = TestEvents.note(1, "first");
        Event second = TestEvents.note(2, "second");
        Event third = TestEvents.note(3, "third");

        connection.send(ClientMessage.event(first));
        connection.send(ClientMessage.event(second));
        assertTrue(connection.send(ClientMessage.event(third)).get(5, TimeUnit.SECONDS));

        List<ClientMessage> events = relay.received(ClientMessage.Type.EVENT);
        assertEquals(3, events.size());
        assertEquals(first.getId(), events.get(0).getEvent().getId());
        assertEquals(second.getId(), events.get(1).getEvent().getId());
        assertEquals(third.getId(), events.get(2).getEvent().getId());
        assertEquals(3, connection.getStats().getMessagesSent());
    }

    @Test
    public void testQueueOverflowDropsOldest() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayOptions options = RelayOptions.builder().queueCapacity(2).jitter(false).build();
        RelayConnection connection = connection(URL, options);
        connection.connect().get(5, TimeUnit.SECONDS);
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        // Hold the connection thread so later messages pile up in the queue
        CompletableFuture<Boolean> held = connection.sendIf(() -> {
            writing.countDown();
            return awaitQuietly(release);
        }, ClientMessage.close("sub-1"));
        assertTrue(writing.await(5, TimeUnit.SECONDS));
        CompletableFuture<Boolean> oldest = connection.send(ClientMessage.close("sub-2"));
        CompletableFuture<Boolean> second = connection.send(ClientMessage.close("sub-3"));
        CompletableFuture<Boolean> newest = connection.send(ClientMessage.close("sub-4"));
        assertEquals(2, connection.getQueuedCount());
        release.countDown();

        assertTrue(held.get(5, TimeUnit.SECONDS));
        assertTrue(second.get(5, TimeUnit.SECONDS));
        assertTrue(newest.get(5, TimeUnit.SECONDS));
        try {
            oldest.get(5, TimeUnit.SECONDS);
            fail("Expected the oldest queued message to be dropped");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof CapacityExceededException);
        }
        assertEquals(0, relay.count(ClientMessage.Type.CLOSE, "sub-2"));
        assertEquals(1, relay.count(ClientMessage.Type.CLOSE, "sub-4"));
        Await.until("overflow reported", () -> listener.overflows.contains(1L));
    }

    @Test
    public void testQueuedMessagesDiscardedWhenConnectionDrops() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, RelayOptions.builder().reconnect(false).build());
        connection.connect().get(5, TimeUnit.SECONDS);
        CountDownLatch dropped = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        // The failure callback is queued on the connection thread ahead of the next drain
        connection.sendIf(() -> {
            relay.drop();
            dropped.countDown();
            awaitQuietly(release);
            return false;
        }, ClientMessage.close("sub-1"));
        assertTrue(dropped.await(5, TimeUnit.SECONDS));
        CompletableFuture<Boolean> queued = connection.send(ClientMessage.close("sub-2"));
        release.countDown();

        assertFalse(queued.get(5, TimeUnit.SECONDS));
        assertEquals(0, relay.count(ClientMessage.Type.CLOSE, "sub-2"));
        assertEquals(0, connection.getQueuedCount());
    }

    @Test
    public void testInboundMessagesReachListener() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);

        relay.send(RelayMessage.notice("hello"));
        relay.send(RelayMessage.eose("sub-1"));

        Await.until("two messages", () -> listener.messages.size() == 2);
        assertEquals(RelayMessage.Type.NOTICE, listener.messages.get(0).getType());
        assertEquals(RelayMessage.Type.EOSE, listener.messages.get(1).getType());
        assertEquals(2, connection.getStats().getMessagesReceived());
    }

    @Test
    public void testMalformedMessageIsReportedAndConnectionSurvives() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);

        relay.sendRaw("[\"EVENT\",");
        relay.send(RelayMessage.notice("still here"));

        Await.until("notice after garbage", () -> listener.messages.size() == 1);
        assertEquals(1, listener.protocolErrors.size());
        assertTrue(connection.isConnected());
    }

    @Test
    public void testReconnectAfterDrop() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);

        relay.drop();

        Await.until("DISCONNECTED notification", () -> listener.statuses.contains(RelayStatus.DISCONNECTED));
        Await.until("second connection", () -> relay.getConnectionCount() == 2
                && connection.getStats().getSuccesses() == 2);
    }

    @Test
    public void testReconnectRetriesUntilRelayAcceptsAgain() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);

        relay.setRefuseConnections(true);
        relay.drop();
        Await.until("several failed attempts", () -> connection.getStats().getAttempts() >= 3);
        assertFalse(connection.isConnected());

        relay.setRefuseConnections(false);
        Await.until("connected again", connection::isConnected);
    }

    @Test
    public void testFailureWithoutReconnectFailsConnect() throws Exception {
        RelayConnection connection = connection("wss://nowhere.test",
                RelayOptions.builder().reconnect(false).build());

        try {
            connection.connect().get(5, TimeUnit.SECONDS);
            fail("Expected connect to fail");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof TransportException);
        }
        assertEquals(RelayStatus.DISCONNECTED, connection.getStatus());
    }

    @Test
    public void testRetryIntervalStretchedForFailingRelay() throws Exception {
        network.relay(URL).setRefuseConnections(true);
        network.relay("wss://other.test").setRefuseConnections(true);
        RelayOptions.Builder builder = RelayOptions.builder()
                .reconnectInterval(Duration.ofMillis(50))
                .maxReconnectInterval(Duration.ofSeconds(5))
                .jitter(false);
        RelayConnection adjusted = connection(URL, builder.build());
        RelayConnection fixed = connection("wss://other.test", builder.adjustRetryInterval(false).build());

        adjusted.connect();
        fixed.connect();

        // No success out of one attempt: the next retry waits ten times the base
        Await.until("fixed interval retries", () -> fixed.getStats().getAttempts() >= 3);
        assertEquals(1, adjusted.getStats().getAttempts());
        assertEquals(0, adjusted.getStats().getSuccesses());
    }

    @Test
    public void testReconnectCanBeEnabledOnLiveConnection() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, RelayOptions.builder()
                .reconnect(false)
                .reconnectInterval(Duration.ofMillis(20))
                .maxReconnectInterval(Duration.ofMillis(100))
                .jitter(false)
                .build());
        connection.connect().get(5, TimeUnit.SECONDS);

        relay.drop();
        Await.until("disconnected", () -> connection.getStatus() == RelayStatus.DISCONNECTED);
        Thread.sleep(100);
        assertEquals(1, relay.getConnectionCount());

        connection.updateReconnect(true);

        assertTrue(connection.isReconnect());
        Await.until("reconnected", () -> connection.isConnected() && relay.getConnectionCount() == 2);
    }

    @Test
    public void testDisablingReconnectCancelsPendingAttempt() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, RelayOptions.builder()
                .reconnectInterval(Duration.ofMillis(300))
                .maxReconnectInterval(Duration.ofMillis(300))
                .adjustRetryInterval(false)
                .jitter(false)
                .build());
        connection.connect().get(5, TimeUnit.SECONDS);

        relay.drop();
        Await.until("disconnected", () -> connection.getStatus() == RelayStatus.DISCONNECTED);
        connection.updateReconnect(false);
        Thread.sleep(500);

        assertEquals(RelayStatus.DISCONNECTED, connection.getStatus());
        assertEquals(1, relay.getConnectionCount());
    }

    @Test
    public void testReconnectIntervalUpdatedOnLiveConnection() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, RelayOptions.builder()
                .reconnectInterval(Duration.ofSeconds(20))
                .maxReconnectInterval(Duration.ofSeconds(30))
                .adjustRetryInterval(false)
                .jitter(false)
                .build());
        connection.connect().get(5, TimeUnit.SECONDS);
        assertFalse(connection.isAdjustRetryInterval());

        connection.updateReconnectInterval(Duration.ofMillis(20));
        relay.drop();

        assertEquals(Duration.ofMillis(20), connection.getReconnectInterval());
        Await.until("reconnected quickly", () -> relay.getConnectionCount() == 2 && connection.isConnected());
        try {
            connection.updateReconnectInterval(Duration.ZERO);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testTerminate() throws Exception {
        FakeRelay relay = network.relay(URL);
        RelayConnection connection = connection(URL, fastReconnect());
        connection.connect().get(5, TimeUnit.SECONDS);

        connection.terminate().get(5, TimeUnit.SECONDS);

        assertEquals(RelayStatus.TERMINATED, connection.getStatus());
        assertFalse(relay.isConnected());
        assertTrue(connection.awaitTermination(5, TimeUnit.SECONDS));
        assertFalse(connection.send(ClientMessage.close("x")).get(5, TimeUnit.SECONDS));
        try {
            connection.connect().get(5, TimeUnit.SECONDS);
            fail("Expected connect after terminate to fail");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testTerminateFailsPendingConnect() throws Exception {
        FakeRelay relay = network.relay(URL);
        relay.setRefuseConnections(true);
        RelayConnection connection = connection(URL, fastReconnect());

        CompletableFuture<Void> pending = connection.connect();
        connection.terminate();

        try {
            pending.get(5, TimeUnit.SECONDS);
            fail("Expected pending connect to fail");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    private static final class RecordingListener implements RelayConnectionListener {
        final List<RelayStatus> statuses = new CopyOnWriteArrayList<>();
        final List<RelayMessage> messages = new CopyOnWriteArrayList<>();
        final List<String> protocolErrors = new CopyOnWriteArrayList<>();
        final List<Long> overflows = new CopyOnWriteArrayList<>();

        @Override
        public void onStatusChanged(RelayConnection connection, RelayStatus previous, RelayStatus current,
                                    String reason) {
            statuses.add(current);
        }

        @Override
        public void onMessage(RelayConnection connection, RelayMessage message) {
            messages.add(message);
        }

        @Override
        public void onProtocolError(RelayConnection connection, String text, ProtocolException error) {
            protocolErrors.add(text);
        }

        @Override
        public void onOutboundOverflow(RelayConnection connection, long droppedTotal) {
            overflows.add(droppedTotal);
        }
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
