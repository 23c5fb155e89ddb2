package org.nostrpool.transport;

import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostrpool.relay.RelayUrl;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * Tests for the OkHttp WebSocket transport against a local server.
 */
public class OkHttpTransportFactoryTest {

    private MockWebServer server;
    private OkHttpTransportFactory factory;

    @Before
    public void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        factory = new OkHttpTransportFactory();
    }

    @After
    public void tearDown() throws Exception {
        factory.close();
        server.shutdown();
    }

    private RelayUrl serverUrl() {
        return RelayUrl.parse("ws://" + server.getHostName() + ":" + server.getPort());
    }

    @Test
    public void testMessagesFlowBothWays() throws Exception {
        BlockingQueue<String> serverReceived = new LinkedBlockingQueue<>();
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.send("[\"NOTICE\",\"welcome\"]");
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                serverReceived.add(text);
            }
        }));
        RecordingListener listener = new RecordingListener();

        RelayTransport transport = factory.open(serverUrl(), listener);

        assertTrue(listener.opened.await(5, TimeUnit.SECONDS));
        assertEquals("[\"NOTICE\",\"welcome\"]", listener.messages.poll(5, TimeUnit.SECONDS));
        assertTrue(transport.send("[\"CLOSE\",\"sub-1\"]"));
        assertEquals("[\"CLOSE\",\"sub-1\"]", serverReceived.poll(5, TimeUnit.SECONDS));

        transport.close(1000, "done");
    }

    @Test
    public void testServerCloseIsReported() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.close(1001, "going away");
            }
        }));
        RecordingListener listener = new RecordingListener();

        factory.open(serverUrl(), listener);

        assertTrue(listener.finished.await(5, TimeUnit.SECONDS));
        assertEquals(Integer.valueOf(1001), listener.closeCode);
        assertNull(listener.failure);
    }

    @Test
    public void testRejectedUpgradeIsFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        RecordingListener listener = new RecordingListener();

        factory.open(serverUrl(), listener);

        assertTrue(listener.finished.await(5, TimeUnit.SECONDS));
        assertNotNull(listener.failure);
        assertEquals(1, listener.opened.getCount());
    }

    private static final class RecordingListener implements TransportListener {
        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch finished = new CountDownLatch(1);
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        volatile Integer closeCode;
        volatile Throwable failure;

        @Override
        public void onOpen() {
            opened.countDown();
        }

        @Override
        public void onMessage(String text) {
            messages.add(text);
        }

        @Override
        public void onClosed(int code, String reason) {
            closeCode = code;
            finished.countDown();
        }

        @Override
        public void onFailure(Throwable error) {
            failure = error;
            finished.countDown();
        }
    }
}
