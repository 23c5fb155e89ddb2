package org.nostrpool.transport;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.nostrpool.errors.TransportException;
import org.nostrpool.relay.RelayUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket transports backed by OkHttp. All transports share one client and
 * therefore one connection pool and dispatcher.
 */
public class OkHttpTransportFactory implements RelayTransportFactory {

    private static final Logger logger = LoggerFactory.getLogger(OkHttpTransportFactory.class);

    /** default connect and write timeout */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** default WebSocket ping interval */
    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(30);

    private final OkHttpClient httpClient;

    public OkHttpTransportFactory() {
        this(DEFAULT_TIMEOUT, DEFAULT_PING_INTERVAL);
    }

    public OkHttpTransportFactory(Duration timeout, Duration pingInterval) {
        this(new OkHttpClient.Builder()
            .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(0, TimeUnit.SECONDS)  // No read timeout for WebSocket
            .writeTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .pingInterval(pingInterval.toMillis(), TimeUnit.MILLISECONDS)
            .build());
    }

    public OkHttpTransportFactory(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RelayTransport open(RelayUrl url, TransportListener listener) {
        Request request;
        try {
            request = new Request.Builder()
                .url(url.toString())
                .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Cannot build request for " + url, e);
        }
        logger.debug("Opening WebSocket to {}", url);
        WebSocket webSocket = httpClient.newWebSocket(request, new ListenerAdapter(url, listener));
        return new OkHttpTransport(webSocket);
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private static final class OkHttpTransport implements RelayTransport {
        private final WebSocket webSocket;

        OkHttpTransport(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public boolean send(String text) {
            return webSocket.send(text);
        }

        @Override
        public void close(int code, String reason) {
            webSocket.close(code, reason);
        }

        @Override
        public void cancel() {
            webSocket.cancel();
        }
    }

    private static final class ListenerAdapter extends WebSocketListener {
        private final RelayUrl url;
        private final TransportListener listener;

        ListenerAdapter(RelayUrl url, TransportListener listener) {
            this.url = url;
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            listener.onOpen();
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            listener.onMessage(text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            // Complete the close handshake started by the relay
            webSocket.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            listener.onClosed(code, reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            // EOF is how an abrupt relay shutdown surfaces
            if (t instanceof java.io.EOFException) {
                logger.debug("Relay closed connection unexpectedly: {}", url);
            }
            listener.onFailure(t);
        }
    }
}
