package org.nostrpool.relay;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one relay connection. Safe to read from any thread.
 */
public class RelayStats {

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private volatile Instant connectedAt;

    void recordAttempt() {
        attempts.incrementAndGet();
    }

    void recordSuccess(Instant now) {
        successes.incrementAndGet();
        connectedAt = now;
    }

    void recordSent() {
        messagesSent.incrementAndGet();
    }

    void recordReceived(String text) {
        messagesReceived.incrementAndGet();
        bytesReceived.addAndGet(text.length());
    }

    /** Transport opens started. */
    public long getAttempts() { return attempts.get(); }

    /** Transport opens that reached CONNECTED. */
    public long getSuccesses() { return successes.get(); }

    public long getMessagesSent() { return messagesSent.get(); }

    public long getMessagesReceived() { return messagesReceived.get(); }

    /** Characters of inbound text, a proxy for bytes on the wire. */
    public long getBytesReceived() { return bytesReceived.get(); }

    /** Time of the last CONNECTED transition, or null if never connected. */
    public Instant getConnectedAt() { return connectedAt; }

    @Override
    public String toString() {
        return "RelayStats{" +
                "attempts=" + attempts +
                ", successes=" + successes +
                ", sent=" + messagesSent +
                ", received=" + messagesReceived +
                '}';
    }
}
