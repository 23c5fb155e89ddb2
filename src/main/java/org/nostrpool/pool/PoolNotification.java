package org.nostrpool.pool;

import org.nostrpool.relay.RelayStatus;
import org.nostrpool.relay.RelayUrl;

/**
 * Something the pool observed outside the event stream: status changes,
 * relay notices, protocol errors, rejected subscriptions, lagging consumers,
 * full outbound queues and aborted reconciliations.
 */
public final class PoolNotification {

    public enum Type {
        RELAY_STATUS_CHANGED,
        RELAY_NOTICE,
        PROTOCOL_ERROR,
        SUBSCRIPTION_REJECTED,
        CONSUMER_LAGGED,
        CONSUMER_DISCONNECTED,
        OUTBOUND_OVERFLOW,
        RECONCILIATION_ABORTED
    }

    private final Type type;
    private final RelayUrl relayUrl;
    private final RelayStatus previousStatus;
    private final RelayStatus status;
    private final String subscriptionId;
    private final String message;
    private final long dropped;

    private PoolNotification(Type type, RelayUrl relayUrl, RelayStatus previousStatus, RelayStatus status,
                             String subscriptionId, String message, long dropped) {
        this.type = type;
        this.relayUrl = relayUrl;
        this.previousStatus = previousStatus;
        this.status = status;
        this.subscriptionId = subscriptionId;
        this.message = message != null ? message : "";
        this.dropped = dropped;
    }

    public static PoolNotification relayStatusChanged(RelayUrl url, RelayStatus previous, RelayStatus current,
                                                      String reason) {
        return new PoolNotification(Type.RELAY_STATUS_CHANGED, url, previous, current, null, reason, 0);
    }

    public static PoolNotification relayNotice(RelayUrl url, String message) {
        return new PoolNotification(Type.RELAY_NOTICE, url, null, null, null, message, 0);
    }

    public static PoolNotification protocolError(RelayUrl url, String message) {
        return new PoolNotification(Type.PROTOCOL_ERROR, url, null, null, null, message, 0);
    }

    public static PoolNotification subscriptionRejected(RelayUrl url, String subscriptionId, String reason) {
        return new PoolNotification(Type.SUBSCRIPTION_REJECTED, url, null, null, subscriptionId, reason, 0);
    }

    public static PoolNotification consumerLagged(long dropped) {
        return new PoolNotification(Type.CONSUMER_LAGGED, null, null, null, null,
                "Event consumer lagged, " + dropped + " events dropped", dropped);
    }

    public static PoolNotification consumerDisconnected(long dropped) {
        return new PoolNotification(Type.CONSUMER_DISCONNECTED, null, null, null, null,
                "Event consumer disconnected after falling behind", dropped);
    }

    public static PoolNotification notificationConsumerLagged(long dropped) {
        return new PoolNotification(Type.CONSUMER_LAGGED, null, null, null, null,
                "Notification consumer lagged, " + dropped + " notifications dropped", dropped);
    }

    public static PoolNotification notificationConsumerDisconnected(long dropped) {
        return new PoolNotification(Type.CONSUMER_DISCONNECTED, null, null, null, null,
                "Notification consumer disconnected after falling behind", dropped);
    }

    public static PoolNotification outboundOverflow(RelayUrl url, long dropped) {
        return new PoolNotification(Type.OUTBOUND_OVERFLOW, url, null, null, null,
                "Outbound queue full, " + dropped + " messages dropped", dropped);
    }

    public static PoolNotification reconciliationAborted(RelayUrl url, String sessionId, String reason) {
        return new PoolNotification(Type.RECONCILIATION_ABORTED, url, null, null, sessionId, reason, 0);
    }

    public Type getType() { return type; }

    /** Relay concerned, or null for consumer notifications. */
    public RelayUrl getRelayUrl() { return relayUrl; }

    public RelayStatus getPreviousStatus() { return previousStatus; }
    public RelayStatus getStatus() { return status; }
    public String getSubscriptionId() { return subscriptionId; }
    public String getMessage() { return message; }

    /** Total items the consumer, or the relay's outbound queue, has lost so far. */
    public long getDropped() { return dropped; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PoolNotification{").append(type);
        if (relayUrl != null) {
            sb.append(", relay=").append(relayUrl);
        }
        if (status != null) {
            sb.append(", ").append(previousStatus).append(" -> ").append(status);
        }
        if (subscriptionId != null) {
            sb.append(", subscription=").append(subscriptionId);
        }
        if (!message.isEmpty()) {
            sb.append(", message='").append(message).append('\'');
        }
        return sb.append('}').toString();
    }
}
