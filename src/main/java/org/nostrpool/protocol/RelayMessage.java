package org.nostrpool.protocol;

/**
 * Message received from a relay.
 */
public final class RelayMessage {

    /**
     * Relay message types with their wire names.
     */
    public enum Type {
        EVENT("EVENT"),
        OK("OK"),
        EOSE("EOSE"),
        CLOSED("CLOSED"),
        NOTICE("NOTICE"),
        NEG_MSG("NEG-MSG"),
        NEG_ERR("NEG-ERR"),
        AUTH("AUTH");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        public static Type fromWireName(String wireName) {
            for (Type type : values()) {
                if (type.wireName.equals(wireName)) {
                    return type;
                }
            }
            return null;
        }
    }

    private final Type type;
    private final String subscriptionId;
    private final Event event;
    private final String eventId;
    private final boolean accepted;
    private final String message;

    private RelayMessage(Type type, String subscriptionId, Event event,
                         String eventId, boolean accepted, String message) {
        this.type = type;
        this.subscriptionId = subscriptionId;
        this.event = event;
        this.eventId = eventId;
        this.accepted = accepted;
        this.message = message != null ? message : "";
    }

    /** ["EVENT", subscriptionId, event] */
    public static RelayMessage event(String subscriptionId, Event event) {
        return new RelayMessage(Type.EVENT, subscriptionId, event, null, false, null);
    }

    /** ["OK", eventId, accepted, message] */
    public static RelayMessage ok(String eventId, boolean accepted, String message) {
        return new RelayMessage(Type.OK, null, null, eventId, accepted, message);
    }

    /** ["EOSE", subscriptionId] */
    public static RelayMessage eose(String subscriptionId) {
        return new RelayMessage(Type.EOSE, subscriptionId, null, null, false, null);
    }

    /** ["CLOSED", subscriptionId, message] */
    public static RelayMessage closed(String subscriptionId, String message) {
        return new RelayMessage(Type.CLOSED, subscriptionId, null, null, false, message);
    }

    /** ["NOTICE", message] */
    public static RelayMessage notice(String message) {
        return new RelayMessage(Type.NOTICE, null, null, null, false, message);
    }

    /** ["NEG-MSG", subscriptionId, messageHex] */
    public static RelayMessage negMsg(String subscriptionId, String messageHex) {
        return new RelayMessage(Type.NEG_MSG, subscriptionId, null, null, false, messageHex);
    }

    /** ["NEG-ERR", subscriptionId, reason] */
    public static RelayMessage negErr(String subscriptionId, String reason) {
        return new RelayMessage(Type.NEG_ERR, subscriptionId, null, null, false, reason);
    }

    /** ["AUTH", challenge] */
    public static RelayMessage auth(String challenge) {
        return new RelayMessage(Type.AUTH, null, null, null, false, challenge);
    }

    public Type getType() { return type; }
    public String getSubscriptionId() { return subscriptionId; }
    public Event getEvent() { return event; }
    public String getEventId() { return eventId; }
    public boolean isAccepted() { return accepted; }

    /**
     * Human-readable message (OK, CLOSED, NOTICE, NEG-ERR, AUTH challenge)
     * or the hex payload of a NEG-MSG.
     */
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "RelayMessage{" + type.getWireName() +
                (subscriptionId != null ? ", sub=" + subscriptionId : "") +
                (eventId != null ? ", eventId=" + eventId + ", accepted=" + accepted : "") +
                (event != null ? ", event=" + event : "") +
                (!message.isEmpty() ? ", message=" + message : "") +
                '}';
    }
}
