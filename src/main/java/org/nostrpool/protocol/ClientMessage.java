package org.nostrpool.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Message sent from client to relay (NIP-01 plus the NEG-* negentropy extension).
 */
public final class ClientMessage {

    /**
     * Client message types with their wire names.
     */
    public enum Type {
        EVENT("EVENT"),
        REQ("REQ"),
        CLOSE("CLOSE"),
        NEG_OPEN("NEG-OPEN"),
        NEG_MSG("NEG-MSG"),
        NEG_CLOSE("NEG-CLOSE");

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
    private final List<Filter> filters;
    private final String negentropyMessage;

    private ClientMessage(Type type, String subscriptionId, Event event,
                          List<Filter> filters, String negentropyMessage) {
        this.type = type;
        this.subscriptionId = subscriptionId;
        this.event = event;
        this.filters = filters != null
                ? Collections.unmodifiableList(new ArrayList<>(filters))
                : Collections.<Filter>emptyList();
        this.negentropyMessage = negentropyMessage;
    }

    /** ["EVENT", event] */
    public static ClientMessage event(Event event) {
        return new ClientMessage(Type.EVENT, null, event, null, null);
    }

    /** ["REQ", subscriptionId, filter...] */
    public static ClientMessage req(String subscriptionId, List<Filter> filters) {
        return new ClientMessage(Type.REQ, subscriptionId, null, filters, null);
    }

    /** ["CLOSE", subscriptionId] */
    public static ClientMessage close(String subscriptionId) {
        return new ClientMessage(Type.CLOSE, subscriptionId, null, null, null);
    }

    /** ["NEG-OPEN", subscriptionId, filter, initialMessageHex] */
    public static ClientMessage negOpen(String subscriptionId, Filter filter, String initialMessageHex) {
        return new ClientMessage(Type.NEG_OPEN, subscriptionId, null,
                Collections.singletonList(filter), initialMessageHex);
    }

    /** ["NEG-MSG", subscriptionId, messageHex] */
    public static ClientMessage negMsg(String subscriptionId, String messageHex) {
        return new ClientMessage(Type.NEG_MSG, subscriptionId, null, null, messageHex);
    }

    /** ["NEG-CLOSE", subscriptionId] */
    public static ClientMessage negClose(String subscriptionId) {
        return new ClientMessage(Type.NEG_CLOSE, subscriptionId, null, null, null);
    }

    public Type getType() { return type; }
    public String getSubscriptionId() { return subscriptionId; }
    public Event getEvent() { return event; }
    public List<Filter> getFilters() { return filters; }
    public String getNegentropyMessage() { return negentropyMessage; }

    @Override
    public String toString() {
        return "ClientMessage{" + type.getWireName() +
                (subscriptionId != null ? ", sub=" + subscriptionId : "") +
                (event != null ? ", event=" + event : "") +
                (!filters.isEmpty() ? ", filters=" + filters.size() : "") +
                '}';
    }
}
