package org.nostrpool.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.nostrpool.errors.ProtocolException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * NIP-01 JSON array codec backed by Jackson.
 * Besides the client-side direction required by {@link MessageCodec} it can also
 * decode client messages and encode relay messages, which is what a relay (or a
 * relay stand-in) needs.
 */
public class JsonMessageCodec implements MessageCodec {

    private final ObjectMapper jsonMapper;

    public JsonMessageCodec() {
        this(new ObjectMapper());
    }

    public JsonMessageCodec(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    @Override
    public String encode(ClientMessage message) {
        List<Object> json = new ArrayList<>();
        json.add(message.getType().getWireName());
        switch (message.getType()) {
            case EVENT:
                json.add(message.getEvent());
                break;
            case REQ:
                json.add(message.getSubscriptionId());
                json.addAll(message.getFilters());
                break;
            case NEG_OPEN:
                json.add(message.getSubscriptionId());
                json.add(message.getFilters().get(0));
                json.add(message.getNegentropyMessage());
                break;
            case NEG_MSG:
                json.add(message.getSubscriptionId());
                json.add(message.getNegentropyMessage());
                break;
            case CLOSE:
            case NEG_CLOSE:
                json.add(message.getSubscriptionId());
                break;
            default:
                throw new ProtocolException("Unsupported client message type: " + message.getType());
        }
        return write(json);
    }

    @Override
    public RelayMessage decode(String text) {
        ArrayNode json = readArray(text);
        String typeName = json.get(0).asText();
        RelayMessage.Type type = RelayMessage.Type.fromWireName(typeName);
        if (type == null) {
            throw new ProtocolException("Unknown relay message type: " + typeName);
        }

        switch (type) {
            case EVENT:
                requireSize(json, 3, typeName);
                return RelayMessage.event(text(json, 1), readEvent(json.get(2)));
            case OK:
                requireSize(json, 3, typeName);
                if (!json.get(2).isBoolean()) {
                    throw new ProtocolException("OK status must be a boolean");
                }
                return RelayMessage.ok(text(json, 1), json.get(2).asBoolean(), optionalText(json, 3));
            case EOSE:
                requireSize(json, 2, typeName);
                return RelayMessage.eose(text(json, 1));
            case CLOSED:
                requireSize(json, 2, typeName);
                return RelayMessage.closed(text(json, 1), optionalText(json, 2));
            case NOTICE:
                requireSize(json, 2, typeName);
                return RelayMessage.notice(text(json, 1));
            case NEG_MSG:
                requireSize(json, 3, typeName);
                return RelayMessage.negMsg(text(json, 1), text(json, 2));
            case NEG_ERR:
                requireSize(json, 3, typeName);
                return RelayMessage.negErr(text(json, 1), text(json, 2));
            case AUTH:
                requireSize(json, 2, typeName);
                return RelayMessage.auth(text(json, 1));
            default:
                throw new ProtocolException("Unsupported relay message type: " + typeName);
        }
    }

    /**
     * Decode a message sent by a client (relay-side direction).
     */
    public ClientMessage decodeClientMessage(String text) {
        ArrayNode json = readArray(text);
        String typeName = json.get(0).asText();
        ClientMessage.Type type = ClientMessage.Type.fromWireName(typeName);
        if (type == null) {
            throw new ProtocolException("Unknown client message type: " + typeName);
        }

        switch (type) {
            case EVENT:
                requireSize(json, 2, typeName);
                return ClientMessage.event(readEvent(json.get(1)));
            case REQ:
                requireSize(json, 3, typeName);
                List<Filter> filters = new ArrayList<>();
                for (int i = 2; i < json.size(); i++) {
                    filters.add(readFilter(json.get(i)));
                }
                return ClientMessage.req(text(json, 1), filters);
            case CLOSE:
                requireSize(json, 2, typeName);
                return ClientMessage.close(text(json, 1));
            case NEG_OPEN:
                requireSize(json, 4, typeName);
                return ClientMessage.negOpen(text(json, 1), readFilter(json.get(2)), text(json, 3));
            case NEG_MSG:
                requireSize(json, 3, typeName);
                return ClientMessage.negMsg(text(json, 1), text(json, 2));
            case NEG_CLOSE:
                requireSize(json, 2, typeName);
                return ClientMessage.negClose(text(json, 1));
            default:
                throw new ProtocolException("Unsupported client message type: " + typeName);
        }
    }

    /**
     * Encode a message as a relay would send it.
     */
    public String encodeRelayMessage(RelayMessage message) {
        String type = message.getType().getWireName();
        switch (message.getType()) {
            case EVENT:
                return write(Arrays.asList(type, message.getSubscriptionId(), message.getEvent()));
            case OK:
                return write(Arrays.asList(type, message.getEventId(), message.isAccepted(), message.getMessage()));
            case EOSE:
                return write(Arrays.asList(type, message.getSubscriptionId()));
            case CLOSED:
            case NEG_MSG:
            case NEG_ERR:
                return write(Arrays.asList(type, message.getSubscriptionId(), message.getMessage()));
            case NOTICE:
            case AUTH:
                return write(Arrays.asList(type, message.getMessage()));
            default:
                throw new ProtocolException("Unsupported relay message type: " + type);
        }
    }

    private String write(Object value) {
        try {
            return jsonMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode message", e);
        }
    }

    private ArrayNode readArray(String text) {
        JsonNode node;
        try {
            node = jsonMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON message", e);
        }
        if (node == null || !node.isArray() || node.size() == 0 || !node.get(0).isTextual()) {
            throw new ProtocolException("Message must be a JSON array starting with its type");
        }
        return (ArrayNode) node;
    }

    private Event readEvent(JsonNode node) {
        if (!node.isObject()) {
            throw new ProtocolException("Event must be a JSON object");
        }
        try {
            Event event = jsonMapper.treeToValue(node, Event.class);
            if (event.getId() == null) {
                throw new ProtocolException("Event without id");
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed event", e);
        }
    }

    private Filter readFilter(JsonNode node) {
        if (!node.isObject()) {
            throw new ProtocolException("Filter must be a JSON object");
        }
        try {
            return jsonMapper.treeToValue(node, Filter.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed filter", e);
        }
    }

    private static void requireSize(ArrayNode json, int size, String type) {
        if (json.size() < size) {
            throw new ProtocolException(type + " message needs at least " + size + " elements");
        }
    }

    private static String text(ArrayNode json, int index) {
        JsonNode node = json.get(index);
        if (!node.isTextual()) {
            throw new ProtocolException("Element " + index + " must be a string");
        }
        return node.asText();
    }

    private static String optionalText(ArrayNode json, int index) {
        return json.size() > index && json.get(index).isTextual() ? json.get(index).asText() : "";
    }
}
