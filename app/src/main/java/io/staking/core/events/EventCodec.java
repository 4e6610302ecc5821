package io.staking.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of a {@link LedgerEvent}: a flat object whose {@code event} member
 * names the type, followed by the event's own fields in emission order.
 */
public final class EventCodec {
    private EventCodec() {}

    public static final String TYPE_FIELD = "event";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static ObjectNode toJson(LedgerEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(TYPE_FIELD, event.type());
        for (Map.Entry<String, Object> e : event.fields().entrySet()) {
            Object v = e.getValue();
            if (v instanceof Long l) {
                node.put(e.getKey(), l);
            } else if (v instanceof Boolean b) {
                node.put(e.getKey(), b);
            } else if (v == null) {
                node.putNull(e.getKey());
            } else {
                node.put(e.getKey(), v.toString());
            }
        }
        return node;
    }

    public static byte[] toBytes(LedgerEvent event) {
        try {
            return MAPPER.writeValueAsBytes(toJson(event));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + event.type(), e);
        }
    }

    public static LedgerEvent fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Event must be a JSON object");
        }
        JsonNode type = node.get(TYPE_FIELD);
        if (type == null || !type.isTextual()) {
            throw new IllegalArgumentException("Missing '" + TYPE_FIELD + "' member");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (TYPE_FIELD.equals(e.getKey())) {
                continue;
            }
            JsonNode v = e.getValue();
            if (v.isIntegralNumber()) {
                fields.put(e.getKey(), v.asLong());
            } else if (v.isBoolean()) {
                fields.put(e.getKey(), v.asBoolean());
            } else if (v.isNull()) {
                fields.put(e.getKey(), null);
            } else {
                fields.put(e.getKey(), v.asText());
            }
        }
        return new LedgerEvent(type.asText(), fields);
    }

    public static LedgerEvent fromBytes(byte[] bytes) {
        try {
            return fromJson(MAPPER.readTree(bytes));
        } catch (IOException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed event bytes", ex);
        }
    }
}
