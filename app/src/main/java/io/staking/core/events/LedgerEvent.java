package io.staking.core.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A structured event emitted by a ledger operation. Field names use the
 * hyphenated form consumed by the indexer ({@code pool-id}, {@code net-amount}, ...).
 * Values are {@code Long}, {@code Boolean} or {@code String}.
 */
public final class LedgerEvent {

    private final String type;
    private final Map<String, Object> fields;

    public LedgerEvent(String type, Map<String, Object> fields) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type required");
        }
        this.type = type;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    }

    public String type() { return type; }
    public Map<String, Object> fields() { return fields; }

    public Object get(String field) {
        return fields.get(field);
    }

    public long getLong(String field) {
        Object value = fields.get(field);
        if (!(value instanceof Long l)) {
            throw new IllegalArgumentException("Field '" + field + "' of " + type + " is not numeric: " + value);
        }
        return l;
    }

    public boolean getBoolean(String field) {
        Object value = fields.get(field);
        if (!(value instanceof Boolean b)) {
            throw new IllegalArgumentException("Field '" + field + "' of " + type + " is not boolean: " + value);
        }
        return b;
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerEvent other)) return false;
        return type.equals(other.type) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, fields);
    }

    @Override
    public String toString() {
        return type + fields;
    }
}
