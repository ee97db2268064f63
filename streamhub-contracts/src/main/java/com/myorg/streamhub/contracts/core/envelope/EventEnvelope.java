package com.myorg.streamhub.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical wrapper for every event that travels over a stream.
 *
 * <p>Immutable: maps are copied on construction and exposed read-only, nested
 * metadata maps and lists included. {@code data} is opaque to the messaging layer
 * and is never validated; {@link #getData()} hands out a copy of it.
 */
@Value
public class EventEnvelope {
    String eventId;          // UUID
    String eventType;        // e.g. "order.created"
    String timestamp;        // ISO-8601 UTC, producer clock
    String source;           // producing service
    String version;          // envelope schema version, e.g. "1.0.0"

    String correlationId;    // shared by a causal chain of events (optional)
    String causationId;      // eventId of the causing event (optional)

    Map<String, String> traceContext; // W3C carrier, see TraceCarrier (optional)
    Map<String, Object> metadata;     // producer-defined side information (optional)

    JsonNode data;

    @Builder(toBuilder = true)
    public EventEnvelope(String eventId,
                         String eventType,
                         String timestamp,
                         String source,
                         String version,
                         String correlationId,
                         String causationId,
                         Map<String, String> traceContext,
                         Map<String, Object> metadata,
                         JsonNode data) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.timestamp = timestamp;
        this.source = source;
        this.version = version;
        this.correlationId = correlationId;
        this.causationId = causationId;
        this.traceContext = copyOf(traceContext);
        this.metadata = metadata == null ? null : deepCopyOf(metadata);
        this.data = data == null ? null : data.deepCopy();
    }

    public JsonNode getData() {
        return data == null ? null : data.deepCopy();
    }

    private static <V> Map<String, V> copyOf(Map<String, V> source) {
        if (source == null) return null;
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static Map<String, Object> deepCopyOf(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), deepCopyValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) return deepCopyOf(map);
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(item -> copy.add(deepCopyValue(item)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof JsonNode node) return node.deepCopy();
        return value;
    }
}
