package com.myorg.streamhub.eventing.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.contracts.core.exception.MalformedEnvelopeException;
import lombok.RequiredArgsConstructor;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@RequiredArgsConstructor
public class JacksonEnvelopeCodec implements EnvelopeCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Set<String> KNOWN_FIELDS = knownFields();

    private final ObjectMapper mapper;

    @Override
    public String encode(EventEnvelope env, FieldDialect dialect) {
        FieldDialect d = dialect == null ? FieldDialect.CAMEL_CASE : dialect;

        ObjectNode root = mapper.createObjectNode();
        putText(root, d.eventId(), env.getEventId());
        putText(root, d.eventType(), env.getEventType());
        putText(root, FieldDialect.TIMESTAMP, env.getTimestamp());
        putText(root, FieldDialect.SOURCE, env.getSource());
        putText(root, FieldDialect.VERSION, env.getVersion());
        putText(root, d.correlationId(), env.getCorrelationId());
        putText(root, d.causationId(), env.getCausationId());
        if (env.getTraceContext() != null) {
            root.set(d.traceContext(), mapper.valueToTree(env.getTraceContext()));
        }
        if (env.getMetadata() != null) {
            root.set(FieldDialect.METADATA, mapper.valueToTree(env.getMetadata()));
        }
        if (env.getData() != null) {
            root.set(FieldDialect.DATA, env.getData());
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize envelope eventId=" + env.getEventId(), e);
        }
    }

    @Override
    public EventEnvelope decode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedEnvelopeException("Envelope is empty");
        }

        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Envelope is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Envelope is not a JSON object");
        }

        String eventId = text(root, FieldDialect.CAMEL_CASE.eventId(), FieldDialect.SNAKE_CASE.eventId());
        String eventType = text(root, FieldDialect.CAMEL_CASE.eventType(), FieldDialect.SNAKE_CASE.eventType());
        if (eventId == null || eventId.isBlank()) {
            throw new MalformedEnvelopeException("Envelope has no eventId");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new MalformedEnvelopeException("Envelope has no eventType, eventId=" + eventId);
        }

        JsonNode data = root.get(FieldDialect.DATA);

        return EventEnvelope.builder()
                .eventId(eventId)
                .eventType(eventType)
                .timestamp(text(root, FieldDialect.TIMESTAMP, null))
                .source(text(root, FieldDialect.SOURCE, null))
                .version(text(root, FieldDialect.VERSION, null))
                .correlationId(text(root, FieldDialect.CAMEL_CASE.correlationId(), FieldDialect.SNAKE_CASE.correlationId()))
                .causationId(text(root, FieldDialect.CAMEL_CASE.causationId(), FieldDialect.SNAKE_CASE.causationId()))
                .traceContext(traceContext(root))
                .metadata(metadata(root))
                .data(data == null || data.isNull() ? null : data)
                .build();
    }

    private static void putText(ObjectNode node, String field, String value) {
        if (value != null) node.put(field, value);
    }

    // first dialect wins when both are present
    private static String text(JsonNode root, String camel, String snake) {
        String v = scalar(root.get(camel));
        if (v == null && snake != null) v = scalar(root.get(snake));
        return v;
    }

    private static String scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        return node.asText();
    }

    private static JsonNode either(JsonNode root, String camel, String snake) {
        JsonNode n = root.get(camel);
        return (n == null || n.isNull()) ? root.get(snake) : n;
    }

    private static Map<String, String> traceContext(JsonNode root) {
        JsonNode tc = either(root, FieldDialect.CAMEL_CASE.traceContext(), FieldDialect.SNAKE_CASE.traceContext());
        if (tc == null || !tc.isObject()) return null;

        Map<String, String> out = new LinkedHashMap<>();
        tc.fields().forEachRemaining(e -> {
            if (e.getValue().isTextual()) out.put(e.getKey(), e.getValue().asText());
        });
        return out;
    }

    private Map<String, Object> metadata(JsonNode root) {
        JsonNode md = root.get(FieldDialect.METADATA);
        if (md == null || !md.isObject()) return null;

        Map<String, Object> out = mapper.convertValue(md, MAP_TYPE);
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!KNOWN_FIELDS.contains(e.getKey())) {
                out.putIfAbsent(e.getKey(), mapper.convertValue(e.getValue(), Object.class));
            }
        }
        return out;
    }

    private static Set<String> knownFields() {
        Set<String> names = new HashSet<>();
        for (FieldDialect d : FieldDialect.values()) {
            names.add(d.eventId());
            names.add(d.eventType());
            names.add(d.correlationId());
            names.add(d.causationId());
            names.add(d.traceContext());
        }
        names.add(FieldDialect.TIMESTAMP);
        names.add(FieldDialect.SOURCE);
        names.add(FieldDialect.VERSION);
        names.add(FieldDialect.METADATA);
        names.add(FieldDialect.DATA);
        return Set.copyOf(names);
    }
}
