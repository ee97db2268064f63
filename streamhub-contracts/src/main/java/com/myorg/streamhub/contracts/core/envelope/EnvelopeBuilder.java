package com.myorg.streamhub.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

@UtilityClass
public class EnvelopeBuilder {

    public static final String DEFAULT_VERSION = "1.0.0";

    public static String newEventId() {
        return UUID.randomUUID().toString();
    }

    // every event gets the same metadata shape, whatever the payload
    public static EventEnvelope wrap(ObjectMapper mapper,
                                     Clock clock,
                                     String eventId,
                                     String eventType,
                                     String source,
                                     String version,
                                     String correlationId,
                                     String causationId,
                                     Map<String, String> traceContext,
                                     Map<String, Object> metadata,
                                     Object payloadObj) {
        return EventEnvelope.builder()
                .eventId(eventId == null ? newEventId() : eventId)
                .eventType(eventType)
                .timestamp(clock.instant().toString())
                .source(source)
                .version(version == null ? DEFAULT_VERSION : version)
                .correlationId(correlationId)
                .causationId(causationId)
                .traceContext(traceContext == null || traceContext.isEmpty() ? null : traceContext)
                .metadata(metadata == null || metadata.isEmpty() ? null : metadata)
                .data(mapper.valueToTree(payloadObj))
                .build();
    }
}
