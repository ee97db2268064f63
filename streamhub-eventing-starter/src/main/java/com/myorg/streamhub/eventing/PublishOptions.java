package com.myorg.streamhub.eventing;

import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class PublishOptions {
    String correlationId;
    String causationId;
    Map<String, Object> metadata;

    private static final PublishOptions NONE = PublishOptions.builder().build();

    public static PublishOptions none() {
        return NONE;
    }

    /**
     * Options for an event emitted while handling {@code cause}: same correlation chain,
     * causation pointing at the cause.
     */
    public static PublishOptions causedBy(EventEnvelope cause) {
        String correlation = cause.getCorrelationId() != null ? cause.getCorrelationId() : cause.getEventId();
        return PublishOptions.builder()
                .correlationId(correlation)
                .causationId(cause.getEventId())
                .build();
    }
}
