package com.myorg.streamhub.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.streamhub.contracts.core.conventions.StreamFields;
import com.myorg.streamhub.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.eventing.broker.StreamBroker;
import com.myorg.streamhub.eventing.codec.EnvelopeCodec;
import com.myorg.streamhub.eventing.exception.PublishFailedException;
import com.myorg.streamhub.observability.MessagingAttributes;
import com.myorg.streamhub.observability.StreamhubMetrics;
import com.myorg.streamhub.observability.TraceBridge;
import io.opentelemetry.api.trace.SpanKind;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class DefaultEventPublisher implements EventPublisher {

    private final StreamBroker broker;
    private final StreamTopology topology;
    private final EnvelopeCodec codec;
    private final ObjectMapper mapper;
    private final TraceBridge traceBridge;
    private final StreamhubMetrics metrics; // nullable
    private final Clock clock;
    private final String source;
    private final String envelopeVersion;
    private final long maxLen;

    @Builder
    public DefaultEventPublisher(StreamBroker broker,
                                 StreamTopology topology,
                                 EnvelopeCodec codec,
                                 ObjectMapper mapper,
                                 TraceBridge traceBridge,
                                 StreamhubMetrics metrics,
                                 Clock clock,
                                 String source,
                                 String envelopeVersion,
                                 long maxLen) {
        this.broker = broker;
        this.topology = topology;
        this.codec = codec;
        this.mapper = mapper;
        this.traceBridge = traceBridge;
        this.metrics = metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.source = source;
        this.envelopeVersion = envelopeVersion == null ? EnvelopeBuilder.DEFAULT_VERSION : envelopeVersion;
        this.maxLen = maxLen;
    }

    @Override
    public String publish(String eventType, Object data, PublishOptions options) {
        String stream = topology.streamName(eventType);
        PublishOptions opts = options == null ? PublishOptions.none() : options;
        String eventId = EnvelopeBuilder.newEventId();

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(MessagingAttributes.SYSTEM, MessagingAttributes.SYSTEM_REDIS_STREAMS);
        attributes.put(MessagingAttributes.DESTINATION, stream);
        attributes.put(MessagingAttributes.OPERATION, MessagingAttributes.OPERATION_PUBLISH);
        attributes.put(MessagingAttributes.EVENT_TYPE, eventType);
        attributes.put(MessagingAttributes.EVENT_ID, eventId);

        try {
            String messageId = traceBridge.withSpan("publish " + eventType, SpanKind.PRODUCER, attributes, null, span -> {
                // the producer span is current here, so consumers become its children
                Map<String, String> carrier = traceBridge.inject(new LinkedHashMap<>());

                EventEnvelope env = EnvelopeBuilder.wrap(
                        mapper,
                        clock,
                        eventId,
                        eventType,
                        source,
                        envelopeVersion,
                        opts.getCorrelationId(),
                        opts.getCausationId(),
                        carrier,
                        opts.getMetadata(),
                        data
                );

                Map<String, String> fields = new LinkedHashMap<>();
                fields.put(StreamFields.DATA, codec.encode(env));
                return broker.append(stream, fields, maxLen);
            });

            if (metrics != null) metrics.incPublished();
            log.info("Event published eventType={} eventId={} stream={} messageId={}",
                    eventType, eventId, stream, messageId);
            return messageId;
        } catch (Exception e) {
            if (metrics != null) metrics.incPublishFail();
            log.error("Failed to publish eventType={} eventId={} stream={}", eventType, eventId, stream, e);
            throw new PublishFailedException(eventType, stream, e);
        }
    }

    @Override
    public void close() {
        broker.close();
    }
}
