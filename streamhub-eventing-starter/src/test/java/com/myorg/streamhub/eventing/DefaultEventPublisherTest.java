package com.myorg.streamhub.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.streamhub.contracts.core.conventions.StreamFields;
import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.contracts.core.envelope.TraceCarrier;
import com.myorg.streamhub.contracts.core.exception.InvalidEventTypeException;
import com.myorg.streamhub.eventing.broker.InMemoryStreams;
import com.myorg.streamhub.eventing.broker.StreamEntry;
import com.myorg.streamhub.eventing.codec.JacksonEnvelopeCodec;
import com.myorg.streamhub.eventing.exception.PublishFailedException;
import com.myorg.streamhub.observability.StreamhubMetrics;
import com.myorg.streamhub.observability.StreamhubObservabilityProperties;
import com.myorg.streamhub.observability.TraceBridge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultEventPublisherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec(mapper);
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private InMemoryStreams streams;
    private InMemorySpanExporter spanExporter;
    private SimpleMeterRegistry registry;
    private DefaultEventPublisher publisher;

    record OrderCreated(String orderId, int quantity) {}

    @BeforeEach
    void setUp() {
        streams = new InMemoryStreams();
        spanExporter = InMemorySpanExporter.create();
        OpenTelemetrySdk otel = OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                        .build())
                .build();
        registry = new SimpleMeterRegistry();
        StreamhubMetrics metrics = new StreamhubMetrics(registry, "order-service", new StreamhubObservabilityProperties());
        metrics.preRegisterBaseMeters();

        publisher = publisherWithMaxLen(otel, metrics, 10_000);
    }

    private DefaultEventPublisher publisherWithMaxLen(OpenTelemetrySdk otel, StreamhubMetrics metrics, long maxLen) {
        return DefaultEventPublisher.builder()
                .broker(streams.open("order-service-publisher"))
                .topology(new StreamTopology("events", "order-service"))
                .codec(codec)
                .mapper(mapper)
                .traceBridge(new TraceBridge(otel))
                .metrics(metrics)
                .clock(clock)
                .source("order-service")
                .envelopeVersion("1.0.0")
                .maxLen(maxLen)
                .build();
    }

    private EventEnvelope onlyEnvelope(String stream) {
        List<StreamEntry> entries = streams.entries(stream);
        assertThat(entries).hasSize(1);
        return codec.decode(entries.get(0).fields().get(StreamFields.DATA));
    }

    @Test
    void appendsEnvelopeToDomainStream() {
        String messageId = publisher.publish("order.created", new OrderCreated("o-1", 2));

        assertThat(messageId).isNotBlank();
        assertThat(streams.entries("events:orders").get(0).id()).isEqualTo(messageId);

        EventEnvelope env = onlyEnvelope("events:orders");
        assertThat(env.getEventType()).isEqualTo("order.created");
        assertThat(env.getSource()).isEqualTo("order-service");
        assertThat(env.getVersion()).isEqualTo("1.0.0");
        assertThat(env.getTimestamp()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(env.getData().get("orderId").asText()).isEqualTo("o-1");
        assertThat(env.getData().get("quantity").asInt()).isEqualTo(2);
        assertThat(registry.get("streamhub.event.published").counter().count()).isEqualTo(1.0);
    }

    @Test
    void carriesProducerSpanInTraceContext() {
        publisher.publish("order.created", new OrderCreated("o-1", 1));

        EventEnvelope env = onlyEnvelope("events:orders");
        SpanData producer = spanExporter.getFinishedSpanItems().get(0);

        assertThat(producer.getName()).isEqualTo("publish order.created");
        assertThat(producer.getKind()).isEqualTo(SpanKind.PRODUCER);
        assertThat(producer.getAttributes().get(AttributeKey.stringKey("messaging.system"))).isEqualTo("redis_streams");
        assertThat(producer.getAttributes().get(AttributeKey.stringKey("messaging.destination"))).isEqualTo("events:orders");
        assertThat(producer.getAttributes().get(AttributeKey.stringKey("event.id"))).isEqualTo(env.getEventId());
        assertThat(env.getTraceContext().get(TraceCarrier.TRACEPARENT))
                .contains(producer.getTraceId())
                .contains(producer.getSpanId());
    }

    @Test
    void appliesPublishOptions() {
        publisher.publish("order.created", new OrderCreated("o-1", 1), PublishOptions.builder()
                .correlationId("c-1")
                .causationId("e-0")
                .metadata(Map.of("tenant", "acme"))
                .build());

        EventEnvelope env = onlyEnvelope("events:orders");
        assertThat(env.getCorrelationId()).isEqualTo("c-1");
        assertThat(env.getCausationId()).isEqualTo("e-0");
        assertThat(env.getMetadata()).containsEntry("tenant", "acme");
    }

    @Test
    void causedByChainsCorrelationAndCausation() {
        EventEnvelope cause = EventEnvelope.builder().eventId("e-1").eventType("order.created").build();

        PublishOptions first = PublishOptions.causedBy(cause);
        PublishOptions second = PublishOptions.causedBy(cause.toBuilder().correlationId("c-root").build());

        assertThat(first.getCorrelationId()).isEqualTo("e-1");
        assertThat(first.getCausationId()).isEqualTo("e-1");
        assertThat(second.getCorrelationId()).isEqualTo("c-root");
    }

    @Test
    void rejectsInvalidTypeBeforeAnyIo() {
        assertThatThrownBy(() -> publisher.publish("ordercreated", new OrderCreated("o-1", 1)))
                .isInstanceOf(InvalidEventTypeException.class);

        assertThat(streams.length("events:ordercreateds")).isZero();
        assertThat(spanExporter.getFinishedSpanItems()).isEmpty();
    }

    @Test
    void wrapsBrokerFailure() {
        streams.failNextAppends(1);

        assertThatThrownBy(() -> publisher.publish("order.created", new OrderCreated("o-1", 1)))
                .isInstanceOf(PublishFailedException.class)
                .hasRootCauseMessage("Connection refused")
                .satisfies(e -> {
                    PublishFailedException pfe = (PublishFailedException) e;
                    assertThat(pfe.getEventType()).isEqualTo("order.created");
                    assertThat(pfe.getStream()).isEqualTo("events:orders");
                });

        assertThat(registry.get("streamhub.event.publish.fail").counter().count()).isEqualTo(1.0);
        assertThat(spanExporter.getFinishedSpanItems().get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    }

    @Test
    void wrapsSerializationFailure() {
        Object unserializable = new Object() {
            public Object getSelf() {
                return this;
            }
        };

        assertThatThrownBy(() -> publisher.publish("order.created", unserializable))
                .isInstanceOf(PublishFailedException.class);
        assertThat(streams.length("events:orders")).isZero();
    }

    @Test
    void trimsStreamApproximatelyToMaxLen() {
        OpenTelemetrySdk otel = OpenTelemetrySdk.builder().build();
        DefaultEventPublisher bounded = publisherWithMaxLen(otel, null, 5);

        for (int i = 0; i < 8; i++) {
            bounded.publish("order.created", new OrderCreated("o-" + i, i));
        }

        assertThat(streams.length("events:orders")).isEqualTo(5);
    }

    @Test
    void closeReleasesConnection() {
        publisher.close();

        assertThat(streams.allConnectionsClosed()).isTrue();
    }
}
