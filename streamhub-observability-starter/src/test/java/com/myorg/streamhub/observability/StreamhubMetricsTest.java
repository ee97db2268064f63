package com.myorg.streamhub.observability;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamhubMetricsTest {

    private SimpleMeterRegistry registry;
    private StreamhubMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StreamhubMetrics(registry, "order-service", new StreamhubObservabilityProperties());
    }

    @Test
    void preRegistersCountersWithServiceTag() {
        metrics.preRegisterBaseMeters();

        assertThat(registry.find("streamhub.event.published").tag("service", "order-service").counter()).isNotNull();
        assertThat(registry.find("streamhub.event.handled.fail").counter()).isNotNull();
        assertThat(registry.find("streamhub.event.reclaimed").counter()).isNotNull();
        assertThat(registry.find("streamhub.event.processing").timer()).isNotNull();
    }

    @Test
    void incrementsAreNoOpsBeforeRegistration() {
        metrics.incPublished();

        assertThat(registry.find("streamhub.event.published").counter()).isNull();
    }

    @Test
    void countsAndTimesOutcomes() {
        metrics.preRegisterBaseMeters();

        metrics.incPublished();
        metrics.incPublished();
        metrics.incReclaimed(3);
        metrics.incReclaimed(0);
        Timer.Sample sample = metrics.startTimer();
        metrics.stopTimer(sample, "order.created", StreamhubMetrics.OUTCOME_SUCCESS);

        assertThat(registry.get("streamhub.event.published").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("streamhub.event.reclaimed").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("streamhub.event.processing")
                .tag("outcome", "success")
                .tag("eventType", "order.created")
                .timer().count()).isEqualTo(1);
    }
}
