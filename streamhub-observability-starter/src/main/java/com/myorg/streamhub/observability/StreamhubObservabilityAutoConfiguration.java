package com.myorg.streamhub.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.opentelemetry.OpenTelemetryAutoConfiguration"
})
@ConditionalOnClass(OpenTelemetry.class)
@EnableConfigurationProperties(StreamhubObservabilityProperties.class)
public class StreamhubObservabilityAutoConfiguration {

    /**
     * The host owns the SDK. Without an {@link OpenTelemetry} bean spans are no-ops and
     * published envelopes carry no trace context.
     */
    @Bean
    @ConditionalOnMissingBean
    public TraceBridge traceBridge(ObjectProvider<OpenTelemetry> openTelemetryProvider,
                                   StreamhubObservabilityProperties props) {
        if (!props.isEnabled() || !props.isTracingEnabled()) {
            return new TraceBridge(OpenTelemetry.noop(), props.getInstrumentationName());
        }
        OpenTelemetry otel = openTelemetryProvider.getIfAvailable();
        if (otel == null) {
            log.warn("No OpenTelemetry bean found; streamhub spans are no-ops");
            otel = OpenTelemetry.noop();
        }
        return new TraceBridge(otel, props.getInstrumentationName());
    }

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean
    public StreamhubMetrics streamhubMetrics(MeterRegistry registry, Environment env, StreamhubObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new StreamhubMetrics(registry, app, props);
    }

    /**
     * Pre-register meters at startup so /actuator/metrics/<name> never returns 404.
     */
    @Bean
    public SmartLifecycle streamhubMetricsPreRegisterLifecycle(
            StreamhubObservabilityProperties props,
            ObjectProvider<StreamhubMetrics> metricsProvider
    ) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                if (!props.isEnabled() || !props.isMetricsEnabled()) {
                    running = true;
                    return;
                }
                StreamhubMetrics m = metricsProvider.getIfAvailable();
                if (m != null) m.preRegisterBaseMeters();
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; } // start very early
        };
    }
}
