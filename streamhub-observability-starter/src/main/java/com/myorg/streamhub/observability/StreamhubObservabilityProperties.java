package com.myorg.streamhub.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "streamhub.observability")
public class StreamhubObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;
    private boolean tracingEnabled = true;

    // instrumentation scope name of the tracer
    private String instrumentationName = TraceBridge.DEFAULT_INSTRUMENTATION_NAME;

    // low-cardinality tags only; eventId is never a tag
    private boolean tagEventType = true;
    private boolean tagOutcome = true;
}
