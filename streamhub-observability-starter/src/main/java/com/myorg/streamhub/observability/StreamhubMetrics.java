package com.myorg.streamhub.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class StreamhubMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAIL = "fail";
    public static final String OUTCOME_MALFORMED = "malformed";

    private final MeterRegistry registry;
    private final String serviceName;
    private final StreamhubObservabilityProperties props;

    // pre-created so /actuator/metrics/<name> exists before the first event
    private Counter cPublished;
    private Counter cPublishFail;
    private Counter cHandledSuccess;
    private Counter cHandledFail;
    private Counter cMalformed;
    private Counter cReclaimed;

    /** Call once on startup. */
    public void preRegisterBaseMeters() {
        cPublished      = Counter.builder("streamhub.event.published").tag("service", serviceName).register(registry);
        cPublishFail    = Counter.builder("streamhub.event.publish.fail").tag("service", serviceName).register(registry);
        cHandledSuccess = Counter.builder("streamhub.event.handled.success").tag("service", serviceName).register(registry);
        cHandledFail    = Counter.builder("streamhub.event.handled.fail").tag("service", serviceName).register(registry);
        cMalformed      = Counter.builder("streamhub.event.malformed").tag("service", serviceName).register(registry);
        cReclaimed      = Counter.builder("streamhub.event.reclaimed").tag("service", serviceName).register(registry);

        Timer.builder("streamhub.event.processing").tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String eventType, String outcome) {
        if (sample == null) return;

        Timer.Builder b = Timer.builder("streamhub.event.processing")
                .tag("service", serviceName);

        if (props.isTagOutcome() && outcome != null) b.tag("outcome", outcome);
        if (props.isTagEventType() && eventType != null) b.tag("eventType", eventType);

        sample.stop(b.register(registry));
    }

    public void incPublished()      { if (cPublished != null) cPublished.increment(); }
    public void incPublishFail()    { if (cPublishFail != null) cPublishFail.increment(); }
    public void incHandledSuccess() { if (cHandledSuccess != null) cHandledSuccess.increment(); }
    public void incHandledFail()    { if (cHandledFail != null) cHandledFail.increment(); }
    public void incMalformed()      { if (cMalformed != null) cMalformed.increment(); }
    public void incReclaimed(int n) { if (cReclaimed != null && n > 0) cReclaimed.increment(n); }
}
