package com.myorg.streamhub.contracts.core.envelope;

/**
 * Keys of the string map stored in {@link EventEnvelope#getTraceContext()}.
 *
 * <p>{@link #TRACEPARENT} is authoritative. The legacy keys are written by older
 * producers and are only consulted when {@code traceparent} is missing.
 */
public final class TraceCarrier {
    private TraceCarrier() {}

    public static final String TRACEPARENT = "traceparent";
    public static final String TRACESTATE = "tracestate";

    public static final String LEGACY_TRACE_ID = "traceId";
    public static final String LEGACY_SPAN_ID = "spanId";
    public static final String LEGACY_PARENT_SPAN_ID = "parentSpanId";
}
