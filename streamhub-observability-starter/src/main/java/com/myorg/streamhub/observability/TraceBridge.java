package com.myorg.streamhub.observability;

import com.myorg.streamhub.contracts.core.envelope.TraceCarrier;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceId;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Carries W3C trace context across the stream boundary and runs work inside spans.
 *
 * <p>Built from an {@link OpenTelemetry} instance owned by the host application; this class
 * never configures the SDK. Propagation always uses the W3C trace-context format, whatever
 * propagators the host registered.
 */
@Slf4j
public class TraceBridge {

    public static final String DEFAULT_INSTRUMENTATION_NAME = "com.myorg.streamhub";

    private static final TextMapSetter<Map<String, String>> SETTER = (carrier, key, value) -> {
        if (carrier != null) carrier.put(key, value);
    };

    private static final TextMapGetter<Map<String, String>> GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
            return carrier.keySet();
        }

        @Override
        public String get(Map<String, String> carrier, String key) {
            return carrier == null ? null : carrier.get(key);
        }
    };

    private final Tracer tracer;
    private final TextMapPropagator propagator;

    public TraceBridge(OpenTelemetry openTelemetry) {
        this(openTelemetry, DEFAULT_INSTRUMENTATION_NAME);
    }

    public TraceBridge(OpenTelemetry openTelemetry, String instrumentationName) {
        if (openTelemetry == null) {
            throw new IllegalArgumentException("openTelemetry must not be null");
        }
        this.tracer = openTelemetry.getTracer(instrumentationName);
        this.propagator = W3CTraceContextPropagator.getInstance();
    }

    /**
     * Starts (but does not activate) a span. A {@code null} parent means the current context.
     */
    public Span startSpan(String name, SpanKind kind, Map<String, String> attributes, Context parentContext) {
        SpanBuilder builder = tracer.spanBuilder(name)
                .setSpanKind(kind == null ? SpanKind.INTERNAL : kind)
                .setParent(parentContext == null ? Context.current() : parentContext);
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (v != null) builder.setAttribute(k, v);
            });
        }
        return builder.startSpan();
    }

    /**
     * Writes the current trace context into {@code carrier} and returns the same map.
     */
    public Map<String, String> inject(Map<String, String> carrier) {
        propagator.inject(Context.current(), carrier, SETTER);
        return carrier;
    }

    /**
     * Reads a parent context out of {@code carrier}.
     *
     * @return the remote parent, or {@link Context#root()} when the carrier holds nothing usable
     */
    public Context extract(Map<String, String> carrier) {
        if (carrier == null || carrier.isEmpty()) {
            return Context.root();
        }
        try {
            if (carrier.containsKey(TraceCarrier.TRACEPARENT)) {
                return propagator.extract(Context.root(), carrier, GETTER);
            }
            return fromLegacyIds(carrier);
        } catch (RuntimeException e) {
            log.debug("Ignoring unreadable trace carrier {}", carrier, e);
            return Context.root();
        }
    }

    public <T> T withSpan(String name, SpanKind kind, SpanWork<T> work) throws Exception {
        return withSpan(name, kind, Map.of(), null, work);
    }

    /**
     * Runs {@code work} with a new span as the current span.
     *
     * <p>Exceptions are recorded on the span and rethrown unchanged. The span is ended exactly
     * once on every exit path.
     */
    public <T> T withSpan(String name,
                          SpanKind kind,
                          Map<String, String> attributes,
                          Context parentContext,
                          SpanWork<T> work) throws Exception {
        Context parent = parentContext == null ? Context.current() : parentContext;
        Span span = startSpan(name, kind, attributes, parent);

        try (Scope ignored = parent.with(span).makeCurrent()) {
            T result = work.run(span);
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            markFailed(span, e);
            throw e;
        } catch (Error e) {
            markFailed(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void markFailed(Span span, Throwable e) {
        span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        span.recordException(e);
    }

    private static Context fromLegacyIds(Map<String, String> carrier) {
        String traceId = carrier.get(TraceCarrier.LEGACY_TRACE_ID);
        String spanId = carrier.get(TraceCarrier.LEGACY_SPAN_ID);
        if (traceId == null || spanId == null
                || !TraceId.isValid(traceId) || !SpanId.isValid(spanId)) {
            return Context.root();
        }
        SpanContext remote = SpanContext.createFromRemoteParent(
                traceId, spanId, TraceFlags.getSampled(), TraceState.getDefault());
        return Context.root().with(Span.wrap(remote));
    }
}
