package com.myorg.streamhub.observability;

import io.opentelemetry.api.trace.Span;

/**
 * Unit of work run by {@link TraceBridge#withSpan}. Receives the span so it can add attributes.
 */
@FunctionalInterface
public interface SpanWork<T> {
    T run(Span span) throws Exception;
}
