package com.myorg.streamhub.eventing.codec;

/**
 * Naming of the top-level envelope fields on the wire. Services written in other stacks publish
 * snake_case; this library publishes camelCase and reads both.
 */
public enum FieldDialect {
    CAMEL_CASE("eventId", "eventType", "correlationId", "causationId", "traceContext"),
    SNAKE_CASE("event_id", "event_type", "correlation_id", "causation_id", "trace_context");

    // identical in both dialects
    public static final String TIMESTAMP = "timestamp";
    public static final String SOURCE = "source";
    public static final String VERSION = "version";
    public static final String METADATA = "metadata";
    public static final String DATA = "data";

    private final String eventId;
    private final String eventType;
    private final String correlationId;
    private final String causationId;
    private final String traceContext;

    FieldDialect(String eventId, String eventType, String correlationId, String causationId, String traceContext) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.correlationId = correlationId;
        this.causationId = causationId;
        this.traceContext = traceContext;
    }

    public String eventId() { return eventId; }
    public String eventType() { return eventType; }
    public String correlationId() { return correlationId; }
    public String causationId() { return causationId; }
    public String traceContext() { return traceContext; }
}
