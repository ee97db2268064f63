package com.myorg.streamhub.observability;

// Span attribute keys shared by producer and consumer spans.
public final class MessagingAttributes {
    private MessagingAttributes() {}

    public static final String SYSTEM = "messaging.system";
    public static final String DESTINATION = "messaging.destination";
    public static final String OPERATION = "messaging.operation";
    public static final String EVENT_TYPE = "event.type";
    public static final String EVENT_ID = "event.id";
    public static final String EVENT_SOURCE = "event.source";

    public static final String SYSTEM_REDIS_STREAMS = "redis_streams";
    public static final String OPERATION_PUBLISH = "publish";
    public static final String OPERATION_RECEIVE = "receive";
}
