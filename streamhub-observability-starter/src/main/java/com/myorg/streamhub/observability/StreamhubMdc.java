package com.myorg.streamhub.observability;

import lombok.experimental.UtilityClass;
import org.slf4j.MDC;

import java.util.List;

/**
 * MDC keys set by the consumer around each dispatch, so handler logs carry the envelope identity.
 */
@UtilityClass
public class StreamhubMdc {

    public static final String EVENT_ID = "eventId";
    public static final String EVENT_TYPE = "eventType";
    public static final String CORRELATION_ID = "corrId";
    public static final String CAUSATION_ID = "causationId";
    public static final String SOURCE = "source";
    public static final String STREAM = "stream";
    public static final String MESSAGE_ID = "messageId";

    private static final List<String> KEYS =
            List.of(EVENT_ID, EVENT_TYPE, CORRELATION_ID, CAUSATION_ID, SOURCE, STREAM, MESSAGE_ID);

    public static void put(StreamhubContext c) {
        if (c == null) return;
        putIfPresent(EVENT_ID, c.eventId());
        putIfPresent(EVENT_TYPE, c.eventType());
        putIfPresent(CORRELATION_ID, c.correlationId());
        putIfPresent(CAUSATION_ID, c.causationId());
        putIfPresent(SOURCE, c.source());
        putIfPresent(STREAM, c.stream());
        putIfPresent(MESSAGE_ID, c.messageId());
    }

    public static void clear() {
        KEYS.forEach(MDC::remove);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) MDC.put(key, value);
    }
}
