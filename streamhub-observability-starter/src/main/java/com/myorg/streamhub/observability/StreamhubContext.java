package com.myorg.streamhub.observability;

/**
 * Identity of the entry being handled: envelope ids plus where the entry was read from.
 */
public record StreamhubContext(
        String eventId,
        String eventType,
        String correlationId,
        String causationId,
        String source,
        String stream,
        String messageId
) {}
