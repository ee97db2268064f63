package com.myorg.streamhub.eventing.exception;

// Raised only when streamhub.eventing.consumer.ignore-unknown-event-type=false,
// so the entry stays pending until a consumer with a handler reclaims it.
public class UnknownEventTypeException extends HandlerFailedException {
    public UnknownEventTypeException(String eventType, String eventId) {
        super("No handler for eventType=" + eventType + ", eventId=" + eventId, eventType, eventId);
    }
}
