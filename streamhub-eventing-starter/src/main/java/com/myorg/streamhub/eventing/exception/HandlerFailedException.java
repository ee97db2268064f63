package com.myorg.streamhub.eventing.exception;

import lombok.Getter;

// The entry stays pending in the group; it is only seen again through a reclaim pass.
@Getter
public class HandlerFailedException extends StreamhubRetryableException {

    private final String eventType;
    private final String eventId;

    public HandlerFailedException(String eventType, String eventId, Throwable cause) {
        super("Handler failed for eventType=" + eventType + ", eventId=" + eventId, cause);
        this.eventType = eventType;
        this.eventId = eventId;
    }

    protected HandlerFailedException(String message, String eventType, String eventId) {
        super(message);
        this.eventType = eventType;
        this.eventId = eventId;
    }
}
