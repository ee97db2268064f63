package com.myorg.streamhub.eventing.exception;

import lombok.Getter;

// Append did not happen. No local retry: the caller owns the retry policy.
@Getter
public class PublishFailedException extends StreamhubRetryableException {

    private final String eventType;
    private final String stream;

    public PublishFailedException(String eventType, String stream, Throwable cause) {
        super("Failed to publish eventType=" + eventType + " to stream=" + stream
                + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.eventType = eventType;
        this.stream = stream;
    }
}
