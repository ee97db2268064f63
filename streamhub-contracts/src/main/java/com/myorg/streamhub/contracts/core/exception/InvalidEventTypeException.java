package com.myorg.streamhub.contracts.core.exception;

import com.myorg.streamhub.contracts.core.conventions.EventTypeFormat;

public class InvalidEventTypeException extends StreamhubNonRetryableException {

    public InvalidEventTypeException(String eventType) {
        super("INVALID_EVENT_TYPE",
                "Invalid eventType='" + eventType + "', expected " + EventTypeFormat.RECOMMENDED_PATTERN);
    }
}
