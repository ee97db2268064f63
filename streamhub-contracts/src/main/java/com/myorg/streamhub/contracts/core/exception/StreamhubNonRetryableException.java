package com.myorg.streamhub.contracts.core.exception;

/**
 * Failure that retrying cannot fix. {@link #getReason()} is a short machine-readable code.
 */
public class StreamhubNonRetryableException extends RuntimeException {

    private final String reason;

    public StreamhubNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public StreamhubNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public StreamhubNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
