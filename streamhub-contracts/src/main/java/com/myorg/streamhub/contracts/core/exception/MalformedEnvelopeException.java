package com.myorg.streamhub.contracts.core.exception;

// Delivered message can never become a valid envelope: consumers ack and drop it.
public class MalformedEnvelopeException extends StreamhubNonRetryableException {

    public MalformedEnvelopeException(String message) {
        super("MALFORMED_ENVELOPE", message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super("MALFORMED_ENVELOPE", message, cause);
    }
}
