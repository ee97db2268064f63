package com.myorg.streamhub.eventing.exception;

public class StreamhubRetryableException extends RuntimeException {
    public StreamhubRetryableException(String msg) { super(msg); }
    public StreamhubRetryableException(String msg, Throwable cause) { super(msg, cause); }
}
