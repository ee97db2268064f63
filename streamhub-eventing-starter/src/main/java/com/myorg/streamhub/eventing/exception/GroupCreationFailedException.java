package com.myorg.streamhub.eventing.exception;

import lombok.Getter;

@Getter
public class GroupCreationFailedException extends RuntimeException {

    private final String stream;
    private final String group;

    public GroupCreationFailedException(String stream, String group, Throwable cause) {
        super("Failed to create consumer group=" + group + " on stream=" + stream, cause);
        this.stream = stream;
        this.group = group;
    }
}
