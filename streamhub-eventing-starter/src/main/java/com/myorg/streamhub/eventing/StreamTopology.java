package com.myorg.streamhub.eventing;

import com.myorg.streamhub.contracts.core.conventions.EventTypeFormat;
import com.myorg.streamhub.contracts.core.exception.InvalidEventTypeException;

/**
 * Maps event types to stream names. Publishers and consumers share this one rule:
 * {@code order.created} lives on {@code {prefix}:orders}.
 */
public class StreamTopology {

    public static final String DEFAULT_PREFIX = "events";

    private final String prefix;
    private final String group;

    public StreamTopology(String prefix, String group) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group must not be blank");
        }
        this.prefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix.trim();
        this.group = group.trim();
    }

    public String domainOf(String eventType) {
        if (!EventTypeFormat.isValid(eventType)) {
            throw new InvalidEventTypeException(eventType);
        }
        return eventType.substring(0, eventType.indexOf(EventTypeFormat.SEPARATOR));
    }

    public String streamName(String eventType) {
        return prefix + ":" + domainOf(eventType) + "s";
    }

    public String groupName() {
        return group;
    }

    public StreamRoute resolve(String eventType) {
        return new StreamRoute(streamName(eventType), group);
    }

    public String prefix() {
        return prefix;
    }
}
