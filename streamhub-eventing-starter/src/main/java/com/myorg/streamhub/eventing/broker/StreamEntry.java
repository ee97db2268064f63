package com.myorg.streamhub.eventing.broker;

import java.util.Map;

/**
 * One entry delivered from a stream to a consumer group member.
 *
 * @param stream physical stream name
 * @param id     broker-assigned entry id, e.g. {@code 1700000000000-0}
 * @param fields entry field-set; empty when the broker no longer holds the entry body
 */
public record StreamEntry(String stream, String id, Map<String, String> fields) {
    public StreamEntry {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
