package com.myorg.streamhub.eventing.broker;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * The log-structured store operations the messaging layer relies on.
 *
 * <p>An instance owns its connection; it is used by exactly one publisher or consumer.
 */
public interface StreamBroker extends AutoCloseable {

    /**
     * Appends an entry, then trims the stream to roughly {@code maxLen} entries (no trim when {@code maxLen <= 0}).
     *
     * @return the broker-assigned entry id
     */
    String append(String stream, Map<String, String> fields, long maxLen);

    /**
     * Creates {@code group} on {@code stream} reading from the start of the stream, creating the
     * stream when missing.
     *
     * @return {@code false} when the group already existed
     */
    boolean createGroup(String stream, String group);

    /**
     * Blocks up to {@code block} for entries never delivered to {@code group} on any of {@code streams}.
     */
    List<StreamEntry> readGroup(String group, String consumer, Collection<String> streams, int count, Duration block);

    void ack(String stream, String group, String entryId);

    /**
     * Transfers to {@code consumer} up to {@code count} pending entries idle for at least {@code minIdle}.
     */
    List<StreamEntry> claimStale(String stream, String group, String consumer, Duration minIdle, int count);

    @Override
    void close();
}
