package com.myorg.streamhub.eventing.redis;

import com.myorg.streamhub.eventing.broker.StreamBroker;
import com.myorg.streamhub.eventing.broker.StreamEntry;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.RedisStreamCommands.XAddOptions;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link StreamBroker} over Redis Streams (XADD MAXLEN ~, XGROUP CREATE, XREADGROUP, XACK, XPENDING/XCLAIM).
 */
public class RedisStreamBroker implements StreamBroker {

    private static final String BUSYGROUP = "BUSYGROUP";

    private final StringRedisTemplate redis;
    private final LettuceConnectionFactory ownedConnectionFactory; // null when the factory is managed elsewhere

    public RedisStreamBroker(StringRedisTemplate redis) {
        this(redis, null);
    }

    private RedisStreamBroker(StringRedisTemplate redis, LettuceConnectionFactory ownedConnectionFactory) {
        this.redis = redis;
        this.ownedConnectionFactory = ownedConnectionFactory;
    }

    /**
     * Opens a broker on a dedicated Lettuce connection factory that is destroyed by {@link #close()}.
     */
    public static RedisStreamBroker open(RedisStandaloneConfiguration configuration, String clientName, Duration commandTimeout) {
        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
                .clientName(clientName)
                .commandTimeout(commandTimeout)
                .build();
        LettuceConnectionFactory cf = new LettuceConnectionFactory(configuration, client);
        cf.afterPropertiesSet();
        return new RedisStreamBroker(new StringRedisTemplate(cf), cf);
    }

    @Override
    public String append(String stream, Map<String, String> fields, long maxLen) {
        Map<byte[], byte[]> raw = new LinkedHashMap<>();
        fields.forEach((k, v) -> raw.put(k.getBytes(StandardCharsets.UTF_8), v.getBytes(StandardCharsets.UTF_8)));
        MapRecord<byte[], byte[], byte[]> record = StreamRecords.newRecord()
                .in(stream.getBytes(StandardCharsets.UTF_8))
                .ofMap(raw);
        // MAXLEN ~ rides on the XADD itself, so an appended entry is never reported as a failure
        XAddOptions options = maxLen > 0
                ? XAddOptions.maxlen(maxLen).approximateTrimming(true)
                : XAddOptions.none();
        RecordId id = redis.execute((RedisCallback<RecordId>) connection ->
                connection.streamCommands().xAdd(record, options));
        return id == null ? "" : id.getValue();
    }

    @Override
    public boolean createGroup(String stream, String group) {
        byte[] rawStream = stream.getBytes(StandardCharsets.UTF_8);
        try {
            redis.execute((RedisCallback<String>) connection ->
                    connection.streamCommands().xGroupCreate(rawStream, group, ReadOffset.from("0"), true));
            return true;
        } catch (RuntimeException e) {
            if (isBusyGroup(e)) {
                return false;
            }
            throw e;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamEntry> readGroup(String group, String consumer, Collection<String> streams, int count, Duration block) {
        if (streams.isEmpty()) return List.of();

        StreamOffset<String>[] offsets = streams.stream()
                .map(s -> StreamOffset.create(s, ReadOffset.lastConsumed()))
                .toArray(StreamOffset[]::new);

        List<MapRecord<String, Object, Object>> records = redis.opsForStream().read(
                Consumer.from(group, consumer),
                StreamReadOptions.empty().count(count).block(block),
                offsets
        );
        return toEntries(records);
    }

    @Override
    public void ack(String stream, String group, String entryId) {
        redis.opsForStream().acknowledge(stream, group, entryId);
    }

    @Override
    public List<StreamEntry> claimStale(String stream, String group, String consumer, Duration minIdle, int count) {
        PendingMessages pending = redis.opsForStream().pending(stream, group, Range.unbounded(), count);
        if (pending == null || pending.isEmpty()) return List.of();

        List<RecordId> stale = new ArrayList<>();
        for (PendingMessage p : pending) {
            if (p.getElapsedTimeSinceLastDelivery().compareTo(minIdle) >= 0) {
                stale.add(p.getId());
            }
        }
        if (stale.isEmpty()) return List.of();

        List<MapRecord<String, Object, Object>> claimed = redis.opsForStream()
                .claim(stream, group, consumer, minIdle, stale.toArray(RecordId[]::new));
        return toEntries(claimed);
    }

    @Override
    public void close() {
        if (ownedConnectionFactory != null) {
            ownedConnectionFactory.destroy();
        }
    }

    private static List<StreamEntry> toEntries(List<MapRecord<String, Object, Object>> records) {
        if (records == null || records.isEmpty()) return List.of();

        List<StreamEntry> out = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> r : records) {
            Map<String, String> fields = new LinkedHashMap<>();
            if (r.getValue() != null) {
                r.getValue().forEach((k, v) -> {
                    if (k != null && v != null) fields.put(String.valueOf(k), String.valueOf(v));
                });
            }
            out.add(new StreamEntry(r.getStream(), r.getId().getValue(), fields));
        }
        return out;
    }

    static boolean isBusyGroup(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(BUSYGROUP)) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }
}
