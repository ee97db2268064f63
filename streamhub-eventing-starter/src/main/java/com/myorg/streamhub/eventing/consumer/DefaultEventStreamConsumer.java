package com.myorg.streamhub.eventing.consumer;

import com.myorg.streamhub.contracts.core.conventions.StreamFields;
import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.contracts.core.exception.MalformedEnvelopeException;
import com.myorg.streamhub.eventing.DefaultEventDispatcher;
import com.myorg.streamhub.eventing.EventDispatcher;
import com.myorg.streamhub.eventing.EventHandler;
import com.myorg.streamhub.eventing.HandlerRegistry;
import com.myorg.streamhub.eventing.StreamRoute;
import com.myorg.streamhub.eventing.StreamTopology;
import com.myorg.streamhub.eventing.broker.StreamBroker;
import com.myorg.streamhub.eventing.broker.StreamEntry;
import com.myorg.streamhub.eventing.codec.EnvelopeCodec;
import com.myorg.streamhub.eventing.exception.GroupCreationFailedException;
import com.myorg.streamhub.eventing.exception.HandlerFailedException;
import com.myorg.streamhub.observability.MessagingAttributes;
import com.myorg.streamhub.observability.StreamhubContext;
import com.myorg.streamhub.observability.StreamhubMdc;
import com.myorg.streamhub.observability.StreamhubMetrics;
import com.myorg.streamhub.observability.TraceBridge;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded consumer: one poll loop reads all subscribed streams with one group read and
 * handles entries one at a time, in delivery order.
 *
 * <p>{@link #stop()} wakes the loop through a stop signal and interrupts the poll thread only while
 * it is parked in the blocking read, so a running handler is never interrupted.
 */
@Slf4j
public class DefaultEventStreamConsumer implements EventStreamConsumer {

    private final StreamBroker broker;
    private final StreamTopology topology;
    private final EnvelopeCodec codec;
    private final TraceBridge traceBridge;
    private final StreamhubMetrics metrics; // nullable
    private final boolean mdcEnabled;

    private final String group;
    private final String consumerName;
    private final int batchSize;
    private final Duration blockTimeout;
    private final Duration errorBackoff;
    private final Duration shutdownTimeout;

    private final boolean reclaimEnabled;
    private final Duration reclaimMinIdle;
    private final Duration reclaimInterval;
    private final int reclaimBatchSize;

    private final HandlerRegistry registry = new HandlerRegistry();
    private final EventDispatcher dispatcher;
    private final Set<String> streams = new CopyOnWriteArraySet<>();

    private final Object subscribeLock = new Object();
    private final Object stateLock = new Object();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch loopExited = new CountDownLatch(1);

    private volatile ConsumerState state = ConsumerState.IDLE;
    private Thread pollThread;   // guarded by stateLock
    private boolean reading;     // guarded by stateLock
    private long nextReclaimAt;  // poll thread only

    @Builder
    public DefaultEventStreamConsumer(StreamBroker broker,
                                      StreamTopology topology,
                                      EnvelopeCodec codec,
                                      TraceBridge traceBridge,
                                      StreamhubMetrics metrics,
                                      Boolean mdcEnabled,
                                      String serviceName,
                                      String consumerName,
                                      Integer batchSize,
                                      Duration blockTimeout,
                                      Duration errorBackoff,
                                      Duration shutdownTimeout,
                                      boolean ignoreUnknownEventType,
                                      boolean reclaimEnabled,
                                      Duration reclaimMinIdle,
                                      Duration reclaimInterval,
                                      Integer reclaimBatchSize) {
        this.broker = broker;
        this.topology = topology;
        this.codec = codec;
        this.traceBridge = traceBridge;
        this.metrics = metrics;
        this.mdcEnabled = mdcEnabled == null || mdcEnabled;

        this.group = topology.groupName();
        this.consumerName = (consumerName == null || consumerName.isBlank())
                ? defaultConsumerName(serviceName == null ? group : serviceName)
                : consumerName;
        this.batchSize = batchSize == null || batchSize <= 0 ? 10 : batchSize;
        this.blockTimeout = blockTimeout == null ? Duration.ofSeconds(5) : blockTimeout;
        this.errorBackoff = errorBackoff == null ? Duration.ofSeconds(5) : errorBackoff;
        this.shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30) : shutdownTimeout;

        this.reclaimEnabled = reclaimEnabled;
        this.reclaimMinIdle = reclaimMinIdle == null ? Duration.ofSeconds(60) : reclaimMinIdle;
        this.reclaimInterval = reclaimInterval == null ? Duration.ofSeconds(30) : reclaimInterval;
        this.reclaimBatchSize = reclaimBatchSize == null || reclaimBatchSize <= 0 ? 10 : reclaimBatchSize;

        this.dispatcher = new DefaultEventDispatcher(registry, ignoreUnknownEventType);
    }

    /**
     * {@code {service}-{pid}-{8 hex}}: unique per process and per instance within a process.
     */
    public static String defaultConsumerName(String serviceName) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return serviceName + "-" + ProcessHandle.current().pid() + "-" + random;
    }

    @Override
    public void subscribe(String eventType, EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        synchronized (subscribeLock) {
            requireNotStopped();
            StreamRoute route = topology.resolve(eventType);

            if (!streams.contains(route.stream())) {
                ensureGroup(route);
            }

            EventHandler previous = registry.register(eventType, handler);
            if (previous != null) {
                log.warn("Replacing handler for eventType={} ({} -> {})", eventType, previous, handler);
            }
            streams.add(route.stream());

            log.info("Subscribed eventType={} stream={} group={} consumer={}",
                    eventType, route.stream(), group, consumerName);
            startIfIdle();
        }
    }

    @Override
    public void stop() {
        Thread loop;
        synchronized (stateLock) {
            if (state == ConsumerState.STOPPED) return;
            state = ConsumerState.STOPPED;
            stopSignal.countDown();
            loop = pollThread;
            if (loop != null && reading) {
                loop.interrupt();
            }
        }

        if (loop != null && loop != Thread.currentThread()) {
            try {
                if (!loopExited.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Poll loop of consumer={} did not exit within {}", consumerName, shutdownTimeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for consumer={} to stop", consumerName);
            }
        }

        try {
            broker.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close broker connection of consumer={}", consumerName, e);
        }
        log.info("Event consumer stopped group={} consumer={}", group, consumerName);
    }

    @Override
    public ConsumerState state() {
        return state;
    }

    @Override
    public String groupName() {
        return group;
    }

    @Override
    public String consumerName() {
        return consumerName;
    }

    // ---------------- lifecycle ----------------

    private void requireNotStopped() {
        if (state == ConsumerState.STOPPED) {
            throw new IllegalStateException("Consumer " + consumerName + " is stopped");
        }
    }

    private void ensureGroup(StreamRoute route) {
        try {
            if (broker.createGroup(route.stream(), route.group())) {
                log.info("Created consumer group={} on stream={}", route.group(), route.stream());
            } else {
                log.debug("Consumer group={} already exists on stream={}", route.group(), route.stream());
            }
        } catch (RuntimeException e) {
            throw new GroupCreationFailedException(route.stream(), route.group(), e);
        }
    }

    private void startIfIdle() {
        synchronized (stateLock) {
            if (state == ConsumerState.STOPPED) {
                throw new IllegalStateException("Consumer " + consumerName + " is stopped");
            }
            if (state == ConsumerState.IDLE) {
                state = ConsumerState.SUBSCRIBED;
            }
            if (pollThread != null) return;

            // RUNNING before the thread exists, so the loop never observes SUBSCRIBED
            state = ConsumerState.RUNNING;
            nextReclaimAt = System.nanoTime() + reclaimInterval.toNanos();
            pollThread = new Thread(this::pollLoop, "streamhub-consumer-" + consumerName);
            pollThread.setDaemon(true);
            pollThread.start();
        }
    }

    private boolean isStopping() {
        return state == ConsumerState.STOPPED;
    }

    // ---------------- poll loop ----------------

    private void pollLoop() {
        log.info("Event consumer started group={} consumer={} streams={}", group, consumerName, streams);
        try {
            while (!isStopping()) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Poll thread of consumer={} interrupted, exiting", consumerName);
                    return;
                }
                try {
                    reclaimIfDue();
                    for (StreamEntry entry : readBatch()) {
                        processMessage(entry);
                    }
                } catch (RuntimeException e) {
                    if (isStopping()) break;
                    log.error("Error consuming events group={} consumer={}", group, consumerName, e);
                    backoff();
                }
            }
        } finally {
            loopExited.countDown();
            log.debug("Poll loop exited consumer={}", consumerName);
        }
    }

    private List<StreamEntry> readBatch() {
        List<String> snapshot = List.copyOf(streams);
        synchronized (stateLock) {
            if (isStopping()) return List.of();
            reading = true;
        }
        try {
            return broker.readGroup(group, consumerName, snapshot, batchSize, blockTimeout);
        } finally {
            synchronized (stateLock) {
                reading = false;
                // drop an interrupt aimed at the read so it cannot reach a handler
                Thread.interrupted();
            }
        }
    }

    private void backoff() {
        try {
            stopSignal.await(errorBackoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void reclaimIfDue() {
        if (!reclaimEnabled || System.nanoTime() < nextReclaimAt) return;
        nextReclaimAt = System.nanoTime() + reclaimInterval.toNanos();

        for (String stream : List.copyOf(streams)) {
            if (isStopping()) return;

            List<StreamEntry> claimed;
            try {
                claimed = broker.claimStale(stream, group, consumerName, reclaimMinIdle, reclaimBatchSize);
            } catch (RuntimeException e) {
                log.warn("Reclaim failed stream={} group={} consumer={}", stream, group, consumerName, e);
                continue;
            }
            if (claimed.isEmpty()) continue;

            log.info("Reclaimed {} stale entries stream={} group={} consumer={}",
                    claimed.size(), stream, group, consumerName);
            if (metrics != null) metrics.incReclaimed(claimed.size());
            claimed.forEach(this::processMessage);
        }
    }

    // ---------------- per message ----------------

    void processMessage(StreamEntry entry) {
        String raw = entry.fields().get(StreamFields.DATA);
        if (raw == null) raw = entry.fields().get(StreamFields.PAYLOAD);
        if (raw == null) {
            log.warn("Message missing data field messageId={} stream={}", entry.id(), entry.stream());
            if (metrics != null) metrics.incMalformed();
            acknowledge(entry);
            return;
        }

        EventEnvelope env;
        try {
            env = codec.decode(raw);
        } catch (MalformedEnvelopeException e) {
            log.warn("Dropping malformed envelope messageId={} stream={}: {}", entry.id(), entry.stream(), e.getMessage());
            if (metrics != null) metrics.incMalformed();
            acknowledge(entry);
            return;
        }

        Context parent = traceBridge.extract(env.getTraceContext());
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(MessagingAttributes.SYSTEM, MessagingAttributes.SYSTEM_REDIS_STREAMS);
        attributes.put(MessagingAttributes.OPERATION, MessagingAttributes.OPERATION_RECEIVE);
        attributes.put(MessagingAttributes.DESTINATION, entry.stream());
        attributes.put(MessagingAttributes.EVENT_TYPE, env.getEventType());
        attributes.put(MessagingAttributes.EVENT_ID, env.getEventId());
        attributes.put(MessagingAttributes.EVENT_SOURCE, env.getSource());

        Timer.Sample sample = metrics == null ? null : metrics.startTimer();
        if (mdcEnabled) {
            StreamhubMdc.put(new StreamhubContext(env.getEventId(), env.getEventType(), env.getCorrelationId(),
                    env.getCausationId(), env.getSource(), entry.stream(), entry.id()));
        }
        try {
            traceBridge.withSpan("consume " + env.getEventType(), SpanKind.CONSUMER, attributes, parent, span -> {
                dispatcher.dispatch(env);
                return null;
            });

            if (metrics != null) {
                metrics.incHandledSuccess();
                metrics.stopTimer(sample, env.getEventType(), StreamhubMetrics.OUTCOME_SUCCESS);
            }
            log.debug("Event processed eventType={} eventId={}", env.getEventType(), env.getEventId());
            acknowledge(entry);
        } catch (Exception | Error e) {
            // a handler error of any kind leaves the entry pending and keeps the loop alive
            HandlerFailedException failure = e instanceof HandlerFailedException hfe
                    ? hfe
                    : new HandlerFailedException(env.getEventType(), env.getEventId(), e);
            if (metrics != null) {
                metrics.incHandledFail();
                metrics.stopTimer(sample, env.getEventType(), StreamhubMetrics.OUTCOME_FAIL);
            }
            log.error("Failed to process message messageId={} stream={}, left pending", entry.id(), entry.stream(), failure);
        } finally {
            if (mdcEnabled) StreamhubMdc.clear();
        }
    }

    private void acknowledge(StreamEntry entry) {
        try {
            broker.ack(entry.stream(), group, entry.id());
        } catch (RuntimeException e) {
            log.error("Failed to acknowledge messageId={} stream={} group={}", entry.id(), entry.stream(), group, e);
        }
    }
}
