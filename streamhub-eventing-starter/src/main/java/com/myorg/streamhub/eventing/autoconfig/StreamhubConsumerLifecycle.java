package com.myorg.streamhub.eventing.autoconfig;

import com.myorg.streamhub.eventing.HandlerRegistry;
import com.myorg.streamhub.eventing.consumer.EventStreamConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;

/**
 * Subscribes every scanned {@code @StreamEventHandler} once the context is up and stops the
 * consumer before the rest of the context shuts down.
 */
@Slf4j
@RequiredArgsConstructor
public class StreamhubConsumerLifecycle implements SmartLifecycle {

    private final ObjectProvider<EventStreamConsumer> consumerProvider;
    private final HandlerRegistry registry;

    private volatile boolean running = false;

    @Override
    public void start() {
        EventStreamConsumer consumer = consumerProvider.getIfAvailable();
        if (consumer == null) {
            if (!registry.isEmpty()) {
                log.warn("@StreamEventHandler methods found but no EventStreamConsumer (is a StreamBrokerFactory available?)");
            }
        } else if (registry.isEmpty()) {
            log.info("No @StreamEventHandler found; consumer={} stays idle", consumer.consumerName());
        } else {
            registry.forEach(consumer::subscribe);
        }
        running = true;
    }

    @Override
    public void stop() {
        EventStreamConsumer consumer = consumerProvider.getIfAvailable();
        if (consumer != null) consumer.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // late start, early stop: handler beans are ready first and still alive while the loop drains
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }
}
