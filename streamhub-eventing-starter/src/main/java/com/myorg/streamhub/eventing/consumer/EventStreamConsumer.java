package com.myorg.streamhub.eventing.consumer;

import com.myorg.streamhub.contracts.core.exception.InvalidEventTypeException;
import com.myorg.streamhub.eventing.EventHandler;
import com.myorg.streamhub.eventing.exception.GroupCreationFailedException;

/**
 * Reads events of subscribed types as one member of a consumer group.
 *
 * <p>Entries are acknowledged only after their handler returned normally. A failed handler leaves
 * the entry pending for the group.
 */
public interface EventStreamConsumer extends AutoCloseable {

    /**
     * Registers {@code handler} for {@code eventType}, replacing any earlier one, and makes sure the
     * group exists on the type's stream. The first subscription starts polling.
     *
     * @throws InvalidEventTypeException   when the type is not {@code domain.action}
     * @throws GroupCreationFailedException when the group cannot be created; nothing is registered
     * @throws IllegalStateException        after {@link #stop()}
     */
    void subscribe(String eventType, EventHandler handler);

    /**
     * Stops polling and releases the connection. The message being handled, if any, is allowed to finish.
     * Calling it again has no effect.
     */
    void stop();

    ConsumerState state();

    String groupName();

    String consumerName();

    @Override
    default void close() {
        stop();
    }
}
