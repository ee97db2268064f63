package com.myorg.streamhub.eventing;

import com.myorg.streamhub.contracts.core.exception.InvalidEventTypeException;
import com.myorg.streamhub.eventing.exception.PublishFailedException;

public interface EventPublisher extends AutoCloseable {

    default String publish(String eventType, Object data) {
        return publish(eventType, data, PublishOptions.none());
    }

    /**
     * Wraps {@code data} in an envelope and appends it to the stream of its domain.
     *
     * @return the id the broker assigned to the entry
     * @throws InvalidEventTypeException before any I/O when the type is not {@code domain.action}
     * @throws PublishFailedException    when encoding or the append fails
     */
    String publish(String eventType, Object data, PublishOptions options);

    @Override
    void close();
}
