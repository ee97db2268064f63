package com.myorg.streamhub.eventing;

import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;

@FunctionalInterface
public interface EventHandler {
    void handle(EventEnvelope envelope) throws Exception;
}
