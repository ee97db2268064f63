package com.myorg.streamhub.eventing;

import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;

public interface EventDispatcher {
    /**
     * Routes the envelope to its handler. Returning normally means the entry may be acknowledged.
     */
    void dispatch(EventEnvelope env) throws Exception;
}
