package com.myorg.streamhub.eventing;

import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.eventing.exception.UnknownEventTypeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class DefaultEventDispatcher implements EventDispatcher {

    private final HandlerRegistry registry;
    private final boolean ignoreUnknown;

    @Override
    public void dispatch(EventEnvelope env) throws Exception {
        String type = env.getEventType();
        EventHandler handler = registry.get(type);

        if (handler == null) {
            if (ignoreUnknown) {
                log.debug("No handler for eventType={}, eventId={}", type, env.getEventId());
                return;
            }
            throw new UnknownEventTypeException(type, env.getEventId());
        }

        handler.handle(env);
    }
}
