package com.myorg.streamhub.eventing;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

// eventType -> handler. Written on subscribe, read by the poll loop.
public class HandlerRegistry {
    private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();

    /**
     * @return the handler previously registered for the type, or {@code null}
     */
    public EventHandler register(String eventType, EventHandler handler) {
        return handlers.put(eventType, handler);
    }

    public EventHandler get(String eventType) {
        return eventType == null ? null : handlers.get(eventType);
    }

    public void forEach(BiConsumer<String, EventHandler> action) {
        handlers.forEach(action);
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }
}
