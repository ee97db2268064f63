package com.myorg.streamhub.eventing;

import java.lang.annotation.*;

/**
 * Marks a bean method as the handler of one event type.
 *
 * <p>Supported signatures: {@code (Payload p)} and {@code (EventEnvelope env, Payload p)}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface StreamEventHandler {
    // event type, e.g. "order.created"
    String value();
    // envelope data is converted to this class before invocation
    Class<?> payload();
}
