package com.myorg.streamhub.eventing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import lombok.Getter;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Adapts a {@link StreamEventHandler} method to {@link EventHandler}.
 */
@Getter
public class HandlerMethodInvoker implements EventHandler {
    private final Object target;
    private final Method method;
    private final Class<?> payloadClass;
    private final ObjectMapper mapper;

    public HandlerMethodInvoker(Object target, Method method, Class<?> payloadClass, ObjectMapper mapper) {
        int params = method.getParameterCount();
        if (params != 1 && params != 2) {
            throw new IllegalStateException(
                    "Handler method must have 1 or 2 params: (payload) or (envelope,payload): " + method);
        }
        this.target = target;
        // handler beans are often package-private or nested classes
        ReflectionUtils.makeAccessible(method);
        this.method = method;
        this.payloadClass = payloadClass;
        this.mapper = mapper;
    }

    @Override
    public void handle(EventEnvelope env) throws Exception {
        JsonNode data = env.getData();
        Object payloadObj = (data == null || data.isNull()) ? null : mapper.treeToValue(data, payloadClass);

        try {
            if (method.getParameterCount() == 1) {
                method.invoke(target, payloadObj);
            } else {
                method.invoke(target, env, payloadObj);
            }
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
