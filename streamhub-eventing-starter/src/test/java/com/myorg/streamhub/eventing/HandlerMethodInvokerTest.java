package com.myorg.streamhub.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.eventing.exception.UnknownEventTypeException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandlerMethodInvokerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    static class Payload {
        public String id;
    }

    static class Handlers {
        final List<String> calls = new ArrayList<>();

        public void payloadOnly(Payload p) {
            calls.add(p == null ? "null" : p.id);
        }

        public void withEnvelope(EventEnvelope env, Payload p) {
            calls.add(env.getEventId() + ":" + p.id);
        }

        public void failing(Payload p) throws IOException {
            throw new IOException("disk full");
        }

        public void noArgs() {
        }
    }

    private static class PrivateHandler {
        final List<String> calls = new ArrayList<>();

        public void onEvent(Payload p) {
            calls.add(p.id);
        }
    }

    private EventEnvelope envelope(String json) throws Exception {
        return EventEnvelope.builder()
                .eventId("e-1")
                .eventType("demo.created")
                .data(json == null ? null : mapper.readTree(json))
                .build();
    }

    private HandlerMethodInvoker invoker(Handlers target, String name, Class<?>... params) throws Exception {
        return new HandlerMethodInvoker(target, Handlers.class.getMethod(name, params), Payload.class, mapper);
    }

    @Test
    void convertsDataToPayload() throws Exception {
        Handlers h = new Handlers();

        invoker(h, "payloadOnly", Payload.class).handle(envelope("{\"id\":\"p-1\"}"));
        invoker(h, "withEnvelope", EventEnvelope.class, Payload.class).handle(envelope("{\"id\":\"p-2\"}"));

        assertThat(h.calls).containsExactly("p-1", "e-1:p-2");
    }

    @Test
    void invokesHandlersDeclaredOnNonPublicClasses() throws Exception {
        PrivateHandler h = new PrivateHandler();
        HandlerMethodInvoker invoker = new HandlerMethodInvoker(
                h, PrivateHandler.class.getMethod("onEvent", Payload.class), Payload.class, mapper);

        invoker.handle(envelope("{\"id\":\"p-1\"}"));

        assertThat(h.calls).containsExactly("p-1");
    }

    @Test
    void passesNullWhenEnvelopeHasNoData() throws Exception {
        Handlers h = new Handlers();

        invoker(h, "payloadOnly", Payload.class).handle(envelope(null));

        assertThat(h.calls).containsExactly("null");
    }

    @Test
    void rethrowsHandlerExceptionUnwrapped() throws Exception {
        HandlerMethodInvoker invoker = invoker(new Handlers(), "failing", Payload.class);

        assertThatThrownBy(() -> invoker.handle(envelope("{\"id\":\"p-1\"}")))
                .isInstanceOf(IOException.class)
                .hasMessage("disk full");
    }

    @Test
    void rejectsUnsupportedSignature() {
        assertThatThrownBy(() -> invoker(new Handlers(), "noArgs"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 or 2 params");
    }

    @Test
    void dispatcherRoutesByTypeAndHonoursUnknownPolicy() throws Exception {
        Handlers h = new Handlers();
        HandlerRegistry registry = new HandlerRegistry();
        registry.register("demo.created", invoker(h, "payloadOnly", Payload.class));

        new DefaultEventDispatcher(registry, true).dispatch(envelope("{\"id\":\"p-1\"}"));
        new DefaultEventDispatcher(registry, true).dispatch(envelope("{\"id\":\"p-2\"}").toBuilder().eventType("demo.deleted").build());

        assertThat(h.calls).containsExactly("p-1");
        assertThatThrownBy(() -> new DefaultEventDispatcher(registry, false)
                .dispatch(envelope("{}").toBuilder().eventType("demo.deleted").build()))
                .isInstanceOf(UnknownEventTypeException.class)
                .hasMessageContaining("demo.deleted");
    }
}
