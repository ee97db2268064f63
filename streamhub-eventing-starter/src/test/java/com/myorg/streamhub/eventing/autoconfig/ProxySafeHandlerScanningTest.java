package com.myorg.streamhub.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.eventing.HandlerRegistry;
import com.myorg.streamhub.eventing.StreamEventHandler;
import org.aopalliance.intercept.MethodInterceptor;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Handler beans are often proxied (AOP, @Transactional, tracing). Scanning bean.getClass()
 * would miss annotations declared on the target class.
 */
class ProxySafeHandlerScanningTest {

    private static final List<String> INTERCEPTED = new CopyOnWriteArrayList<>();

    // no StreamBrokerFactory: neither publisher nor consumer is created
    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(StreamhubEventingAutoConfiguration.class));

    @Test
    void shouldRegisterHandlerEvenWhenBeanIsProxied() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> {
                    HandlerRegistry registry = ctx.getBean(HandlerRegistry.class);

                    assertThat(registry.get("demo.created"))
                            .as("handler for demo.created should be registered")
                            .isNotNull();
                });
    }

    @Test
    void shouldInvokeHandlerThroughTheProxy() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> {
                    EventEnvelope env = EventEnvelope.builder()
                            .eventId("e-1")
                            .eventType("demo.created")
                            .data(new ObjectMapper().createObjectNode().put("id", "d-1"))
                            .build();

                    ctx.getBean(HandlerRegistry.class).get("demo.created").handle(env);

                    assertThat(INTERCEPTED).contains("handle");
                    assertThat(ctx.getBean(TestConfig.DemoHandler.class).getLastId()).isEqualTo("d-1");
                });
    }

    @Configuration
    static class TestConfig {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        // proxies DemoHandler after init, like AOP would in production
        @Bean
        static BeanPostProcessor proxyingPostProcessor() {
            return new BeanPostProcessor() {
                @Override
                public Object postProcessAfterInitialization(Object bean, String beanName) {
                    if (bean instanceof DemoHandler) {
                        ProxyFactory pf = new ProxyFactory(bean);
                        pf.setProxyTargetClass(true); // CGLIB proxy
                        pf.addAdvice((MethodInterceptor) invocation -> {
                            INTERCEPTED.add(invocation.getMethod().getName());
                            return invocation.proceed();
                        });
                        return pf.getProxy();
                    }
                    return bean;
                }
            };
        }

        @Component
        static class DemoHandler {
            private volatile String lastId;

            @StreamEventHandler(value = "demo.created", payload = DemoPayload.class)
            public void handle(DemoPayload payload) {
                lastId = payload.id;
            }

            public String getLastId() {
                return lastId;
            }
        }

        static class DemoPayload {
            public String id;
        }
    }
}
