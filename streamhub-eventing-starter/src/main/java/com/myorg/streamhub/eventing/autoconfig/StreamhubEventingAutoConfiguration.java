package com.myorg.streamhub.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.streamhub.eventing.DefaultEventPublisher;
import com.myorg.streamhub.eventing.EventPublisher;
import com.myorg.streamhub.eventing.HandlerMethodInvoker;
import com.myorg.streamhub.eventing.HandlerRegistry;
import com.myorg.streamhub.eventing.StreamEventHandler;
import com.myorg.streamhub.eventing.StreamTopology;
import com.myorg.streamhub.eventing.StreamhubEventingProperties;
import com.myorg.streamhub.eventing.broker.StreamBrokerFactory;
import com.myorg.streamhub.eventing.codec.EnvelopeCodec;
import com.myorg.streamhub.eventing.codec.JacksonEnvelopeCodec;
import com.myorg.streamhub.eventing.consumer.DefaultEventStreamConsumer;
import com.myorg.streamhub.eventing.consumer.EventStreamConsumer;
import com.myorg.streamhub.observability.StreamhubMetrics;
import com.myorg.streamhub.observability.StreamhubObservabilityAutoConfiguration;
import com.myorg.streamhub.observability.StreamhubObservabilityProperties;
import com.myorg.streamhub.observability.TraceBridge;
import io.opentelemetry.api.OpenTelemetry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.Map;

@Slf4j
@AutoConfiguration(after = {StreamhubObservabilityAutoConfiguration.class, StreamhubRedisAutoConfiguration.class})
@EnableConfigurationProperties(StreamhubEventingProperties.class)
public class StreamhubEventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry() {
        return new HandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ObjectProvider<ObjectMapper> mapperProvider) {
        return new JacksonEnvelopeCodec(mapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamTopology streamTopology(StreamhubEventingProperties props, Environment env) {
        String group = props.getConsumer().getGroup();
        if (!StringUtils.hasText(group)) {
            group = serviceName(props, env);
        }
        return new StreamTopology(props.getStreamPrefix(), group);
    }

    @Bean
    @ConditionalOnMissingBean(name = "streamhubClock")
    public Clock streamhubClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceBridge streamhubFallbackTraceBridge() {
        // only reached when the observability auto-configuration is excluded
        return new TraceBridge(OpenTelemetry.noop());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(StreamBrokerFactory.class)
    @ConditionalOnProperty(prefix = "streamhub.eventing.publisher", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EventPublisher eventPublisher(StreamBrokerFactory brokerFactory,
                                         StreamTopology topology,
                                         EnvelopeCodec codec,
                                         ObjectProvider<ObjectMapper> mapperProvider,
                                         TraceBridge traceBridge,
                                         ObjectProvider<StreamhubMetrics> metricsProvider,
                                         ObjectProvider<StreamhubObservabilityProperties> obsProvider,
                                         Clock streamhubClock,
                                         StreamhubEventingProperties props,
                                         Environment env) {
        String service = serviceName(props, env);
        return DefaultEventPublisher.builder()
                .broker(brokerFactory.open(service + "-publisher"))
                .topology(topology)
                .codec(codec)
                .mapper(mapperProvider.getIfAvailable(ObjectMapper::new))
                .traceBridge(traceBridge)
                .metrics(metricsEnabled(obsProvider) ? metricsProvider.getIfAvailable() : null)
                .clock(streamhubClock)
                .source(service)
                .envelopeVersion(props.getEnvelopeVersion())
                .maxLen(props.getPublisher().getMaxLen())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(StreamBrokerFactory.class)
    @ConditionalOnProperty(prefix = "streamhub.eventing.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EventStreamConsumer eventStreamConsumer(StreamBrokerFactory brokerFactory,
                                                   StreamTopology topology,
                                                   EnvelopeCodec codec,
                                                   TraceBridge traceBridge,
                                                   ObjectProvider<StreamhubMetrics> metricsProvider,
                                                   ObjectProvider<StreamhubObservabilityProperties> obsProvider,
                                                   StreamhubEventingProperties props,
                                                   Environment env) {
        String service = serviceName(props, env);
        StreamhubEventingProperties.Consumer c = props.getConsumer();
        String consumerName = StringUtils.hasText(c.getConsumerName())
                ? c.getConsumerName()
                : DefaultEventStreamConsumer.defaultConsumerName(service);
        StreamhubObservabilityProperties obs = obsProvider.getIfAvailable();

        return DefaultEventStreamConsumer.builder()
                .broker(brokerFactory.open(consumerName))
                .topology(topology)
                .codec(codec)
                .traceBridge(traceBridge)
                .metrics(metricsEnabled(obsProvider) ? metricsProvider.getIfAvailable() : null)
                .mdcEnabled(obs == null || (obs.isEnabled() && obs.isMdcEnabled()))
                .serviceName(service)
                .consumerName(consumerName)
                .batchSize(c.getBatchSize())
                .blockTimeout(c.getBlockTimeout())
                .errorBackoff(c.getErrorBackoff())
                .shutdownTimeout(c.getShutdownTimeout())
                .ignoreUnknownEventType(c.isIgnoreUnknownEventType())
                .reclaimEnabled(c.getReclaim().isEnabled())
                .reclaimMinIdle(c.getReclaim().getMinIdle())
                .reclaimInterval(c.getReclaim().getInterval())
                .reclaimBatchSize(c.getReclaim().getBatchSize())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "streamhub.eventing.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StreamhubConsumerLifecycle streamhubConsumerLifecycle(ObjectProvider<EventStreamConsumer> consumerProvider,
                                                                 HandlerRegistry registry) {
        return new StreamhubConsumerLifecycle(consumerProvider, registry);
    }

    @Bean
    @ConditionalOnMissingBean(name = "streamhubHandlerScanner")
    public Object streamhubHandlerScanner(ApplicationContext ctx,
                                          HandlerRegistry registry,
                                          ObjectProvider<ObjectMapper> mapperProvider) {
        ObjectMapper mapper = mapperProvider.getIfAvailable(ObjectMapper::new);
        Map<String, Object> beans = ctx.getBeansWithAnnotation(Component.class);

        beans.values().forEach(bean -> {
            Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);

            Map<Method, StreamEventHandler> methods = MethodIntrospector.selectMethods(
                    targetClass,
                    (Method m) -> AnnotatedElementUtils.findMergedAnnotation(m, StreamEventHandler.class)
            );

            methods.forEach((method, ann) -> {
                // annotations live on the target class, but the call must go through the proxy
                Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
                registry.register(ann.value(), new HandlerMethodInvoker(bean, invocable, ann.payload(), mapper));
                log.debug("Registered handler eventType={} method={}", ann.value(), method);
            });
        });

        // marker bean, makes the scan run once
        return new Object();
    }

    private static boolean metricsEnabled(ObjectProvider<StreamhubObservabilityProperties> obsProvider) {
        StreamhubObservabilityProperties obs = obsProvider.getIfAvailable();
        return obs == null || (obs.isEnabled() && obs.isMetricsEnabled());
    }

    static String serviceName(StreamhubEventingProperties props, Environment env) {
        String name = props.getServiceName();
        if (!StringUtils.hasText(name)) {
            name = env.getProperty("spring.application.name", "unknown-service");
        }
        return name.trim();
    }
}
