package com.myorg.streamhub.eventing.autoconfig;

import com.myorg.streamhub.eventing.StreamhubEventingProperties;
import com.myorg.streamhub.eventing.broker.StreamBrokerFactory;
import com.myorg.streamhub.eventing.redis.RedisStreamBrokerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.util.StringUtils;

/**
 * Redis Streams transport.
 *
 * <p>Kept apart from {@link StreamhubEventingAutoConfiguration} so an application can plug in
 * another {@link StreamBrokerFactory} without Redis on the classpath.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(StreamhubEventingProperties.class)
@ConditionalOnClass(LettuceConnectionFactory.class)
public class StreamhubRedisAutoConfiguration {

    /**
     * Publisher and consumer each open their own connection from spring.data.redis.* (standalone).
     * A host-level RedisConnectionFactory is deliberately not reused.
     */
    @Bean
    @ConditionalOnMissingBean
    public StreamBrokerFactory streamBrokerFactory(Environment env, StreamhubEventingProperties props) {
        String host = env.getProperty("spring.data.redis.host", "localhost");
        int port = Integer.parseInt(env.getProperty("spring.data.redis.port", "6379"));
        int db = Integer.parseInt(env.getProperty("spring.data.redis.database", "0"));
        String username = env.getProperty("spring.data.redis.username");
        String password = env.getProperty("spring.data.redis.password");

        RedisStandaloneConfiguration cfg = new RedisStandaloneConfiguration(host, port);
        cfg.setDatabase(db);
        if (StringUtils.hasText(username)) {
            cfg.setUsername(username);
        }
        if (StringUtils.hasText(password)) {
            cfg.setPassword(RedisPassword.of(password));
        }

        if (props.getRedis().getCommandTimeout().compareTo(props.getConsumer().getBlockTimeout()) <= 0) {
            log.warn("streamhub.eventing.redis.command-timeout={} should exceed consumer.block-timeout={}",
                    props.getRedis().getCommandTimeout(), props.getConsumer().getBlockTimeout());
        }
        return new RedisStreamBrokerFactory(cfg, props.getRedis().getCommandTimeout());
    }
}
