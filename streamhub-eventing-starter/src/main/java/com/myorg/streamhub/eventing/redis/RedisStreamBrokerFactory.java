package com.myorg.streamhub.eventing.redis;

import com.myorg.streamhub.eventing.broker.StreamBroker;
import com.myorg.streamhub.eventing.broker.StreamBrokerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;

import java.time.Duration;

// Every open() gets its own connection factory: publisher and consumer never share a connection.
@Slf4j
@RequiredArgsConstructor
public class RedisStreamBrokerFactory implements StreamBrokerFactory {

    private final RedisStandaloneConfiguration configuration;
    private final Duration commandTimeout;

    @Override
    public StreamBroker open(String owner) {
        log.info("Connecting to Redis Streams owner={} host={} port={} db={}",
                owner, configuration.getHostName(), configuration.getPort(), configuration.getDatabase());
        return RedisStreamBroker.open(configuration, owner, commandTimeout);
    }
}
