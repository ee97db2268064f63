package com.myorg.streamhub.eventing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "streamhub.eventing")
public class StreamhubEventingProperties {
    // empty -> spring.application.name
    private String serviceName;
    // streams are named {streamPrefix}:{domain}s
    private String streamPrefix = "events";
    // written into every published envelope
    private String envelopeVersion = "1.0.0";

    private Publisher publisher = new Publisher();
    private Consumer consumer = new Consumer();
    private Redis redis = new Redis();

    @Data
    public static class Publisher {
        private boolean enabled = true;
        // approximate MAXLEN applied after every append, <= 0 disables trimming
        private long maxLen = 10_000;
    }

    @Data
    public static class Consumer {
        private boolean enabled = true;
        // empty -> service name
        private String group;
        // empty -> {service}-{pid}-{random}
        private String consumerName;
        private int batchSize = 10;
        private Duration blockTimeout = Duration.ofSeconds(5);
        // wait after a failed read before polling again
        private Duration errorBackoff = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        // true = log + ack, false = leave pending
        private boolean ignoreUnknownEventType = true;

        private Reclaim reclaim = new Reclaim();
    }

    /**
     * Takes over entries left pending by failed handlers or dead consumers of the same group.
     */
    @Data
    public static class Reclaim {
        private boolean enabled = false;
        private Duration minIdle = Duration.ofSeconds(60);
        private Duration interval = Duration.ofSeconds(30);
        private int batchSize = 10;
    }

    @Data
    public static class Redis {
        // must exceed consumer.block-timeout, otherwise blocking reads time out client side
        private Duration commandTimeout = Duration.ofSeconds(60);
    }
}
