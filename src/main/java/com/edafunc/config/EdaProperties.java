package com.edafunc.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralizes all runtime configuration.
 *
 * Bound from application.yml under "eda" prefix:
 *   eda:
 *     connection:
 *       broker: localhost:9092      (env KAFKA_BROKER)
 *       topic: events               (env KAFKA_TOPIC)
 *       group: poc                  (env KAFKA_GROUP)
 *     engine:
 *       poll-timeout: 100ms
 *       max-consecutive-errors: 5
 *     routing:
 *       file: ./routing.yaml        (optional, otherwise looked up next to the handler)
 *       required: false
 *     retry:
 *       max-retries: 0              (0 = never retry)
 *     clusters:
 *       analytics: kafka-analytics:9092
 *
 * The connection block only provides defaults for the in-process decision
 * backend; the engine always asks the backend for its ConnectionConfig.
 */
@Component
@ConfigurationProperties(prefix = "eda")
@Getter
@Setter
public class EdaProperties {

    private Connection connection = new Connection();
    private Engine engine = new Engine();
    private Routing routing = new Routing();
    private Retry retry = new Retry();
    private Codec codec = new Codec();
    private Kafka kafka = new Kafka();

    /** Named Kafka clusters an output destination may be scoped to: name → bootstrap servers. */
    private Map<String, String> clusters = new HashMap<>();

    @Getter
    @Setter
    public static class Connection {
        private String broker = "localhost:9092";
        private String topic = "events";
        private String group = "poc";
    }

    @Getter
    @Setter
    public static class Engine {
        private Duration pollTimeout = Duration.ofMillis(100);
        private int maxConsecutiveErrors = 5;
        /** Bounded wait for pending output publishes while draining. */
        private Duration flushTimeout = Duration.ofSeconds(5);
        private Duration sendTimeout = Duration.ofSeconds(10);
        /** How long Spring shutdown waits for the engine to reach a terminal state. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        /** Optional run deadline; the engine drains once it passes. */
        private Duration deadline;
    }

    @Getter
    @Setter
    public static class Routing {
        private String file;
        private boolean required = false;
        private Destination defaultDestination = new Destination();
    }

    @Getter
    @Setter
    public static class Destination {
        private String type = "kafka";
        private String target = "output-events";
        private String cluster;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 0;
        private long baseDelayMs = 5000;
        private int multiplier = 5;
    }

    @Getter
    @Setter
    public static class Codec {
        /** Wrap payloads that are not CloudEvents as "kafka.message" events instead of skipping them. */
        private boolean wrapRawMessages = false;
        /** Source stamped on output events that carry none; unset means the input event's source. */
        private String outputSource;
    }

    @Getter
    @Setter
    public static class Kafka {
        /** Extra Kafka consumer client properties, passed through verbatim. */
        private Map<String, String> consumer = new HashMap<>();
        /** Extra Kafka producer client properties, passed through verbatim. */
        private Map<String, String> producer = new HashMap<>();
    }
}
