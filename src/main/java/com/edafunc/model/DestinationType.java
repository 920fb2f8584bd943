package com.edafunc.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Category of output sink an output event can be routed to.
 *   BROKER  → publish to a Kafka topic ("kafka" or "broker")
 *   QUEUE   → message queue such as RabbitMQ ("rabbitmq" or "queue"), not publishable yet
 *   HTTP    → HTTP endpoint ("http"), not publishable yet
 *   DISCARD → intentional drop ("discard")
 */
public enum DestinationType {
    BROKER("kafka", "broker"),
    QUEUE("rabbitmq", "queue"),
    HTTP("http"),
    DISCARD("discard");

    private final List<String> names;

    DestinationType(String... names) {
        this.names = List.of(names);
    }

    /** The name written into routing files and destinations. */
    public String wireName() {
        return names.get(0);
    }

    public static Optional<DestinationType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.names.contains(normalized))
                .findFirst();
    }
}
