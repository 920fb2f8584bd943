package com.edafunc.model;

import lombok.Builder;
import lombok.Value;

/**
 * Kafka connection settings handed out by the decision backend.
 * Fetched once at startup and never changed for the engine's lifetime.
 */
@Value
@Builder
public class ConnectionConfig {

    String broker;
    String topic;
    String group;

    /**
     * Broker and topic are mandatory; the group may be blank (Kafka then
     * rejects subscription, which is reported as a subscribe failure).
     */
    public void validate() {
        if (broker == null || broker.isBlank()) {
            throw new IllegalArgumentException("Connection config has no broker address");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Connection config has no topic");
        }
    }
}
