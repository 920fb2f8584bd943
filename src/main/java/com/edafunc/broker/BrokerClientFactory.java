package com.edafunc.broker;

import com.edafunc.model.ConnectionConfig;
import org.apache.kafka.clients.consumer.Consumer;

/**
 * Creates the broker clients an engine owns: one inbound consumer, and one
 * publisher per cluster it publishes output events to.
 */
public interface BrokerClientFactory {

    Consumer<String, byte[]> createConsumer(ConnectionConfig config);

    EventPublisher createPublisher(String bootstrapServers);
}
