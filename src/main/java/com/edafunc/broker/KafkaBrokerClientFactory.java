package com.edafunc.broker;

import com.edafunc.config.EdaProperties;
import com.edafunc.model.ConnectionConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds Kafka clients through Spring Kafka's factories.
 *
 * Consumer defaults:
 *   auto.offset.reset  = earliest
 *   enable.auto.commit = true
 *   max.poll.records   = 1       → one message per poll, so cancellation is
 *                                  observed between every two messages
 *
 * Anything under eda.kafka.consumer / eda.kafka.producer is passed through
 * and wins over these defaults.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KafkaBrokerClientFactory implements BrokerClientFactory {

    private final EdaProperties properties;

    @Override
    public Consumer<String, byte[]> createConsumer(ConnectionConfig config) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getBroker());
        if (config.getGroup() != null && !config.getGroup().isBlank()) {
            props.put(ConsumerConfig.GROUP_ID_CONFIG, config.getGroup());
        }
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);
        props.putAll(properties.getKafka().getConsumer());

        log.info("Creating Kafka consumer: broker={}, group={}", config.getBroker(), config.getGroup());
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), new ByteArrayDeserializer())
                .createConsumer();
    }

    @Override
    public EventPublisher createPublisher(String bootstrapServers) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.putAll(properties.getKafka().getProducer());

        DefaultKafkaProducerFactory<String, byte[]> producerFactory =
                new DefaultKafkaProducerFactory<>(props, new StringSerializer(), new ByteArraySerializer());
        log.info("Creating Kafka producer for output events: broker={}", bootstrapServers);
        return new KafkaEventPublisher(producerFactory, new KafkaTemplate<>(producerFactory),
                properties.getEngine().getSendTimeout());
    }
}
