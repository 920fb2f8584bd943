package com.edafunc.broker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes output events through a {@link KafkaTemplate}.
 *
 * Sends are synchronous (bounded by the send timeout) so a failed publish is
 * reported against the event that caused it and output order follows input
 * order.
 */
@RequiredArgsConstructor
@Slf4j
public class KafkaEventPublisher implements EventPublisher {

    private final DefaultKafkaProducerFactory<String, byte[]> producerFactory;
    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final Duration sendTimeout;

    @Override
    public void publish(String topic, String key, byte[] payload) throws PublishException {
        try {
            kafkaTemplate.send(topic, key, payload).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new PublishException("Publish to " + topic + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new PublishException("Publish to " + topic + " timed out after " + sendTimeout.toMillis() + "ms", e);
        } catch (RuntimeException e) {
            throw new PublishException("Publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close(Duration flushTimeout) {
        // closing the physical producer flushes pending records within the timeout
        producerFactory.setPhysicalCloseTimeout((int) Math.max(1, flushTimeout.toSeconds()));
        producerFactory.destroy();
        log.info("Output producer closed");
    }
}
