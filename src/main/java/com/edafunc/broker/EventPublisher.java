package com.edafunc.broker;

import java.time.Duration;

/**
 * Outbound connection used to publish output events.
 */
public interface EventPublisher {

    /**
     * Publishes one message and waits for the broker acknowledgement.
     */
    void publish(String topic, String key, byte[] payload) throws PublishException;

    /**
     * Flushes pending sends, waiting at most {@code flushTimeout}, then closes.
     */
    void close(Duration flushTimeout);
}
