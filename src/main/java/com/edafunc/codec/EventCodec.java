package com.edafunc.codec;

import com.edafunc.model.Event;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Converts between Kafka records and {@link Event} envelopes.
 */
public interface EventCodec {

    Event decode(ConsumerRecord<String, byte[]> record) throws EventDecodeException;

    /** Canonical envelope bytes, as published and as shown to the routing decision. */
    byte[] encode(Event event) throws EventEncodeException;
}
