package com.edafunc.broker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;

import java.util.Collection;

/**
 * Rewinds every newly assigned partition to its earliest offset.
 *
 * This makes demos reproducible: each (re)assignment replays the whole
 * topic. It also means every restart reprocesses everything, which is not
 * acceptable outside a demo setup.
 */
@RequiredArgsConstructor
@Slf4j
public class ReplayFromEarliestRebalanceListener implements ConsumerRebalanceListener {

    private final Consumer<?, ?> consumer;

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        if (partitions.isEmpty()) {
            return;
        }
        log.info("Partitions assigned: {}, replaying from earliest offset", partitions);
        consumer.seekToBeginning(partitions);
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        if (!partitions.isEmpty()) {
            log.info("Partitions revoked: {}", partitions);
        }
    }
}
