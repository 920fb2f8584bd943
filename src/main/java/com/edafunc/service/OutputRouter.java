package com.edafunc.service;

import com.edafunc.broker.BrokerClientFactory;
import com.edafunc.broker.EventPublisher;
import com.edafunc.broker.PublishException;
import com.edafunc.codec.EventCodec;
import com.edafunc.codec.EventEncodeException;
import com.edafunc.core.Core;
import com.edafunc.core.CoreException;
import com.edafunc.model.ConnectionConfig;
import com.edafunc.model.DestinationType;
import com.edafunc.model.Event;
import com.edafunc.model.OutputDestination;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routes output events produced by handlers.
 *
 * FLOW:
 *   Output event → encode to the canonical JSON envelope
 *                      ↓
 *               Core.getOutputDestination(envelope)
 *                      ↓
 *   ┌──────────┬───────┴───────┬──────────────┐
 *   BROKER     DISCARD         QUEUE / HTTP   unknown type
 *   publish    log, drop       warn, drop     RoutingException
 *
 * Broker publishes use the event id as message key. A destination scoped to
 * a named cluster (eda.clusters.&lt;name&gt;) gets its own publisher, created on
 * first use; no cluster or "default" uses the input cluster.
 *
 * Every failure is reported for the single event being routed.
 */
@Slf4j
public class OutputRouter {

    public enum Result {
        PUBLISHED,
        DISCARDED,
        UNSUPPORTED
    }

    private final Core core;
    private final EventCodec codec;
    private final BrokerClientFactory brokerClientFactory;
    private final Map<String, String> clusters;
    private final EventPublisher primaryPublisher;
    private final Map<String, EventPublisher> clusterPublishers = new LinkedHashMap<>();

    public OutputRouter(Core core, EventCodec codec, BrokerClientFactory brokerClientFactory,
                        ConnectionConfig connectionConfig, Map<String, String> clusters) {
        this.core = core;
        this.codec = codec;
        this.brokerClientFactory = brokerClientFactory;
        this.clusters = Map.copyOf(clusters);
        this.primaryPublisher = brokerClientFactory.createPublisher(connectionConfig.getBroker());
    }

    public Result route(Event event) throws RoutingException {
        byte[] payload;
        try {
            payload = codec.encode(event);
        } catch (EventEncodeException e) {
            throw new RoutingException("Cannot serialize output event " + event.getId() + ": " + e.getMessage(), e);
        }
        String envelopeJson = new String(payload, StandardCharsets.UTF_8);

        OutputDestination destination;
        try {
            destination = core.getOutputDestination(envelopeJson);
        } catch (CoreException | RuntimeException e) {
            throw new RoutingException("Failed to get output destination for " + event.getId() + ": " + e.getMessage(), e);
        }
        if (destination == null) {
            throw new RoutingException("Decision backend returned no destination for " + event.getId());
        }

        DestinationType type = DestinationType.fromName(destination.getType())
                .orElseThrow(() -> new RoutingException("Unknown destination type: " + destination.getType()));

        log.info("Routing output event: type={}, id={}, destType={}, target={}",
                event.getType(), event.getId(), type, destination.getTarget());

        return switch (type) {
            case BROKER -> {
                publish(event, destination, payload);
                yield Result.PUBLISHED;
            }
            case DISCARD -> {
                log.info("Discarding output event: type={}, id={}", event.getType(), event.getId());
                yield Result.DISCARDED;
            }
            case QUEUE, HTTP -> {
                log.warn("Destination type {} not yet supported, discarding output event: type={}, id={}",
                        type, event.getType(), event.getId());
                yield Result.UNSUPPORTED;
            }
        };
    }

    /**
     * Closes every publisher, each with a bounded flush. Named-cluster
     * publishers go first, the primary one last.
     */
    public void close(Duration flushTimeout) {
        for (Map.Entry<String, EventPublisher> entry : clusterPublishers.entrySet()) {
            closeQuietly(entry.getKey(), entry.getValue(), flushTimeout);
        }
        clusterPublishers.clear();
        closeQuietly(OutputDestination.DEFAULT_CLUSTER, primaryPublisher, flushTimeout);
    }

    private void publish(Event event, OutputDestination destination, byte[] payload) throws RoutingException {
        String topic = destination.getTarget();
        if (topic == null || topic.isBlank()) {
            throw new RoutingException("Broker destination for " + event.getId() + " has no target topic");
        }
        EventPublisher publisher = publisherFor(destination);
        try {
            publisher.publish(topic, event.getId(), payload);
        } catch (PublishException e) {
            throw new RoutingException("Failed to publish output event " + event.getId() + " to " + topic, e);
        }
        log.info("Published output event to Kafka: topic={}, cluster={}, type={}, id={}",
                topic, destination.usesDefaultCluster() ? OutputDestination.DEFAULT_CLUSTER : destination.getCluster(),
                event.getType(), event.getId());
    }

    private EventPublisher publisherFor(OutputDestination destination) throws RoutingException {
        if (destination.usesDefaultCluster()) {
            return primaryPublisher;
        }
        String cluster = destination.getCluster();
        EventPublisher existing = clusterPublishers.get(cluster);
        if (existing != null) {
            return existing;
        }
        String bootstrapServers = clusters.get(cluster);
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            throw new RoutingException("Unknown cluster '" + cluster + "'; configure eda.clusters." + cluster);
        }
        try {
            EventPublisher publisher = brokerClientFactory.createPublisher(bootstrapServers);
            clusterPublishers.put(cluster, publisher);
            return publisher;
        } catch (RuntimeException e) {
            throw new RoutingException("Cannot create publisher for cluster '" + cluster + "'", e);
        }
    }

    private static void closeQuietly(String cluster, EventPublisher publisher, Duration flushTimeout) {
        try {
            publisher.close(flushTimeout);
        } catch (RuntimeException e) {
            log.error("Failed to close output publisher: cluster={}, error={}", cluster, e.getMessage(), e);
        }
    }
}
