package com.edafunc.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Engine counters registered on a Micrometer {@link MeterRegistry}.
 *
 * Counters:
 *   eda.events.received            messages taken off the input topic
 *   eda.events.decode.failures     messages skipped as malformed
 *   eda.events.acknowledged        handler calls that returned without error
 *   eda.handler.failures           handler calls that failed
 *   eda.retries.recommended        failures the backend would have retried
 *   eda.outputs.produced           output events returned by the handler
 *   eda.outputs.published          output events published to Kafka
 *   eda.outputs.discarded          output events dropped by routing
 *   eda.outputs.routing.failures   output events that could not be routed
 *   eda.transport.errors           failed polls
 */
public final class EngineMeters {

    public static final String PREFIX = "eda.";

    public static final String RECEIVED = "eda.events.received";
    public static final String DECODE_FAILURES = "eda.events.decode.failures";
    public static final String ACKNOWLEDGED = "eda.events.acknowledged";
    public static final String HANDLER_FAILURES = "eda.handler.failures";
    public static final String RETRY_RECOMMENDED = "eda.retries.recommended";
    public static final String OUTPUTS_PRODUCED = "eda.outputs.produced";
    public static final String PUBLISHED = "eda.outputs.published";
    public static final String DISCARDED = "eda.outputs.discarded";
    public static final String ROUTING_FAILURES = "eda.outputs.routing.failures";
    public static final String TRANSPORT_ERRORS = "eda.transport.errors";

    private final Counter received;
    private final Counter decodeFailures;
    private final Counter acknowledged;
    private final Counter handlerFailures;
    private final Counter retryRecommended;
    private final Counter outputsProduced;
    private final Counter published;
    private final Counter discarded;
    private final Counter routingFailures;
    private final Counter transportErrors;

    public EngineMeters(MeterRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        this.received = counter(registry, RECEIVED, "Messages taken off the input topic");
        this.decodeFailures = counter(registry, DECODE_FAILURES, "Messages skipped because they could not be decoded");
        this.acknowledged = counter(registry, ACKNOWLEDGED, "Handler calls that returned without error");
        this.handlerFailures = counter(registry, HANDLER_FAILURES, "Handler calls that failed");
        this.retryRecommended = counter(registry, RETRY_RECOMMENDED, "Failures the decision backend would retry");
        this.outputsProduced = counter(registry, OUTPUTS_PRODUCED, "Output events returned by the handler");
        this.published = counter(registry, PUBLISHED, "Output events published to Kafka");
        this.discarded = counter(registry, DISCARDED, "Output events dropped by routing");
        this.routingFailures = counter(registry, ROUTING_FAILURES, "Output events that could not be routed");
        this.transportErrors = counter(registry, TRANSPORT_ERRORS, "Polls that failed with a transport error");
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(registry);
    }

    void messageReceived() {
        received.increment();
    }

    void decodeFailed() {
        decodeFailures.increment();
    }

    void acknowledged() {
        acknowledged.increment();
    }

    void handlerFailed() {
        handlerFailures.increment();
    }

    void retryRecommended() {
        retryRecommended.increment();
    }

    void outputProduced() {
        outputsProduced.increment();
    }

    void published() {
        published.increment();
    }

    void discarded() {
        discarded.increment();
    }

    void routingFailed() {
        routingFailures.increment();
    }

    void transportError() {
        transportErrors.increment();
    }

    long receivedCount() {
        return (long) received.count();
    }

    long acknowledgedCount() {
        return (long) acknowledged.count();
    }

    long publishedCount() {
        return (long) published.count();
    }
}
