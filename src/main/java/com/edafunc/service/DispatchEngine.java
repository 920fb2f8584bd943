package com.edafunc.service;

import com.edafunc.broker.BrokerClientFactory;
import com.edafunc.broker.ReplayFromEarliestRebalanceListener;
import com.edafunc.codec.EventCodec;
import com.edafunc.codec.EventDecodeException;
import com.edafunc.config.EdaProperties;
import com.edafunc.core.Core;
import com.edafunc.core.CoreException;
import com.edafunc.core.CoreFactory;
import com.edafunc.handler.HandlerAdapter;
import com.edafunc.handler.HandlerShape;
import com.edafunc.handler.HandlerShapeException;
import com.edafunc.model.ConnectionConfig;
import com.edafunc.model.EngineState;
import com.edafunc.model.Event;
import com.edafunc.model.HandlerOutcome;
import com.edafunc.model.RetryAttempt;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one event function: consumes CloudEvents from Kafka, hands each one
 * to the user handler and routes whatever the handler produces.
 *
 * FLOW:
 *   CREATED ──configure──→ CONFIGURED ──subscribe──→ SUBSCRIBED ──→ RUNNING
 *      │  Core from factory,      │  consumer + rebalance listener,   │
 *      │  ConnectionConfig,       │  output router (output handlers)  │
 *      │  routing file,           │                                   │
 *      │  handler shape           │                                   ↓
 *      └────── setup error ───────┴──────────→ FAILED          poll one record
 *                                                                     ↓
 *                                               decode → handler → outcome
 *                                                 │        ACK             → done
 *                                                 │        ACK_WITH_OUTPUT → OutputRouter
 *                                                 │        FAILURE         → retry decision (logged)
 *                                                 ↓
 *                                       skip malformed message
 *
 *   cancelled           → DRAINING → publishers, consumer, Core closed → CLOSED
 *   5 transport errors  → DRAINING → same release order                → FAILED
 *
 * An output event without a source gets eda.codec.output-source, or the
 * source of the input event it was derived from.
 *
 * Everything runs on the caller's thread. Cancellation is checked between
 * messages, so a running handler is never interrupted. An engine instance
 * runs once; restarting means creating a new one.
 */
@Slf4j
public class DispatchEngine {

    private final CoreFactory coreFactory;
    private final Object handler;
    private final BrokerClientFactory brokerClientFactory;
    private final EventCodec codec;
    private final EdaProperties properties;
    private final ShutdownSignal shutdownSignal;
    private final EngineMeters metrics;

    private final AtomicBoolean started = new AtomicBoolean();

    private volatile EngineState state = EngineState.CREATED;
    private volatile int consecutiveTransportErrors;

    private Core core;
    private ConnectionConfig connectionConfig;
    private HandlerAdapter handlerAdapter;
    private Consumer<String, byte[]> consumer;
    private OutputRouter outputRouter;

    public DispatchEngine(CoreFactory coreFactory, Object handler, BrokerClientFactory brokerClientFactory,
                          EventCodec codec, EdaProperties properties, ShutdownSignal shutdownSignal,
                          MeterRegistry meterRegistry) {
        this.coreFactory = coreFactory;
        this.handler = handler;
        this.brokerClientFactory = brokerClientFactory;
        this.codec = codec;
        this.properties = properties;
        this.shutdownSignal = shutdownSignal;
        this.metrics = new EngineMeters(meterRegistry);
    }

    /**
     * Runs the engine until the shutdown signal is cancelled.
     *
     * @throws EngineFailedException on a setup failure or when the transport
     *                               circuit breaker trips
     * @throws IllegalStateException when called on an engine that already ran
     */
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine already started (state " + state
                    + "); create a new engine to run again");
        }

        try {
            configure();
            subscribe();
        } catch (EngineFailedException e) {
            log.error("Engine setup failed in state {}: {}", e.getFailedIn(), e.getMessage());
            releaseResources();
            state = EngineState.FAILED;
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Engine setup crashed in state {}: {}", state, e.toString());
            releaseResources();
            state = EngineState.FAILED;
            throw e;
        }

        EngineFailedException failure = null;
        Error fatal = null;
        try {
            state = EngineState.RUNNING;
            log.info("Starting consumer: topic={}, group={}, handler={}",
                    connectionConfig.getTopic(), connectionConfig.getGroup(), handlerAdapter.getShape());
            pollLoop();
        } catch (EngineFailedException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new EngineFailedException(EngineState.RUNNING, "Dispatch loop crashed: " + e.getMessage(), e);
        } catch (Error e) {
            fatal = e;
        } finally {
            state = EngineState.DRAINING;
            releaseResources();
        }

        if (fatal != null) {
            state = EngineState.FAILED;
            log.error("Engine stopped after fatal error: {}", fatal.toString());
            throw fatal;
        }
        if (failure != null) {
            state = EngineState.FAILED;
            log.error("Engine stopped after failure: {}", failure.getMessage());
            throw failure;
        }
        state = EngineState.CLOSED;
        log.info("Consumer stopped: received={}, acknowledged={}, published={}",
                metrics.receivedCount(), metrics.acknowledgedCount(), metrics.publishedCount());
    }

    public EngineState getState() {
        return state;
    }

    public int getConsecutiveTransportErrors() {
        return consecutiveTransportErrors;
    }

    /** Detected handler shape, or null before configuration finished. */
    public HandlerShape getHandlerShape() {
        HandlerAdapter adapter = handlerAdapter;
        return adapter == null ? null : adapter.getShape();
    }

    private void configure() {
        try {
            core = coreFactory.create();
        } catch (CoreException | RuntimeException e) {
            throw new EngineFailedException(EngineState.CREATED, "Failed to create decision backend: " + e.getMessage(), e);
        }
        if (core == null) {
            throw new EngineFailedException(EngineState.CREATED, "Decision backend factory returned null", null);
        }

        try {
            connectionConfig = core.getConnectionConfig();
            if (connectionConfig == null) {
                throw new IllegalArgumentException("Decision backend returned no connection config");
            }
            connectionConfig.validate();
        } catch (CoreException | RuntimeException e) {
            throw new EngineFailedException(EngineState.CREATED, "Invalid connection config: " + e.getMessage(), e);
        }
        log.info("Connection config: broker={}, topic={}, group={}",
                connectionConfig.getBroker(), connectionConfig.getTopic(), connectionConfig.getGroup());

        loadRoutingConfig();

        try {
            handlerAdapter = HandlerAdapter.of(handler);
        } catch (HandlerShapeException e) {
            throw new EngineFailedException(EngineState.CREATED, e.getMessage(), e);
        }
        log.info("Handler detected: class={}, shape={}", handler.getClass().getName(), handlerAdapter.getShape());
        state = EngineState.CONFIGURED;
    }

    private void loadRoutingConfig() {
        EdaProperties.Routing routing = properties.getRouting();
        Class<?> handlerClass = handler == null ? null : handler.getClass();
        Optional<Path> routingFile = RoutingFileLocator.locate(
                routing.getFile(), handlerClass, Path.of("").toAbsolutePath());

        if (routingFile.isEmpty()) {
            if (routing.isRequired()) {
                throw new EngineFailedException(EngineState.CREATED,
                        "Routing config is required but no " + RoutingFileLocator.FILE_NAME + " was found", null);
            }
            log.info("No routing config found, output events use the default destination");
            return;
        }

        Path path = routingFile.get();
        try {
            core.loadRoutingConfig(path.toString());
        } catch (CoreException | RuntimeException e) {
            if (routing.isRequired()) {
                throw new EngineFailedException(EngineState.CREATED,
                        "Failed to load routing config " + path + ": " + e.getMessage(), e);
            }
            log.warn("Failed to load routing config, using default destination: file={}, error={}",
                    path, e.getMessage());
        }
    }

    private void subscribe() {
        String topic = connectionConfig.getTopic();
        try {
            consumer = brokerClientFactory.createConsumer(connectionConfig);
            consumer.subscribe(List.of(topic), new ReplayFromEarliestRebalanceListener(consumer));
        } catch (RuntimeException e) {
            throw new EngineFailedException(EngineState.CONFIGURED,
                    "Failed to subscribe to topic " + topic + ": " + e.getMessage(), e);
        }

        if (handlerAdapter.producesOutput()) {
            try {
                outputRouter = new OutputRouter(core, codec, brokerClientFactory, connectionConfig,
                        properties.getClusters());
            } catch (RuntimeException e) {
                throw new EngineFailedException(EngineState.CONFIGURED,
                        "Failed to create output producer: " + e.getMessage(), e);
            }
        }
        state = EngineState.SUBSCRIBED;
        log.info("Subscribed to topic: {}", topic);
    }

    private void pollLoop() {
        Duration pollTimeout = properties.getEngine().getPollTimeout();
        int maxConsecutiveErrors = properties.getEngine().getMaxConsecutiveErrors();

        while (!shutdownSignal.isCancelled()) {
            ConsumerRecords<String, byte[]> records;
            try {
                records = consumer.poll(pollTimeout);
            } catch (WakeupException | InterruptException e) {
                log.info("Consumer poll interrupted, stopping");
                return;
            } catch (KafkaException e) {
                consecutiveTransportErrors++;
                metrics.transportError();
                log.error("Error reading message ({}/{}): {}",
                        consecutiveTransportErrors, maxConsecutiveErrors, e.getMessage());
                if (consecutiveTransportErrors >= maxConsecutiveErrors) {
                    throw new EngineFailedException(EngineState.RUNNING,
                            "Too many consecutive transport errors (" + consecutiveTransportErrors + "), giving up", e);
                }
                continue;
            }

            if (records.isEmpty()) {
                continue;
            }
            consecutiveTransportErrors = 0;
            for (ConsumerRecord<String, byte[]> record : records) {
                dispatch(record);
            }
        }
        log.info("Shutdown requested, stopping consumer");
    }

    private void dispatch(ConsumerRecord<String, byte[]> record) {
        metrics.messageReceived();
        Event event;
        try {
            event = codec.decode(record);
        } catch (EventDecodeException e) {
            metrics.decodeFailed();
            log.error("Error parsing CloudEvent, skipping: topic={}, partition={}, offset={}, error={}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            return;
        }

        log.debug("Dispatching event: type={}, source={}, id={}", event.getType(), event.getSource(), event.getId());
        HandlerOutcome outcome = handlerAdapter.invoke(event);

        switch (outcome.getKind()) {
            case ACK -> metrics.acknowledged();
            case ACK_WITH_OUTPUT -> {
                metrics.acknowledged();
                metrics.outputProduced();
                routeOutput(withDefaultSource(outcome.getOutput(), event));
            }
            case FAILURE -> handleFailure(event, outcome);
        }
    }

    private Event withDefaultSource(Event output, Event input) {
        String source = output.getSource();
        if (source != null && !source.isBlank()) {
            return output;
        }
        String configured = properties.getCodec().getOutputSource();
        String fallback = configured != null && !configured.isBlank() ? configured : input.getSource();
        log.debug("Output event has no source, using {}: id={}", fallback, output.getId());
        return output.toBuilder().source(fallback).build();
    }

    private void routeOutput(Event output) {
        try {
            OutputRouter.Result result = outputRouter.route(output);
            if (result == OutputRouter.Result.PUBLISHED) {
                metrics.published();
            } else {
                metrics.discarded();
            }
        } catch (RoutingException e) {
            metrics.routingFailed();
            log.error("Failed to route output event: type={}, id={}, error={}",
                    output.getType(), output.getId(), e.getMessage());
        }
    }

    // No redelivery: the decision is only logged and the offset moves on.
    private void handleFailure(Event event, HandlerOutcome outcome) {
        metrics.handlerFailed();
        RetryAttempt attempt = RetryAttempt.first(outcome.errorMessage());
        log.error("Handler error: type={}, id={}, error={}",
                event.getType(), event.getId(), attempt.getErrorMessage(), outcome.getError());

        boolean retry;
        try {
            retry = core.shouldRetry(attempt.getErrorMessage(), attempt.getAttemptNumber());
        } catch (CoreException | RuntimeException e) {
            log.error("Error checking retry, treating as no retry: id={}, error={}", event.getId(), e.getMessage());
            return;
        }
        if (!retry) {
            log.debug("No retry for event: id={}", event.getId());
            return;
        }

        metrics.retryRecommended();
        try {
            long backoffMs = core.calculateBackoff(attempt.getAttemptNumber());
            log.warn("Retry recommended but not performed: id={}, attempt={}, backoffMs={}",
                    event.getId(), attempt.getAttemptNumber(), backoffMs);
        } catch (CoreException | RuntimeException e) {
            log.error("Error calculating backoff: id={}, error={}", event.getId(), e.getMessage());
        }
    }

    /**
     * Release order: output publishers, then the consumer, then the Core,
     * each step running even if an earlier one failed.
     */
    private void releaseResources() {
        boolean interrupted = Thread.interrupted();
        try {
            if (outputRouter != null) {
                try {
                    outputRouter.close(properties.getEngine().getFlushTimeout());
                } catch (RuntimeException e) {
                    log.error("Error closing output publishers: {}", e.getMessage(), e);
                }
            }
            if (consumer != null) {
                try {
                    consumer.close();
                } catch (RuntimeException e) {
                    log.error("Error closing consumer: {}", e.getMessage(), e);
                }
            }
        } finally {
            if (core != null) {
                try {
                    core.close();
                } catch (RuntimeException e) {
                    log.error("Error closing decision backend: {}", e.getMessage(), e);
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
