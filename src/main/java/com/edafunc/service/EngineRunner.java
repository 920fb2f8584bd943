package com.edafunc.service;

import com.edafunc.EdaFuncApplication;
import com.edafunc.broker.BrokerClientFactory;
import com.edafunc.codec.EventCodec;
import com.edafunc.config.EdaProperties;
import com.edafunc.core.CoreFactory;
import com.edafunc.handler.OutputHandler;
import com.edafunc.handler.SimpleHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the dispatch engine once the application context is up.
 *
 * FLOW:
 *   Spring Boot started → resolve handler bean → new DispatchEngine
 *                                                     ↓
 *                                         engine.run() blocks this thread
 *                                                     ↓
 *   SIGINT/SIGTERM → context close → @PreDestroy cancels the signal and
 *                                    waits (bounded) for the engine to drain
 *
 * Handler lookup: the bean named "eventHandler" if present, otherwise the
 * single SimpleHandler or OutputHandler bean in the context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ApplicationContext applicationContext;
    private final CoreFactory coreFactory;
    private final BrokerClientFactory brokerClientFactory;
    private final EventCodec codec;
    private final EdaProperties properties;
    private final MeterRegistry meterRegistry;

    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile DispatchEngine engine;
    private volatile ShutdownSignal shutdownSignal;
    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        Duration deadline = properties.getEngine().getDeadline();
        shutdownSignal = deadline == null ? ShutdownSignal.create() : ShutdownSignal.withTimeout(deadline);
        try {
            engine = new DispatchEngine(coreFactory, resolveHandler(), brokerClientFactory, codec,
                    properties, shutdownSignal, meterRegistry);
            engine.run();
        } catch (RuntimeException | Error e) {
            exitCode = 1;
            throw e;
        } finally {
            finished.countDown();
        }
    }

    @PreDestroy
    public void shutdown() {
        ShutdownSignal signal = shutdownSignal;
        if (signal == null) {
            return;
        }
        log.info("Shutdown signal received, draining engine");
        signal.cancel();
        Duration timeout = properties.getEngine().getShutdownTimeout();
        try {
            if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Engine did not stop within {}", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** The engine of this process, or null before it was created. */
    public DispatchEngine getEngine() {
        return engine;
    }

    Object resolveHandler() {
        if (applicationContext.containsBean(EdaFuncApplication.HANDLER_BEAN)) {
            return applicationContext.getBean(EdaFuncApplication.HANDLER_BEAN);
        }
        Map<String, Object> candidates = new LinkedHashMap<>();
        candidates.putAll(applicationContext.getBeansOfType(SimpleHandler.class));
        candidates.putAll(applicationContext.getBeansOfType(OutputHandler.class));
        if (candidates.size() != 1) {
            throw new IllegalStateException("Expected exactly one event handler bean but found "
                    + candidates.size() + " " + candidates.keySet()
                    + "; register one named '" + EdaFuncApplication.HANDLER_BEAN + "'");
        }
        return candidates.values().iterator().next();
    }
}
