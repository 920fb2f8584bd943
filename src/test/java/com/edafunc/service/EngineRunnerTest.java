package com.edafunc.service;

import com.edafunc.EdaFuncApplication;
import com.edafunc.broker.BrokerClientFactory;
import com.edafunc.codec.EventCodec;
import com.edafunc.config.EdaProperties;
import com.edafunc.core.Core;
import com.edafunc.core.CoreException;
import com.edafunc.core.CoreFactory;
import com.edafunc.handler.OutputHandler;
import com.edafunc.handler.SimpleHandler;
import com.edafunc.model.ConnectionConfig;
import com.edafunc.model.EngineState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ApplicationContext;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for EngineRunner: handler lookup, exit code and shutdown hook.
 */
@ExtendWith(MockitoExtension.class)
class EngineRunnerTest {

    @Mock private ApplicationContext applicationContext;
    @Mock private BrokerClientFactory brokerClientFactory;
    @Mock private EventCodec codec;
    @Mock private Core core;

    @TempDir
    Path tempDir;

    private EdaProperties properties;
    private final SimpleHandler simpleHandler = event -> { };

    @BeforeEach
    void setUp() {
        properties = new EdaProperties();
        properties.getRouting().setFile(tempDir.resolve("absent.yaml").toString());
    }

    private EngineRunner runner(CoreFactory coreFactory) {
        return new EngineRunner(applicationContext, coreFactory, brokerClientFactory, codec, properties,
                new SimpleMeterRegistry());
    }

    @Nested
    @DisplayName("Handler lookup")
    class HandlerLookupTests {

        @Test
        @DisplayName("the bean named eventHandler wins")
        void namedBean() {
            when(applicationContext.containsBean(EdaFuncApplication.HANDLER_BEAN)).thenReturn(true);
            when(applicationContext.getBean(EdaFuncApplication.HANDLER_BEAN)).thenReturn(simpleHandler);

            assertSame(simpleHandler, runner(() -> core).resolveHandler());
        }

        @Test
        @DisplayName("otherwise the single handler bean of either shape is used")
        void singleTypedBean() {
            OutputHandler outputHandler = event -> null;
            when(applicationContext.getBeansOfType(SimpleHandler.class)).thenReturn(Map.of());
            when(applicationContext.getBeansOfType(OutputHandler.class)).thenReturn(Map.of("fn", outputHandler));

            assertSame(outputHandler, runner(() -> core).resolveHandler());
        }

        @Test
        @DisplayName("no handler bean, or more than one, is an error")
        void ambiguous() {
            when(applicationContext.getBeansOfType(SimpleHandler.class)).thenReturn(Map.of("a", simpleHandler));
            when(applicationContext.getBeansOfType(OutputHandler.class)).thenReturn(Map.of("b", (OutputHandler) e -> null));

            assertThrows(IllegalStateException.class, () -> runner(() -> core).resolveHandler());
        }
    }

    @Test
    @DisplayName("a failing engine propagates its error and sets exit code 1")
    void failure() {
        when(applicationContext.containsBean(EdaFuncApplication.HANDLER_BEAN)).thenReturn(true);
        when(applicationContext.getBean(EdaFuncApplication.HANDLER_BEAN)).thenReturn(simpleHandler);
        EngineRunner runner = runner(() -> {
            throw new CoreException("no backend");
        });

        assertThrows(EngineFailedException.class, () -> runner.run(new DefaultApplicationArguments()));

        assertEquals(1, runner.getExitCode());
        assertEquals(EngineState.FAILED, runner.getEngine().getState());
    }

    @Test
    @DisplayName("an expired deadline drains the engine and exits with 0")
    void deadline() throws Exception {
        ConnectionConfig connection = ConnectionConfig.builder().broker("kafka:9092").topic("events").build();
        MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        when(applicationContext.containsBean(EdaFuncApplication.HANDLER_BEAN)).thenReturn(true);
        when(applicationContext.getBean(EdaFuncApplication.HANDLER_BEAN)).thenReturn(simpleHandler);
        when(core.getConnectionConfig()).thenReturn(connection);
        when(brokerClientFactory.createConsumer(connection)).thenReturn(consumer);
        properties.getEngine().setDeadline(Duration.ZERO);

        EngineRunner runner = runner(() -> core);
        runner.run(new DefaultApplicationArguments());
        runner.shutdown();

        assertEquals(0, runner.getExitCode());
        assertEquals(EngineState.CLOSED, runner.getEngine().getState());
        assertTrue(consumer.closed());
    }

    @Test
    @DisplayName("shutdown before the engine started is a no-op")
    void shutdownBeforeStart() {
        EngineRunner runner = runner(() -> core);

        runner.shutdown();

        assertNull(runner.getEngine());
    }
}
