package com.edafunc.core;

import com.edafunc.config.EdaProperties;
import com.edafunc.core.routing.RoutingConfigException;
import com.edafunc.model.ConnectionConfig;
import com.edafunc.model.OutputDestination;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InProcessCore, the decision backend that runs inside the JVM.
 *
 * Verifies:
 *   - Connection config comes from eda.connection.*
 *   - Retry decisions and exponential backoff
 *   - Routing by rules loaded from YAML, with fallback to the default
 *   - Invalid routing files are rejected and leave the previous rules active
 *   - Every call fails once the backend is closed
 */
class InProcessCoreTest {

    private static final String ORDER_EVENT =
            "{\"specversion\":\"1.0\",\"id\":\"processed-e1\",\"type\":\"order.processed\","
                    + "\"source\":\"/shop\",\"tenant\":\"acme\",\"data\":{\"type\":\"ignored\"}}";
    private static final String HEARTBEAT_EVENT =
            "{\"specversion\":\"1.0\",\"id\":\"h1\",\"type\":\"heartbeat\",\"source\":\"/monitor\"}";
    private static final String OTHER_EVENT =
            "{\"specversion\":\"1.0\",\"id\":\"x1\",\"type\":\"user.created\",\"source\":\"/crm\"}";

    @TempDir
    Path tempDir;

    private EdaProperties properties;
    private InProcessCore core;

    @BeforeEach
    void setUp() throws CoreException {
        properties = new EdaProperties();
        properties.getConnection().setBroker("kafka:9092");
        properties.getConnection().setTopic("orders");
        properties.getConnection().setGroup("order-fn");
        core = new InProcessCore(properties, new ObjectMapper());
    }

    @Test
    @DisplayName("connection config reflects eda.connection properties")
    void connectionConfig() throws CoreException {
        ConnectionConfig config = core.getConnectionConfig();

        assertEquals("kafka:9092", config.getBroker());
        assertEquals("orders", config.getTopic());
        assertEquals("order-fn", config.getGroup());
    }

    @Nested
    @DisplayName("Retry decisions")
    class RetryTests {

        @Test
        @DisplayName("retries are disabled by default")
        void disabledByDefault() throws CoreException {
            assertFalse(core.shouldRetry("boom", 1));
            assertEquals(0, core.calculateBackoff(1));
        }

        @Test
        @DisplayName("retries until max-retries is exhausted")
        void retriesUpToMax() throws CoreException {
            properties.getRetry().setMaxRetries(3);

            assertTrue(core.shouldRetry("boom", 1));
            assertTrue(core.shouldRetry("boom", 3));
            assertFalse(core.shouldRetry("boom", 4));
            assertFalse(core.shouldRetry("boom", 0));
        }

        @Test
        @DisplayName("no error message means nothing to retry")
        void nullMessage() throws CoreException {
            properties.getRetry().setMaxRetries(3);
            assertFalse(core.shouldRetry(null, 1));
        }

        @Test
        @DisplayName("backoff grows exponentially: 5s → 25s → 125s")
        void exponentialBackoff() throws CoreException {
            properties.getRetry().setMaxRetries(3);

            assertEquals(5_000, core.calculateBackoff(1));
            assertEquals(25_000, core.calculateBackoff(2));
            assertEquals(125_000, core.calculateBackoff(3));
        }

        @Test
        @DisplayName("backoff saturates at Long.MAX_VALUE for large attempt numbers")
        void backoffSaturates() throws CoreException {
            properties.getRetry().setMaxRetries(1000);

            assertEquals(Long.MAX_VALUE, core.calculateBackoff(30));
            assertEquals(Long.MAX_VALUE, core.calculateBackoff(1000));
            assertTrue(core.calculateBackoff(20) > 0);
        }
    }

    @Nested
    @DisplayName("Output routing")
    class RoutingTests {

        @Test
        @DisplayName("without rules every event goes to the default destination")
        void defaultDestination() throws CoreException {
            OutputDestination destination = core.getOutputDestination(ORDER_EVENT);

            assertEquals("kafka", destination.getType());
            assertEquals("output-events", destination.getTarget());
            assertTrue(destination.usesDefaultCluster());
        }

        @Test
        @DisplayName("rules are matched in order and fall back to the file's default")
        void rulesFromYaml() throws Exception {
            core.loadRoutingConfig(writeRouting("""
                    routing:
                      default:
                        type: kafka
                        target: everything-else
                      rules:
                        - name: orders
                          filter:
                            all:
                              - prefix: { type: "order." }
                              - exact: { tenant: acme }
                          destination:
                            type: kafka
                            target: acme-orders
                            cluster: analytics
                        - name: heartbeats
                          filter:
                            sql: "type = 'heartbeat'"
                          destination:
                            type: discard
                    """));

            OutputDestination orders = core.getOutputDestination(ORDER_EVENT);
            assertEquals("acme-orders", orders.getTarget());
            assertEquals("analytics", orders.getCluster());

            assertEquals("discard", core.getOutputDestination(HEARTBEAT_EVENT).getType());
            assertEquals("everything-else", core.getOutputDestination(OTHER_EVENT).getTarget());
            assertEquals(2, core.getRoutingTable().getRules().size());
        }

        @Test
        @DisplayName("the payload never takes part in matching")
        void dataIsIgnored() throws Exception {
            core.loadRoutingConfig(writeRouting("""
                    routing:
                      rules:
                        - name: ignored
                          filter: { exact: { type: ignored } }
                          destination: { type: discard }
                    """));

            assertEquals("output-events", core.getOutputDestination(ORDER_EVENT).getTarget());
        }

        @Test
        @DisplayName("a file without default keeps the configured default")
        void keepsConfiguredDefault() throws Exception {
            core.loadRoutingConfig(writeRouting("""
                    routing:
                      rules: []
                    """));

            assertEquals("output-events", core.getOutputDestination(OTHER_EVENT).getTarget());
        }

        @Test
        @DisplayName("an unknown destination type rejects the whole file")
        void unknownDestinationType() throws Exception {
            String path = writeRouting("""
                    routing:
                      rules:
                        - name: bad
                          filter: { exact: { type: heartbeat } }
                          destination: { type: smoke-signal, target: hill }
                    """);

            assertThrows(RoutingConfigException.class, () -> core.loadRoutingConfig(path));
            assertTrue(core.getRoutingTable().getRules().isEmpty());
        }

        @Test
        @DisplayName("an invalid filter rejects the whole file")
        void invalidFilter() throws Exception {
            String path = writeRouting("""
                    routing:
                      rules:
                        - name: bad
                          filter: { sql: "type = " }
                          destination: { type: kafka, target: t }
                    """);

            assertThrows(RoutingConfigException.class, () -> core.loadRoutingConfig(path));
        }

        @Test
        @DisplayName("a missing file is an error")
        void missingFile() {
            assertThrows(RoutingConfigException.class,
                    () -> core.loadRoutingConfig(tempDir.resolve("nope.yaml").toString()));
        }

        @Test
        @DisplayName("an output event that is not JSON is an error")
        void invalidEnvelope() {
            assertThrows(CoreException.class, () -> core.getOutputDestination("not json"));
            assertThrows(CoreException.class, () -> core.getOutputDestination("[1,2]"));
        }

        @Test
        @DisplayName("an unknown default destination type fails construction")
        void invalidConfiguredDefault() {
            properties.getRouting().getDefaultDestination().setType("carrier-pigeon");

            assertThrows(CoreException.class, () -> new InProcessCore(properties, new ObjectMapper()));
        }
    }

    @Test
    @DisplayName("after close every call fails, and close is idempotent")
    void closed() {
        core.close();
        core.close();

        assertThrows(CoreException.class, () -> core.getConnectionConfig());
        assertThrows(CoreException.class, () -> core.shouldRetry("boom", 1));
        assertThrows(CoreException.class, () -> core.getOutputDestination(ORDER_EVENT));
    }

    private String writeRouting(String yaml) throws IOException {
        Path file = tempDir.resolve("routing.yaml");
        Files.writeString(file, yaml);
        return file.toString();
    }
}
