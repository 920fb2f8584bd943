package com.edafunc.core;

import com.edafunc.config.EdaProperties;
import com.edafunc.core.routing.RoutingConfigFile;
import com.edafunc.core.routing.RoutingConfigLoader;
import com.edafunc.core.routing.RoutingTable;
import com.edafunc.model.ConnectionConfig;
import com.edafunc.model.OutputDestination;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decision backend running inside the JVM.
 *
 * CONFIG:
 *   ConnectionConfig comes from eda.connection.*, whose defaults are
 *   taken from the environment (KAFKA_BROKER, KAFKA_TOPIC, KAFKA_GROUP).
 *
 * RETRY (configurable via application.yml, disabled by default):
 *   max-retries = 0 → never retry, backoff 0
 *   max-retries = 3, base-delay-ms = 5000, multiplier = 5:
 *     attempt 1 → retry after 5s
 *     attempt 2 → retry after 25s
 *     attempt 3 → retry after 125s
 *     attempt 4 → give up
 *
 * ROUTING:
 *   The output event's context attributes (every top-level member except
 *   the payload) are matched against the loaded rules in order. No match,
 *   or no rules loaded → the configured default destination.
 */
@Slf4j
public class InProcessCore implements Core {

    private final EdaProperties properties;
    private final ObjectMapper objectMapper;
    private final RoutingConfigLoader routingConfigLoader = new RoutingConfigLoader();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile RoutingTable routingTable;

    public InProcessCore(EdaProperties properties, ObjectMapper objectMapper) throws CoreException {
        this.properties = properties;
        this.objectMapper = objectMapper;
        EdaProperties.Destination configured = properties.getRouting().getDefaultDestination();
        RoutingConfigFile.DestinationSpec spec = new RoutingConfigFile.DestinationSpec();
        spec.setType(configured.getType());
        spec.setTarget(configured.getTarget());
        spec.setCluster(configured.getCluster());
        this.routingTable = RoutingTable.defaultsOnly(RoutingConfigLoader.toDestination(spec, "eda.routing"));
    }

    @Override
    public ConnectionConfig getConnectionConfig() throws CoreException {
        ensureOpen();
        EdaProperties.Connection connection = properties.getConnection();
        return ConnectionConfig.builder()
                .broker(connection.getBroker())
                .topic(connection.getTopic())
                .group(connection.getGroup())
                .build();
    }

    @Override
    public boolean shouldRetry(String errorMessage, int attempt) throws CoreException {
        ensureOpen();
        if (errorMessage == null) {
            return false;
        }
        return attempt >= 1 && attempt <= properties.getRetry().getMaxRetries();
    }

    @Override
    public long calculateBackoff(int attempt) throws CoreException {
        ensureOpen();
        EdaProperties.Retry retry = properties.getRetry();
        if (retry.getMaxRetries() <= 0 || attempt < 1) {
            return 0;
        }
        long factor = (long) Math.pow(retry.getMultiplier(), attempt - 1);
        try {
            return Math.multiplyExact(retry.getBaseDelayMs(), factor);
        } catch (ArithmeticException e) {
            // saturate instead of wrapping negative
            return Long.MAX_VALUE;
        }
    }

    @Override
    public OutputDestination getOutputDestination(String eventEnvelopeJson) throws CoreException {
        ensureOpen();
        Map<String, String> attributes = contextAttributes(eventEnvelopeJson);
        RoutingTable table = routingTable;
        OutputDestination destination = table.route(attributes);
        if (log.isDebugEnabled()) {
            String rule = table.matchingRule(attributes);
            log.debug("Routing decision: type={}, rule={}, destination={}",
                    attributes.get("type"), rule == null ? "<default>" : rule, destination);
        }
        return destination;
    }

    @Override
    public void loadRoutingConfig(String path) throws CoreException {
        ensureOpen();
        RoutingTable loaded = routingConfigLoader.load(Path.of(path), routingTable.getDefaultDestination());
        routingTable = loaded;
        log.info("Loaded routing config: file={}, rules={}, default={}",
                path, loaded.getRules().size(), loaded.getDefaultDestination());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("In-process core closed");
        }
    }

    public RoutingTable getRoutingTable() {
        return routingTable;
    }

    private Map<String, String> contextAttributes(String eventEnvelopeJson) throws CoreException {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(eventEnvelopeJson);
        } catch (JsonProcessingException e) {
            throw new CoreException("Output event is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new CoreException("Output event is not a JSON object");
        }

        Map<String, String> attributes = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = envelope.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey().toLowerCase(Locale.ROOT);
            JsonNode value = field.getValue();
            if (name.equals("data") || name.equals("data_base64") || value.isNull()) {
                continue;
            }
            attributes.put(name, value.isValueNode() ? value.asText() : value.toString());
        }
        return attributes;
    }

    private void ensureOpen() throws CoreException {
        if (closed.get()) {
            throw new CoreException("Core is closed");
        }
    }
}
