package com.edafunc.codec;

import com.edafunc.config.EdaProperties;
import com.edafunc.model.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CloudEvents codec for Kafka records.
 *
 * DECODING tries, in order:
 *   1. Binary mode:     a "ce_specversion" header is present; attributes come
 *                       from ce_* headers, the record value is the data
 *   2. Structured mode: the record value is a JSON envelope
 *                       {"specversion":"1.0","id":..,"type":..,"source":..,"data":..}
 *                       ("specversion" may be omitted, it defaults to 1.0)
 *   3. Raw wrapping:    only with eda.codec.wrap-raw-messages=true; any other
 *                       payload becomes a "kafka.message" event from source "kafka"
 *
 * ENCODING always produces a structured JSON envelope. Binary data is written
 * as "data_base64", extensions as top-level members.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CloudEventJsonCodec implements EventCodec {

    static final String HEADER_PREFIX = "ce_";
    static final String RAW_SOURCE = "kafka";
    static final String RAW_TYPE = "kafka.message";

    private static final Set<String> CONTEXT_ATTRIBUTES = Set.of(
            "specversion", "id", "type", "source", "subject", "time",
            "datacontenttype", "dataschema", "data", "data_base64");

    private final ObjectMapper objectMapper;
    private final EdaProperties properties;

    @Override
    public Event decode(ConsumerRecord<String, byte[]> record) throws EventDecodeException {
        Headers headers = record.headers();
        if (headers != null && headers.lastHeader(HEADER_PREFIX + "specversion") != null) {
            return decodeBinary(record);
        }

        byte[] value = record.value();
        if (value == null || value.length == 0) {
            throw new EventDecodeException("Message at " + coordinates(record) + " has no payload");
        }
        try {
            return decodeStructured(value);
        } catch (EventDecodeException e) {
            if (properties.getCodec().isWrapRawMessages()) {
                log.debug("Wrapping non-CloudEvent payload at {}: {}", coordinates(record), e.getMessage());
                return wrapRaw(record);
            }
            throw e;
        }
    }

    @Override
    public byte[] encode(Event event) throws EventEncodeException {
        requireAttribute("id", event.getId());
        requireAttribute("type", event.getType());
        requireAttribute("source", event.getSource());

        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("specversion", event.getSpecVersion() == null ? Event.SPEC_VERSION : event.getSpecVersion());
        envelope.put("id", event.getId());
        envelope.put("source", event.getSource());
        envelope.put("type", event.getType());
        putIfPresent(envelope, "subject", event.getSubject());
        if (event.getTime() != null) {
            envelope.put("time", event.getTime().toString());
        }
        putIfPresent(envelope, "datacontenttype", event.getDataContentType());
        putIfPresent(envelope, "dataschema", event.getDataSchema());

        for (Map.Entry<String, Object> extension : event.getExtensions().entrySet()) {
            String name = extension.getKey().toLowerCase(Locale.ROOT);
            if (CONTEXT_ATTRIBUTES.contains(name)) {
                throw new EventEncodeException("Extension name clashes with a context attribute: " + name);
            }
            envelope.set(name, objectMapper.valueToTree(extension.getValue()));
        }

        if (event.hasData()) {
            JsonNode data = event.getData();
            if (data.isBinary()) {
                envelope.put("data_base64", Base64.getEncoder().encodeToString(((BinaryNode) data).binaryValue()));
            } else {
                envelope.set("data", data);
            }
        }

        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new EventEncodeException("Cannot serialize event " + event.getId(), e);
        }
    }

    private Event decodeStructured(byte[] value) throws EventDecodeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(value);
        } catch (IOException e) {
            throw new EventDecodeException("Payload is not JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EventDecodeException("Payload is not a JSON object");
        }

        Event.EventBuilder builder = Event.builder()
                .id(requiredText(root, "id"))
                .type(requiredText(root, "type"))
                .source(requiredText(root, "source"))
                .subject(optionalText(root, "subject"))
                .time(parseTime(optionalText(root, "time")))
                .dataContentType(optionalText(root, "datacontenttype"))
                .dataSchema(optionalText(root, "dataschema"));

        String specVersion = optionalText(root, "specversion");
        if (specVersion != null) {
            builder.specVersion(specVersion);
        }

        if (root.hasNonNull("data_base64")) {
            try {
                builder.data(BinaryNode.valueOf(Base64.getDecoder().decode(root.get("data_base64").asText())));
            } catch (IllegalArgumentException e) {
                throw new EventDecodeException("data_base64 is not valid base64", e);
            }
        } else if (root.has("data")) {
            builder.data(root.get("data"));
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!CONTEXT_ATTRIBUTES.contains(field.getKey()) && !field.getValue().isNull()) {
                builder.extension(field.getKey(), extensionValue(field.getValue()));
            }
        }
        return builder.build();
    }

    private Event decodeBinary(ConsumerRecord<String, byte[]> record) throws EventDecodeException {
        Event.EventBuilder builder = Event.builder();
        String id = null;
        String type = null;
        String source = null;
        String contentType = null;

        for (Header header : record.headers()) {
            String key = header.key().toLowerCase(Locale.ROOT);
            String value = header.value() == null ? null : new String(header.value(), StandardCharsets.UTF_8);
            if (key.equals("content-type")) {
                contentType = value;
                continue;
            }
            if (!key.startsWith(HEADER_PREFIX) || value == null) {
                continue;
            }
            String attribute = key.substring(HEADER_PREFIX.length());
            switch (attribute) {
                case "id" -> id = value;
                case "type" -> type = value;
                case "source" -> source = value;
                case "specversion" -> builder.specVersion(value);
                case "subject" -> builder.subject(value);
                case "time" -> builder.time(parseTime(value));
                case "dataschema" -> builder.dataSchema(value);
                case "datacontenttype" -> contentType = value;
                default -> builder.extension(attribute, value);
            }
        }

        if (isBlank(id) || isBlank(type) || isBlank(source)) {
            throw new EventDecodeException("Binary-mode message at " + coordinates(record)
                    + " lacks ce_id, ce_type or ce_source");
        }
        builder.id(id).type(type).source(source).dataContentType(contentType);

        byte[] value = record.value();
        if (value != null && value.length > 0) {
            builder.data(binaryData(value, contentType));
        }
        return builder.build();
    }

    private JsonNode binaryData(byte[] value, String contentType) throws EventDecodeException {
        String normalized = contentType == null ? null : contentType.toLowerCase(Locale.ROOT);
        if (normalized == null || normalized.contains("json")) {
            try {
                return objectMapper.readTree(value);
            } catch (IOException e) {
                if (normalized != null) {
                    throw new EventDecodeException("Data declared as " + contentType + " is not JSON", e);
                }
                return BinaryNode.valueOf(value);
            }
        }
        if (normalized.startsWith("text/")) {
            return TextNode.valueOf(new String(value, StandardCharsets.UTF_8));
        }
        return BinaryNode.valueOf(value);
    }

    private Event wrapRaw(ConsumerRecord<String, byte[]> record) {
        String id = isBlank(record.key())
                ? record.topic() + "-" + record.partition() + "-" + record.offset()
                : record.key();
        Event.EventBuilder builder = Event.builder()
                .id(id)
                .source(RAW_SOURCE)
                .type(RAW_TYPE);
        try {
            builder.data(objectMapper.readTree(record.value())).dataContentType("application/json");
        } catch (IOException e) {
            builder.data(TextNode.valueOf(new String(record.value(), StandardCharsets.UTF_8)))
                    .dataContentType("text/plain");
        }
        return builder.build();
    }

    private static String requiredText(JsonNode root, String field) throws EventDecodeException {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new EventDecodeException("Envelope attribute '" + field + "' is missing or not a string");
        }
        return node.asText();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static OffsetDateTime parseTime(String raw) throws EventDecodeException {
        if (raw == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw);
        } catch (DateTimeParseException e) {
            throw new EventDecodeException("Envelope attribute 'time' is not RFC 3339: " + raw, e);
        }
    }

    private static Object extensionValue(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.toString();
    }

    private static void requireAttribute(String name, String value) throws EventEncodeException {
        if (isBlank(value)) {
            throw new EventEncodeException("Event is missing required attribute '" + name + "'");
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String coordinates(ConsumerRecord<?, ?> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
