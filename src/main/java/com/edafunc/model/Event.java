package com.edafunc.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * The standard event envelope (CloudEvents 1.0) used on both input and output.
 *
 * Example:
 * {
 *   "specversion": "1.0",
 *   "id": "e1",
 *   "type": "order.created",
 *   "source": "/shop",
 *   "datacontenttype": "application/json",
 *   "data": {"orderId": 42},
 *   "tenant": "acme"            ← extension attribute
 * }
 *
 * Instances are immutable. The data tree is copied on the way in (builder)
 * and on the way out (getter), so a handler can never mutate an event that
 * another component still holds.
 */
@Value
@Builder(toBuilder = true)
public class Event {

    public static final String SPEC_VERSION = "1.0";

    @Builder.Default
    String specVersion = SPEC_VERSION;

    String id;
    String type;
    String source;
    String subject;
    OffsetDateTime time;
    String dataContentType;
    String dataSchema;

    /** Structured payload; binary payloads are held as a binary node. */
    JsonNode data;

    @Singular
    Map<String, Object> extensions;

    public JsonNode getData() {
        return data == null ? null : data.deepCopy();
    }

    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode();
    }

    public Object getExtension(String name) {
        return extensions.get(name);
    }

    public static class EventBuilder {
        public EventBuilder data(JsonNode data) {
            this.data = data == null ? null : data.deepCopy();
            return this;
        }
    }
}
