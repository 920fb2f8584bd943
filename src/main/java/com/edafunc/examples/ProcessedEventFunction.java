package com.edafunc.examples;

import com.edafunc.EdaFuncApplication;
import com.edafunc.handler.OutputHandler;
import com.edafunc.model.Event;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Function that answers every event with a "processed" event.
 *
 *   in:  {id: "e1", type: "order.created", source: "/shop"}
 *   out: {id: "processed-e1", type: "com.example.processed", source: "eda-func/processed-event-function",
 *         data: {original_id: "e1", original_type: "order.created", ...}}
 *
 * Events already of the processed type are acknowledged without output, so
 * routing the output back to the input topic does not loop.
 */
@Slf4j
public class ProcessedEventFunction implements OutputHandler {

    public static final String PROCESSED_TYPE = "com.example.processed";
    public static final String SOURCE = "eda-func/processed-event-function";

    private final Clock clock;

    public ProcessedEventFunction() {
        this(Clock.systemUTC());
    }

    ProcessedEventFunction(Clock clock) {
        this.clock = clock;
    }

    public static void main(String[] args) {
        EdaFuncApplication.run(new ProcessedEventFunction(), args);
    }

    @Override
    public Event handle(Event event) {
        log.info("Received event: id={}, type={}, source={}", event.getId(), event.getType(), event.getSource());
        if (PROCESSED_TYPE.equals(event.getType())) {
            return null;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ObjectNode data = JsonNodeFactory.instance.objectNode()
                .put("original_id", event.getId())
                .put("original_type", event.getType())
                .put("processed_at", now.toString())
                .put("message", "Event processed successfully");

        Event output = Event.builder()
                .id("processed-" + event.getId())
                .type(PROCESSED_TYPE)
                .source(SOURCE)
                .time(now)
                .dataContentType("application/json")
                .data(data)
                .build();
        log.info("Producing output event: id={}, type={}", output.getId(), output.getType());
        return output;
    }
}
