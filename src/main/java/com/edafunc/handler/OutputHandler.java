package com.edafunc.handler;

import com.edafunc.model.Event;

/**
 * Handler that may derive one output event from each input event.
 *
 * <pre>
 * OutputHandler handler = event -> Event.builder()
 *         .id("processed-" + event.getId())
 *         .type("order.processed")
 *         .source("/orders")
 *         .build();
 * </pre>
 *
 * Returning null acknowledges without output. When the handler throws, any
 * output is discarded and the failure goes through the retry decision.
 */
@FunctionalInterface
public interface OutputHandler {

    Event handle(Event event) throws Exception;
}
