package com.edafunc.handler;

import com.edafunc.model.Event;

/**
 * Handler that consumes events without producing any.
 *
 * <pre>
 * SimpleHandler handler = event -> log.info("Received {}", event.getId());
 * </pre>
 *
 * Returning normally acknowledges the event; throwing reports a failure.
 */
@FunctionalInterface
public interface SimpleHandler {

    void handle(Event event) throws Exception;
}
