package com.edafunc.model;

/**
 * Lifecycle of a dispatch engine.
 *
 *   CREATED → CONFIGURED → SUBSCRIBED → RUNNING → DRAINING → CLOSED
 *
 * FAILED is reached from the setup states on fatal errors, and after the
 * transport circuit breaker trips. CLOSED and FAILED are terminal.
 */
public enum EngineState {
    CREATED,
    CONFIGURED,
    SUBSCRIBED,
    RUNNING,
    DRAINING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
