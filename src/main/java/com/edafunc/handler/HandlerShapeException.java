package com.edafunc.handler;

/**
 * The supplied handler matches neither accepted shape.
 */
public class HandlerShapeException extends IllegalArgumentException {

    public HandlerShapeException(String message) {
        super(message);
    }
}
