package com.edafunc.service;

/**
 * A single output event could not be routed or published.
 */
public class RoutingException extends Exception {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
