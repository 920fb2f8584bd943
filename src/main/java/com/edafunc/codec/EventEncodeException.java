package com.edafunc.codec;

/**
 * An event could not be serialized, typically because a required attribute is missing.
 */
public class EventEncodeException extends Exception {

    public EventEncodeException(String message) {
        super(message);
    }

    public EventEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
