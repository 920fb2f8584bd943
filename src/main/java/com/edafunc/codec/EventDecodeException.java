package com.edafunc.codec;

/**
 * A broker message could not be turned into an event.
 */
public class EventDecodeException extends Exception {

    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
