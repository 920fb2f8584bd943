package com.edafunc.broker;

/**
 * An output event could not be published.
 */
public class PublishException extends Exception {

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
