package com.edafunc.model;

import lombok.Value;

/**
 * One failed handler invocation as seen by the retry decision.
 * The attempt number is 1-based.
 */
@Value
public class RetryAttempt {

    String errorMessage;
    int attemptNumber;

    public static RetryAttempt first(String errorMessage) {
        return new RetryAttempt(errorMessage, 1);
    }
}
