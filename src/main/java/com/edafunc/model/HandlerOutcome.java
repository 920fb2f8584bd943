package com.edafunc.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;

/**
 * Result of one handler invocation.
 *
 *   ACK             → handler succeeded, nothing to publish
 *   ACK_WITH_OUTPUT → handler succeeded and produced exactly one derived event
 *   FAILURE         → handler failed; the output (if any) is ignored
 *
 * Outcomes are plain return values: the engine holds at most one at a time.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class HandlerOutcome {

    public enum Kind {
        ACK,
        ACK_WITH_OUTPUT,
        FAILURE
    }

    private static final HandlerOutcome ACK = new HandlerOutcome(Kind.ACK, null, null);

    private final Kind kind;
    private final Event output;
    private final Throwable error;

    public static HandlerOutcome ack() {
        return ACK;
    }

    public static HandlerOutcome ackWithOutput(Event output) {
        return new HandlerOutcome(Kind.ACK_WITH_OUTPUT, Objects.requireNonNull(output, "output"), null);
    }

    public static HandlerOutcome failure(Throwable error) {
        return new HandlerOutcome(Kind.FAILURE, null, Objects.requireNonNull(error, "error"));
    }

    /**
     * The failure description handed to the retry decision. Falls back to the
     * exception class name when the exception carries no message.
     */
    public String errorMessage() {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }
}
