package com.edafunc.service;

import com.edafunc.model.EngineState;
import lombok.Getter;

/**
 * The engine stopped because of a fatal error: a setup failure or a tripped
 * transport circuit breaker.
 */
@Getter
public class EngineFailedException extends RuntimeException {

    /** State the engine was in when the error happened. */
    private final EngineState failedIn;

    public EngineFailedException(EngineState failedIn, String message, Throwable cause) {
        super(message, cause);
        this.failedIn = failedIn;
    }
}
