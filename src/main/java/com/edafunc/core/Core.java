package com.edafunc.core;

import com.edafunc.model.ConnectionConfig;
import com.edafunc.model.OutputDestination;

/**
 * Capability contract of the decision backend.
 *
 * The dispatch engine obtains its configuration and every retry/routing
 * decision through this interface and never assumes which implementation
 * (in-process, native library, sandboxed module) sits behind it.
 *
 * Apart from {@link #close()}, calls carry no ordering dependency on each
 * other. Failures are reported as {@link CoreException}; the engine decides
 * which of them are fatal.
 */
public interface Core extends AutoCloseable {

    /** Called once, before any broker interaction. */
    ConnectionConfig getConnectionConfig() throws CoreException;

    /**
     * @param errorMessage description of the handler failure
     * @param attempt      1-based attempt number
     */
    boolean shouldRetry(String errorMessage, int attempt) throws CoreException;

    /** Delay in milliseconds before the given attempt; only asked after shouldRetry said yes. */
    long calculateBackoff(int attempt) throws CoreException;

    /**
     * @param eventEnvelopeJson the fully serialized output event
     */
    OutputDestination getOutputDestination(String eventEnvelopeJson) throws CoreException;

    /** Loads routing rules from a YAML file. Called at most once, at startup. */
    void loadRoutingConfig(String path) throws CoreException;

    /** Idempotent. */
    @Override
    void close();
}
