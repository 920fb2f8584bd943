package com.edafunc.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a dispatch engine.
 *
 * The engine checks {@link #isCancelled()} between loop iterations only, so
 * cancelling never interrupts a handler that is already running. A signal
 * is cancelled either explicitly or once its optional deadline passes.
 */
public final class ShutdownSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Instant deadline;
    private final Clock clock;

    private ShutdownSignal(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static ShutdownSignal create() {
        return new ShutdownSignal(null, Clock.systemUTC());
    }

    public static ShutdownSignal withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    static ShutdownSignal withTimeout(Duration timeout, Clock clock) {
        return new ShutdownSignal(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }
}
