package com.questrail.reconnect.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a failure reported by the wrapped connection.
 *
 * @param vetoed whether the error handler turned this failure into a terminal one
 */
public record ReconnectErrorEvent(
    Instant timestamp,
    Phase phase,
    Throwable cause,
    boolean vetoed
) {
    /**
     * Connection operation that failed.
     */
    public enum Phase {
        ESTABLISH,
        AWAIT_DROP,
        TERMINATE
    }

    public ReconnectErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(cause, "cause");
    }
}
