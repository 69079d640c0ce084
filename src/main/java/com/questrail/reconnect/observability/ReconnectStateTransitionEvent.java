package com.questrail.reconnect.observability;

import com.questrail.reconnect.api.ConnectionState;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a lifecycle transition of the reconnect loop.
 *
 * @param previousState state before the transition; {@code null} for the
 *                      initial {@link ConnectionState#CONNECTING}
 * @param connectAttempts consecutive establish failures after the transition
 * @param connectionErrors consecutive await-drop failures after the transition
 */
public record ReconnectStateTransitionEvent(
    Instant timestamp,
    ConnectionState previousState,
    ConnectionState newState,
    int connectAttempts,
    int connectionErrors
) {
    public ReconnectStateTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(newState, "newState");
    }

    public boolean isTerminal() {
        return newState.isTerminal();
    }
}
