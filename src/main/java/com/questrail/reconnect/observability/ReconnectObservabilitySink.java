package com.questrail.reconnect.observability;

/**
 * Main interface for receiving reconnection observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are delivered synchronously on the thread that produced the
 * event, which is normally the thread running the reconnect loop.</p>
 */
public interface ReconnectObservabilitySink {
    /**
     * Called on every lifecycle state transition.
     * @param event the transition event details
     */
    void onStateTransition(ReconnectStateTransitionEvent event);

    /**
     * Called when the wrapped connection reports a failure.
     * @param event the error event
     */
    void onError(ReconnectErrorEvent event);
}
