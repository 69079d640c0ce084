package com.questrail.reconnect.observability;

/**
 * No-op implementation of ReconnectObservabilitySink.
 */
public final class NullObservabilitySink implements ReconnectObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ReconnectStateTransitionEvent event) {}

    @Override
    public void onError(ReconnectErrorEvent event) {}
}
