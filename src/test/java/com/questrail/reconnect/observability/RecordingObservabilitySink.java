package com.questrail.reconnect.observability;

import com.questrail.reconnect.api.ConnectionState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ReconnectObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ReconnectStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ReconnectErrorEvent event) {
        events.add(event);
    }

    public synchronized List<ReconnectStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof ReconnectStateTransitionEvent)
            .map(e -> (ReconnectStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<ConnectionState> getStates() {
        return getStateTransitions().stream()
            .map(ReconnectStateTransitionEvent::newState)
            .collect(Collectors.toList());
    }

    public synchronized List<ReconnectErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof ReconnectErrorEvent)
            .map(e -> (ReconnectErrorEvent) e)
            .collect(Collectors.toList());
    }
}
