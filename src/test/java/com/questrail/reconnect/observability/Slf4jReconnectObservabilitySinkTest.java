package com.questrail.reconnect.observability;

import com.questrail.reconnect.api.ConnectionState;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jReconnectObservabilitySinkTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final IOException CAUSE = new IOException("reset");

    private final Slf4jReconnectObservabilitySink sink = new Slf4jReconnectObservabilitySink();

    private static ReconnectStateTransitionEvent transition(ConnectionState from, ConnectionState to) {
        return new ReconnectStateTransitionEvent(NOW, from, to, 1, 0);
    }

    private static ReconnectErrorEvent error(ReconnectErrorEvent.Phase phase, boolean vetoed) {
        return new ReconnectErrorEvent(NOW, phase, CAUSE, vetoed);
    }

    @Test
    void failedTransitionLogsAtErrorAndOthersAtInfo() {
        for (ConnectionState state : ConnectionState.values()) {
            Level expected = state == ConnectionState.FAILED ? Level.ERROR : Level.INFO;
            assertEquals(expected,
                Slf4jReconnectObservabilitySink.levelFor(transition(ConnectionState.FAILING, state)),
                state.name());
        }
    }

    @Test
    void absorbedErrorsLogAtWarn() {
        assertEquals(Level.WARN,
            Slf4jReconnectObservabilitySink.levelFor(error(ReconnectErrorEvent.Phase.ESTABLISH, false)));
        assertEquals(Level.WARN,
            Slf4jReconnectObservabilitySink.levelFor(error(ReconnectErrorEvent.Phase.AWAIT_DROP, false)));
    }

    @Test
    void vetoedAndTerminateErrorsLogAtError() {
        assertEquals(Level.ERROR,
            Slf4jReconnectObservabilitySink.levelFor(error(ReconnectErrorEvent.Phase.ESTABLISH, true)));
        assertEquals(Level.ERROR,
            Slf4jReconnectObservabilitySink.levelFor(error(ReconnectErrorEvent.Phase.AWAIT_DROP, true)));
        assertEquals(Level.ERROR,
            Slf4jReconnectObservabilitySink.levelFor(error(ReconnectErrorEvent.Phase.TERMINATE, false)));
    }

    @Test
    void initialTransitionWithoutPreviousStateIsLogged() {
        assertDoesNotThrow(() -> sink.onStateTransition(transition(null, ConnectionState.CONNECTING)));
        assertDoesNotThrow(() -> sink.onError(error(ReconnectErrorEvent.Phase.TERMINATE, false)));
    }
}
