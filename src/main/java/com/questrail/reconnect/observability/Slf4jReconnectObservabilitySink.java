package com.questrail.reconnect.observability;

import com.questrail.reconnect.api.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Production implementation of ReconnectObservabilitySink that emits logs via SLF4J.
 *
 * <p>Transitions log at INFO, except {@link ConnectionState#FAILED} at ERROR.
 * Errors the loop absorbs log at WARN; vetoed and terminate errors at ERROR.</p>
 */
public final class Slf4jReconnectObservabilitySink implements ReconnectObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jReconnectObservabilitySink.class);

    @Override
    public void onStateTransition(ReconnectStateTransitionEvent event) {
        log.atLevel(levelFor(event))
            .addArgument(event.previousState() != null ? event.previousState() : "none")
            .addArgument(event.newState())
            .addArgument(event.connectAttempts())
            .addArgument(event.connectionErrors())
            .log("Connection state: {} -> {} (connect attempts={}, connection errors={})");
    }

    @Override
    public void onError(ReconnectErrorEvent event) {
        log.atLevel(levelFor(event))
            .setCause(event.cause())
            .addArgument(event.phase())
            .addArgument(event.vetoed())
            .log("Connection error during {} (vetoed={})");
    }

    static Level levelFor(ReconnectStateTransitionEvent event) {
        return event.newState() == ConnectionState.FAILED ? Level.ERROR : Level.INFO;
    }

    static Level levelFor(ReconnectErrorEvent event) {
        if (event.vetoed() || event.phase() == ReconnectErrorEvent.Phase.TERMINATE) {
            return Level.ERROR;
        }
        return Level.WARN;
    }
}
