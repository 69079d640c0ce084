package com.questrail.reconnect.api;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Lifecycle states emitted by a {@link Reconnector}.
 *
 * <p>States are purely observational. They never influence control flow, but
 * they are emitted in a fixed order:</p>
 * <pre>
 *   CONNECTING   -> CONNECTED | FAILING
 *   FAILING      -> FAILED | RECONNECTING
 *   CONNECTED    -> DISCONNECTED
 *   DISCONNECTED -> RECONNECTING | CLOSED
 *   RECONNECTING -> CONNECTED | FAILING | CLOSED
 * </pre>
 *
 * {@link #CLOSED} and {@link #FAILED} are terminal.
 */
public enum ConnectionState
{
    /** Emitted once, before the first connection attempt. */
    CONNECTING,

    /** Emitted before a new attempt following a failure or a drop. */
    RECONNECTING,

    /** The connection was established. */
    CONNECTED,

    /** The connection dropped without error. */
    DISCONNECTED,

    /** An attempt or an established connection failed; retry may follow. */
    FAILING,

    /** Retries are exhausted or were vetoed. Terminal. */
    FAILED,

    /** A requested stop was observed. Terminal. */
    CLOSED;

    /**
     * Human-readable name of this state.
     */
    public String displayName() {
        return switch (this) {
            case CONNECTING -> "connecting";
            case RECONNECTING -> "reconnecting";
            case CONNECTED -> "connected";
            case DISCONNECTED -> "disconnected";
            case FAILING -> "failing";
            case FAILED -> "failed";
            case CLOSED -> "closed";
        };
    }

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
