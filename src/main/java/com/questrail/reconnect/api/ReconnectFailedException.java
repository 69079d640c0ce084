package com.questrail.reconnect.api;

import java.util.Objects;

/**
 * Thrown by {@link Reconnector#start()} when the reconnection loop ends in
 * {@link ConnectionState#FAILED}.
 *
 * <p>{@link #getCause()} is always the final error: the last establish error,
 * the last await-drop error, or the veto returned by the
 * {@link ReconnectErrorHandler}.</p>
 */
public final class ReconnectFailedException extends Exception
{
    /**
     * Why the loop gave up.
     */
    public enum FailureReason {
        CONNECT_ATTEMPTS_EXHAUSTED,
        CONNECTION_ERRORS_EXHAUSTED,
        VETOED
    }

    private final FailureReason reason;
    private final int connectAttempts;
    private final int connectionErrors;

    public ReconnectFailedException(FailureReason reason,
                                    Exception cause,
                                    int connectAttempts,
                                    int connectionErrors) {
        super(describe(reason, connectAttempts, connectionErrors), Objects.requireNonNull(cause, "cause"));
        this.reason = Objects.requireNonNull(reason, "reason");
        this.connectAttempts = connectAttempts;
        this.connectionErrors = connectionErrors;
    }

    public FailureReason reason() {
        return reason;
    }

    /**
     * Consecutive establish failures counted when the loop gave up.
     */
    public int connectAttempts() {
        return connectAttempts;
    }

    /**
     * Consecutive await-drop failures counted when the loop gave up.
     */
    public int connectionErrors() {
        return connectionErrors;
    }

    private static String describe(FailureReason reason, int connectAttempts, int connectionErrors) {
        return switch (reason) {
            case CONNECT_ATTEMPTS_EXHAUSTED -> "Gave up after " + connectAttempts + " failed connect attempt(s)";
            case CONNECTION_ERRORS_EXHAUSTED -> "Gave up after " + connectionErrors + " connection error(s)";
            case VETOED -> "Reconnection vetoed by error handler";
        };
    }
}
