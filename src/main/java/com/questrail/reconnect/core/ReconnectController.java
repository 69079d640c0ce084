package com.questrail.reconnect.core;

import com.questrail.reconnect.api.ConnectionState;
import com.questrail.reconnect.api.ReconnectFailedException;
import com.questrail.reconnect.api.ReconnectFailedException.FailureReason;
import com.questrail.reconnect.api.ReconnectableConnection;
import com.questrail.reconnect.api.Reconnector;
import com.questrail.reconnect.config.ReconnectConfig;
import com.questrail.reconnect.observability.ReconnectErrorEvent;
import com.questrail.reconnect.observability.ReconnectStateTransitionEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * ReconnectController
 * =============================================================================
 * Retry state machine that keeps a {@link ReconnectableConnection} up.
 *
 * <h2>Loop</h2>
 * Each iteration:
 * <ol>
 *   <li>observes a pending stop request and exits through {@code CLOSED}</li>
 *   <li>establishes the connection; on failure counts an attempt and retries
 *       without waiting for a drop</li>
 *   <li>awaits the drop; on failure counts a connection error</li>
 *   <li>re-enters through {@code RECONNECTING} unless a stop was requested</li>
 * </ol>
 * Attempt and error counters are independent and reset on the matching
 * success. A veto from the error handler ends the loop regardless of the
 * counters.
 *
 * <h2>Threading Model</h2>
 * {@link #start()} runs on a caller-provided thread. {@link #close()} is called
 * from another thread; it relies on {@link ReconnectableConnection#terminate()}
 * to break {@code start()} out of a blocked call. The stop request itself is
 * only checked once per iteration, never preemptively. Hooks and the
 * observability sink are invoked on the {@code start()} thread, except for
 * terminate errors which are reported on the closing thread.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   controller.start()  -> blocks until CLOSED or FAILED
 *   controller.close()  -> stop request + terminate, then waits for start() to unwind
 * </pre>
 * A controller runs once; it is inert after termination.
 */
public final class ReconnectController implements Reconnector
{
    private final ReconnectableConnection connection;
    private final ReconnectConfig config;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch loopExited = new CountDownLatch(1);

    private volatile ConnectionState state;

    // Confined to the start() thread.
    private int connectAttempts;
    private int connectionErrors;

    public ReconnectController(ReconnectableConnection connection, ReconnectConfig config) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Creates a controller whose config is built by applying the customizers
     * in order.
     */
    @SafeVarargs
    public static ReconnectController create(ReconnectableConnection connection,
                                             Consumer<ReconnectConfig.Builder>... customizers) {
        return new ReconnectController(connection, ReconnectConfig.of(customizers));
    }

    @Override
    public void start() throws ReconnectFailedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Reconnector already started");
        }
        try {
            runLoop();
        } finally {
            loopExited.countDown();
        }
    }

    private void runLoop() throws ReconnectFailedException {
        emit(ConnectionState.CONNECTING);
        while (true) {
            if (stopRequested.get()) {
                emit(ConnectionState.CLOSED);
                return;
            }

            Exception connectError = null;
            try {
                connection.establish();
            } catch (InterruptedException e) {
                stopOnInterrupt();
                continue;
            } catch (Exception e) {
                connectError = e;
            }

            if (connectError == null) {
                connectAttempts = 0;
                emit(ConnectionState.CONNECTED);
            } else {
                Optional<Exception> veto = notifyError(ReconnectErrorEvent.Phase.ESTABLISH, connectError);
                connectAttempts++;
                emit(ConnectionState.FAILING);
                if (veto.isPresent()) {
                    throw fail(FailureReason.VETOED, veto.get());
                }
                if (limitReached(connectAttempts, config.maxConnectAttempts())) {
                    throw fail(FailureReason.CONNECT_ATTEMPTS_EXHAUSTED, connectError);
                }
                emit(ConnectionState.RECONNECTING);
                continue;
            }

            Exception dropError = null;
            try {
                connection.awaitDrop();
            } catch (InterruptedException e) {
                stopOnInterrupt();
            } catch (Exception e) {
                dropError = e;
            }

            if (dropError == null) {
                connectionErrors = 0;
                emit(ConnectionState.DISCONNECTED);
            } else {
                Optional<Exception> veto = notifyError(ReconnectErrorEvent.Phase.AWAIT_DROP, dropError);
                connectionErrors++;
                emit(ConnectionState.FAILING);
                if (veto.isPresent()) {
                    throw fail(FailureReason.VETOED, veto.get());
                }
                if (limitReached(connectionErrors, config.maxConnectionErrors())) {
                    throw fail(FailureReason.CONNECTION_ERRORS_EXHAUSTED, dropError);
                }
            }

            if (!stopRequested.get()) {
                emit(ConnectionState.RECONNECTING);
            }
        }
    }

    /**
     * Requests a stop, terminates the connection and waits until
     * {@link #start()} has returned.
     *
     * <p>If {@code start()} has not been invoked yet, this blocks until it is
     * invoked and observes the stop. Use {@link #close(Duration)} for a bounded
     * wait.</p>
     */
    @Override
    public void close() throws Exception {
        stopRequested.set(true);
        Exception terminateError = terminateQuietly();
        try {
            loopExited.await();
        } catch (InterruptedException e) {
            if (terminateError != null) {
                e.addSuppressed(terminateError);
            }
            throw e;
        }
        if (terminateError != null) {
            throw terminateError;
        }
    }

    /**
     * Bounded variant of {@link #close()}.
     *
     * @return {@code true} if {@link #start()} unwound within the timeout
     * @throws Exception the terminate exception, once the wait is over
     */
    public boolean close(Duration timeout) throws Exception {
        Objects.requireNonNull(timeout, "timeout");
        stopRequested.set(true);
        Exception terminateError = terminateQuietly();
        boolean exited;
        try {
            exited = loopExited.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            if (terminateError != null) {
                e.addSuppressed(terminateError);
            }
            throw e;
        }
        if (terminateError != null) {
            throw terminateError;
        }
        return exited;
    }

    /**
     * Waits for {@link #start()} to return, without requesting a stop.
     *
     * @return {@code true} if the loop exited within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return loopExited.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Returns the most recently emitted state, or {@code null} before
     * {@link #start()}.
     */
    public ConnectionState currentState() {
        return state;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private Exception terminateQuietly() {
        try {
            connection.terminate();
            return null;
        } catch (Exception e) {
            config.observabilitySink().onError(new ReconnectErrorEvent(
                config.wallClock().now(),
                ReconnectErrorEvent.Phase.TERMINATE,
                e,
                false
            ));
            return e;
        }
    }

    /**
     * An interrupted start() thread is treated as a stop request; the flag is
     * restored so the caller still sees it.
     */
    private void stopOnInterrupt() {
        Thread.currentThread().interrupt();
        stopRequested.set(true);
    }

    private Optional<Exception> notifyError(ReconnectErrorEvent.Phase phase, Exception error) {
        Optional<Exception> veto = Optional.empty();
        if (config.errorHandler().isPresent()) {
            veto = Objects.requireNonNullElse(config.errorHandler().get().onError(error), Optional.empty());
        }
        config.observabilitySink().onError(new ReconnectErrorEvent(
            config.wallClock().now(),
            phase,
            error,
            veto.isPresent()
        ));
        return veto;
    }

    private ReconnectFailedException fail(FailureReason reason, Exception cause) {
        emit(ConnectionState.FAILED);
        return new ReconnectFailedException(reason, cause, connectAttempts, connectionErrors);
    }

    private static boolean limitReached(int count, int limit) {
        return limit > 0 && count >= limit;
    }

    private void emit(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        if (config.stateListener().isPresent()) {
            config.stateListener().get().onState(next);
        }
        config.observabilitySink().onStateTransition(new ReconnectStateTransitionEvent(
            config.wallClock().now(),
            previous,
            next,
            connectAttempts,
            connectionErrors
        ));
    }
}
