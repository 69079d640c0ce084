package com.questrail.reconnect.runtime;

import com.questrail.reconnect.api.Reconnector;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ReconnectRuntime
 * =============================================================================
 * Lifecycle owner that runs a {@link Reconnector} on a dedicated thread.
 *
 * <pre>
 *   runtime.start()         -> spawns the reconnect thread, returns immediately
 *   runtime.termination()   -> completes when the reconnect loop ends
 *   runtime.stop()          -> closes the reconnector and waits for the loop
 * </pre>
 *
 * {@link #termination()} completes normally after a requested stop and
 * exceptionally with whatever {@link Reconnector#start()} threw otherwise.
 */
public final class ReconnectRuntime
{
    static final String THREAD_NAME = "reconnect-controller";

    private final Reconnector reconnector;
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReconnectRuntime(Reconnector reconnector) {
        this.reconnector = Objects.requireNonNull(reconnector, "reconnector");
    }

    /**
     * Starts the reconnect thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread loopThread = new Thread(this::runLoop, THREAD_NAME);
            loopThread.start();
        }
    }

    /**
     * Closes the reconnector. Blocks until the reconnect loop has returned.
     * Has no effect if the runtime was never started or was already stopped.
     *
     * @throws Exception the exception raised while terminating the connection
     */
    public void stop() throws Exception {
        if (running.compareAndSet(true, false)) {
            reconnector.close();
        }
    }

    public CompletableFuture<Void> termination() {
        return termination;
    }

    public boolean isRunning() {
        return running.get() && !termination.isDone();
    }

    private void runLoop() {
        try {
            reconnector.start();
            termination.complete(null);
        } catch (Throwable t) {
            termination.completeExceptionally(t);
        }
    }
}
