package com.questrail.reconnect.runtime;

import com.questrail.reconnect.api.ReconnectFailedException;
import com.questrail.reconnect.core.ReconnectController;
import com.questrail.reconnect.core.ScriptedConnection;
import com.questrail.reconnect.core.ScriptedConnection.Step;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReconnectRuntimeTest
 * -----------------------------------------------------------------------------
 * Verifies the threaded lifecycle wrapper around a reconnector.
 */
class ReconnectRuntimeTest {

    @Test
    void stopCompletesTerminationNormally() throws Exception {
        ScriptedConnection c = new ScriptedConnection().onEstablish(Step.ok());
        AtomicReference<String> loopThread = new AtomicReference<>();
        ReconnectController controller = ReconnectController.create(c,
            o -> o.withStateListener(s -> loopThread.compareAndSet(null, Thread.currentThread().getName())));
        ReconnectRuntime runtime = new ReconnectRuntime(controller);

        runtime.start();
        runtime.start();
        assertTrue(c.awaitBlocked(5, TimeUnit.SECONDS));
        assertTrue(runtime.isRunning());

        runtime.stop();

        assertNull(runtime.termination().get(5, TimeUnit.SECONDS));
        assertFalse(runtime.isRunning());
        assertEquals(ReconnectRuntime.THREAD_NAME, loopThread.get());
        assertEquals(1, c.establishCalls());
    }

    @Test
    void exhaustedRetriesCompleteTerminationExceptionally() {
        IOException refused = new IOException("refused");
        ScriptedConnection c = new ScriptedConnection().onEstablish(Step.fail(refused), Step.fail(refused));
        ReconnectRuntime runtime = new ReconnectRuntime(
            ReconnectController.create(c, o -> o.withMaxConnectAttempts(2)));

        runtime.start();

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> runtime.termination().get(5, TimeUnit.SECONDS));
        ReconnectFailedException failure = assertInstanceOf(ReconnectFailedException.class, e.getCause());
        assertSame(refused, failure.getCause());
    }

    @Test
    void stopRethrowsTerminateError() throws Exception {
        IOException teardown = new IOException("teardown");
        ScriptedConnection c = new ScriptedConnection().onEstablish(Step.ok()).onTerminate(teardown);
        ReconnectRuntime runtime = new ReconnectRuntime(ReconnectController.create(c));

        runtime.start();
        assertTrue(c.awaitBlocked(5, TimeUnit.SECONDS));

        assertSame(teardown, assertThrows(IOException.class, runtime::stop));
        assertNull(runtime.termination().get(5, TimeUnit.SECONDS));
    }

    @Test
    void stopWithoutStartReturnsImmediately() throws Exception {
        ScriptedConnection c = new ScriptedConnection();
        ReconnectRuntime runtime = new ReconnectRuntime(ReconnectController.create(c));

        CompletableFuture<Void> stopped = CompletableFuture.runAsync(() -> {
            try {
                runtime.stop();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        assertNull(stopped.get(2, TimeUnit.SECONDS));
        assertEquals(0, c.terminateCalls());
        assertFalse(runtime.isRunning());
        assertFalse(runtime.termination().isDone());
    }

    @Test
    void secondStopIsNoOp() throws Exception {
        ScriptedConnection c = new ScriptedConnection().onEstablish(Step.ok());
        ReconnectRuntime runtime = new ReconnectRuntime(ReconnectController.create(c));

        runtime.start();
        assertTrue(c.awaitBlocked(5, TimeUnit.SECONDS));
        runtime.stop();
        runtime.stop();

        assertNull(runtime.termination().get(5, TimeUnit.SECONDS));
        assertEquals(1, c.terminateCalls());
    }
}
