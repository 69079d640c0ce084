package com.questrail.reconnect.api;

/**
 * ReconnectableConnection
 * -----------------------------------------------------------------------------
 * Minimal capability a transport must offer to be driven by a
 * {@link Reconnector}.
 *
 * <p>The reconnection layer never inspects the concrete transport. It only
 * sequences these three operations. Each of them may fail independently with an
 * implementation-defined exception.</p>
 *
 * <h2>Concurrency contract</h2>
 * The reconnector owns the connection exclusively. The single exception is
 * {@link #terminate()}, which is invoked from the closing thread while
 * {@link #establish()} or {@link #awaitDrop()} may still be running on the
 * reconnect thread. Implementations MUST tolerate that overlap.
 */
public interface ReconnectableConnection
{
    /**
     * Attempt to bring the connection up.
     *
     * <p>May be called repeatedly, including after a previous failure.</p>
     *
     * @throws Exception if the connection could not be established
     */
    void establish() throws Exception;

    /**
     * Block until the connection is lost.
     *
     * <p>A normal return signals an orderly drop. This method MUST return
     * promptly once {@link #terminate()} has been invoked concurrently.</p>
     *
     * @throws Exception if the connection failed
     */
    void awaitDrop() throws Exception;

    /**
     * Tear the connection down and release any in-flight {@link #awaitDrop()}.
     *
     * @throws Exception if teardown itself failed
     */
    void terminate() throws Exception;
}
