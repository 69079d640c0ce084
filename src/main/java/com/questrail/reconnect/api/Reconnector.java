package com.questrail.reconnect.api;

/**
 * Reconnector
 * -----------------------------------------------------------------------------
 * Keeps a {@link ReconnectableConnection} up until it is closed or its retry
 * policy gives up.
 *
 * <h2>Threading</h2>
 * {@link #start()} blocks and is meant to run on a caller-provided thread.
 * {@link #close()} is meant to be called from a different thread while
 * {@code start()} is running.
 */
public interface Reconnector extends AutoCloseable
{
    /**
     * Run the reconnection loop until it terminates.
     *
     * <p>Returns normally only after a requested stop has been observed.</p>
     *
     * @throws ReconnectFailedException if retries were exhausted or vetoed; the
     *         cause is the final error
     * @throws IllegalStateException if this reconnector was already started
     */
    void start() throws ReconnectFailedException;

    /**
     * Request a stop, terminate the underlying connection and wait for
     * {@link #start()} to unwind.
     *
     * @throws Exception exactly the exception thrown by
     *         {@link ReconnectableConnection#terminate()}, if any
     */
    @Override
    void close() throws Exception;
}
