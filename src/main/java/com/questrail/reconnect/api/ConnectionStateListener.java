package com.questrail.reconnect.api;

/**
 * Receives every {@link ConnectionState} transition, synchronously, on the
 * thread running {@link Reconnector#start()}.
 */
@FunctionalInterface
public interface ConnectionStateListener
{
    void onState(ConnectionState state);
}
