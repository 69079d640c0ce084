package com.questrail.reconnect.api;

import java.util.Optional;

/**
 * Hook invoked for every failure of {@link ReconnectableConnection#establish()}
 * or {@link ReconnectableConnection#awaitDrop()}.
 *
 * <p>Returning a present value vetoes any further retry: the reconnector stops
 * immediately with that error, regardless of the configured limits. Returning
 * {@link Optional#empty()} lets the normal limit accounting decide.</p>
 */
@FunctionalInterface
public interface ReconnectErrorHandler
{
    Optional<Exception> onError(Exception error);
}
