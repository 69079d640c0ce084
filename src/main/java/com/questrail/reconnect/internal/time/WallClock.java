package com.questrail.reconnect.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>The reconnection loop has no timers, so nothing operational depends on
 * this clock. Tests substitute a fixed clock to get deterministic events.</p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
