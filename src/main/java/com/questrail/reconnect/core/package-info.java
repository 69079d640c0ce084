/**
 * Reconnection control loop.
 *
 * <p>{@link com.questrail.reconnect.core.ReconnectController} is the only
 * component with real invariants: the ordering of emitted states, the two
 * independent failure counters, the precedence of an error-handler veto over
 * those counters, and the guarantee that {@code close()} never returns before
 * {@code start()} has unwound.</p>
 */
package com.questrail.reconnect.core;
