/**
 * Concrete {@link com.questrail.reconnect.api.ReconnectableConnection}
 * implementations.
 *
 * <h2>Architectural constraints</h2>
 * Implementations in this package MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not retry, back off, or count failures; that belongs to the reconnector</li>
 *   <li>Tolerate {@code terminate()} racing an in-flight {@code establish()} or
 *       {@code awaitDrop()}</li>
 *   <li>Keep framework types (Netty channels, buffers, event loops) private</li>
 * </ul>
 */
package com.questrail.reconnect.transport;
