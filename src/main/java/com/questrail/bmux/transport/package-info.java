/**
 * bmux Connection Lifecycle
 * =============================================================================
 *
 * <p>Everything between a listening socket and the dispatcher. Two
 * interchangeable engines implement
 * {@link com.questrail.bmux.transport.ConnectionEngine}:</p>
 *
 * <ul>
 *   <li>{@code transport.blocking} - one worker thread per connection, an
 *       acceptor guarded by a semaphore sized to the connection cap.</li>
 *   <li>{@code transport.netty} - a fixed set of Netty event loops; connections
 *       over the cap are closed on open.</li>
 * </ul>
 *
 * <h2>Containment rule</h2>
 * Sockets and Netty types do not escape their engine packages. Handlers see
 * only {@link com.questrail.bmux.api.Connection}.
 *
 * <h2>Shared guarantees</h2>
 * <ul>
 *   <li>Messages of one connection are processed strictly in arrival order.</li>
 *   <li>A framing, decode or handler failure closes only its own connection.</li>
 *   <li>Shutdown closes the listener first, cancels every connection lifetime,
 *       then waits (bounded) for in-flight work.</li>
 * </ul>
 */
package com.questrail.bmux.transport;
