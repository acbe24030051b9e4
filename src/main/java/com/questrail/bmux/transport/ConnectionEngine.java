package com.questrail.bmux.transport;

import com.questrail.bmux.error.ShutdownTimeoutException;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * ConnectionEngine
 * -----------------------------------------------------------------------------
 * Owns the listening socket and every accepted connection.
 *
 * <p>Two implementations exist, one per concurrency model. Both feed complete
 * envelopes to an {@link EnvelopeProcessor}, so framing, decoding and dispatch
 * behave identically whichever engine runs them.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #bind()} opens the listener and starts accepting. Called once.</li>
 *   <li>{@link #stop(Duration)} stops accepting, cancels every live connection
 *       and waits for them to drain.</li>
 * </ul>
 */
public interface ConnectionEngine
{
    /**
     * Bind the listener and begin accepting connections.
     *
     * @return the address actually bound (useful with port 0)
     * @throws com.questrail.bmux.error.ConfigurationException if the configured
     *         address cannot be used; no socket has been opened in that case
     * @throws java.io.UncheckedIOException if the bind itself fails
     */
    InetSocketAddress bind();

    /**
     * @return the bound address, or {@code null} before {@link #bind()}
     */
    InetSocketAddress localAddress();

    int activeConnections();

    /**
     * Cooperative drain. The listener is closed before this method waits.
     *
     * @param timeout maximum wait; {@link Duration#ZERO} waits without bound
     * @throws ShutdownTimeoutException if connections were still running when
     *         the timeout expired; they are abandoned, not interrupted
     */
    void stop(Duration timeout) throws ShutdownTimeoutException;
}
