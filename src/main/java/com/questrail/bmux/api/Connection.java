package com.questrail.bmux.api;

import java.net.SocketAddress;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * Transport-neutral handle to one live client connection.
 *
 * <p>Both connection engines expose their sockets through this interface so
 * handlers never see {@code java.net.Socket} or Netty channel types.</p>
 */
public interface Connection
{
    /**
     * Short identifier, unique within one server run.
     */
    String id();

    SocketAddress remoteAddress();

    SocketAddress localAddress();

    /**
     * Frame {@code head} and {@code body} as one envelope and write it.
     *
     * <p>Size limits are checked before anything is written.
     * The blocking engine writes synchronously and reports failure with an
     * {@link java.io.UncheckedIOException}; the event-loop engine writes
     * asynchronously and closes the connection if the write fails.</p>
     *
     * @throws IllegalArgumentException if the header exceeds 255 bytes or the
     *         body exceeds 65535 bytes
     */
    void send(byte[] head, byte[] body);

    /**
     * Close the connection. Idempotent.
     */
    void close();

    boolean isOpen();

    /**
     * Per-connection application state created by the server's attachment
     * factory, or {@code null} if none was configured.
     */
    Object attachment();

    void attach(Object attachment);
}
