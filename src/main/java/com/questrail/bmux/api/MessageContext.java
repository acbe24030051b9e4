package com.questrail.bmux.api;

import java.util.Objects;

/**
 * Everything a handler sees for one dispatched message.
 *
 * @param lifetime  cancellable scope of the connection the message arrived on
 * @param connection the connection itself
 * @param header    decoded, schema-typed header
 * @param body      raw body bytes (never {@code null}, possibly empty)
 * @param messageId identifier the message was dispatched by
 */
public record MessageContext<H>(
        ConnectionLifetime lifetime,
        Connection connection,
        H header,
        byte[] body,
        int messageId
) {
    public MessageContext {
        Objects.requireNonNull(lifetime, "lifetime");
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
    }

    /**
     * Convenience for replying on the same connection.
     */
    public void reply(byte[] head, byte[] body)
    {
        connection.send(head, body);
    }
}
