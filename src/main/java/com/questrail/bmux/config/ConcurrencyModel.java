package com.questrail.bmux.config;

/**
 * How a server runs its connections. Both models honour the same framing and
 * dispatch contract.
 */
public enum ConcurrencyModel
{
    /**
     * One blocking worker thread per connection. Accepting waits once the
     * connection cap is reached.
     */
    BLOCKING,

    /**
     * A small fixed set of Netty event loops multiplexing all connections.
     * Connections over the cap are closed as soon as they open.
     */
    EVENT_LOOP
}
