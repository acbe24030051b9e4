package com.questrail.bmux.error;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Raised by a shutdown call when in-flight connections did not drain within
 * the allowed time.
 *
 * <p>The listener is already closed when this is thrown. Workers that are
 * still running are abandoned, not interrupted.</p>
 */
public final class ShutdownTimeoutException extends TimeoutException
{
    private final Duration timeout;
    private final int undrained;

    public ShutdownTimeoutException(Duration timeout, int undrained)
    {
        super("Shutdown did not drain within " + timeout + " (" + undrained + " connection(s) still active)");
        this.timeout = timeout;
        this.undrained = undrained;
    }

    public Duration timeout()
    {
        return timeout;
    }

    /**
     * Number of connections that were still registered when the wait gave up.
     */
    public int undrained()
    {
        return undrained;
    }
}
