package com.questrail.bmux.api;

import java.util.ArrayList;
import java.util.List;

/**
 * ConnectionLifetime
 * -----------------------------------------------------------------------------
 * Cancellable scope bound to one connection.
 *
 * <p>A lifetime is created when a connection is accepted and handed to every
 * message dispatched on it. It is cancelled exactly once, when the connection
 * closes or the server shuts down. Cancellation is cooperative: handlers may
 * poll {@link #isCancelled()} or register a callback, but they are never
 * interrupted.</p>
 *
 * <p>Callbacks registered after cancellation run immediately on the
 * registering thread.</p>
 */
public final class ConnectionLifetime
{
    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();

    private volatile boolean cancelled;

    public boolean isCancelled()
    {
        return cancelled;
    }

    /**
     * Cancel the lifetime and run registered callbacks in registration order.
     *
     * @return {@code true} if this call performed the cancellation
     */
    public boolean cancel()
    {
        final List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }

        RuntimeException failure = null;
        for (Runnable r : toRun) {
            try {
                r.run();
            }
            catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                }
                else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    public void onCancel(Runnable callback)
    {
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }
}
