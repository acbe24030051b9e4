package com.questrail.bmux.transport;

import com.questrail.bmux.api.ConnectionLifetime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live connections of one engine, keyed by connection id.
 *
 * <p>Registration and removal are serialized on the registry's monitor.
 * {@link #cancelAll()} snapshots under the monitor and cancels outside it,
 * so cancellation callbacks can unregister without deadlocking.</p>
 */
public final class ConnectionRegistry
{
    private final Map<String, ConnectionLifetime> live = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public String nextId()
    {
        return "conn-" + sequence.incrementAndGet();
    }

    /**
     * @return number of live connections after registering
     */
    public synchronized int register(String id, ConnectionLifetime lifetime)
    {
        live.put(id, lifetime);
        return live.size();
    }

    /**
     * @return number of live connections after removal
     */
    public synchronized int unregister(String id)
    {
        live.remove(id);
        return live.size();
    }

    public synchronized int size()
    {
        return live.size();
    }

    /**
     * Cancel every registered lifetime.
     *
     * <p>Every lifetime is cancelled even if some cancellation callbacks
     * throw; the first failure is rethrown afterwards with the rest
     * suppressed.</p>
     */
    public void cancelAll()
    {
        final List<ConnectionLifetime> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(live.values());
        }
        RuntimeException failure = null;
        for (ConnectionLifetime lifetime : snapshot) {
            try {
                lifetime.cancel();
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
    }
}
