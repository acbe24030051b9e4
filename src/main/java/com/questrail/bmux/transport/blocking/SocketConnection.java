package com.questrail.bmux.transport.blocking;

import com.questrail.bmux.api.Connection;
import com.questrail.bmux.codec.PacketEnvelope;
import com.questrail.bmux.observability.BmuxErrorEvent;
import com.questrail.bmux.observability.BmuxObservabilitySink;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SocketConnection
 * -----------------------------------------------------------------------------
 * {@link Connection} over a plain blocking {@link Socket}.
 *
 * <p>Writes are serialized by a lock so that envelopes sent from several
 * threads never interleave on the wire. When a write timeout is configured a
 * watchdog task closes the socket if a single {@code send} blocks longer than
 * allowed; the blocked write then fails with an {@link UncheckedIOException}.</p>
 */
final class SocketConnection implements Connection
{
    private final String id;
    private final Socket socket;
    private final OutputStream out;
    private final long writeTimeoutNanos;
    private final ScheduledExecutorService watchdog;
    private final BmuxObservabilitySink sink;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Object attachment;

    SocketConnection(String id,
                     Socket socket,
                     Duration writeTimeout,
                     ScheduledExecutorService watchdog,
                     BmuxObservabilitySink sink) throws IOException
    {
        this.id = id;
        this.socket = socket;
        this.out = socket.getOutputStream();
        this.writeTimeoutNanos = writeTimeout.toNanos();
        this.watchdog = watchdog;
        this.sink = sink;
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return socket.getRemoteSocketAddress();
    }

    @Override
    public SocketAddress localAddress()
    {
        return socket.getLocalSocketAddress();
    }

    @Override
    public void send(byte[] head, byte[] body)
    {
        // Validate lengths before anything touches the stream.
        PacketEnvelope envelope = new PacketEnvelope(head, body);

        if (!isOpen()) {
            throw new UncheckedIOException(new IOException("Connection " + id + " is closed"));
        }

        writeLock.lock();
        ScheduledFuture<?> guard = null;
        try {
            if (writeTimeoutNanos > 0) {
                guard = watchdog.schedule(this::close, writeTimeoutNanos, TimeUnit.NANOSECONDS);
            }
            envelope.writeTo(out);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Write failed on " + id, e);
        }
        finally {
            if (guard != null) {
                guard.cancel(false);
            }
            writeLock.unlock();
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        }
        catch (IOException e) {
            sink.onError(BmuxErrorEvent.of(id, "Close failed", e));
        }
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get() && !socket.isClosed();
    }

    @Override
    public Object attachment()
    {
        return attachment;
    }

    @Override
    public void attach(Object attachment)
    {
        this.attachment = attachment;
    }

    /**
     * Unblock a pending read while leaving the output side usable, so an
     * in-flight handler can still write its response.
     */
    void shutdownInput()
    {
        if (socket.isClosed() || socket.isInputShutdown()) {
            return;
        }
        try {
            socket.shutdownInput();
        }
        catch (IOException e) {
            // Input cannot be half-closed; fall back to a full close.
            close();
        }
    }
}
