package com.questrail.bmux.transport.blocking;

import com.questrail.bmux.codec.ReadDeadline;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Per-stage read deadline backed by {@code SO_TIMEOUT}.
 *
 * <p>{@link #arm()} fixes an absolute deadline for the stage. Before every
 * blocking read the remaining time is pushed into the socket's
 * {@code SO_TIMEOUT}, so a peer that trickles bytes cannot extend a stage
 * beyond the configured read timeout.</p>
 */
final class SocketReadDeadline implements ReadDeadline
{
    private final Socket socket;
    private final long timeoutNanos;

    private long deadlineNanos;

    SocketReadDeadline(Socket socket, Duration readTimeout)
    {
        this.socket = socket;
        this.timeoutNanos = readTimeout.toNanos();
    }

    @Override
    public void arm()
    {
        if (timeoutNanos > 0) {
            deadlineNanos = System.nanoTime() + timeoutNanos;
        }
    }

    @Override
    public void beforeRead() throws IOException
    {
        if (timeoutNanos <= 0) {
            socket.setSoTimeout(0);
            return;
        }

        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new SocketTimeoutException("Read deadline exceeded");
        }

        // SO_TIMEOUT of 0 means infinite, so never round down to it.
        long millis = Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining));
        socket.setSoTimeout((int) Math.min(millis, Integer.MAX_VALUE));
    }
}
