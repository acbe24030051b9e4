package com.questrail.bmux.transport.blocking;

import com.questrail.bmux.api.ConnectionLifetime;
import com.questrail.bmux.api.HandlerAction;
import com.questrail.bmux.codec.EnvelopeReader;
import com.questrail.bmux.codec.PacketEnvelope;
import com.questrail.bmux.config.BmuxServerConfig;
import com.questrail.bmux.error.FramingException;
import com.questrail.bmux.error.ShutdownTimeoutException;
import com.questrail.bmux.observability.BmuxErrorEvent;
import com.questrail.bmux.observability.BmuxObservabilitySink;
import com.questrail.bmux.observability.ConnectionEvent;
import com.questrail.bmux.transport.ConnectionEngine;
import com.questrail.bmux.transport.ConnectionRegistry;
import com.questrail.bmux.transport.EnvelopeProcessor;
import com.questrail.bmux.transport.ListenAddresses;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * BlockingConnectionEngine
 * =============================================================================
 * Thread-per-connection engine over {@link ServerSocket}.
 *
 * <h2>Admission</h2>
 * The acceptor thread takes a permit from a {@link Semaphore} sized to
 * {@code maxConnections} <em>before</em> calling {@code accept()}. With every
 * permit taken the acceptor parks, and further clients wait in the kernel
 * backlog until a slot frees up.
 *
 * <h2>Per-connection loop</h2>
 * <pre>
 *   read envelope → decode header → dispatch → repeat
 * </pre>
 * until EOF, a failure, a {@link HandlerAction#CLOSE} action, or
 * cancellation of the connection's {@link ConnectionLifetime}.
 *
 * <h2>Timeouts</h2>
 * <ul>
 *   <li>read: per-stage deadline, see {@link SocketReadDeadline}</li>
 *   <li>idle: watchdog armed while waiting for the next envelope</li>
 *   <li>write: watchdog around each send, see {@link SocketConnection}</li>
 * </ul>
 */
public final class BlockingConnectionEngine<H> implements ConnectionEngine
{
    private final BmuxServerConfig config;
    private final EnvelopeProcessor<H> processor;
    private final BmuxObservabilitySink sink;
    private final Supplier<?> attachmentFactory;

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final Semaphore slots;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;

    private volatile ServerSocket serverSocket;
    private volatile Thread acceptor;
    private volatile boolean running;

    public BlockingConnectionEngine(BmuxServerConfig config,
                                    EnvelopeProcessor<H> processor,
                                    Supplier<?> attachmentFactory)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.sink = processor.sink();
        this.attachmentFactory = Objects.requireNonNull(attachmentFactory, "attachmentFactory");

        this.slots = new Semaphore(config.maxConnections());
        this.workers = Executors.newCachedThreadPool(daemonThreads("bmux-worker-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("bmux-watchdog-"));
    }

    @Override
    public synchronized InetSocketAddress bind()
    {
        if (serverSocket != null) {
            throw new IllegalStateException("Engine already bound");
        }

        final InetSocketAddress address;
        try {
            address = ListenAddresses.resolve(config);
        }
        catch (RuntimeException e) {
            releaseExecutors();
            throw e;
        }

        ServerSocket ss = null;
        try {
            ss = new ServerSocket();
            ss.setReuseAddress(true);
            ss.bind(address);
        }
        catch (IOException e) {
            closeListener(ss);
            releaseExecutors();
            throw new UncheckedIOException("Failed to bind " + address, e);
        }

        serverSocket = ss;
        running = true;

        Thread t = new Thread(this::acceptLoop, "bmux-acceptor");
        t.setDaemon(true);
        acceptor = t;
        t.start();

        return (InetSocketAddress) ss.getLocalSocketAddress();
    }

    @Override
    public InetSocketAddress localAddress()
    {
        ServerSocket ss = serverSocket;
        return ss == null ? null : (InetSocketAddress) ss.getLocalSocketAddress();
    }

    @Override
    public int activeConnections()
    {
        return registry.size();
    }

    @Override
    public void stop(Duration timeout) throws ShutdownTimeoutException
    {
        Objects.requireNonNull(timeout, "timeout");

        running = false;

        // 1) Stop accepting.
        closeListener(serverSocket);
        Thread t = acceptor;
        if (t != null) {
            t.interrupt();
        }
        workers.shutdown();

        // 2) Cancel every live connection.
        try {
            registry.cancelAll();
        }
        catch (RuntimeException e) {
            sink.onError(BmuxErrorEvent.of(null, "Connection cancellation callback failed", e));
        }

        // 3) Bounded drain.
        boolean drained;
        try {
            drained = awaitWorkers(timeout);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = workers.isTerminated();
        }
        watchdog.shutdownNow();

        if (!drained) {
            throw new ShutdownTimeoutException(timeout, registry.size());
        }
    }

    private boolean awaitWorkers(Duration timeout) throws InterruptedException
    {
        if (timeout.isZero()) {
            while (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
                // keep waiting
            }
            return true;
        }
        return workers.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    // -------------------------------------------------------------------------
    // Acceptor
    // -------------------------------------------------------------------------

    private void acceptLoop()
    {
        ServerSocket ss = serverSocket;

        while (running) {
            try {
                slots.acquire();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            final Socket socket;
            try {
                socket = ss.accept();
            }
            catch (IOException e) {
                slots.release();
                if (!running || ss.isClosed()) {
                    return;
                }
                sink.onError(BmuxErrorEvent.of(null, "Accept failed", e));
                continue;
            }

            if (!running) {
                discard(socket);
                return;
            }

            try {
                configure(socket);
                workers.execute(() -> serve(socket));
            }
            catch (IOException | RejectedExecutionException e) {
                if (running) {
                    sink.onError(BmuxErrorEvent.of(null, "Failed to start connection", e));
                }
                discard(socket);
            }
        }
    }

    private void configure(Socket socket) throws IOException
    {
        socket.setKeepAlive(config.keepAlive());
        socket.setTcpNoDelay(true);
    }

    private void discard(Socket socket)
    {
        try {
            socket.close();
        }
        catch (IOException e) {
            sink.onError(BmuxErrorEvent.of(null, "Failed to close rejected socket", e));
        }
        finally {
            slots.release();
        }
    }

    // -------------------------------------------------------------------------
    // Worker
    // -------------------------------------------------------------------------

    private void serve(Socket socket)
    {
        final String id = registry.nextId();
        final SocketAddress remote = socket.getRemoteSocketAddress();
        final ConnectionLifetime lifetime = new ConnectionLifetime();

        final SocketConnection connection;
        try {
            connection = new SocketConnection(id, socket, config.writeTimeout(), watchdog, sink);
        }
        catch (IOException e) {
            sink.onError(BmuxErrorEvent.of(id, "Failed to open connection streams", e));
            discard(socket);
            return;
        }

        int active = registry.register(id, lifetime);
        sink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.OPENED, id, remote, active));

        ScheduledFuture<?> idleGuard = null;
        try {
            lifetime.onCancel(connection::shutdownInput);
            if (!running) {
                lifetime.cancel();
            }

            connection.attach(attachmentFactory.get());

            EnvelopeReader reader = new EnvelopeReader(
                    socket.getInputStream(),
                    new SocketReadDeadline(socket, config.readTimeout()));

            while (!lifetime.isCancelled()) {
                idleGuard = armIdle(lifetime);
                PacketEnvelope envelope = reader.read();
                idleGuard = disarm(idleGuard);

                if (lifetime.isCancelled()) {
                    break;
                }

                HandlerAction action = processor.process(envelope, connection, lifetime);
                if (action == HandlerAction.CLOSE) {
                    break;
                }
            }
        }
        catch (FramingException e) {
            if (!lifetime.isCancelled()) {
                processor.reportFailure(connection, e);
            }
        }
        catch (IOException | RuntimeException e) {
            processor.reportFailure(connection, e);
        }
        finally {
            disarm(idleGuard);
            int remaining = registry.unregister(id);
            try {
                lifetime.cancel();
            }
            catch (RuntimeException e) {
                sink.onError(BmuxErrorEvent.of(id, "Connection cancellation callback failed", e));
            }
            connection.close();
            slots.release();
            sink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.CLOSED, id, remote, remaining));
        }
    }

    private ScheduledFuture<?> armIdle(ConnectionLifetime lifetime)
    {
        Duration idle = config.idleTimeout();
        if (idle.isZero()) {
            return null;
        }
        return watchdog.schedule(lifetime::cancel, idle.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static ScheduledFuture<?> disarm(ScheduledFuture<?> guard)
    {
        if (guard != null) {
            guard.cancel(false);
        }
        return null;
    }

    private void releaseExecutors()
    {
        workers.shutdownNow();
        watchdog.shutdownNow();
    }

    private void closeListener(ServerSocket ss)
    {
        if (ss == null || ss.isClosed()) {
            return;
        }
        try {
            ss.close();
        }
        catch (IOException e) {
            sink.onError(BmuxErrorEvent.of(null, "Failed to close listener", e));
        }
    }

    private static ThreadFactory daemonThreads(String prefix)
    {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
