package com.questrail.bmux.transport.netty;

import com.questrail.bmux.api.ConnectionLifetime;
import com.questrail.bmux.config.BmuxServerConfig;
import com.questrail.bmux.error.ShutdownTimeoutException;
import com.questrail.bmux.observability.BmuxErrorEvent;
import com.questrail.bmux.observability.BmuxObservabilitySink;
import com.questrail.bmux.observability.ConnectionEvent;
import com.questrail.bmux.transport.ConnectionEngine;
import com.questrail.bmux.transport.ConnectionRegistry;
import com.questrail.bmux.transport.EnvelopeProcessor;
import com.questrail.bmux.transport.ListenAddresses;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * NettyConnectionEngine
 * =============================================================================
 * Event-loop engine: a fixed set of Netty loops serves every connection.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>one boss loop accepting connections</li>
 *   <li>worker loops: one per available processor when {@code multicore} is
 *       on, otherwise a single loop</li>
 * </ul>
 * Handlers run on the connection's worker loop. A handler that blocks stalls
 * every connection sharing that loop.
 *
 * <h2>Admission</h2>
 * Connections beyond {@code maxConnections} are accepted by the kernel and
 * closed immediately in {@code initChannel}; a {@code REJECTED} event is
 * reported.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   IdleStateHandler        (if idle timeout &gt; 0)
 *   WriteTimeoutHandler     (if write timeout &gt; 0)
 *   EnvelopeFrameDecoder    (partial frames + read deadline)
 *   EnvelopeDispatchHandler (decode header, dispatch)
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package.
 */
public final class NettyConnectionEngine<H> implements ConnectionEngine
{
    private static final int BACKLOG = 128;

    private final BmuxServerConfig config;
    private final EnvelopeProcessor<H> processor;
    private final BmuxObservabilitySink sink;
    private final Supplier<?> attachmentFactory;

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final AtomicInteger admitted = new AtomicInteger();

    private final EventLoopGroup boss;
    private final EventLoopGroup workers;

    private volatile Channel serverChannel;
    private volatile boolean running;

    public NettyConnectionEngine(BmuxServerConfig config,
                                 EnvelopeProcessor<H> processor,
                                 Supplier<?> attachmentFactory)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.sink = processor.sink();
        this.attachmentFactory = Objects.requireNonNull(attachmentFactory, "attachmentFactory");

        int loops = config.multicore() ? Runtime.getRuntime().availableProcessors() : 1;
        this.boss = new NioEventLoopGroup(1, new DefaultThreadFactory("bmux-boss", true));
        this.workers = new NioEventLoopGroup(loops, new DefaultThreadFactory("bmux-loop", true));
    }

    @Override
    public synchronized InetSocketAddress bind()
    {
        if (serverChannel != null) {
            throw new IllegalStateException("Engine already bound");
        }

        final InetSocketAddress address;
        try {
            address = ListenAddresses.resolve(config);
        }
        catch (RuntimeException e) {
            releaseLoops();
            throw e;
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(boss, workers)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, BACKLOG)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, config.keepAlive())
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        admit(ch);
                    }
                });

        running = true;
        ChannelFuture f = bootstrap.bind(address).awaitUninterruptibly();
        if (!f.isSuccess()) {
            running = false;
            releaseLoops();

            Throwable cause = f.cause();
            if (cause instanceof IOException io) {
                throw new UncheckedIOException("Failed to bind " + address, io);
            }
            throw new IllegalStateException("Failed to bind " + address, cause);
        }

        serverChannel = f.channel();
        return (InetSocketAddress) serverChannel.localAddress();
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
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
        Channel sc = serverChannel;
        if (sc != null) {
            sc.close().awaitUninterruptibly();
        }
        boss.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);

        // 2) Cancel every live connection; each lifetime closes its channel.
        try {
            registry.cancelAll();
        }
        catch (RuntimeException e) {
            sink.onError(BmuxErrorEvent.of(null, "Connection cancellation callback failed", e));
        }

        // 3) Let the loops finish queued work, bounded by the timeout.
        workers.shutdownGracefully(0, timeout.toMillis(), TimeUnit.MILLISECONDS);

        boolean drained;
        try {
            drained = awaitLoops(timeout);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = workers.isTerminated();
        }

        if (!drained) {
            throw new ShutdownTimeoutException(timeout, registry.size());
        }
    }

    private boolean awaitLoops(Duration timeout) throws InterruptedException
    {
        if (timeout.isZero()) {
            while (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
                // keep waiting
            }
            return true;
        }
        return workers.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void releaseLoops()
    {
        boss.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
        workers.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
    }

    private void admit(SocketChannel ch)
    {
        final String id = registry.nextId();
        final SocketAddress remote = ch.remoteAddress();

        if (!running) {
            reject(ch, id, remote);
            return;
        }
        if (admitted.incrementAndGet() > config.maxConnections()) {
            admitted.decrementAndGet();
            reject(ch, id, remote);
            return;
        }

        final ConnectionLifetime lifetime = new ConnectionLifetime();
        final ChannelConnection connection = new ChannelConnection(id, ch);

        int active = registry.register(id, lifetime);
        ch.closeFuture().addListener(f -> {
            admitted.decrementAndGet();
            int remaining = registry.unregister(id);
            sink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.CLOSED, id, remote, remaining));
        });
        lifetime.onCancel(ch::close);
        sink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.OPENED, id, remote, active));

        ChannelPipeline p = ch.pipeline();
        if (!config.idleTimeout().isZero()) {
            p.addLast(new IdleStateHandler(0, 0, config.idleTimeout().toNanos(), TimeUnit.NANOSECONDS));
        }
        if (!config.writeTimeout().isZero()) {
            p.addLast(new WriteTimeoutHandler(config.writeTimeout().toNanos(), TimeUnit.NANOSECONDS));
        }
        p.addLast(new EnvelopeFrameDecoder(config.readTimeout()));
        p.addLast(new EnvelopeDispatchHandler<>(processor, connection, lifetime));

        connection.attach(attachmentFactory.get());
    }

    private void reject(SocketChannel ch, String id, SocketAddress remote)
    {
        sink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.REJECTED, id, remote, admitted.get()));
        ch.close();
    }
}
