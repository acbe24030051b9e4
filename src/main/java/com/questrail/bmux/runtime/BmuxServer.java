package com.questrail.bmux.runtime;

import com.questrail.bmux.config.BmuxServerConfig;
import com.questrail.bmux.error.ShutdownTimeoutException;
import com.questrail.bmux.header.HeaderDecoder;
import com.questrail.bmux.header.HeaderSchema;
import com.questrail.bmux.middleware.PacketLoggingMiddleware;
import com.questrail.bmux.observability.BmuxErrorEvent;
import com.questrail.bmux.observability.BmuxObservabilitySink;
import com.questrail.bmux.observability.ServerLifecycleEvent;
import com.questrail.bmux.observability.Slf4jBmuxObservabilitySink;
import com.questrail.bmux.route.DispatchTable;
import com.questrail.bmux.route.Dispatcher;
import com.questrail.bmux.route.Middleware;
import com.questrail.bmux.route.RouteCompiler;
import com.questrail.bmux.route.Router;
import com.questrail.bmux.transport.ConnectionEngine;
import com.questrail.bmux.transport.EnvelopeProcessor;
import com.questrail.bmux.transport.blocking.BlockingConnectionEngine;
import com.questrail.bmux.transport.netty.NettyConnectionEngine;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.function.Supplier;

/**
 * BmuxServer
 * =============================================================================
 * Composition root for a bmux server.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring and ownership component only</strong>. It
 * owns the registered routers and middleware, compiles them once into a
 * {@link DispatchTable}, and hands the result to the
 * {@link ConnectionEngine} selected by the configured concurrency model.
 *
 * <h2>Inbound Data Flow</h2>
 * <pre>
 *   ConnectionEngine
 *        → EnvelopeReader / EnvelopeFrameDecoder
 *            → HeaderDecoder
 *                → Dispatcher
 *                    → global → router → route middleware → handler
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   NEW ──bind()──▶ RUNNING ──shutdown()──▶ STOPPING ──▶ STOPPED
 * </pre>
 * <ul>
 *   <li>Routers and middleware may only be loaded while {@code NEW}. Loading
 *       appends; nothing is de-duplicated.</li>
 *   <li>{@link #bind()} compiles the dispatch table exactly once and opens
 *       the listener. It does not block.</li>
 *   <li>{@link #start()} binds if necessary and blocks until shutdown
 *       completes.</li>
 * </ul>
 *
 * <p>The server never installs signal handlers. Wire
 * {@link #shutdownTrigger()} into {@code Runtime.addShutdownHook} (or any other
 * trigger) from the application.</p>
 */
public final class BmuxServer<H>
{
    private enum State
    {
        NEW,
        RUNNING,
        STOPPING,
        STOPPED
    }

    private final BmuxServerConfig config;
    private final HeaderDecoder<H> headerDecoder;
    private final BmuxObservabilitySink sink;
    private final Supplier<?> attachmentFactory;

    private final List<Router<H>> routers = new ArrayList<>();
    private final List<Middleware<H>> middleware = new ArrayList<>();

    private final Object lock = new Object();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private State state = State.NEW;
    private DispatchTable<H> dispatchTable;
    private ConnectionEngine engine;

    private BmuxServer(Builder<H> builder)
    {
        this.config = builder.config;
        this.headerDecoder = new HeaderDecoder<>(builder.schema);
        this.sink = builder.sink;
        this.attachmentFactory = builder.attachmentFactory;
    }

    public static <H> Builder<H> builder(HeaderSchema<H> schema)
    {
        return new Builder<>(schema);
    }

    public BmuxServerConfig config()
    {
        return config;
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    @SafeVarargs
    public final BmuxServer<H> loadRouters(Router<H>... routers)
    {
        return loadRouters(Arrays.asList(routers));
    }

    public BmuxServer<H> loadRouters(List<Router<H>> routers)
    {
        Objects.requireNonNull(routers, "routers");
        synchronized (lock) {
            requireNew("load routers");
            for (Router<H> r : routers) {
                this.routers.add(Objects.requireNonNull(r, "router"));
            }
        }
        return this;
    }

    public BmuxServer<H> loadRouter(Router<H> router)
    {
        return loadRouters(List.of(router));
    }

    @SafeVarargs
    public final BmuxServer<H> loadMiddleware(Middleware<H>... middleware)
    {
        Objects.requireNonNull(middleware, "middleware");
        synchronized (lock) {
            requireNew("load middleware");
            for (Middleware<H> m : middleware) {
                this.middleware.add(Objects.requireNonNull(m, "middleware"));
            }
        }
        return this;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Compile the dispatch table and open the listener.
     *
     * @return the bound address
     * @throws com.questrail.bmux.error.ConfigurationException if the bind
     *         address is unusable; no socket is opened
     * @throws java.io.UncheckedIOException if the listener cannot be bound
     * @throws IllegalStateException if the server was already bound or stopped
     */
    public InetSocketAddress bind()
    {
        synchronized (lock) {
            requireNew("bind");

            List<Middleware<H>> global = new ArrayList<>();
            if (config.packetLogging()) {
                global.add(PacketLoggingMiddleware.create());
            }
            global.addAll(middleware);

            RouteCompiler<H> compiler = new RouteCompiler<>(config.experimental(), sink);
            dispatchTable = compiler.compile(List.copyOf(routers), global);

            EnvelopeProcessor<H> processor = new EnvelopeProcessor<>(
                    headerDecoder,
                    new Dispatcher<>(dispatchTable, sink),
                    sink);

            engine = switch (config.concurrencyModel()) {
                case BLOCKING -> new BlockingConnectionEngine<>(config, processor, attachmentFactory);
                case EVENT_LOOP -> new NettyConnectionEngine<>(config, processor, attachmentFactory);
            };

            final InetSocketAddress bound;
            try {
                bound = engine.bind();
            }
            catch (RuntimeException e) {
                state = State.STOPPED;
                terminated.countDown();
                throw e;
            }

            state = State.RUNNING;
            sink.onLifecycleEvent(ServerLifecycleEvent.of(
                    ServerLifecycleEvent.Phase.BOUND, bound, config.concurrencyModel().name()));
            return bound;
        }
    }

    /**
     * Bind (if not yet bound) and block until the server has stopped.
     */
    public void start() throws InterruptedException
    {
        boolean needsBind;
        synchronized (lock) {
            needsBind = state == State.NEW;
        }
        if (needsBind) {
            bind();
        }
        terminated.await();
    }

    /**
     * Stop accepting, cancel every connection and wait for in-flight work.
     *
     * <p>Calling this more than once, or on a server that never bound, is a
     * no-op.</p>
     *
     * @param timeout maximum drain time; {@link Duration#ZERO} waits without bound
     * @throws ShutdownTimeoutException if connections were still running at the
     *         deadline; the listener is closed regardless
     */
    public void shutdown(Duration timeout) throws ShutdownTimeoutException
    {
        Objects.requireNonNull(timeout, "timeout");

        final ConnectionEngine e;
        synchronized (lock) {
            switch (state) {
                case NEW -> {
                    state = State.STOPPED;
                    terminated.countDown();
                    return;
                }
                case STOPPING, STOPPED -> {
                    return;
                }
                case RUNNING -> state = State.STOPPING;
            }
            e = engine;
        }

        InetSocketAddress address = e.localAddress();
        sink.onLifecycleEvent(ServerLifecycleEvent.of(
                ServerLifecycleEvent.Phase.SHUTTING_DOWN, address, "timeout " + timeout));
        try {
            e.stop(timeout);
        }
        catch (ShutdownTimeoutException ex) {
            sink.onLifecycleEvent(ServerLifecycleEvent.of(
                    ServerLifecycleEvent.Phase.DRAIN_TIMEOUT,
                    address,
                    ex.undrained() + " connection(s) still running after " + timeout));
            throw ex;
        }
        finally {
            synchronized (lock) {
                state = State.STOPPED;
            }
            terminated.countDown();
            sink.onLifecycleEvent(ServerLifecycleEvent.of(ServerLifecycleEvent.Phase.STOPPED, address, null));
        }
    }

    /**
     * Shutdown using the configured shutdown timeout.
     */
    public void shutdown() throws ShutdownTimeoutException
    {
        shutdown(config.shutdownTimeout());
    }

    /**
     * @return a task that shuts the server down with the configured timeout,
     *         suitable for {@code Runtime.getRuntime().addShutdownHook(new Thread(...))}
     */
    public Runnable shutdownTrigger()
    {
        return () -> {
            try {
                shutdown();
            }
            catch (ShutdownTimeoutException e) {
                sink.onError(BmuxErrorEvent.of(null, "Shutdown trigger could not drain connections", e));
            }
        };
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    /**
     * @throws IllegalStateException before {@link #bind()}
     */
    public DispatchTable<H> dispatchTable()
    {
        synchronized (lock) {
            if (dispatchTable == null) {
                throw new IllegalStateException("Dispatch table is compiled on bind()");
            }
            return dispatchTable;
        }
    }

    public InetSocketAddress localAddress()
    {
        synchronized (lock) {
            return engine == null ? null : engine.localAddress();
        }
    }

    public int activeConnections()
    {
        synchronized (lock) {
            return engine == null ? 0 : engine.activeConnections();
        }
    }

    private void requireNew(String action)
    {
        if (state != State.NEW) {
            throw new IllegalStateException("Cannot " + action + " once the server is " + state);
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder<H>
    {
        private final HeaderSchema<H> schema;
        private BmuxServerConfig config = BmuxServerConfig.defaults();
        private BmuxObservabilitySink sink = new Slf4jBmuxObservabilitySink();
        private Supplier<?> attachmentFactory = () -> null;

        private Builder(HeaderSchema<H> schema)
        {
            this.schema = schema;
        }

        public Builder<H> withConfig(BmuxServerConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder<H> withObservabilitySink(BmuxObservabilitySink sink)
        {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * Factory for the per-connection attachment, invoked once for every
         * accepted connection.
         */
        public Builder<H> withAttachmentFactory(Supplier<?> factory)
        {
            this.attachmentFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        /**
         * @throws com.questrail.bmux.error.ConfigurationException if no header
         *         schema was supplied
         */
        public BmuxServer<H> build()
        {
            return new BmuxServer<>(this);
        }
    }
}
