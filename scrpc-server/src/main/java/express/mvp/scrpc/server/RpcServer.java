package express.mvp.scrpc.server;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.scrpc.transport.FramedTransport;
import express.mvp.scrpc.transport.TransportException;
import express.mvp.scrpc.transport.TransportTimeoutException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-connection RPC server.
 *
 * <p>The server listens on one socket and serves each accepted connection on its own worker
 * thread, one call at a time. Shutdown is cooperative: {@link #stop(boolean)} raises a flag that the
 * accept loop and the workers check every {@link RpcServerConfig#getPollInterval() poll interval}.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌────────────────────────────────────────────────────────────┐
 * │                         RpcServer                          │
 * ├────────────────────────────────────────────────────────────┤
 * │   ┌──────────────┐  accept(pollInterval)                   │
 * │   │  Listening   │◀──────────────┐                         │
 * │   │  transport   │               │                         │
 * │   └──────┬───────┘     ┌─────────┴─────────┐               │
 * │          │ accepted    │  scrpc-accept-N   │  checks       │
 * │          ▼             │   (accept loop)   │  shutdown     │
 * │   ┌─────────────────────────────────────┐  └───────────────┤
 * │   │ RpcWorker  RpcWorker  RpcWorker ... │  one thread and  │
 * │   │ (scrpc-worker-N, one connection)    │  one connection  │
 * │   └──────────────────┬──────────────────┘  per worker      │
 * │                      ▼                                     │
 * │              FunctionRegistry (frozen at start)            │
 * └────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * FunctionRegistry registry = new FunctionRegistry();
 * registry.register("add", args -> (Integer) args[0] + (Integer) args[1]);
 *
 * try (RpcServer server = new RpcServer(RpcServerConfig.builder().port(3344).build(), registry)) {
 *     server.start();
 *     server.awaitReady(Duration.ofSeconds(5));
 *     // serve until closed
 * }
 * }</pre>
 *
 * @see RpcWorker
 * @see FunctionRegistry
 */
public class RpcServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RpcServer.class.getName());

    private final RpcServerConfig config;
    private final FunctionRegistry registry;

    @SuppressFBWarnings(
            value = "AT_UNSAFE_RESOURCE_ACCESS_IN_THREAD",
            justification = "Only the accept thread accepts; teardown closes it, which wakes the loop.")
    private final FramedTransport listener;

    private final Set<RpcWorker> workers = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.NEW);
    private final List<ServerStateListener> listeners = new CopyOnWriteArrayList<>();
    private final WorkerThreadFactory acceptThreads = new WorkerThreadFactory("scrpc-accept", true);
    private final WorkerThreadFactory workerThreads = new WorkerThreadFactory("scrpc-worker", true);

    /** Guards start/stop so the accept thread is replaced atomically. */
    private final Object lifecycleLock = new Object();

    private volatile boolean shutdown;
    private volatile CountDownLatch readyLatch = new CountDownLatch(1);

    @CheckForNull private Thread acceptThread;

    /**
     * Creates a server on {@code 0.0.0.0} with an ephemeral port.
     *
     * @param registry the functions to serve
     * @throws express.mvp.scrpc.transport.TransportException if the socket cannot be bound
     */
    public RpcServer(FunctionRegistry registry) {
        this(RpcServerConfig.builder().build(), registry);
    }

    /**
     * Creates a server and binds its listening socket.
     *
     * <p>The socket is bound and listening when the constructor returns, so {@link #getAddress()}
     * is valid immediately. Connections are queued by the operating system until {@link #start()}.
     *
     * @param config the server configuration
     * @param registry the functions to serve
     * @throws express.mvp.scrpc.transport.TransportException if the socket cannot be bound
     */
    @SuppressFBWarnings(
            value = "CT_CONSTRUCTOR_THROW",
            justification = "Binding eagerly is the contract; nothing escapes before the bind.")
    public RpcServer(RpcServerConfig config, FunctionRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.listener = FramedTransport.listen(
                new InetSocketAddress(config.getHost(), config.getPort()),
                config.getBacklog(),
                config.getTransportConfig());
        LOGGER.log(Level.FINE, "SCRPC server listening on {0}", listener.localAddress());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Lifecycle
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Starts the accept loop on a background thread.
     *
     * <p>Freezes the registry. Calling this while running has no effect. A stopped server may be
     * started again; if the previous accept loop is still winding down, this waits for it first.
     *
     * @throws IllegalStateException if the server was torn down
     */
    public void start() {
        synchronized (lifecycleLock) {
            ServerState current = state.get();
            if (!current.canStart()) {
                throw new IllegalStateException("Server has been torn down");
            }
            if (current == ServerState.RUNNING) {
                return;
            }
            joinAcceptThread();
            registry.freeze();
            shutdown = false;
            if (readyLatch.getCount() == 0) {
                // a restart; the first start keeps the latch early waiters hold
                readyLatch = new CountDownLatch(1);
            }
            if (!transition(state.get(), ServerState.RUNNING)) {
                throw new IllegalStateException("Server has been torn down");
            }
            Thread thread = acceptThreads.newThread(this::runAcceptLoop);
            acceptThread = thread;
            thread.start();
        }
    }

    /**
     * Waits until the accept loop is running.
     *
     * @param timeout the maximum time to wait
     * @return true if the server is accepting connections
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return readyLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Requests shutdown of the accept loop and all workers.
     *
     * <p>Each worker finishes the call it is serving and exits at its next poll. The listening socket
     * stays open; see {@link #teardown()}.
     *
     * @param block whether to wait until the accept loop has exited
     */
    public void stop(boolean block) {
        Thread thread;
        synchronized (lifecycleLock) {
            shutdown = true;
            transition(ServerState.RUNNING, ServerState.SHUTTING_DOWN);
            thread = acceptThread;
        }
        if (block && thread != null && thread != Thread.currentThread()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Closes the listening socket and every live connection. The server cannot be restarted.
     *
     * @throws TransportException if the listening socket cannot be closed cleanly
     */
    public void teardown() {
        ServerState previous;
        synchronized (lifecycleLock) {
            shutdown = true;
            previous = state.getAndSet(ServerState.TORN_DOWN);
        }
        if (previous == ServerState.TORN_DOWN) {
            return;
        }
        notifyListeners(previous, ServerState.TORN_DOWN);
        for (RpcWorker worker : workers) {
            worker.disconnect();
        }
        listener.close();
        LOGGER.log(Level.FINE, "SCRPC server torn down");
    }

    /** Stops the accept loop, waiting for it, then tears the server down. */
    @Override
    public void close() {
        stop(true);
        teardown();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // State
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns the address the server listens on, with the actual port.
     *
     * @return the bound address, or {@code null} once torn down
     */
    public InetSocketAddress getAddress() {
        return listener.localAddress();
    }

    public ServerState getState() {
        return state.get();
    }

    /**
     * Returns the number of connections currently being served.
     *
     * @return the live worker count
     */
    public int getConnectionCount() {
        return workers.size();
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    public RpcServerConfig getConfig() {
        return config;
    }

    /**
     * Registers a listener for lifecycle changes.
     *
     * @param listener the listener
     */
    public void addStateListener(ServerStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /** Polled by the accept loop and the workers. */
    boolean shutdownRequested() {
        return shutdown;
    }

    /** Forgets a worker. Called by the worker itself on exit; idempotent. */
    void removeConnection(RpcWorker worker) {
        workers.remove(worker);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Accept loop
    // ─────────────────────────────────────────────────────────────────────────

    private void runAcceptLoop() {
        readyLatch.countDown();
        Duration pollInterval = config.getPollInterval();
        try {
            while (!shutdown) {
                FramedTransport connection;
                try {
                    connection = listener.accept(pollInterval);
                } catch (TransportTimeoutException e) {
                    continue;
                } catch (TransportException e) {
                    if (!shutdown) {
                        LOGGER.log(Level.WARNING, "Accept failed, stopping accept loop", e);
                    }
                    break;
                }
                spawnWorker(connection);
            }
        } finally {
            // never takes lifecycleLock: start() joins this thread while holding it
            if (!transition(ServerState.SHUTTING_DOWN, ServerState.STOPPED)) {
                transition(ServerState.RUNNING, ServerState.STOPPED);
            }
        }
    }

    void spawnWorker(FramedTransport connection) {
        RpcWorker worker = new RpcWorker(connection, this, registry, config);
        workers.add(worker);
        if (shutdown) {
            // teardown() may already have swept the worker set
            worker.disconnect();
            return;
        }
        try {
            workerThreads.newThread(worker).start();
        } catch (RuntimeException | OutOfMemoryError e) {
            LOGGER.log(Level.WARNING, "Cannot start worker for " + worker, e);
            worker.disconnect();
        }
    }

    private boolean transition(ServerState from, ServerState to) {
        if (state.compareAndSet(from, to)) {
            notifyListeners(from, to);
            return true;
        }
        return false;
    }

    private void notifyListeners(ServerState previous, ServerState current) {
        LOGGER.log(Level.FINE, "SCRPC server {0} -> {1}", new Object[] {previous, current});
        for (ServerStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Server state listener failed", e);
            }
        }
    }

    private void joinAcceptThread() {
        Thread previous = acceptThread;
        if (previous == null || previous == Thread.currentThread()) {
            return;
        }
        try {
            previous.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the previous accept loop", e);
        }
    }

    @Override
    public String toString() {
        return "RpcServer[" + listener.localAddress() + ", " + state.get()
                + ", connections=" + workers.size() + "]";
    }
}
