package express.mvp.scrpc.transport;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import express.mvp.scrpc.transport.framing.FramingException;
import express.mvp.scrpc.transport.framing.FramingHandler;
import express.mvp.scrpc.transport.framing.LengthPrefixedFramingHandler;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.channels.UnresolvedAddressException;
import java.nio.channels.UnsupportedAddressTypeException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A TCP socket with timed, readiness-gated blocking calls and length-prefixed message framing.
 *
 * <p>The wrapped channel is put in non-blocking mode and registered with a {@link Selector} owned
 * by this transport. Every blocking operation first waits on the selector for the required
 * readiness, bounded by a timeout, and only then performs the native call. A wait that elapses
 * raises {@link TransportTimeoutException}, which lets the server accept loop and every worker read
 * loop poll a shutdown flag instead of blocking forever.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────┐
 * │                    FramedTransport                      │
 * ├─────────────────────────────────────────────────────────┤
 * │   sendFramed() / recvFramed()   (4-byte BE length +     │
 * │            │                     payload, 4K chunks)    │
 * │            ▼                                            │
 * │   send() / recv() / accept() / connect()                │
 * │            │                                            │
 * │            ▼                                            │
 * │   ┌─────────────┐  select(timeout)  ┌───────────────┐   │
 * │   │  Selector   │◀─────────────────▶│ SocketChannel │   │
 * │   └─────────────┘                   └───────────────┘   │
 * └─────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Peer Close</h2>
 *
 * <p>{@link #recv(int, Duration)} returns an empty array when the peer has closed the connection and
 * {@link #recvFramed(Duration)} returns {@code null} when the peer closed before the next frame
 * began. Both are distinct from a timeout, which always raises.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>A transport is owned by one thread at a time (a server worker, or a client proxy under its
 * call lock). {@link #close()} may be called from any thread and wakes up a pending wait.
 */
public final class FramedTransport implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(FramedTransport.class.getName());

    private static final byte[] EMPTY = new byte[0];

    private final SelectableChannel channel;
    private final Selector selector;
    private final SelectionKey key;
    private final TransportConfig config;
    private final FramingHandler framing;

    @CheckForNull private SocketAddress bindAddress;

    private volatile boolean closed;

    private FramedTransport(SelectableChannel channel, TransportConfig config) throws IOException {
        this.channel = channel;
        this.config = config;
        this.framing = new LengthPrefixedFramingHandler(config.maxPayloadSize());
        channel.configureBlocking(false);
        Selector opened = Selector.open();
        try {
            this.key = channel.register(opened, 0);
        } catch (IOException | RuntimeException e) {
            opened.close();
            throw e;
        }
        this.selector = opened;
    }

    /**
     * Creates an unconnected stream transport, ready for {@link #connect(SocketAddress)}.
     *
     * @param config the transport configuration
     * @return a new transport
     * @throws TransportException if the socket cannot be created
     */
    public static FramedTransport open(TransportConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        SocketChannel socket = null;
        try {
            socket = SocketChannel.open();
            return new FramedTransport(socket, config);
        } catch (IOException e) {
            closeQuietly(socket);
            throw new TransportException("Error creating socket", e);
        }
    }

    /**
     * Creates an unbound passive transport, ready for {@link #bind(SocketAddress)} and {@link
     * #listen(int)}.
     *
     * @param config the configuration shared with every accepted transport
     * @return a new passive transport
     * @throws TransportException if the socket cannot be created
     */
    public static FramedTransport openServer(TransportConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        ServerSocketChannel server = null;
        try {
            server = ServerSocketChannel.open();
            return new FramedTransport(server, config);
        } catch (IOException e) {
            closeQuietly(server);
            throw new TransportException("Error creating server socket", e);
        }
    }

    /**
     * Creates a passive transport bound to {@code address} and listening with {@code backlog}.
     *
     * @param address the address to listen on (port 0 picks an ephemeral port)
     * @param backlog the maximum number of pending connections
     * @param config the configuration shared with every accepted transport
     * @return a listening transport
     * @throws TransportException if binding fails
     */
    public static FramedTransport listen(SocketAddress address, int backlog, TransportConfig config) {
        FramedTransport transport = openServer(config);
        try {
            transport.bind(address);
            transport.listen(backlog);
            return transport;
        } catch (RuntimeException e) {
            transport.closeAfterFailure(e);
            throw e;
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Connection setup
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Connects to {@code address} within the configured connect timeout.
     *
     * @param address the remote address
     * @throws TransportException if the connection cannot be established
     */
    public void connect(SocketAddress address) {
        connect(address, config.connectTimeout());
    }

    /**
     * Connects to {@code address} within {@code timeout}.
     *
     * @param address the remote address
     * @param timeout the maximum time to wait for the connection
     * @throws TransportException if the connection cannot be established
     */
    public void connect(SocketAddress address, Duration timeout) {
        Objects.requireNonNull(address, "address must not be null");
        SocketChannel socket = socketChannel();
        long deadline = deadlineFor(timeout);
        try {
            if (!socket.connect(address)) {
                do {
                    awaitReady(SelectionKey.OP_CONNECT, remaining(deadline), timeout);
                } while (!socket.finishConnect());
            }
            configureConnected(socket, config);
        } catch (IOException | UnresolvedAddressException | UnsupportedAddressTypeException e) {
            throw new TransportException("Error connecting to " + address, e);
        }
        LOGGER.log(Level.FINE, "Connected to {0}", address);
    }

    /**
     * Records the local address for a subsequent {@link #listen(int)}.
     *
     * <p>The JDK binds and listens in a single native step, so the address is only applied when
     * {@link #listen(int)} is called.
     *
     * @param address the address to listen on
     */
    public void bind(SocketAddress address) {
        serverChannel();
        this.bindAddress = Objects.requireNonNull(address, "address must not be null");
    }

    /**
     * Binds to the address given to {@link #bind(SocketAddress)} and starts listening.
     *
     * @param backlog the maximum number of pending connections
     * @throws TransportException if binding fails
     * @throws IllegalStateException if {@link #bind(SocketAddress)} was not called first
     */
    public void listen(int backlog) {
        ServerSocketChannel server = serverChannel();
        SocketAddress address = bindAddress;
        if (address == null) {
            throw new IllegalStateException("bind() must be called before listen()");
        }
        try {
            server.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            server.bind(address, backlog);
        } catch (IOException | UnresolvedAddressException | UnsupportedAddressTypeException e) {
            throw new TransportException("Error binding to " + address, e);
        }
    }

    /**
     * Waits up to {@code timeout} for an incoming connection and accepts it.
     *
     * @param timeout the maximum time to wait
     * @return a new transport owning the accepted connection, sharing this transport's configuration
     * @throws TransportTimeoutException if no connection arrived in time
     * @throws TransportException if the listening socket is broken or closed
     */
    public FramedTransport accept(Duration timeout) {
        ServerSocketChannel server = serverChannel();
        long deadline = deadlineFor(timeout);
        while (true) {
            awaitReady(SelectionKey.OP_ACCEPT, remaining(deadline), timeout);
            SocketChannel accepted = null;
            try {
                accepted = server.accept();
                if (accepted != null) {
                    configureConnected(accepted, config);
                    return new FramedTransport(accepted, config);
                }
            } catch (IOException e) {
                closeQuietly(accepted);
                throw new TransportException("Connection broken?", e);
            }
        }
    }

    /**
     * Waits for an incoming connection using the default timeout.
     *
     * @return a new transport owning the accepted connection
     * @see #accept(Duration)
     */
    public FramedTransport accept() {
        return accept(config.defaultTimeout());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Raw transfer
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Waits for writability and writes once.
     *
     * <p>Fewer bytes than {@code data.remaining()} may be written; the buffer position advances by
     * the returned count.
     *
     * @param data the bytes to write
     * @param timeout the maximum time to wait for writability
     * @return the number of bytes written
     * @throws TransportTimeoutException if the socket did not become writable in time
     * @throws TransportException if the connection is broken
     */
    public int send(ByteBuffer data, Duration timeout) {
        SocketChannel socket = socketChannel();
        awaitReady(SelectionKey.OP_WRITE, timeout, timeout);
        try {
            return socket.write(data);
        } catch (IOException e) {
            throw new TransportException("Connection broken?", e);
        }
    }

    /**
     * Waits for writability and writes once from {@code data}.
     *
     * @param data the bytes to write
     * @param timeout the maximum time to wait for writability
     * @return the number of bytes written
     */
    public int send(byte[] data, Duration timeout) {
        return send(ByteBuffer.wrap(data), timeout);
    }

    /**
     * Waits for readability and reads up to {@code maxBytes}.
     *
     * @param maxBytes the maximum number of bytes to read
     * @param timeout the maximum time to wait for data
     * @return the bytes read, or an empty array if the peer closed the connection
     * @throws TransportTimeoutException if no data arrived in time
     * @throws TransportException if the connection is broken
     */
    public byte[] recv(int maxBytes, Duration timeout) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        ByteBuffer buffer = ByteBuffer.allocate(maxBytes);
        int read = readSome(buffer, timeout);
        if (read < 0) {
            return EMPTY;
        }
        byte[] result = new byte[read];
        buffer.flip();
        buffer.get(result);
        return result;
    }

    /**
     * Reads up to {@code maxBytes} using the default timeout.
     *
     * @param maxBytes the maximum number of bytes to read
     * @return the bytes read, or an empty array if the peer closed the connection
     * @see #recv(int, Duration)
     */
    public byte[] recv(int maxBytes) {
        return recv(maxBytes, config.defaultTimeout());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Framed transfer
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Sends {@code message} as one length-prefixed frame.
     *
     * <p>The frame is written in chunks of at most {@link TransportConfig#chunkSize()} bytes; each
     * chunk waits up to {@code timeout} for writability.
     *
     * @param message the payload
     * @param timeout the maximum wait for each chunk
     * @throws FramingException if the message exceeds the maximum payload size
     * @throws TransportTimeoutException if the socket stopped accepting data
     * @throws TransportException if the connection is broken
     */
    public void sendFramed(byte[] message, Duration timeout) {
        ByteBuffer frame = framing.frame(message);
        while (frame.hasRemaining()) {
            ByteBuffer chunk = frame.slice();
            chunk.limit(Math.min(config.chunkSize(), chunk.remaining()));
            int written = send(chunk, timeout);
            frame.position(frame.position() + written);
        }
    }

    /**
     * Sends {@code message} as one frame using the default timeout.
     *
     * @param message the payload
     * @see #sendFramed(byte[], Duration)
     */
    public void sendFramed(byte[] message) {
        sendFramed(message, config.defaultTimeout());
    }

    /**
     * Receives one length-prefixed frame.
     *
     * <p>{@code timeout} bounds the wait for the first byte of the length prefix. Once a frame has
     * started, the remaining prefix and payload bytes are read in chunks of at most {@link
     * TransportConfig#chunkSize()} bytes, each waiting up to {@link
     * TransportConfig#payloadChunkTimeout()}. A chunk timeout is retried until {@link
     * TransportConfig#maxConsecutivePayloadTimeouts()} timeouts happen in a row without any data.
     *
     * @param timeout the maximum wait for the frame to begin
     * @return the payload (empty for a zero-length frame), or {@code null} if the peer closed the
     *     connection before the frame began
     * @throws TransportTimeoutException if no frame began in time
     * @throws FramingException if the prefix is malformed or the payload stalled
     * @throws TransportException if the peer closed mid-frame or the connection is broken
     */
    @CheckForNull
    public byte[] recvFramed(Duration timeout) {
        ByteBuffer header = ByteBuffer.allocate(framing.getHeaderSize());
        if (readSome(header, timeout) < 0) {
            return null;
        }
        readRemaining(header, true);
        header.flip();
        int length = framing.readPayloadLength(header);

        byte[] payload = new byte[length];
        readRemaining(ByteBuffer.wrap(payload), false);
        return payload;
    }

    /**
     * Receives one frame using the default timeout.
     *
     * @return the payload, or {@code null} if the peer closed the connection
     * @see #recvFramed(Duration)
     */
    @CheckForNull
    public byte[] recvFramed() {
        return recvFramed(config.defaultTimeout());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // State
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns the local address of the socket.
     *
     * @return the bound local address, or {@code null} if not bound or closed
     */
    @CheckForNull
    public InetSocketAddress localAddress() {
        try {
            if (channel instanceof ServerSocketChannel) {
                return (InetSocketAddress) ((ServerSocketChannel) channel).getLocalAddress();
            }
            return (InetSocketAddress) ((SocketChannel) channel).getLocalAddress();
        } catch (ClosedChannelException e) {
            return null;
        } catch (IOException e) {
            throw new TransportException("Cannot read local address", e);
        }
    }

    /**
     * Returns the address of the connected peer.
     *
     * @return the peer address, or {@code null} if not connected or closed
     */
    @CheckForNull
    public InetSocketAddress remoteAddress() {
        if (!(channel instanceof SocketChannel)) {
            return null;
        }
        try {
            return (InetSocketAddress) ((SocketChannel) channel).getRemoteAddress();
        } catch (ClosedChannelException e) {
            return null;
        } catch (IOException e) {
            throw new TransportException("Cannot read remote address", e);
        }
    }

    /**
     * Returns the configuration of this transport.
     *
     * @return the transport configuration
     */
    public TransportConfig getConfig() {
        return config;
    }

    /**
     * Checks whether the transport is still open.
     *
     * @return true until {@link #close()} is called
     */
    public boolean isOpen() {
        return !closed && channel.isOpen();
    }

    /**
     * Releases the selector and the socket.
     *
     * <p>A wait in progress on another thread is woken up and fails with {@link
     * TransportException}.
     *
     * @throws TransportException if the socket cannot be closed cleanly
     */
    @Override
    public void close() {
        closed = true;
        IOException failure = null;
        try {
            selector.close();
        } catch (IOException e) {
            failure = e;
        }
        try {
            channel.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw new TransportException("Error closing transport", failure);
        }
    }

    @Override
    public String toString() {
        String kind = channel instanceof ServerSocketChannel ? "listening" : "stream";
        return "FramedTransport[" + kind + (closed ? ", closed" : "") + "]";
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Internals
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Reads whatever is available into {@code dst} once the socket is readable.
     *
     * @return the number of bytes read (positive), or -1 if the peer closed the connection
     */
    private int readSome(ByteBuffer dst, Duration timeout) {
        SocketChannel socket = socketChannel();
        long deadline = deadlineFor(timeout);
        while (true) {
            awaitReady(SelectionKey.OP_READ, remaining(deadline), timeout);
            try {
                int read = socket.read(dst);
                if (read != 0) {
                    return read;
                }
            } catch (IOException e) {
                throw new TransportException("Connection broken?", e);
            }
        }
    }

    /** Fills {@code dst} completely, applying the chunk timeout policy. */
    private void readRemaining(ByteBuffer dst, boolean prefix) {
        int consecutiveTimeouts = 0;
        while (dst.hasRemaining()) {
            ByteBuffer chunk = dst.slice();
            chunk.limit(Math.min(config.chunkSize(), chunk.remaining()));
            int read;
            try {
                read = readSome(chunk, config.payloadChunkTimeout());
            } catch (TransportTimeoutException e) {
                consecutiveTimeouts++;
                if (consecutiveTimeouts >= config.maxConsecutivePayloadTimeouts()) {
                    throw new FramingException(String.format(
                            "Not enough data was received: %d of %d bytes",
                            dst.position(), dst.capacity()), e);
                }
                LOGGER.log(Level.FINE, "Frame stalled at {0} of {1} bytes, retrying",
                        new Object[] {dst.position(), dst.capacity()});
                continue;
            }
            if (read < 0) {
                if (prefix) {
                    throw new FramingException(String.format(
                            "Invalid length prefix: connection closed after %d of %d bytes",
                            dst.position(), dst.capacity()));
                }
                throw new TransportException("Connection was closed unexpectedly.");
            }
            dst.position(dst.position() + read);
            consecutiveTimeouts = 0;
        }
    }

    /**
     * Blocks until the channel is ready for {@code ops} or {@code wait} elapses.
     *
     * @param ops the interest set
     * @param wait the remaining time to wait
     * @param requested the timeout originally requested, reported on expiry
     */
    private void awaitReady(int ops, Duration wait, Duration requested) {
        if (closed) {
            throw new TransportException("Connection broken? Transport is closed.");
        }
        long deadline = deadlineFor(wait);
        try {
            key.interestOps(ops);
            while (true) {
                selector.selectedKeys().clear();
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                int selected = remainingMillis > 0
                        ? selector.select(remainingMillis)
                        : selector.selectNow();
                if (selected > 0 && (key.readyOps() & ops) != 0) {
                    return;
                }
                if (closed) {
                    throw new TransportException("Connection broken? Transport is closed.");
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new TransportException("Interrupted while waiting for socket readiness");
                }
                if (remainingMillis <= 0) {
                    throw new TransportTimeoutException(requested);
                }
            }
        } catch (ClosedSelectorException | CancelledKeyException e) {
            throw new TransportException("Connection broken? Transport is closed.", e);
        } catch (IOException e) {
            throw new TransportException("Connection broken?", e);
        }
    }

    private static long deadlineFor(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Invalid timeout period (" + timeout + ")");
        }
        return System.nanoTime() + timeout.toNanos();
    }

    private static Duration remaining(long deadline) {
        long nanos = deadline - System.nanoTime();
        return nanos > 0 ? Duration.ofNanos(nanos) : Duration.ZERO;
    }

    private SocketChannel socketChannel() {
        if (!(channel instanceof SocketChannel)) {
            throw new IllegalStateException("Operation requires a stream socket: " + this);
        }
        return (SocketChannel) channel;
    }

    private ServerSocketChannel serverChannel() {
        if (!(channel instanceof ServerSocketChannel)) {
            throw new IllegalStateException("Operation requires a listening socket: " + this);
        }
        return (ServerSocketChannel) channel;
    }

    private static void configureConnected(SocketChannel socket, TransportConfig config)
            throws IOException {
        socket.setOption(StandardSocketOptions.TCP_NODELAY, config.tcpNoDelay());
    }

    private void closeAfterFailure(RuntimeException failure) {
        try {
            close();
        } catch (TransportException e) {
            failure.addSuppressed(e);
        }
    }

    private static void closeQuietly(@CheckForNull Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Ignoring close failure after setup error", e);
        }
    }
}
