package express.mvp.scrpc.client;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.scrpc.error.CommunicationException;
import express.mvp.scrpc.error.MarshalingException;
import express.mvp.scrpc.error.RemoteException;
import express.mvp.scrpc.protocol.Frame;
import express.mvp.scrpc.serialization.Serializer;
import express.mvp.scrpc.transport.FramedTransport;
import express.mvp.scrpc.transport.TransportException;
import express.mvp.scrpc.transport.TransportTimeoutException;
import express.mvp.scrpc.transport.lifecycle.ConnectionState;
import express.mvp.scrpc.transport.lifecycle.ConnectionStateListener;
import express.mvp.scrpc.transport.lifecycle.ConnectionStateMachine;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client side of one persistent connection to an SCRPC server.
 *
 * <p>The proxy connects in its constructor and keeps that connection for all calls. Calls are
 * mutually exclusive: concurrent callers queue on a lock and each call owns the wire from {@code
 * PERFORM} to {@code RESULT}. When the connection breaks, the proxy drops it, raises {@link
 * CommunicationException}, and reconnects on the next call.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (RpcProxy proxy = new RpcProxy(new InetSocketAddress("localhost", 3344))) {
 *     int sum = (Integer) proxy.call("add", 2, 3);
 *
 *     Calculator calc = proxy.bind(Calculator.class);
 *     int product = calc.multiply(4, 5);
 * }
 * }</pre>
 *
 * <h2>Errors</h2>
 *
 * <ul>
 *   <li>{@link CommunicationException} - unreachable server, broken or closed connection,
 *       unexpected frame; the connection is dropped
 *   <li>{@link RemoteException} - {@code NACK}, or an exception raised by the remote function (the
 *       deserialized exception is the cause)
 *   <li>{@link MarshalingException} - arguments or result not serializable; nothing is sent when
 *       the arguments fail
 * </ul>
 */
public final class RpcProxy implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RpcProxy.class.getName());

    /** Host used by {@link #RpcProxy()}. */
    public static final String DEFAULT_HOST = "localhost";

    /** Port used by {@link #RpcProxy()}. */
    public static final int DEFAULT_PORT = 3344;

    static final String CONNECTION_CLOSED = "Connection closed by server.";
    static final String UNKNOWN_REMOTE_EXCEPTION = "Unknown exception raised on server.";

    private final ProxyConfig config;
    private final Serializer serializer;
    private final ReentrantLock callLock = new ReentrantLock();
    private final ConnectionStateMachine state;

    private volatile InetSocketAddress address;

    @CheckForNull private volatile FramedTransport transport;

    /**
     * Connects to {@code localhost:3344}.
     *
     * @throws CommunicationException if the server is unreachable
     */
    public RpcProxy() {
        this(new InetSocketAddress(DEFAULT_HOST, DEFAULT_PORT));
    }

    /**
     * Connects to {@code address} with the default configuration.
     *
     * @param address the server address
     * @throws CommunicationException if the server is unreachable
     */
    public RpcProxy(InetSocketAddress address) {
        this(address, ProxyConfig.defaults());
    }

    /**
     * Connects to {@code address}.
     *
     * @param address the server address
     * @param config the proxy configuration
     * @throws CommunicationException if the server is unreachable
     */
    @SuppressFBWarnings(
            value = "CT_CONSTRUCTOR_THROW",
            justification = "Connecting eagerly is part of the contract; the class is final")
    public RpcProxy(InetSocketAddress address, ProxyConfig config) {
        this.address = Objects.requireNonNull(address, "address must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.serializer = config.serializer();
        this.state = new ConnectionStateMachine("proxy-" + address);
        callLock.lock();
        try {
            connect();
        } finally {
            callLock.unlock();
        }
    }

    /**
     * Calls a remote function.
     *
     * @param functionName the registered name of the function
     * @param args the positional arguments, each serializable
     * @return the deserialized return value, may be null
     * @throws CommunicationException if the connection failed or the proxy is closed
     * @throws RemoteException if the server rejected the call or the function raised
     * @throws MarshalingException if arguments or result could not be (de)serialized
     */
    @CheckForNull
    public Object call(String functionName, Object... args) {
        Objects.requireNonNull(functionName, "functionName must not be null");
        Object[] arguments = args == null ? new Object[0] : args;

        callLock.lock();
        try {
            if (state.isClosedOrClosing()) {
                throw new CommunicationException("Proxy is closed.");
            }
            FramedTransport current = transport;
            if (current == null) {
                current = connect();
            }
            return perform(current, functionName, arguments);
        } finally {
            callLock.unlock();
        }
    }

    /**
     * Returns an implementation of {@code iface} whose methods call the remote functions of the same
     * name.
     *
     * <p>Methods of {@link Object} are answered locally. When a remote function raises an exception
     * that the interface method declares, that exception is rethrown as itself; any other failure
     * surfaces as the {@link express.mvp.scrpc.error.RpcException} raised by {@link #call}.
     *
     * @param iface the interface describing the remote functions
     * @param <T> the interface type
     * @return a proxy instance backed by this connection
     */
    public <T> T bind(Class<T> iface) {
        Objects.requireNonNull(iface, "iface must not be null");
        if (!iface.isInterface()) {
            throw new IllegalArgumentException(iface.getName() + " is not an interface");
        }
        InvocationHandler handler = (instance, method, args) -> {
            if (method.getDeclaringClass() == Object.class) {
                return invokeObjectMethod(instance, method, args);
            }
            try {
                return call(method.getName(), args);
            } catch (RemoteException e) {
                Throwable cause = e.getCause();
                if (cause != null && isDeclared(method, cause)) {
                    throw cause;
                }
                throw e;
            }
        };
        return iface.cast(Proxy.newProxyInstance(iface.getClassLoader(), new Class<?>[] {iface}, handler));
    }

    /**
     * Changes the server address. Takes effect at the next connection attempt.
     *
     * @param address the new server address
     */
    public void setAddress(InetSocketAddress address) {
        this.address = Objects.requireNonNull(address, "address must not be null");
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    /**
     * Checks if the proxy currently holds a connection.
     *
     * @return true in {@link ConnectionState#CONNECTED} state
     */
    public boolean isConnected() {
        return state.isActive();
    }

    public ConnectionState getConnectionState() {
        return state.getState();
    }

    /**
     * Registers a listener for connection state changes.
     *
     * @param listener the listener
     */
    public void addConnectionStateListener(ConnectionStateListener listener) {
        state.addListener(listener);
    }

    /**
     * Closes the connection. The proxy cannot be used afterwards.
     *
     * <p>Does not wait for a call in progress; that call fails with {@link
     * CommunicationException}. Closing twice has no effect.
     *
     * @throws CommunicationException if the socket could not be closed cleanly
     */
    @Override
    public void close() {
        ConnectionState current;
        do {
            current = state.getState();
            if (current.isTerminalOrClosing()) {
                return;
            }
        } while (!state.transitionFrom(current, ConnectionState.CLOSING));

        FramedTransport open = transport;
        transport = null;
        try {
            if (open != null) {
                open.close();
            }
        } catch (TransportException e) {
            throw new CommunicationException("Error disconnecting from server.", e);
        } finally {
            state.transitionTo(ConnectionState.CLOSED);
        }
    }

    @Override
    public String toString() {
        return "RpcProxy[" + address + ", " + state.getState() + "]";
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Call sequence
    // ─────────────────────────────────────────────────────────────────────────

    @CheckForNull
    private Object perform(FramedTransport wire, String functionName, Object[] arguments) {
        byte[] input;
        try {
            input = serializer.serialize(arguments);
        } catch (MarshalingException e) {
            throw new MarshalingException("Error marshaling function input.", e);
        }

        Duration ackTimeout = config.transportConfig().defaultTimeout();

        send(wire, Frame.perform(functionName).encode(), "Error sending PERFORM request to server.");
        Frame response = receive(wire, ackTimeout, "Server did not respond to PERFORM request.");
        switch (response.type()) {
            case ACK:
                break;
            case NACK:
                throw new RemoteException(response.text());
            default:
                throw protocolFault(response);
        }

        send(wire, input, "Error sending function input to server.");
        response = receive(wire, ackTimeout, "Server did not ack receipt of input.");
        switch (response.type()) {
            case ACK:
                break;
            case NACK:
                throw new RemoteException(response.text());
            case EXCEPTION:
                throw remoteFailure(response);
            default:
                throw protocolFault(response);
        }

        Frame result = awaitResult(wire);
        switch (result.type()) {
            case RESULT:
                try {
                    return serializer.deserialize(result.body());
                } catch (MarshalingException e) {
                    throw new MarshalingException("Error unmarshalling result.", e);
                }
            case EXCEPTION:
                throw remoteFailure(result);
            default:
                throw protocolFault(result);
        }
    }

    private void send(FramedTransport wire, byte[] message, String failureMessage) {
        try {
            wire.sendFramed(message);
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, failureMessage, e);
            disconnect(e);
            throw new CommunicationException(failureMessage, e);
        }
    }

    private Frame receive(FramedTransport wire, Duration timeout, String failureMessage) {
        byte[] message;
        try {
            message = wire.recvFramed(timeout);
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, failureMessage, e);
            disconnect(e);
            throw new CommunicationException(failureMessage, e);
        }
        return closedOrParse(message);
    }

    private Frame awaitResult(FramedTransport wire) {
        byte[] message;
        try {
            message = wire.recvFramed(config.maxCallDuration());
        } catch (TransportTimeoutException e) {
            // a late RESULT would be read as the answer to the next call
            disconnect(e);
            throw new RemoteException("Timeout while performing remote function.", e, false);
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, "Error receiving remote function output.", e);
            disconnect(e);
            throw new CommunicationException("Error receiving remote function output.", e);
        }
        return closedOrParse(message);
    }

    private Frame closedOrParse(@CheckForNull byte[] message) {
        if (message == null || message.length == 0) {
            disconnect(null);
            throw new CommunicationException(CONNECTION_CLOSED);
        }
        return Frame.parse(message);
    }

    private RemoteException remoteFailure(Frame frame) {
        Object error;
        try {
            error = serializer.deserialize(frame.body());
        } catch (MarshalingException e) {
            return new RemoteException(UNKNOWN_REMOTE_EXCEPTION, e);
        }
        if (error instanceof Throwable) {
            Throwable remote = (Throwable) error;
            return new RemoteException("Remote function raised " + remote, remote);
        }
        return new RemoteException(UNKNOWN_REMOTE_EXCEPTION);
    }

    private CommunicationException protocolFault(Frame frame) {
        disconnect(null);
        return new CommunicationException("Unexpected response from server: " + frame);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Connection management
    // ─────────────────────────────────────────────────────────────────────────

    /** Opens a new transport. Caller holds the call lock. */
    private FramedTransport connect() {
        InetSocketAddress target = address;
        if (!state.transitionTo(ConnectionState.CONNECTING)) {
            throw new CommunicationException("Proxy is closed.");
        }
        FramedTransport opened = null;
        try {
            opened = FramedTransport.open(config.transportConfig());
            opened.connect(target);
        } catch (TransportException e) {
            closeQuietly(opened);
            state.transitionTo(ConnectionState.FAILED, e);
            throw new CommunicationException("Error connecting to RPC server at " + target + ".", e);
        }
        transport = opened;
        if (!state.transitionTo(ConnectionState.CONNECTED)) {
            // closed concurrently while connecting
            transport = null;
            closeQuietly(opened);
            throw new CommunicationException("Proxy is closed.");
        }
        LOGGER.log(Level.FINE, "Connected to RPC server at {0}", target);
        return opened;
    }

    /** Drops the current transport; the next call reconnects. */
    private void disconnect(@CheckForNull Throwable cause) {
        FramedTransport current = transport;
        transport = null;
        closeQuietly(current);
        state.transitionTo(ConnectionState.FAILED, cause);
    }

    private static void closeQuietly(@CheckForNull FramedTransport wire) {
        if (wire == null) {
            return;
        }
        try {
            wire.close();
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, "Error disconnecting from server.", e);
        }
    }

    private static boolean isDeclared(Method method, Throwable cause) {
        for (Class<?> declared : method.getExceptionTypes()) {
            if (declared.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }

    private Object invokeObjectMethod(Object instance, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                return instance == args[0];
            case "hashCode":
                return System.identityHashCode(instance);
            case "toString":
                return "RemoteProxy[" + address + "]";
            default:
                throw new UnsupportedOperationException(method.toString());
        }
    }
}
