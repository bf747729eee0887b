package express.mvp.scrpc.client;

import express.mvp.scrpc.error.CommunicationException;
import express.mvp.scrpc.error.ErrorKind;
import express.mvp.scrpc.error.MarshalingException;
import express.mvp.scrpc.error.RemoteException;
import express.mvp.scrpc.protocol.Frame;
import express.mvp.scrpc.protocol.FrameType;
import express.mvp.scrpc.serialization.JavaSerializer;
import express.mvp.scrpc.transport.FramedTransport;
import express.mvp.scrpc.transport.TransportConfig;
import express.mvp.scrpc.transport.TransportTimeoutException;
import express.mvp.scrpc.transport.lifecycle.ConnectionState;
import org.junit.jupiter.api.*;

import java.io.FileNotFoundException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives {@link RpcProxy} against a scripted peer speaking the wire protocol directly.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class RpcProxyTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final JavaSerializer SERIALIZER = JavaSerializer.getInstance();

    private FramedTransport listener;
    private final List<FramedTransport> accepted = new ArrayList<>();
    private RpcProxy proxy;

    interface Files {
        String read(String path) throws FileNotFoundException;

        int size(String path);
    }

    @BeforeEach
    void setUp() {
        listener = FramedTransport.listen(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 5, TransportConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        if (proxy != null) {
            proxy.close();
        }
        synchronized (accepted) {
            accepted.forEach(FramedTransport::close);
        }
        listener.close();
    }

    /** Accepts the next connection and runs {@code script} on it in the background. */
    private CompletableFuture<Void> peer(Consumer<FramedTransport> script) {
        return CompletableFuture.runAsync(() -> {
            FramedTransport connection = listener.accept(WAIT);
            synchronized (accepted) {
                accepted.add(connection);
            }
            script.accept(connection);
        });
    }

    private RpcProxy connect() {
        return connect(ProxyConfig.defaults());
    }

    private RpcProxy connect(ProxyConfig config) {
        proxy = new RpcProxy(listener.localAddress(), config);
        return proxy;
    }

    private static Frame expect(FramedTransport connection, FrameType type) {
        Frame frame = Frame.parse(connection.recvFramed(WAIT));
        assertEquals(type, frame.type());
        return frame;
    }

    /** Plays the server side of one successful call returning {@code result}. */
    private static void serveOne(FramedTransport connection, Object result) {
        expect(connection, FrameType.PERFORM);
        connection.sendFramed(Frame.ack().encode());
        connection.recvFramed(WAIT);
        connection.sendFramed(Frame.ack().encode());
        connection.sendFramed(Frame.result(SERIALIZER.serialize(result)).encode());
    }

    // ==================== Connection ====================

    @Test
    @DisplayName("Constructor fails with CommunicationException when nobody listens")
    void unreachable() {
        InetSocketAddress address = listener.localAddress();
        listener.close();

        CommunicationException e = assertThrows(CommunicationException.class, () -> new RpcProxy(address));
        assertEquals(ErrorKind.COMMUNICATION, e.kind());
        assertFalse(e.connectionIntact());
    }

    @Test
    @DisplayName("Successful call sends PERFORM, then the argument tuple")
    void successfulCall() throws Exception {
        CompletableFuture<Object[]> received = new CompletableFuture<>();
        CompletableFuture<Void> server = peer(connection -> {
            Frame perform = expect(connection, FrameType.PERFORM);
            assertEquals("add", perform.text());
            connection.sendFramed(Frame.ack().encode());
            received.complete((Object[]) SERIALIZER.deserialize(connection.recvFramed(WAIT)));
            connection.sendFramed(Frame.ack().encode());
            connection.sendFramed(Frame.result(SERIALIZER.serialize(5)).encode());
        });
        connect();

        assertEquals(5, proxy.call("add", 2, 3));
        assertArrayEquals(new Object[] {2, 3}, received.get(5, TimeUnit.SECONDS));
        server.get(5, TimeUnit.SECONDS);
        assertTrue(proxy.isConnected());
        assertEquals(ConnectionState.CONNECTED, proxy.getConnectionState());
    }

    @Test
    @DisplayName("Call with no arguments sends an empty tuple")
    void noArguments() throws Exception {
        CompletableFuture<Object> received = new CompletableFuture<>();
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.ack().encode());
            received.complete(SERIALIZER.deserialize(connection.recvFramed(WAIT)));
            connection.sendFramed(Frame.ack().encode());
            connection.sendFramed(Frame.result(SERIALIZER.serialize(null)).encode());
        });
        connect();

        assertNull(proxy.call("ping"));
        assertArrayEquals(new Object[0], (Object[]) received.get(5, TimeUnit.SECONDS));
    }

    // ==================== Remote failures ====================

    @Test
    @DisplayName("NACK to PERFORM is a RemoteException carrying the reason")
    void nackOnPerform() throws Exception {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.nack("Function (nope) does not exist.").encode());
            serveOne(connection, "still here");
        });
        connect();

        RemoteException e = assertThrows(RemoteException.class, () -> proxy.call("nope"));
        assertEquals("Function (nope) does not exist.", e.getMessage());
        assertTrue(e.connectionIntact());
        assertEquals("still here", proxy.call("echo"));
    }

    @Test
    @DisplayName("EXCEPTION after the arguments carries the remote exception as cause")
    void exceptionOnArguments() {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.ack().encode());
            connection.recvFramed(WAIT);
            connection.sendFramed(Frame.exception(SERIALIZER.serialize(new IllegalStateException("bad input"))).encode());
        });
        connect();

        RemoteException e = assertThrows(RemoteException.class, () -> proxy.call("f", 1));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("bad input", e.getCause().getMessage());
    }

    @Test
    @DisplayName("Undecodable EXCEPTION body becomes an unknown remote exception")
    void undecodableException() {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.ack().encode());
            connection.recvFramed(WAIT);
            connection.sendFramed(Frame.ack().encode());
            connection.sendFramed(Frame.exception(new byte[] {1, 2, 3}).encode());
        });
        connect();

        RemoteException e = assertThrows(RemoteException.class, () -> proxy.call("f"));
        assertEquals(RpcProxy.UNKNOWN_REMOTE_EXCEPTION, e.getMessage());
    }

    @Test
    @DisplayName("Result that cannot be deserialized is a MarshalingException")
    void undecodableResult() {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.ack().encode());
            connection.recvFramed(WAIT);
            connection.sendFramed(Frame.ack().encode());
            connection.sendFramed(Frame.result(new byte[] {42}).encode());
        });
        connect();

        MarshalingException e = assertThrows(MarshalingException.class, () -> proxy.call("f"));
        assertEquals(ErrorKind.MARSHALING, e.kind());
        assertTrue(proxy.isConnected());
    }

    @Test
    @DisplayName("Unserializable arguments fail before anything is sent")
    void unserializableArguments() throws Exception {
        CompletableFuture<Void> server = peer(connection ->
                assertThrows(TransportTimeoutException.class, () -> connection.recvFramed(Duration.ofMillis(300))));
        connect();

        assertThrows(MarshalingException.class, () -> proxy.call("f", new Object()));
        server.get(5, TimeUnit.SECONDS);
        assertTrue(proxy.isConnected());
    }

    // ==================== Connection loss ====================

    @Test
    @DisplayName("Server closing the connection is a CommunicationException, next call reconnects")
    void peerCloseAndReconnect() throws Exception {
        CompletableFuture<Void> first = peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.close();
        });
        connect();

        CommunicationException e = assertThrows(CommunicationException.class, () -> proxy.call("f"));
        assertEquals(RpcProxy.CONNECTION_CLOSED, e.getMessage());
        assertEquals(ConnectionState.FAILED, proxy.getConnectionState());
        first.get(5, TimeUnit.SECONDS);

        peer(connection -> serveOne(connection, "reconnected"));
        assertEquals("reconnected", proxy.call("f"));
        assertTrue(proxy.isConnected());
    }

    @Test
    @DisplayName("Unexpected frame drops the connection")
    void unexpectedFrame() {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.result(SERIALIZER.serialize("too early")).encode());
        });
        connect();

        CommunicationException e = assertThrows(CommunicationException.class, () -> proxy.call("f"));
        assertTrue(e.getMessage().startsWith("Unexpected response from server"));
        assertFalse(proxy.isConnected());
    }

    @Test
    @DisplayName("Result timeout is a RemoteException and drops the connection")
    void resultTimeout() {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.ack().encode());
            connection.recvFramed(WAIT);
            connection.sendFramed(Frame.ack().encode());
        });
        connect(ProxyConfig.builder().maxCallDuration(Duration.ofMillis(200)).build());

        RemoteException e = assertThrows(RemoteException.class, () -> proxy.call("slow"));
        assertInstanceOf(TransportTimeoutException.class, e.getCause());
        assertFalse(e.connectionIntact());
        assertEquals(ConnectionState.FAILED, proxy.getConnectionState());
    }

    @Test
    @DisplayName("setAddress() is used by the next reconnect")
    void setAddress() throws Exception {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.close();
        });
        connect();
        assertThrows(CommunicationException.class, () -> proxy.call("f"));

        FramedTransport other = FramedTransport.listen(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 5, TransportConfig.defaults());
        try {
            proxy.setAddress(other.localAddress());
            CompletableFuture<Void> server = CompletableFuture.runAsync(() -> {
                FramedTransport connection = other.accept(WAIT);
                try {
                    serveOne(connection, "moved");
                } finally {
                    connection.recvFramed(WAIT);
                    connection.close();
                }
            });

            assertEquals("moved", proxy.call("f"));
            assertEquals(other.localAddress(), proxy.getAddress());
            proxy.close();
            server.get(5, TimeUnit.SECONDS);
        } finally {
            other.close();
        }
    }

    // ==================== Close ====================

    @Test
    @DisplayName("Closed proxy refuses calls")
    void closedProxy() {
        peer(connection -> connection.recvFramed(WAIT));
        connect();

        proxy.close();
        proxy.close();

        assertEquals(ConnectionState.CLOSED, proxy.getConnectionState());
        assertThrows(CommunicationException.class, () -> proxy.call("f"));
    }

    @Test
    @DisplayName("State listeners observe the connection being lost")
    void stateListener() {
        List<ConnectionState> states = new ArrayList<>();
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.close();
        });
        connect();
        proxy.addConnectionStateListener((prev, curr, cause) -> states.add(curr));

        assertThrows(CommunicationException.class, () -> proxy.call("f"));
        proxy.close();

        assertEquals(List.of(ConnectionState.FAILED, ConnectionState.CLOSING, ConnectionState.CLOSED), states);
    }

    // ==================== Interface binding ====================

    @Test
    @DisplayName("Bound interface methods become calls by name")
    void boundInterface() throws Exception {
        CompletableFuture<String> name = new CompletableFuture<>();
        peer(connection -> {
            name.complete(expect(connection, FrameType.PERFORM).text());
            connection.sendFramed(Frame.ack().encode());
            connection.recvFramed(WAIT);
            connection.sendFramed(Frame.ack().encode());
            connection.sendFramed(Frame.result(SERIALIZER.serialize(42)).encode());
        });
        connect();
        Files files = proxy.bind(Files.class);

        assertEquals(42, files.size("/tmp/x"));
        assertEquals("size", name.get(5, TimeUnit.SECONDS));
        assertTrue(files.toString().startsWith("RemoteProxy["));
        assertEquals(files, files);
    }

    @Test
    @DisplayName("Declared exception raised remotely is rethrown as itself")
    void boundDeclaredException() {
        peer(connection -> {
            expect(connection, FrameType.PERFORM);
            connection.sendFramed(Frame.ack().encode());
            connection.recvFramed(WAIT);
            connection.sendFramed(Frame.ack().encode());
            connection.sendFramed(Frame.exception(SERIALIZER.serialize(new FileNotFoundException("/etc/none"))).encode());
        });
        connect();
        Files files = proxy.bind(Files.class);

        FileNotFoundException e = assertThrows(FileNotFoundException.class, () -> files.read("/etc/none"));
        assertEquals("/etc/none", e.getMessage());
    }

    @Test
    @DisplayName("Only interfaces can be bound")
    void bindRequiresInterface() {
        peer(connection -> connection.recvFramed(WAIT));
        connect();
        assertThrows(IllegalArgumentException.class, () -> proxy.bind(String.class));
    }
}
