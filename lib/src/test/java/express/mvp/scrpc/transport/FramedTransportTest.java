package express.mvp.scrpc.transport;

import express.mvp.scrpc.transport.framing.FramingException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loopback tests for {@link FramedTransport}.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class FramedTransportTest {

    private static final Duration ACCEPT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration SHORT = Duration.ofMillis(150);

    private FramedTransport listener;
    private FramedTransport client;
    private FramedTransport server;

    @BeforeEach
    void setUp() {
        listener = FramedTransport.listen(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 5, TransportConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        closeAll(server, client, listener);
    }

    private void connectPair() {
        client = FramedTransport.open(TransportConfig.defaults());
        client.connect(listener.localAddress());
        server = listener.accept(ACCEPT_TIMEOUT);
    }

    private Socket rawClient() throws IOException {
        Socket socket = new Socket();
        socket.connect(listener.localAddress(), 5000);
        server = listener.accept(ACCEPT_TIMEOUT);
        return socket;
    }

    private static void closeAll(FramedTransport... transports) {
        for (FramedTransport transport : transports) {
            if (transport != null) {
                transport.close();
            }
        }
    }

    // ==================== Setup Tests ====================

    @Nested
    @DisplayName("Connection setup")
    class ConnectionSetup {

        @Test
        @DisplayName("Port 0 binds an ephemeral port")
        void ephemeralPort() {
            assertTrue(listener.localAddress().getPort() > 0);
        }

        @Test
        @DisplayName("Accepted transport reports the client as its peer")
        void acceptedPeer() {
            connectPair();
            assertEquals(client.localAddress().getPort(), server.remoteAddress().getPort());
            assertTrue(server.isOpen());
        }

        @Test
        @DisplayName("Connecting to a closed port fails with TransportException")
        void connectRefused() {
            InetSocketAddress address = listener.localAddress();
            listener.close();

            FramedTransport transport = FramedTransport.open(TransportConfig.defaults());
            try {
                assertThrows(TransportException.class, () -> transport.connect(address, Duration.ofSeconds(2)));
            } finally {
                transport.close();
            }
        }

        @Test
        @DisplayName("listen() requires bind() first")
        void listenWithoutBind() {
            FramedTransport passive = FramedTransport.openServer(TransportConfig.defaults());
            try {
                assertThrows(IllegalStateException.class, () -> passive.listen(5));
            } finally {
                passive.close();
            }
        }

        @Test
        @DisplayName("Stream operations are refused on a listening transport")
        void wrongSocketKind() {
            assertThrows(IllegalStateException.class, () -> listener.recvFramed(SHORT));
            assertThrows(IllegalStateException.class, () -> listener.send(new byte[1], SHORT));
        }
    }

    // ==================== Timeout Tests ====================

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        @Test
        @DisplayName("accept() times out when nobody connects")
        void acceptTimesOut() {
            long start = System.nanoTime();
            TransportTimeoutException e =
                    assertThrows(TransportTimeoutException.class, () -> listener.accept(SHORT));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMillis >= SHORT.toMillis() - 10, "returned after " + elapsedMillis + " ms");
            assertEquals(SHORT, e.getTimeout());
        }

        @Test
        @DisplayName("Zero timeout polls without blocking")
        void zeroTimeoutPolls() {
            assertThrows(TransportTimeoutException.class, () -> listener.accept(Duration.ZERO));
        }

        @Test
        @DisplayName("recvFramed() timeout leaves the connection usable")
        void recvTimeoutIsRecoverable() {
            connectPair();

            assertThrows(TransportTimeoutException.class, () -> server.recvFramed(SHORT));
            assertThrows(TransportTimeoutException.class, () -> server.recv(16, SHORT));

            client.sendFramed("ACK".getBytes());
            assertArrayEquals("ACK".getBytes(), server.recvFramed(ACCEPT_TIMEOUT));
        }

        @Test
        @DisplayName("send() times out once the peer stops reading")
        void sendTimesOut() {
            connectPair();
            byte[] block = new byte[64 * 1024];

            assertThrows(TransportTimeoutException.class, () -> {
                while (true) {
                    client.send(block, Duration.ofMillis(100));
                }
            });
        }

        @Test
        @DisplayName("Negative timeout is rejected")
        void negativeTimeout() {
            assertThrows(IllegalArgumentException.class, () -> listener.accept(Duration.ofMillis(-1)));
        }
    }

    // ==================== Framing Tests ====================

    @Nested
    @DisplayName("Framed transfer")
    class FramedTransfer {

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 11, 4095, 4096, 4097, 100 * 1024})
        @DisplayName("Frames of any size arrive intact")
        void roundTrip(int size) throws Exception {
            connectPair();
            byte[] payload = new byte[size];
            new Random(size).nextBytes(payload);

            CompletableFuture<Void> sent = CompletableFuture.runAsync(() -> client.sendFramed(payload));
            byte[] received = server.recvFramed(ACCEPT_TIMEOUT);
            sent.get(5, TimeUnit.SECONDS);

            assertArrayEquals(payload, received);
        }

        @Test
        @DisplayName("Consecutive frames keep their boundaries")
        void frameBoundaries() {
            connectPair();
            client.sendFramed("PERFORM add".getBytes());
            client.sendFramed(new byte[0]);
            client.sendFramed("ACK".getBytes());

            assertEquals("PERFORM add", new String(server.recvFramed(ACCEPT_TIMEOUT)));
            assertEquals(0, server.recvFramed(ACCEPT_TIMEOUT).length);
            assertEquals("ACK", new String(server.recvFramed(ACCEPT_TIMEOUT)));
        }

        @Test
        @DisplayName("Frame split across writes is reassembled")
        void splitFrame() throws Exception {
            try (Socket socket = rawClient()) {
                OutputStream out = socket.getOutputStream();
                out.write(new byte[] {0, 0});
                out.flush();
                Thread.sleep(50);
                out.write(new byte[] {0, 3, 'A'});
                out.flush();
                Thread.sleep(50);
                out.write(new byte[] {'C', 'K'});
                out.flush();

                assertEquals("ACK", new String(server.recvFramed(ACCEPT_TIMEOUT)));
            }
        }

        @Test
        @DisplayName("Oversized payload is refused before anything is sent")
        void oversizedSend() {
            FramedTransport small = FramedTransport.open(TransportConfig.builder().maxPayloadSize(8).build());
            try {
                small.connect(listener.localAddress());
                server = listener.accept(ACCEPT_TIMEOUT);

                assertThrows(FramingException.class, () -> small.sendFramed(new byte[9]));
                assertThrows(TransportTimeoutException.class, () -> server.recv(16, SHORT));
            } finally {
                small.close();
            }
        }

        @Test
        @DisplayName("Oversized length prefix is a framing error")
        void oversizedPrefix() throws Exception {
            try (Socket socket = rawClient()) {
                socket.getOutputStream().write(ByteBuffer.allocate(4).putInt(Integer.MAX_VALUE).array());

                assertThrows(FramingException.class, () -> server.recvFramed(ACCEPT_TIMEOUT));
            }
        }
    }

    // ==================== Peer Close Tests ====================

    @Nested
    @DisplayName("Peer close")
    class PeerClose {

        @Test
        @DisplayName("Close before a frame begins returns null")
        void closeBetweenFrames() {
            connectPair();
            client.sendFramed("RESULT x".getBytes());
            client.close();

            assertNotNull(server.recvFramed(ACCEPT_TIMEOUT));
            assertNull(server.recvFramed(ACCEPT_TIMEOUT));
        }

        @Test
        @DisplayName("recv() returns an empty array after peer close")
        void rawRecvAfterClose() {
            connectPair();
            client.close();

            assertEquals(0, server.recv(16, ACCEPT_TIMEOUT).length);
        }

        @Test
        @DisplayName("Close inside the length prefix is a framing error")
        void closeInsidePrefix() throws Exception {
            try (Socket socket = rawClient()) {
                socket.getOutputStream().write(new byte[] {0, 0});
            }

            assertThrows(FramingException.class, () -> server.recvFramed(ACCEPT_TIMEOUT));
        }

        @Test
        @DisplayName("Close inside the payload is a transport error")
        void closeInsidePayload() throws Exception {
            try (Socket socket = rawClient()) {
                socket.getOutputStream().write(new byte[] {0, 0, 0, 10, 1, 2, 3});
            }

            TransportException e = assertThrows(TransportException.class, () -> server.recvFramed(ACCEPT_TIMEOUT));
            assertFalse(e instanceof FramingException);
            assertFalse(e instanceof TransportTimeoutException);
        }

        @Test
        @DisplayName("Local close wakes up a blocked receive")
        void closeWakesReceiver() throws Exception {
            connectPair();
            CompletableFuture<byte[]> pending = CompletableFuture.supplyAsync(
                    () -> server.recvFramed(Duration.ofSeconds(20)));
            Thread.sleep(100);

            server.close();

            Exception e = assertThrows(Exception.class, () -> pending.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TransportException.class, e.getCause());
            assertFalse(server.isOpen());
        }
    }

    // ==================== Stall Tests ====================

    @Test
    @DisplayName("Stalled payload fails after the consecutive timeout threshold")
    void stalledPayload() throws Exception {
        listener.close();
        listener = FramedTransport.listen(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0),
                5,
                TransportConfig.builder()
                        .payloadChunkTimeout(Duration.ofMillis(100))
                        .maxConsecutivePayloadTimeouts(2)
                        .build());

        try (Socket socket = rawClient()) {
            socket.getOutputStream().write(new byte[] {0, 0, 0, 10, 1, 2, 3});

            long start = System.nanoTime();
            FramingException e = assertThrows(FramingException.class, () -> server.recvFramed(ACCEPT_TIMEOUT));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(e.getMessage().startsWith("Not enough data was received"), e.getMessage());
            assertTrue(elapsedMillis >= 180, "failed after " + elapsedMillis + " ms");
        }
    }

    @Test
    @DisplayName("Slow but progressing payload is not failed")
    void slowPayload() throws Exception {
        listener.close();
        listener = FramedTransport.listen(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0),
                5,
                TransportConfig.builder()
                        .payloadChunkTimeout(Duration.ofMillis(300))
                        .maxConsecutivePayloadTimeouts(1)
                        .build());

        try (Socket socket = rawClient()) {
            OutputStream out = socket.getOutputStream();
            CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
                try {
                    out.write(new byte[] {0, 0, 0, 3});
                    for (byte b : new byte[] {'N', 'A', 'K'}) {
                        Thread.sleep(100);
                        out.write(b);
                    }
                } catch (IOException | InterruptedException e) {
                    throw new IllegalStateException(e);
                }
            });

            assertEquals("NAK", new String(server.recvFramed(ACCEPT_TIMEOUT)));
            writer.get(5, TimeUnit.SECONDS);
        }
    }
}
