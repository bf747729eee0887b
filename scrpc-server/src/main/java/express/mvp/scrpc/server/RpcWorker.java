package express.mvp.scrpc.server;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import express.mvp.scrpc.error.MarshalingException;
import express.mvp.scrpc.protocol.Frame;
import express.mvp.scrpc.protocol.FrameType;
import express.mvp.scrpc.serialization.Serializer;
import express.mvp.scrpc.transport.FramedTransport;
import express.mvp.scrpc.transport.TransportException;
import express.mvp.scrpc.transport.TransportTimeoutException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves one accepted connection until the peer leaves, the connection breaks, or the server shuts
 * down.
 *
 * <h2>Call Sequence</h2>
 *
 * <pre>
 * recv "PERFORM name" ─▶ registered? ──no──▶ NACK "Function (name) does not exist."
 *                              │ yes
 *                              ▼
 *                  ACK, intent hook(false)
 *                              │
 * recv arguments ──▶ deserialize ──fail──▶ intent(true), EXCEPTION
 *                              │
 *                        Object[]? ──no──▶ intent(true), NACK "Argument must be a tuple."
 *                              │ yes
 *                              ▼
 *                  ACK, invoke ──raises──▶ EXCEPTION
 *                              │
 *                  serialize ──fail──▶ EXCEPTION
 *                              │
 *                              ▼
 *                           RESULT
 * </pre>
 *
 * <p>{@code NACK} and {@code EXCEPTION} keep the connection open. Any send failure, a peer close or
 * a broken connection ends the worker, which then deregisters from the server and closes its
 * socket.
 */
final class RpcWorker implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(RpcWorker.class.getName());

    static final String ARGUMENT_NOT_TUPLE = "Argument must be a tuple.";

    private final FramedTransport connection;
    private final RpcServer server;
    private final FunctionRegistry registry;
    private final Serializer serializer;
    private final Duration pollInterval;

    @CheckForNull private final InetSocketAddress peer;

    RpcWorker(FramedTransport connection, RpcServer server, FunctionRegistry registry, RpcServerConfig config) {
        this.connection = connection;
        this.server = server;
        this.registry = registry;
        this.serializer = config.getSerializer();
        this.pollInterval = config.getPollInterval();
        this.peer = connection.remoteAddress();
    }

    static String unknownFunction(String functionName) {
        return "Function (" + functionName + ") does not exist.";
    }

    @Override
    public void run() {
        LOGGER.log(Level.FINE, "SCRPC worker spawned, peer={0}", peer);
        try {
            while (!server.shutdownRequested()) {
                byte[] message;
                try {
                    message = connection.recvFramed(pollInterval);
                } catch (TransportTimeoutException e) {
                    continue;
                } catch (TransportException e) {
                    LOGGER.log(Level.FINE, "Connection broken", e);
                    break;
                }
                if (message == null || message.length == 0) {
                    LOGGER.fine("Connection closed by peer.");
                    break;
                }

                Frame command = Frame.parse(message);
                if (command.type() != FrameType.PERFORM) {
                    LOGGER.log(Level.FINE, "Ignoring unexpected frame {0}", command);
                    continue;
                }
                if (!perform(command.text())) {
                    LOGGER.fine("Error performing RPC.");
                    break;
                }
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Unhandled exception while performing RPC.", e);
        } finally {
            LOGGER.log(Level.FINE, "SCRPC worker leaving, peer={0}", peer);
            disconnect();
        }
    }

    /**
     * Runs one call.
     *
     * @return false if the connection can no longer be used
     */
    private boolean perform(String functionName) {
        Optional<RemoteFunction> function = registry.lookup(functionName);
        if (function.isEmpty()) {
            return send(Frame.nack(unknownFunction(functionName)));
        }
        if (!send(Frame.ack())) {
            return false;
        }

        Optional<RemoteFunction> intent = registry.lookup(functionName + FunctionRegistry.INTENT_SUFFIX);
        notifyIntent(intent, false);

        byte[] input;
        try {
            input = connection.recvFramed();
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, "Client did not send input", e);
            notifyIntent(intent, true);
            return false;
        }
        if (input == null || input.length == 0) {
            LOGGER.fine("Client did not send input");
            notifyIntent(intent, true);
            return false;
        }

        Object arguments;
        try {
            arguments = serializer.deserialize(input);
        } catch (MarshalingException e) {
            LOGGER.log(Level.FINE, "Cannot deserialize arguments", e);
            notifyIntent(intent, true);
            return send(Frame.exception(serializer.serializeFailure(e)));
        }

        if (!(arguments instanceof Object[])) {
            boolean sent = send(Frame.nack(ARGUMENT_NOT_TUPLE));
            notifyIntent(intent, true);
            return sent;
        }
        if (!send(Frame.ack())) {
            notifyIntent(intent, true);
            return false;
        }

        Object result;
        try {
            result = function.get().invoke((Object[]) arguments);
        } catch (Exception | AssertionError | LinkageError | StackOverflowError e) {
            // other VirtualMachineErrors leave the JVM unusable and still propagate
            LOGGER.log(Level.FINE, "Remote function " + functionName + " raised", e);
            return send(Frame.exception(serializer.serializeFailure(e)));
        }

        byte[] marshalled;
        try {
            marshalled = serializer.serialize(result);
        } catch (MarshalingException e) {
            LOGGER.log(Level.FINE, "Cannot serialize result of " + functionName, e);
            return send(Frame.exception(serializer.serializeFailure(e)));
        }
        return send(Frame.result(marshalled));
    }

    private boolean send(Frame frame) {
        try {
            connection.sendFramed(frame.encode());
            return true;
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, "Cannot send " + frame.type(), e);
            return false;
        }
    }

    private void notifyIntent(Optional<RemoteFunction> intent, boolean failed) {
        if (intent.isEmpty()) {
            return;
        }
        try {
            intent.get().invoke(Boolean.valueOf(failed));
        } catch (Exception | AssertionError | LinkageError | StackOverflowError e) {
            LOGGER.log(Level.WARNING, "Intent hook failed", e);
        }
    }

    /** Deregisters from the server and closes the connection. Safe to call more than once. */
    void disconnect() {
        server.removeConnection(this);
        try {
            connection.close();
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, "Error closing connection", e);
        }
    }

    @Override
    public String toString() {
        return "RpcWorker[" + peer + "]";
    }
}
