package express.mvp.scrpc.error;

import edu.umd.cs.findbugs.annotations.CheckForNull;

/**
 * The server rejected the call or the remote function failed.
 *
 * <p>For a rejection ({@code NACK}) the message is the server's reason and there is no cause. For
 * an application failure the deserialized server-side exception is the {@linkplain #getCause()
 * cause}.
 */
public class RemoteException extends RpcException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception for a rejection.
     *
     * @param message the reason given by the server
     */
    public RemoteException(String message) {
        this(message, null);
    }

    /**
     * Creates an exception for a failure that left the connection usable.
     *
     * @param message the detail message
     * @param cause the remote exception, may be null
     */
    public RemoteException(String message, @CheckForNull Throwable cause) {
        this(message, cause, true);
    }

    /**
     * Creates an exception.
     *
     * @param message the detail message
     * @param cause the remote exception, may be null
     * @param connectionIntact whether the proxy kept its connection
     */
    public RemoteException(String message, @CheckForNull Throwable cause, boolean connectionIntact) {
        super(ErrorKind.REMOTE, message, cause, connectionIntact);
    }
}
