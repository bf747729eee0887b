package express.mvp.scrpc.error;

import edu.umd.cs.findbugs.annotations.CheckForNull;

/**
 * The connection to the server failed, was closed, or carried an unexpected frame.
 *
 * <p>The proxy has dropped its connection and reconnects on the next call.
 */
public class CommunicationException extends RpcException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param message the detail message
     */
    public CommunicationException(String message) {
        this(message, null);
    }

    /**
     * Creates an exception.
     *
     * @param message the detail message
     * @param cause the underlying transport failure, may be null
     */
    public CommunicationException(String message, @CheckForNull Throwable cause) {
        super(ErrorKind.COMMUNICATION, message, cause, false);
    }
}
