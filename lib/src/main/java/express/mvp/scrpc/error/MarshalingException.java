package express.mvp.scrpc.error;

import edu.umd.cs.findbugs.annotations.CheckForNull;

/** Arguments or a result could not be serialized or deserialized. */
public class MarshalingException extends RpcException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param message the detail message
     * @param cause the serialization failure, may be null
     */
    public MarshalingException(String message, @CheckForNull Throwable cause) {
        super(ErrorKind.MARSHALING, message, cause, true);
    }
}
