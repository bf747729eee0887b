package express.mvp.scrpc.error;

import edu.umd.cs.findbugs.annotations.CheckForNull;

/**
 * Base class of every error raised to the caller of a remote function.
 *
 * <p>All subclasses are unchecked. {@link #kind()} tells callers what went wrong without an
 * {@code instanceof} chain, and {@link #connectionIntact()} whether the proxy kept its connection.
 */
public abstract class RpcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final boolean connectionIntact;

    /**
     * Creates an exception.
     *
     * @param kind the error kind
     * @param message the detail message
     * @param cause the underlying cause, may be null
     * @param connectionIntact whether the connection is still usable
     */
    protected RpcException(
            ErrorKind kind, String message, @CheckForNull Throwable cause, boolean connectionIntact) {
        super(message, cause);
        this.kind = kind;
        this.connectionIntact = connectionIntact;
    }

    /**
     * Returns the kind of failure.
     *
     * @return the error kind
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns whether the proxy connection survived this failure.
     *
     * @return true if the next call reuses the same connection
     */
    public boolean connectionIntact() {
        return connectionIntact;
    }
}
