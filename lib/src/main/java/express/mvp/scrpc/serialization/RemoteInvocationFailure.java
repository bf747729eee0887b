package express.mvp.scrpc.serialization;

/**
 * Serializable stand-in for a server-side exception that could not be serialized itself.
 *
 * <p>Keeps the original class name, message and stack trace. The cause chain is converted the same
 * way.
 */
public class RemoteInvocationFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String originalClassName;

    /**
     * Captures {@code original}.
     *
     * @param original the exception to describe
     */
    public RemoteInvocationFailure(Throwable original) {
        super(original.getClass().getName() + ": " + original.getMessage(),
                original.getCause() == null ? null : new RemoteInvocationFailure(original.getCause()));
        this.originalClassName = original.getClass().getName();
        setStackTrace(original.getStackTrace());
    }

    /**
     * Returns the class name of the exception raised on the server.
     *
     * @return the fully qualified class name
     */
    public String getOriginalClassName() {
        return originalClassName;
    }
}
