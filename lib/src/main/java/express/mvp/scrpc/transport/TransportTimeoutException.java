package express.mvp.scrpc.transport;

import java.time.Duration;

/**
 * Signals that a transport wait elapsed without the socket becoming ready.
 *
 * <p>A timeout is not a failure of the connection: callers such as the server accept loop use it as
 * their poll point and simply retry. It must therefore always be caught before {@link
 * TransportException}.
 */
public class TransportTimeoutException extends TransportException {

    private final Duration timeout;

    /**
     * Creates a timeout exception for the given wait.
     *
     * @param timeout the wait that elapsed
     */
    public TransportTimeoutException(Duration timeout) {
        super("Operation timed out after " + timeout.toMillis() + " ms.");
        this.timeout = timeout;
    }

    /**
     * Returns the wait that elapsed.
     *
     * @return the timeout duration
     */
    public Duration getTimeout() {
        return timeout;
    }
}
