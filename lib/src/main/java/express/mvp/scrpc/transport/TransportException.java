package express.mvp.scrpc.transport;

/**
 * Unchecked exception thrown when a framed transport operation fails.
 *
 * <p>This exception wraps I/O errors, connection failures and broken connections detected by the
 * readiness selector. It extends {@link RuntimeException} to avoid cluttering method signatures
 * with checked exceptions.
 *
 * <h2>Common Causes</h2>
 *
 * <ul>
 *   <li>Connection refused or reset
 *   <li>I/O errors during send/receive operations
 *   <li>Peer closed the connection in the middle of a frame
 *   <li>Operation on a transport that has already been closed
 * </ul>
 *
 * <p>A wait that merely ran out of time is reported with the subclass {@link
 * TransportTimeoutException} so that callers can poll and retry. Malformed frames are reported with
 * {@link express.mvp.scrpc.transport.framing.FramingException}.
 */
public class TransportException extends RuntimeException {

    /**
     * Constructs a new transport exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Constructs a new transport exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
