package express.mvp.scrpc.transport.framing;

import express.mvp.scrpc.transport.TransportException;

/**
 * Exception thrown when message framing or deframing fails.
 *
 * <p>This exception indicates protocol-level errors in the framing layer, such as:
 *
 * <ul>
 *   <li><b>Oversized messages:</b> Payload exceeds the configured maximum size
 *   <li><b>Invalid length prefix:</b> The connection ended inside the 4-byte prefix
 *   <li><b>Stalled payload:</b> The declared payload did not arrive within the tolerated number of
 *       consecutive chunk timeouts
 * </ul>
 *
 * <h2>Error Recovery</h2>
 *
 * <p>When a {@code FramingException} is caught, the connection should be closed because the byte
 * stream is in an inconsistent state. It is not possible to resynchronize a length-prefixed stream
 * once the position of the next prefix has been lost.
 *
 * @see FramingHandler
 */
public class FramingException extends TransportException {

    /**
     * Constructs a new framing exception with the specified detail message.
     *
     * @param message the detail message describing the framing error
     */
    public FramingException(String message) {
        super(message);
    }

    /**
     * Constructs a new framing exception with the specified detail message and cause.
     *
     * @param message the detail message describing the framing error
     * @param cause the underlying cause of the framing error
     */
    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
