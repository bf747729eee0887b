package express.mvp.scrpc.transport.framing;

import java.nio.ByteBuffer;

/**
 * Strategy interface for message framing in stream protocols.
 *
 * <p>TCP provides a continuous byte stream without inherent message boundaries. A framing handler
 * encodes the boundary of each message into a fixed-size header written before the payload, and
 * validates headers read back from the stream.
 *
 * <h2>Framing Process</h2>
 *
 * <pre>
 * Sender:                                    Receiver:
 * ┌──────────────┐                          ┌──────────────┐
 * │   Message    │                          │   Message    │
 * │   Payload    │                          │   Payload    │
 * └──────────────┘                          └──────────────┘
 *        │                                         ▲
 *        ▼ frame()                                 │ readPayloadLength() + payload
 * ┌────┬──────────────┐    Network    ┌────┬──────────────┐
 * │Hdr │   Payload    │  ─────────▶  │Hdr │   Payload    │
 * └────┴──────────────┘               └────┴──────────────┘
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations must be stateless and immutable so that the same instance can be shared by
 * every transport.
 *
 * @see LengthPrefixedFramingHandler
 * @see FramingException
 */
public interface FramingHandler {

    /**
     * Builds a complete frame (header followed by payload) for the given message.
     *
     * @param payload the message payload
     * @return a buffer positioned at zero containing the whole frame
     * @throws FramingException if the payload exceeds {@link #getMaxPayloadSize()}
     */
    ByteBuffer frame(byte[] payload);

    /**
     * Decodes and validates the payload length from a complete header.
     *
     * @param header a buffer holding exactly {@link #getHeaderSize()} remaining bytes
     * @return the payload length in bytes
     * @throws FramingException if the header is incomplete or declares an invalid length
     */
    int readPayloadLength(ByteBuffer header);

    /**
     * Returns the size of the framing header in bytes.
     *
     * @return the header size in bytes
     */
    int getHeaderSize();

    /**
     * Returns the maximum payload size that can be framed or accepted.
     *
     * @return the maximum payload size in bytes
     */
    int getMaxPayloadSize();
}
