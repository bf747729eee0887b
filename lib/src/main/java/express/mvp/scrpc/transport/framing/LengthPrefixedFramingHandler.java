package express.mvp.scrpc.transport.framing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * A framing handler that uses a 4-byte big-endian length prefix.
 *
 * <p>This implementation frames messages by prepending a 4-byte unsigned integer in network byte
 * order that specifies the payload length.
 *
 * <h2>Frame Format</h2>
 *
 * <pre>
 * ┌────────────────────────┬─────────────────────────────────────┐
 * │  Length (4 bytes, BE)  │           Payload (N bytes)         │
 * └────────────────────────┴─────────────────────────────────────┘
 * </pre>
 *
 * <p>The prefix is unsigned on the wire. Values of 2^31 and above cannot be represented by a Java
 * array and are rejected together with anything above the configured maximum payload size, which
 * defaults to {@value #DEFAULT_MAX_PAYLOAD_SIZE} bytes (64 MiB).
 *
 * <p>This class is immutable and thread-safe.
 *
 * @see FramingHandler
 * @see FramingException
 */
public final class LengthPrefixedFramingHandler implements FramingHandler {

    /** The size of the length prefix header in bytes. */
    public static final int HEADER_SIZE = 4;

    /** The default maximum payload size: 64 MiB. */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 64 * 1024 * 1024;

    private final int maxPayloadSize;

    /** Creates a handler with the default maximum payload size. */
    public LengthPrefixedFramingHandler() {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    /**
     * Creates a handler with the specified maximum payload size.
     *
     * @param maxPayloadSize the maximum payload size in bytes
     * @throws IllegalArgumentException if maxPayloadSize is not positive or would overflow the frame
     *     size
     */
    public LengthPrefixedFramingHandler(int maxPayloadSize) {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
        }
        // Ensure total frame size doesn't overflow
        if (maxPayloadSize > Integer.MAX_VALUE - HEADER_SIZE) {
            throw new IllegalArgumentException(
                    "maxPayloadSize too large, would overflow frame size: " + maxPayloadSize);
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The returned buffer is heap-backed and big-endian.
     */
    @Override
    public ByteBuffer frame(byte[] payload) {
        Objects.requireNonNull(payload, "payload must not be null");

        if (payload.length > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Payload size %d exceeds maximum allowed size %d", payload.length, maxPayloadSize));
        }

        ByteBuffer frame = ByteBuffer.allocate(HEADER_SIZE + payload.length).order(ByteOrder.BIG_ENDIAN);
        frame.putInt(payload.length);
        frame.put(payload);
        frame.flip();
        return frame;
    }

    /**
     * {@inheritDoc}
     *
     * @throws FramingException if fewer than {@value #HEADER_SIZE} bytes remain, or the prefix is
     *     negative as a signed int (2^31 or more unsigned) or larger than {@link
     *     #getMaxPayloadSize()}
     */
    @Override
    public int readPayloadLength(ByteBuffer header) {
        Objects.requireNonNull(header, "header must not be null");

        if (header.remaining() != HEADER_SIZE) {
            throw new FramingException(String.format(
                    "Invalid length prefix: expected %d bytes, got %d", HEADER_SIZE, header.remaining()));
        }

        long payloadLength = Integer.toUnsignedLong(header.order(ByteOrder.BIG_ENDIAN).getInt());
        if (payloadLength > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Length prefix %d exceeds maximum allowed size %d", payloadLength, maxPayloadSize));
        }
        return (int) payloadLength;
    }

    /**
     * {@inheritDoc}
     *
     * @return 4 (the size of the 32-bit length prefix)
     */
    @Override
    public int getHeaderSize() {
        return HEADER_SIZE;
    }

    @Override
    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    @Override
    public String toString() {
        return String.format("LengthPrefixedFramingHandler[headerSize=%d, maxPayloadSize=%d]",
                HEADER_SIZE, maxPayloadSize);
    }
}
