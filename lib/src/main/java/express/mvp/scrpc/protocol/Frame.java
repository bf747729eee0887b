package express.mvp.scrpc.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One control frame of the SCRPC protocol.
 *
 * <p>A frame is a command word, optionally followed by a single space and a body. The body is a
 * UTF-8 string for {@code PERFORM} and {@code NACK}, and raw serialized bytes for {@code EXCEPTION}
 * and {@code RESULT}. The serialized argument array that follows an accepted {@code PERFORM} is not
 * a control frame; it travels as a bare message.
 *
 * <p>Instances are immutable. Body arrays are copied on the way in and out.
 */
public final class Frame {

    private static final byte SEPARATOR = ' ';
    private static final byte[] NO_BODY = new byte[0];
    private static final Frame ACK = new Frame(FrameType.ACK, NO_BODY);

    private final FrameType type;
    private final byte[] body;

    private Frame(FrameType type, byte[] body) {
        this.type = type;
        this.body = body;
    }

    /**
     * Creates a {@code PERFORM <name>} frame.
     *
     * @param functionName the function to invoke
     * @return the frame
     */
    public static Frame perform(String functionName) {
        Objects.requireNonNull(functionName, "functionName must not be null");
        return new Frame(FrameType.PERFORM, functionName.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the {@code ACK} frame.
     *
     * @return the shared ACK frame
     */
    public static Frame ack() {
        return ACK;
    }

    /**
     * Creates a {@code NACK <reason>} frame.
     *
     * @param reason human-readable rejection reason
     * @return the frame
     */
    public static Frame nack(String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        return new Frame(FrameType.NACK, reason.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates an {@code EXCEPTION <bytes>} frame.
     *
     * @param serializedError the serialized throwable
     * @return the frame
     */
    public static Frame exception(byte[] serializedError) {
        return new Frame(FrameType.EXCEPTION, serializedError.clone());
    }

    /**
     * Creates a {@code RESULT <bytes>} frame.
     *
     * @param serializedValue the serialized return value
     * @return the frame
     */
    public static Frame result(byte[] serializedValue) {
        return new Frame(FrameType.RESULT, serializedValue.clone());
    }

    /**
     * Parses a received message.
     *
     * <p>The command word is matched exactly against the known words. A body-carrying word is
     * followed by a space or ends the message (empty body), and a body-less word must stand alone;
     * anything else parses as {@link FrameType#UNKNOWN} with the whole message as body.
     *
     * @param message a complete received message
     * @return the parsed frame, never null
     */
    public static Frame parse(byte[] message) {
        Objects.requireNonNull(message, "message must not be null");
        for (FrameType type : FrameType.values()) {
            if (type == FrameType.UNKNOWN) {
                continue;
            }
            byte[] word = type.commandBytes();
            if (!startsWith(message, word)) {
                continue;
            }
            if (!type.hasBody() && message.length == word.length) {
                return new Frame(type, NO_BODY);
            }
            if (type.hasBody() && message.length == word.length) {
                return new Frame(type, NO_BODY);
            }
            if (type.hasBody() && message[word.length] == SEPARATOR) {
                return new Frame(type, Arrays.copyOfRange(message, word.length + 1, message.length));
            }
        }
        return new Frame(FrameType.UNKNOWN, message.clone());
    }

    /**
     * Encodes this frame into a message ready for framing.
     *
     * @return the wire bytes
     */
    public byte[] encode() {
        if (type == FrameType.UNKNOWN) {
            return body.clone();
        }
        byte[] word = type.commandBytes();
        if (!type.hasBody()) {
            return word.clone();
        }
        byte[] message = new byte[word.length + 1 + body.length];
        System.arraycopy(word, 0, message, 0, word.length);
        message[word.length] = SEPARATOR;
        System.arraycopy(body, 0, message, word.length + 1, body.length);
        return message;
    }

    /**
     * Returns the frame type.
     *
     * @return the type
     */
    public FrameType type() {
        return type;
    }

    /**
     * Returns a copy of the body bytes.
     *
     * @return the body, empty for body-less frames
     */
    public byte[] body() {
        return body.clone();
    }

    /**
     * Returns the body decoded as UTF-8, for {@code PERFORM} names and {@code NACK} reasons.
     *
     * @return the body text
     */
    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }

    private static boolean startsWith(byte[] message, byte[] prefix) {
        if (message.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (message[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame other = (Frame) o;
        return type == other.type && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        if (type == FrameType.PERFORM || type == FrameType.NACK) {
            return type.command() + " " + text();
        }
        return type.hasBody() ? type.command() + " <" + body.length + " bytes>" : type.name();
    }
}
