package express.mvp.scrpc.protocol;

import java.nio.charset.StandardCharsets;

/**
 * Command words of the SCRPC wire protocol.
 *
 * <p>Each frame starts with one US-ASCII command word. Frames that carry data separate it from the
 * word by a single space.
 *
 * <pre>
 * client                          server
 *   │ ── PERFORM add ───────────────▶ │
 *   │ ◀────────────────────── ACK ─── │   (or NACK reason)
 *   │ ── serialized Object[] ───────▶ │
 *   │ ◀────────────────────── ACK ─── │   (or NACK / EXCEPTION)
 *   │ ◀─────────── RESULT value ───── │   (or EXCEPTION error)
 * </pre>
 */
public enum FrameType {

    /** Client asks to invoke the named function. Body: UTF-8 function name. */
    PERFORM("PERFORM", true),

    /** Server accepted the previous step. No body. */
    ACK("ACK", false),

    /** Server rejected the previous step. Body: UTF-8 reason. The connection stays open. */
    NACK("NACK", true),

    /** The call failed. Body: serialized {@link Throwable}. The connection stays open. */
    EXCEPTION("EXCEPTION", true),

    /** The call succeeded. Body: serialized return value. */
    RESULT("RESULT", true),

    /** Anything that does not start with a known command word. */
    UNKNOWN("", false);

    private final String command;
    private final byte[] commandBytes;
    private final boolean hasBody;

    FrameType(String command, boolean hasBody) {
        this.command = command;
        this.commandBytes = command.getBytes(StandardCharsets.US_ASCII);
        this.hasBody = hasBody;
    }

    /**
     * Returns the command word as written on the wire.
     *
     * @return the command word, empty for {@link #UNKNOWN}
     */
    public String command() {
        return command;
    }

    /**
     * Checks if frames of this type carry a body after the command word.
     *
     * @return true for PERFORM, NACK, EXCEPTION and RESULT
     */
    public boolean hasBody() {
        return hasBody;
    }

    byte[] commandBytes() {
        return commandBytes;
    }
}
