package express.mvp.scrpc.protocol;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FrameTest {

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    // ==================== Encoding ====================

    @Test
    @DisplayName("Control frames encode to their wire text")
    void encodeControlFrames() {
        assertArrayEquals(ascii("PERFORM add"), Frame.perform("add").encode());
        assertArrayEquals(ascii("ACK"), Frame.ack().encode());
        assertArrayEquals(ascii("NACK Function (x) does not exist."),
                Frame.nack("Function (x) does not exist.").encode());
    }

    @Test
    @DisplayName("Data frames keep their body bytes verbatim after one space")
    void encodeDataFrames() {
        byte[] body = {(byte) 0xAC, (byte) 0xED, 0x00, 0x05, ' '};

        byte[] encoded = Frame.result(body).encode();

        assertEquals("RESULT ", new String(encoded, 0, 7, StandardCharsets.US_ASCII));
        assertArrayEquals(body, java.util.Arrays.copyOfRange(encoded, 7, encoded.length));
    }

    @Test
    @DisplayName("Function names are UTF-8")
    void utf8Names() {
        Frame parsed = Frame.parse(Frame.perform("größe").encode());
        assertEquals(FrameType.PERFORM, parsed.type());
        assertEquals("größe", parsed.text());
    }

    // ==================== Parsing ====================

    @Test
    @DisplayName("Each known command word is recognised")
    void parseKnownWords() {
        assertEquals(FrameType.ACK, Frame.parse(ascii("ACK")).type());
        assertEquals(FrameType.PERFORM, Frame.parse(ascii("PERFORM add")).type());
        assertEquals(FrameType.NACK, Frame.parse(ascii("NACK Argument must be a tuple.")).type());
        assertEquals(FrameType.EXCEPTION, Frame.parse(ascii("EXCEPTION \u0001")).type());
        assertEquals(FrameType.RESULT, Frame.parse(ascii("RESULT \u0001")).type());
    }

    @Test
    @DisplayName("NACK reason is everything after the first space")
    void nackReason() {
        assertEquals("Argument must be a tuple.", Frame.parse(ascii("NACK Argument must be a tuple.")).text());
    }

    @Test
    @DisplayName("Body-carrying word without a body parses with an empty body")
    void emptyBody() {
        Frame frame = Frame.parse(ascii("NACK"));
        assertEquals(FrameType.NACK, frame.type());
        assertEquals(0, frame.body().length);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ACKNOWLEDGE", "ACK extra", "NACKED", "perform add", "HELLO", "RESULTS 1", " ACK"})
    @DisplayName("Anything else is UNKNOWN")
    void parseUnknown(String message) {
        Frame frame = Frame.parse(ascii(message));
        assertEquals(FrameType.UNKNOWN, frame.type());
        assertArrayEquals(ascii(message), frame.encode());
    }

    @Test
    @DisplayName("Body accessor returns a defensive copy")
    void bodyIsCopied() {
        byte[] body = {1, 2, 3};
        Frame frame = Frame.exception(body);
        body[0] = 9;
        frame.body()[1] = 9;

        assertArrayEquals(new byte[] {1, 2, 3}, frame.body());
    }

    @Test
    @DisplayName("Equal frames compare equal")
    void equality() {
        assertEquals(Frame.perform("add"), Frame.parse(ascii("PERFORM add")));
        assertEquals(Frame.perform("add").hashCode(), Frame.parse(ascii("PERFORM add")).hashCode());
        assertNotEquals(Frame.perform("add"), Frame.perform("sub"));
        assertEquals("PERFORM add", Frame.perform("add").toString());
        assertEquals("RESULT <3 bytes>", Frame.result(new byte[3]).toString());
    }
}
