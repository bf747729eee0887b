/**
 * Message framing for the SCRPC wire.
 *
 * <p>Every protocol frame travels as one length-prefixed message: a 4-byte unsigned big-endian
 * payload length followed by the payload bytes.
 *
 * <ul>
 *   <li>{@link express.mvp.scrpc.transport.framing.FramingHandler} - Strategy interface for
 *       framing and header validation
 *   <li>{@link express.mvp.scrpc.transport.framing.LengthPrefixedFramingHandler} - 4-byte
 *       big-endian length prefix implementation
 *   <li>{@link express.mvp.scrpc.transport.framing.FramingException} - Exception for framing errors
 * </ul>
 *
 * @see express.mvp.scrpc.transport.FramedTransport
 */
package express.mvp.scrpc.transport.framing;
