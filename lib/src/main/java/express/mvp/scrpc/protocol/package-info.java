/**
 * The SCRPC request/response protocol: {@code PERFORM}, {@code ACK}, {@code NACK}, {@code
 * EXCEPTION} and {@code RESULT} frames.
 */
package express.mvp.scrpc.protocol;
