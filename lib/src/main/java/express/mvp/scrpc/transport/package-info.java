/**
 * Timed, length-prefixed message transport over TCP.
 *
 * <p>{@link express.mvp.scrpc.transport.FramedTransport} is the only I/O primitive of the
 * framework. Both the server (accept loop and workers) and the client proxy exchange whole frames
 * through it, and rely on its timeouts to poll for shutdown.
 *
 * <h2>Exceptions</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.scrpc.transport.TransportTimeoutException} - a wait elapsed; the
 *       connection is still usable
 *   <li>{@link express.mvp.scrpc.transport.framing.FramingException} - malformed or stalled frame
 *   <li>{@link express.mvp.scrpc.transport.TransportException} - anything else; the connection
 *       should be discarded
 * </ul>
 */
package express.mvp.scrpc.transport;
