/**
 * Errors raised to callers of remote functions.
 *
 * <ul>
 *   <li>{@link express.mvp.scrpc.error.CommunicationException} - the connection failed; the
 *       proxy reconnects on the next call
 *   <li>{@link express.mvp.scrpc.error.RemoteException} - the server rejected or failed the call
 *   <li>{@link express.mvp.scrpc.error.MarshalingException} - serialization failed
 * </ul>
 */
package express.mvp.scrpc.error;
