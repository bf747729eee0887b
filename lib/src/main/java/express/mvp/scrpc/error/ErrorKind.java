package express.mvp.scrpc.error;

/**
 * Classification of a failed remote call, as seen by the caller.
 *
 * <table class="striped">
 *   <caption>Error kinds</caption>
 *   <tr><th>Kind</th><th>Connection afterwards</th><th>Typical cause</th></tr>
 *   <tr><td>COMMUNICATION</td><td>dropped, reconnected on next call</td>
 *       <td>unreachable server, peer close, broken pipe</td></tr>
 *   <tr><td>REMOTE</td><td>kept, except after a result timeout</td>
 *       <td>NACK, application exception on the server</td></tr>
 *   <tr><td>MARSHALING</td><td>kept</td><td>arguments or result not serializable</td></tr>
 * </table>
 */
public enum ErrorKind {
    /** The connection failed or the server broke protocol. */
    COMMUNICATION,

    /** The server rejected or failed the call. */
    REMOTE,

    /** Arguments or results could not be converted to or from bytes. */
    MARSHALING
}
