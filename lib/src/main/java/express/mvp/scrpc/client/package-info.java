/**
 * Client proxy for calling functions on an SCRPC server over one persistent connection.
 *
 * @see express.mvp.scrpc.client.RpcProxy
 */
package express.mvp.scrpc.client;
