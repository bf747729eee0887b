/**
 * The SCRPC server: function registry, accept loop and per-connection workers.
 *
 * <p>{@link express.mvp.scrpc.server.RpcServer} is the entry point. Functions are registered in a
 * {@link express.mvp.scrpc.server.FunctionRegistry} before the server starts.
 */
package express.mvp.scrpc.server;
