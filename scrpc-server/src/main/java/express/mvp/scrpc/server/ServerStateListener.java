package express.mvp.scrpc.server;

/**
 * Callback for {@link RpcServer} lifecycle changes.
 *
 * <p>Invoked on the thread that caused the change: the caller of {@code start}, {@code stop} or
 * {@code teardown}, or the accept thread when it exits.
 */
@FunctionalInterface
public interface ServerStateListener {

    /**
     * Called after the server changed state.
     *
     * @param previous the state before the change
     * @param current the new state
     */
    void onStateChanged(ServerState previous, ServerState current);
}
