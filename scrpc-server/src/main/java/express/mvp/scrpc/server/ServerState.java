package express.mvp.scrpc.server;

/**
 * Lifecycle of an {@link RpcServer}.
 *
 * <pre>
 * NEW ──start()──▶ RUNNING ──stop()──▶ SHUTTING_DOWN ──loop exits──▶ STOPPED
 *                     ▲                                                │
 *                     └───────────────────── start() ──────────────────┘
 *
 * teardown() from any state ──▶ TORN_DOWN (terminal)
 * </pre>
 */
public enum ServerState {
    /** Listening socket bound, accept loop not started. */
    NEW,

    /** Accept loop running. */
    RUNNING,

    /** Shutdown requested; the accept loop and workers exit at their next poll. */
    SHUTTING_DOWN,

    /** Accept loop exited. The listening socket is still open and the server may be restarted. */
    STOPPED,

    /** Listening socket closed. */
    TORN_DOWN;

    /**
     * Checks if {@link RpcServer#start()} is allowed in this state.
     *
     * @return true unless torn down
     */
    public boolean canStart() {
        return this != TORN_DOWN;
    }
}
