package express.mvp.scrpc.transport.lifecycle;

/**
 * Callback for connection state changes.
 *
 * <p>Invoked synchronously on the thread performing the transition, usually the thread making a
 * call through the proxy. Implementations should return quickly.
 *
 * @see ConnectionStateMachine
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called after the connection moved to a new state.
     *
     * @param previousState the state before the transition
     * @param currentState the new state
     * @param cause the failure behind the transition, or null for normal transitions
     */
    void onStateChanged(ConnectionState previousState, ConnectionState currentState, Throwable cause);
}
