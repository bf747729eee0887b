package express.mvp.scrpc.transport.lifecycle;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for a proxy connection.
 *
 * <p>Only the transitions below are accepted; any other request is refused and reported by a
 * {@code false} return. Listeners are notified after each accepted transition.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * NEW        → CONNECTING, CLOSING
 * CONNECTING → CONNECTED, FAILED, CLOSING
 * CONNECTED  → FAILED, CLOSING
 * FAILED     → CONNECTING, CLOSING
 * CLOSING    → CLOSED
 * CLOSED     → (terminal)
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionStateMachine state = new ConnectionStateMachine("proxy-localhost:3344");
 * state.addListener((prev, curr, cause) -> LOGGER.fine(prev + " -> " + curr));
 *
 * state.transitionTo(ConnectionState.CONNECTING);
 * state.transitionTo(ConnectionState.CONNECTED);
 * state.transitionTo(ConnectionState.FAILED, brokenPipe);   // dropped, reconnect later
 * state.transitionTo(ConnectionState.CONNECTING);
 * }</pre>
 *
 * @see ConnectionState
 * @see ConnectionStateListener
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    private static final Set<ConnectionState> FROM_NEW =
            EnumSet.of(ConnectionState.CONNECTING, ConnectionState.CLOSING);

    private static final Set<ConnectionState> FROM_CONNECTING =
            EnumSet.of(ConnectionState.CONNECTED, ConnectionState.FAILED, ConnectionState.CLOSING);

    private static final Set<ConnectionState> FROM_CONNECTED =
            EnumSet.of(ConnectionState.FAILED, ConnectionState.CLOSING);

    private static final Set<ConnectionState> FROM_FAILED =
            EnumSet.of(ConnectionState.CONNECTING, ConnectionState.CLOSING);

    private static final Set<ConnectionState> FROM_CLOSING = EnumSet.of(ConnectionState.CLOSED);

    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.NEW);

    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    @CheckForNull private final String connectionId;

    /** Creates a state machine in {@link ConnectionState#NEW} state. */
    public ConnectionStateMachine() {
        this(null);
    }

    /**
     * Creates a state machine with an identifier used in log output.
     *
     * @param connectionId identifier for this connection, may be null
     */
    public ConnectionStateMachine(@CheckForNull String connectionId) {
        this.connectionId = connectionId;
    }

    /**
     * Returns the current state.
     *
     * @return the current connection state
     */
    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Checks if the connection is established.
     *
     * @return true in {@link ConnectionState#CONNECTED} state
     */
    public boolean isActive() {
        return state.get().isActive();
    }

    /**
     * Checks if the connection is closing or closed.
     *
     * @return true in CLOSING or CLOSED state
     */
    public boolean isClosedOrClosing() {
        return state.get().isTerminalOrClosing();
    }

    /**
     * Registers a listener for state changes.
     *
     * @param listener the listener to register
     */
    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was registered
     */
    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired state
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(ConnectionState newState) {
        return transitionTo(newState, null);
    }

    /**
     * Attempts to transition to a new state, passing a cause to listeners.
     *
     * @param newState the desired state
     * @param cause the reason for the transition, may be null
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(ConnectionState newState, @CheckForNull Throwable cause) {
        while (true) {
            ConnectionState current = state.get();
            if (!isValidTransition(current, newState)) {
                return false;
            }
            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState, cause);
                return true;
            }
        }
    }

    /**
     * Transitions only if the current state is {@code expectedState}.
     *
     * @param expectedState the state the caller observed
     * @param newState the desired state
     * @return true if the transition was applied
     */
    public boolean transitionFrom(ConnectionState expectedState, ConnectionState newState) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            notifyListeners(expectedState, newState, null);
            return true;
        }
        return false;
    }

    /**
     * Checks if a transition is allowed.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        if (from == to) {
            return false;
        }
        return getValidTransitions(from).contains(to);
    }

    /**
     * Returns the states reachable in one step from {@code from}.
     *
     * @param from the source state
     * @return a fresh set of valid target states
     */
    public static Set<ConnectionState> getValidTransitions(ConnectionState from) {
        return switch (from) {
            case NEW -> EnumSet.copyOf(FROM_NEW);
            case CONNECTING -> EnumSet.copyOf(FROM_CONNECTING);
            case CONNECTED -> EnumSet.copyOf(FROM_CONNECTED);
            case FAILED -> EnumSet.copyOf(FROM_FAILED);
            case CLOSING -> EnumSet.copyOf(FROM_CLOSING);
            case CLOSED -> EnumSet.noneOf(ConnectionState.class);
        };
    }

    private void notifyListeners(
            ConnectionState previous, ConnectionState current, @CheckForNull Throwable cause) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(this + ": " + previous + " -> " + current);
        }
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return connectionId != null
                ? "ConnectionStateMachine[" + connectionId + ":" + state.get() + "]"
                : "ConnectionStateMachine[" + state.get() + "]";
    }
}
