package express.mvp.scrpc.transport.lifecycle;

/**
 * States of the single connection held by a client proxy.
 *
 * <p>A proxy connects eagerly, drops its transport whenever the wire becomes unusable and reconnects
 * lazily on the next call. Closing the proxy is final.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌────────┐ connect ┌────────────┐ success ┌───────────┐
 * │  NEW   │────────▶│ CONNECTING │────────▶│ CONNECTED │
 * └────────┘         └────────────┘         └───────────┘
 *                       ▲      │ failure          │ broken wire,
 *                       │      ▼                  │ peer close
 *             next call │  ┌────────┐             │
 *                       └──│ FAILED │◀────────────┘
 *                          └────────┘
 *
 *     close() from any live state ──▶ CLOSING ──▶ CLOSED
 * </pre>
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {

    /** Proxy created, no connection attempted yet. */
    NEW("New", false, false),

    /**
     * Connection attempt in progress.
     *
     * <p>Ends in {@link #CONNECTED} on success or {@link #FAILED} if the endpoint is unreachable.
     */
    CONNECTING("Connecting", false, false),

    /** Transport established; calls may proceed. */
    CONNECTED("Connected", true, false),

    /**
     * Connection lost or never established.
     *
     * <p>The transport has been discarded. The next call moves back to {@link #CONNECTING}.
     */
    FAILED("Failed", false, false),

    /** The proxy is releasing its transport. */
    CLOSING("Closing", false, true),

    /** Terminal. The proxy cannot be used again. */
    CLOSED("Closed", false, true);

    private final String displayName;
    private final boolean active;
    private final boolean terminal;

    ConnectionState(String displayName, boolean active, boolean terminal) {
        this.displayName = displayName;
        this.active = active;
        this.terminal = terminal;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if a transport is established.
     *
     * @return true only in {@link #CONNECTED} state
     */
    public boolean isActive() {
        return active;
    }

    /**
     * Checks if the proxy is closing or closed.
     *
     * @return true if no more calls should be attempted
     */
    public boolean isTerminalOrClosing() {
        return terminal;
    }

    /**
     * Checks if a connection attempt may start from this state.
     *
     * @return true in {@link #NEW} or {@link #FAILED} state
     */
    public boolean canConnect() {
        return this == NEW || this == FAILED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
