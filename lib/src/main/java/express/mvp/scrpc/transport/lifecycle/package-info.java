/**
 * Client connection lifecycle.
 *
 * <p>{@link express.mvp.scrpc.transport.lifecycle.ConnectionStateMachine} replaces a plain
 * "connected" flag on the proxy so that a lost connection, a reconnect and a final close are
 * explicit, validated transitions that listeners can observe.
 */
package express.mvp.scrpc.transport.lifecycle;
