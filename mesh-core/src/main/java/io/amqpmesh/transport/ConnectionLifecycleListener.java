package io.amqpmesh.transport;

/**
 * Observes state transitions of a {@link TransportConnection}. All callbacks default to no-ops.
 */
public interface ConnectionLifecycleListener {

    default void onConnect() {
    }

    default void onConnectFailed(Throwable cause) {
    }

    default void onDisconnect(Throwable cause) {
    }

    default void onBlocked(String reason) {
    }

    default void onUnblocked() {
    }
}
