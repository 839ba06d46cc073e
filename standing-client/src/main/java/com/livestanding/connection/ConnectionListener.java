package com.livestanding.connection;

/**
 * Callbacks raised by {@link ConnectionManager}.
 *
 * All methods have empty defaults so callers override only what they need.
 * Callbacks run on the thread that produced the event (a Netty I/O thread or
 * the timer thread) and must not block.
 */
public interface ConnectionListener {

    /**
     * Raised when a connection attempt finishes.
     *
     * @param succeeded true once the server acknowledged authentication
     * @param reconnect true when the attempt was an automatic reconnect
     * @param message   human readable outcome, the failure cause when not succeeded
     */
    default void onConnect(boolean succeeded, boolean reconnect, String message) {
    }

    default void onDisconnect(boolean closedByUser) {
    }

    /**
     * Raised for every payload frame.
     *
     * @param payload      the opaque snapshot payload
     * @param reconnecting true only for the first payload after a reconnect
     */
    default void onMessage(String payload, boolean reconnecting) {
    }

    default void onStatusChange(ConnectionStatus status) {
    }
}
