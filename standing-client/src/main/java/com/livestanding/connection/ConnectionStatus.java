package com.livestanding.connection;

/**
 * Externally visible state of the feed connection.
 *
 * DISCONNECTED -> CONNECTING -> CONNECTED -> (loss) -> CONNECTING -> ...
 * A user close always ends in DISCONNECTED.
 */
public enum ConnectionStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
