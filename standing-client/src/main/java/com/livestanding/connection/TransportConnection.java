package com.livestanding.connection;

/**
 * An open WebSocket connection.
 */
public interface TransportConnection {

    void send(String text);

    void close();

    boolean isActive();
}
