package com.livestanding.connection;

/**
 * Low level events of one connection attempt.
 */
public interface TransportListener {

    void onOpen(TransportConnection connection);

    void onText(String text);

    void onClosed();

    void onError(Throwable cause);
}
