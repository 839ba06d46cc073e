package com.livestanding.connection;

import java.net.URI;

/**
 * Opens WebSocket connections for {@link ConnectionManager}.
 *
 * The Netty implementation lives in {@code com.livestanding.handler}; tests plug
 * in an in-memory transport.
 */
public interface FeedTransport {

    /**
     * Starts an asynchronous connection attempt. Never blocks.
     *
     * Exactly one of {@link TransportListener#onOpen} or
     * {@link TransportListener#onError} is raised for the attempt; once open,
     * {@link TransportListener#onClosed} follows when the connection ends.
     */
    void open(URI endpoint, TransportListener listener);

    /**
     * Releases I/O resources. No further connections can be opened.
     */
    void shutdown();
}
