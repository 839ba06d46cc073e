package com.livestanding.dispatch;

import java.util.Objects;

/**
 * A payload waiting in the {@link DispatchQueue}. Immutable.
 */
public class QueuedMessage {

    private final boolean reconnecting;
    private final String payload;

    public QueuedMessage(boolean reconnecting, String payload) {
        this.reconnecting = reconnecting;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public boolean isReconnecting() {
        return reconnecting;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "QueuedMessage{" +
                "reconnecting=" + reconnecting +
                ", payloadLength=" + payload.length() +
                '}';
    }
}
