package com.livestanding.connection;

import com.livestanding.config.FeedConfig;
import com.livestanding.protocol.Envelope;
import com.livestanding.protocol.EnvelopeFormatException;
import com.livestanding.protocol.EnvelopeKind;
import com.livestanding.protocol.EnvelopeSerializer;

import io.netty.util.Timeout;
import io.netty.util.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns the single feed connection: handshake, authentication and reconnection.
 *
 * Lifecycle:
 * - connect(credential): open the transport, send the credential, wait for the
 *   server's "authenticated" code before reporting CONNECTED
 * - any loss that the user did not ask for: report it, wait a fixed delay,
 *   open a new transport flagged as a reconnect
 * - close(): terminal for this instance, no reconnect is ever scheduled again
 *
 * The first payload delivered after a reconnect is tagged {@code reconnecting = true};
 * the tag is cleared by that delivery, not by the reconnect attempt.
 *
 * Thread Safety:
 * - Transport callbacks arrive on Netty I/O threads, the reconnect runs on the
 *   timer thread, close() on the caller's thread. All state changes go through
 *   this object's monitor.
 * - Every connection attempt carries an id. Callbacks from an attempt that is no
 *   longer current (lost, replaced or user-closed) are discarded.
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final FeedTransport transport;
    private final Timer timer;
    private final EnvelopeSerializer serializer;
    private final URI endpoint;
    private final long reconnectDelayMs;
    private final int authenticatedCode;
    private final int payloadCode;
    private final List<ConnectionListener> listeners;

    // Guarded by this
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private String credential = "";
    private boolean started;
    private boolean closedByUser;
    private boolean authenticated;
    private boolean reconnecting;
    private long currentAttempt;
    private TransportConnection connection;
    private Timeout reconnectTimeout;

    public ConnectionManager(FeedConfig config, FeedTransport transport, Timer timer) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.serializer = new EnvelopeSerializer();
        this.endpoint = config.endpoint();
        this.reconnectDelayMs = config.getReconnectDelayMs();
        this.authenticatedCode = config.getAuthenticatedCode();
        this.payloadCode = config.getPayloadCode();
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    // === Public API ===

    /**
     * Starts the first connection attempt. Returns immediately.
     *
     * @param credential access token sent in the authentication frame
     * @throws IllegalStateException if this manager was already closed
     */
    public synchronized void connect(String credential) {
        if (closedByUser) {
            throw new IllegalStateException("Connection manager was closed");
        }
        if (started) {
            logger.warn("connect() ignored, connection already started ({})", status);
            return;
        }

        this.credential = Objects.requireNonNull(credential, "credential");
        this.started = true;
        openAttempt(false);
    }

    /**
     * Closes the connection for good. Safe to call more than once.
     */
    public synchronized void close() {
        if (closedByUser) {
            return;
        }
        closedByUser = true;

        // Invalidate callbacks still in flight for the current attempt
        currentAttempt++;
        cancelReconnect();
        closeConnection();
        authenticated = false;
        reconnecting = false;

        if (started) {
            logger.info("Connection closed by user");
            notifyListeners(l -> l.onDisconnect(true));
        }
        updateStatus(ConnectionStatus.DISCONNECTED);
    }

    public synchronized ConnectionStatus getStatus() {
        return status;
    }

    public synchronized boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    public synchronized boolean isReconnecting() {
        return reconnecting;
    }

    public synchronized boolean isClosedByUser() {
        return closedByUser;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    // === Connection attempts ===

    private void openAttempt(boolean reconnect) {
        if (closedByUser) {
            return;
        }

        long attempt = ++currentAttempt;
        reconnecting = reconnect;
        authenticated = false;
        connection = null;
        updateStatus(ConnectionStatus.CONNECTING);

        logger.info("Connecting to {} (attempt {}, reconnect={})", endpoint, attempt, reconnect);

        try {
            transport.open(endpoint, new AttemptListener(attempt, reconnect));
        } catch (RuntimeException e) {
            handleError(attempt, reconnect, e);
        }
    }

    private synchronized void handleOpen(long attempt, TransportConnection opened) {
        if (attempt != currentAttempt || closedByUser) {
            // Late open after close() or after the attempt was abandoned
            opened.close();
            return;
        }

        connection = opened;
        logger.info("Transport open, sending authentication");

        try {
            opened.send(serializer.serializeAuth(credential));
        } catch (RuntimeException e) {
            handleError(attempt, reconnecting, e);
        }
    }

    private synchronized void handleText(long attempt, String text) {
        if (attempt != currentAttempt || closedByUser) {
            return;
        }

        logger.debug("Received frame: {}", text);

        Envelope envelope;
        try {
            envelope = serializer.deserialize(text);
        } catch (EnvelopeFormatException e) {
            logger.error("Failed to parse frame, dropping connection: {}", text, e);
            handleProtocolError(attempt, "malformed frame");
            return;
        }

        switch (EnvelopeKind.classify(envelope, authenticatedCode, payloadCode)) {
            case AUTHENTICATED -> handleAuthenticated();
            case PAYLOAD -> handlePayload(envelope);
            default -> {
                logger.error("Received error code: {}, message: {}",
                        envelope.codeOrMissing(),
                        envelope.getMessage() != null ? envelope.getMessage() : "Unknown");
                handleProtocolError(attempt, "error code " + envelope.codeOrMissing());
            }
        }
    }

    private void handleAuthenticated() {
        authenticated = true;
        logger.info("Authentication successful (reconnect={})", reconnecting);

        updateStatus(ConnectionStatus.CONNECTED);
        boolean reconnect = reconnecting;
        notifyListeners(l -> l.onConnect(true, reconnect, "Authenticated"));
    }

    private void handlePayload(Envelope envelope) {
        if (!authenticated) {
            logger.warn("Dropping payload received before authentication");
            return;
        }
        if (!envelope.hasData()) {
            logger.warn("Received payload code {} with no data", payloadCode);
            return;
        }

        boolean tagged = reconnecting;
        String data = envelope.getData();
        notifyListeners(l -> l.onMessage(data, tagged));

        // Only the first payload after a reconnect carries the tag
        reconnecting = false;
    }

    private void handleProtocolError(long attempt, String reason) {
        if (!authenticated) {
            // e.g. the credential was rejected
            boolean reconnect = reconnecting;
            notifyListeners(l -> l.onConnect(false, reconnect, reason));
        }
        updateStatus(ConnectionStatus.DISCONNECTED);
        handleLoss(attempt, reason);
    }

    private synchronized void handleError(long attempt, boolean reconnect, Throwable cause) {
        if (attempt != currentAttempt || closedByUser) {
            return;
        }

        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        logger.error("Connection error: {}", message, cause);

        if (!authenticated) {
            notifyListeners(l -> l.onConnect(false, reconnect, message));
        }
        handleLoss(attempt, message);
    }

    /**
     * Common path for every loss that the user did not request.
     */
    private synchronized void handleLoss(long attempt, String reason) {
        if (attempt != currentAttempt || closedByUser) {
            return;
        }

        // Nothing more from this attempt is processed
        currentAttempt++;
        closeConnection();
        authenticated = false;

        logger.info("Connection lost ({}), reconnecting in {} ms", reason, reconnectDelayMs);
        notifyListeners(l -> l.onDisconnect(false));

        updateStatus(ConnectionStatus.CONNECTING);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        cancelReconnect();
        try {
            reconnectTimeout = timer.newTimeout(timeout -> reconnectNow(), reconnectDelayMs, TimeUnit.MILLISECONDS);
        } catch (IllegalStateException e) {
            logger.warn("Reconnect timer is unavailable: {}", e.getMessage());
            updateStatus(ConnectionStatus.DISCONNECTED);
        }
    }

    private synchronized void reconnectNow() {
        reconnectTimeout = null;
        if (closedByUser) {
            return;
        }
        logger.info("Attempting to reconnect...");
        openAttempt(true);
    }

    private void cancelReconnect() {
        if (reconnectTimeout != null) {
            reconnectTimeout.cancel();
            reconnectTimeout = null;
        }
    }

    private void closeConnection() {
        if (connection != null) {
            TransportConnection toClose = connection;
            connection = null;
            try {
                toClose.close();
            } catch (RuntimeException e) {
                logger.warn("Error while closing transport: {}", e.getMessage());
            }
        }
    }

    private void updateStatus(ConnectionStatus newStatus) {
        if (status == newStatus) {
            return;
        }
        logger.debug("Status {} -> {}", status, newStatus);
        status = newStatus;
        notifyListeners(l -> l.onStatusChange(newStatus));
    }

    private void notifyListeners(Consumer<ConnectionListener> event) {
        for (ConnectionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Connection listener failed", e);
            }
        }
    }

    /**
     * Binds transport events to the attempt that produced them.
     */
    private class AttemptListener implements TransportListener {

        private final long attempt;
        private final boolean reconnect;

        AttemptListener(long attempt, boolean reconnect) {
            this.attempt = attempt;
            this.reconnect = reconnect;
        }

        @Override
        public void onOpen(TransportConnection opened) {
            handleOpen(attempt, opened);
        }

        @Override
        public void onText(String text) {
            handleText(attempt, text);
        }

        @Override
        public void onClosed() {
            handleLoss(attempt, "closed by peer");
        }

        @Override
        public void onError(Throwable cause) {
            handleError(attempt, reconnect, cause);
        }
    }
}
