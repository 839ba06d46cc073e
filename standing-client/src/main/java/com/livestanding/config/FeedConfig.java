package com.livestanding.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings for the standing feed client.
 *
 * Every value has a default, so an empty JSON object (or no file at all) yields
 * a working configuration. Jackson binds the fields through the setters.
 *
 * JSON format:
 * {
 *     "host": "localhost",
 *     "port": 8080,
 *     "useSsl": false,
 *     "accessToken": "...",
 *     "pacingIntervalMs": 1500,
 *     "reconnectDelayMs": 3000
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_PATH = "/api/v1/broadcast";

    public static final long DEFAULT_PACING_INTERVAL_MS = 1500;
    public static final long DEFAULT_PACING_CHECK_MS = 100;
    public static final long DEFAULT_RECONNECT_DELAY_MS = 3000;
    public static final int DEFAULT_MAX_DISPLAYED_TEAMS = 16;
    public static final int DEFAULT_MIN_SQUAD_SIZE = 4;
    public static final int DEFAULT_READER_IDLE_SECONDS = 60;

    public static final int DEFAULT_AUTHENTICATED_CODE = 201;
    public static final int DEFAULT_PAYLOAD_CODE = 200;

    // Endpoint
    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private boolean useSsl;
    private String path = DEFAULT_PATH;
    private String accessToken = "";

    // Timing
    private long pacingIntervalMs = DEFAULT_PACING_INTERVAL_MS;
    private long pacingCheckMs = DEFAULT_PACING_CHECK_MS;
    private long reconnectDelayMs = DEFAULT_RECONNECT_DELAY_MS;
    private int readerIdleSeconds = DEFAULT_READER_IDLE_SECONDS;

    // Display
    private int maxDisplayedTeams = DEFAULT_MAX_DISPLAYED_TEAMS;
    private int minSquadSize = DEFAULT_MIN_SQUAD_SIZE;

    // In-band status codes
    private int authenticatedCode = DEFAULT_AUTHENTICATED_CODE;
    private int payloadCode = DEFAULT_PAYLOAD_CODE;

    public static FeedConfig defaults() {
        return new FeedConfig();
    }

    /**
     * Builds the WebSocket endpoint, e.g. {@code ws://localhost:8080/api/v1/broadcast}.
     */
    public URI endpoint() {
        String scheme = useSsl ? "wss" : "ws";
        return URI.create(scheme + "://" + host + ":" + port + path);
    }

    /**
     * Replaces missing or out-of-range values with their defaults.
     *
     * @return the names of the fields that were reset, for logging
     */
    public List<String> sanitize() {
        List<String> reset = new ArrayList<>();

        if (host == null || host.isBlank()) {
            host = DEFAULT_HOST;
            reset.add("host");
        }
        if (port <= 0 || port > 65535) {
            port = DEFAULT_PORT;
            reset.add("port");
        }
        if (path == null || !path.startsWith("/")) {
            path = DEFAULT_PATH;
            reset.add("path");
        }
        if (accessToken == null) {
            accessToken = "";
        }
        if (pacingIntervalMs <= 0) {
            pacingIntervalMs = DEFAULT_PACING_INTERVAL_MS;
            reset.add("pacingIntervalMs");
        }
        if (pacingCheckMs <= 0) {
            pacingCheckMs = DEFAULT_PACING_CHECK_MS;
            reset.add("pacingCheckMs");
        }
        if (reconnectDelayMs <= 0) {
            reconnectDelayMs = DEFAULT_RECONNECT_DELAY_MS;
            reset.add("reconnectDelayMs");
        }
        if (readerIdleSeconds < 0) {
            readerIdleSeconds = DEFAULT_READER_IDLE_SECONDS;
            reset.add("readerIdleSeconds");
        }
        if (maxDisplayedTeams <= 0) {
            maxDisplayedTeams = DEFAULT_MAX_DISPLAYED_TEAMS;
            reset.add("maxDisplayedTeams");
        }
        if (minSquadSize <= 0) {
            minSquadSize = DEFAULT_MIN_SQUAD_SIZE;
            reset.add("minSquadSize");
        }

        return reset;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isUseSsl() {
        return useSsl;
    }

    public void setUseSsl(boolean useSsl) {
        this.useSsl = useSsl;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public long getPacingIntervalMs() {
        return pacingIntervalMs;
    }

    public void setPacingIntervalMs(long pacingIntervalMs) {
        this.pacingIntervalMs = pacingIntervalMs;
    }

    public long getPacingCheckMs() {
        return pacingCheckMs;
    }

    public void setPacingCheckMs(long pacingCheckMs) {
        this.pacingCheckMs = pacingCheckMs;
    }

    public long getReconnectDelayMs() {
        return reconnectDelayMs;
    }

    public void setReconnectDelayMs(long reconnectDelayMs) {
        this.reconnectDelayMs = reconnectDelayMs;
    }

    public int getReaderIdleSeconds() {
        return readerIdleSeconds;
    }

    public void setReaderIdleSeconds(int readerIdleSeconds) {
        this.readerIdleSeconds = readerIdleSeconds;
    }

    public int getMaxDisplayedTeams() {
        return maxDisplayedTeams;
    }

    public void setMaxDisplayedTeams(int maxDisplayedTeams) {
        this.maxDisplayedTeams = maxDisplayedTeams;
    }

    public int getMinSquadSize() {
        return minSquadSize;
    }

    public void setMinSquadSize(int minSquadSize) {
        this.minSquadSize = minSquadSize;
    }

    public int getAuthenticatedCode() {
        return authenticatedCode;
    }

    public void setAuthenticatedCode(int authenticatedCode) {
        this.authenticatedCode = authenticatedCode;
    }

    public int getPayloadCode() {
        return payloadCode;
    }

    public void setPayloadCode(int payloadCode) {
        this.payloadCode = payloadCode;
    }

    @Override
    public String toString() {
        return "FeedConfig{" +
                "endpoint=" + endpoint() +
                ", pacingIntervalMs=" + pacingIntervalMs +
                ", pacingCheckMs=" + pacingCheckMs +
                ", reconnectDelayMs=" + reconnectDelayMs +
                ", maxDisplayedTeams=" + maxDisplayedTeams +
                '}';
    }
}
