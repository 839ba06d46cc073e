package com.livestanding.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads inbound envelopes and writes the authentication frame.
 *
 * The serializer is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class EnvelopeSerializer {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeSerializer.class);

    // ObjectMapper is thread-safe and should be reused
    private final ObjectMapper objectMapper;

    public EnvelopeSerializer() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Parses one text frame.
     *
     * @param json The raw frame text
     * @return The envelope
     * @throws EnvelopeFormatException if the frame is not a JSON object with an integer code
     */
    public Envelope deserialize(String json) {
        if (json == null || json.isBlank()) {
            throw new EnvelopeFormatException("Empty frame", null);
        }
        try {
            Envelope envelope = objectMapper.readValue(json, Envelope.class);
            if (envelope == null) {
                throw new EnvelopeFormatException("Frame is JSON null", null);
            }
            return envelope;
        } catch (JsonProcessingException e) {
            logger.debug("Failed to deserialize envelope: {}", json);
            throw new EnvelopeFormatException("Malformed envelope", e);
        }
    }

    /**
     * Serializes the authentication frame, e.g. {@code {"access_token":"abc"}}.
     */
    public String serializeAuth(String accessToken) {
        try {
            return objectMapper.writeValueAsString(new AuthRequest(accessToken));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize authentication request", e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }

    /**
     * Serializes an envelope in the server's frame format.
     */
    public String serialize(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize envelope: {}", envelope, e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }
}
