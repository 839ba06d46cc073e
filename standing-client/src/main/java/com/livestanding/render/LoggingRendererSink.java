package com.livestanding.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livestanding.reconcile.ReconcileResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each result as one JSON line. Default sink when no renderer is attached.
 */
public class LoggingRendererSink implements RendererSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingRendererSink.class);

    private final ObjectMapper objectMapper;

    public LoggingRendererSink() {
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void apply(ReconcileResult result) {
        logger.info("Standing update: {}", toJson(result));
    }

    public String toJson(ReconcileResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize standing update", e);
            return result.toString();
        }
    }
}
