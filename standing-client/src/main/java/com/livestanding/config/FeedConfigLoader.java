package com.livestanding.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads {@link FeedConfig} from a JSON file.
 *
 * A missing or unreadable file is not fatal: the client falls back to defaults
 * and logs why. Out-of-range values are reset by {@link FeedConfig#sanitize()}.
 */
public class FeedConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(FeedConfigLoader.class);

    private final ObjectMapper objectMapper;

    public FeedConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    public FeedConfig load(Path path) {
        FeedConfig config;

        if (path == null) {
            config = FeedConfig.defaults();
        } else if (!Files.exists(path)) {
            logger.warn("Config file {} not found, using defaults", path);
            config = FeedConfig.defaults();
        } else {
            config = read(path);
        }

        List<String> reset = config.sanitize();
        if (!reset.isEmpty()) {
            logger.warn("Invalid config values replaced with defaults: {}", reset);
        }

        logger.info("Loaded {}", config);
        return config;
    }

    private FeedConfig read(Path path) {
        try (Reader reader = Files.newBufferedReader(path)) {
            FeedConfig config = objectMapper.readValue(reader, FeedConfig.class);
            return config == null ? FeedConfig.defaults() : config;
        } catch (IOException e) {
            logger.warn("Failed to read config from {}, using defaults", path, e);
            return FeedConfig.defaults();
        }
    }
}
