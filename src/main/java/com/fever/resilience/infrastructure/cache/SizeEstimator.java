package com.fever.resilience.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximate serialized size of cached values.
 * Uses the JSON encoding when the value serializes, otherwise the UTF-8 length of
 * {@code String.valueOf(value)}. The figure is a heuristic for accounting, not a byte count.
 */
public class SizeEstimator {

    private static final Logger logger = LoggerFactory.getLogger(SizeEstimator.class);

    private final ObjectMapper objectMapper;

    public SizeEstimator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public long estimate(Object value) {
        if (value == null) {
            return 0;
        }
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            logger.debug("Falling back to string size for {}: {}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value).getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
