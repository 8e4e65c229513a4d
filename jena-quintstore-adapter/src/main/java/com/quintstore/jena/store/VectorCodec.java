package com.quintstore.jena.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON form of the vector column: an array of floats, or SQL NULL.
 */
final class VectorCodec {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        VectorCodec.class);

    /** Shared mapper; thread-safe once configured. */
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Private constructor to prevent instantiation. */
    private VectorCodec() {
        // Utility class
    }

    /**
     * Serialise a vector. JSON has no NaN or infinity, so such components
     * are rejected.
     *
     * @param vector the vector, or null
     * @return the JSON array, or null
     * @throws IllegalArgumentException if a component is not finite
     */
    static String write(final float[] vector) {
        if (vector == null) {
            return null;
        }
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                throw new IllegalArgumentException(
                    "Vector component " + i + " is not finite: " + vector[i]);
            }
        }
        try {
            return MAPPER.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise vector", e);
        }
    }

    /**
     * Parse a stored vector. A payload that is not a JSON number array is
     * logged and read as no vector.
     *
     * @param json the stored JSON, or null
     * @return the vector, or null
     */
    static float[] read(final Object json) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readValue(json.toString(), float[].class);
        } catch (JsonProcessingException e) {
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn("Ignoring unreadable vector payload: {}", e.getOriginalMessage());
            }
            return null;
        }
    }
}
