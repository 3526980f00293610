package com.telemetryrollup.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration.
 *
 * <p>
 * Instants are written as ISO-8601 strings and unknown input properties are
 * ignored. {@link ObjectMapper} is thread-safe once configured, so one
 * instance serves the whole process.
 * </p>
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = buildMapper();

    private JsonSupport() {
        // utility class, not instantiable
    }

    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static ObjectMapper buildMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
