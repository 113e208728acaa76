package com.pulsesentinel.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration.
 *
 * <p>
 * snake_case property names, ISO-8601 timestamps, {@code null} fields
 * omitted, unknown properties ignored. Used for store files, configuration
 * export/import, the YAML seed file (after SnakeYAML parsing) and outbound
 * webhook payloads.
 * </p>
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = newObjectMapper();

    private JsonSupport() {
        // utility class, not instantiable
    }

    /**
     * @return the shared, fully configured mapper (thread-safe once configured)
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @return a new mapper with the project-wide settings
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
