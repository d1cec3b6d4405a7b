package com.fleetsentinel.cycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * JSON export of cycle reports, insights and incidents.
 *
 * <p>
 * Field names are snake_case, timestamps ISO-8601 strings and enums their
 * wire names ({@code cpu}, {@code isolation-forest}, {@code Memory Leak}).
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleReportJson {

    private static final Logger LOG = LoggerFactory.getLogger(CycleReportJson.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.WRITE_ENUMS_USING_TO_STRING, true)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .build();

    private CycleReportJson() {
    }

    /**
     * @param value report, insight, incident or a collection of them
     * @return UTF-8 JSON, or an empty array if serialization failed
     */
    public static byte[] serialize(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}",
                    value != null ? value.getClass().getSimpleName() : "null", e.getMessage(), e);
            return new byte[0];
        }
    }

    public static String toJson(Object value) {
        return new String(serialize(value), StandardCharsets.UTF_8);
    }

    /**
     * @return the configured mapper, for callers that read the JSON back
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
