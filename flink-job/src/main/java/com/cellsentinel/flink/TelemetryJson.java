package com.cellsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson setup shared by the JSON-lines reader and writer.
 *
 * <p>
 * Field names are snake_case ({@code cell_id}, {@code traffic_cs}, ...),
 * timestamps are ISO-8601 strings such as {@code 2024-01-01T10:00:00}, and
 * columns the model does not know are ignored. An explicit {@code null} for a
 * numeric column is rejected rather than read as {@code 0.0}.
 * </p>
 */
final class TelemetryJson {

    private TelemetryJson() {
    }

    static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
