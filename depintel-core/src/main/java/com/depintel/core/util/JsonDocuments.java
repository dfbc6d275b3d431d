package com.depintel.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Map;

/**
 * Converts typed report records into plain result-document structures and JSON.
 *
 * <p>Record components become snake_case keys; dates become ISO-8601 strings; unknown
 * ({@code null}) values are kept as explicit nulls.
 */
public final class JsonDocuments {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonDocuments() {
        // Utility class
    }

    /**
     * Converts a record (or map) into a map of primitives.
     *
     * @param value typed value
     * @return plain map
     */
    public static Map<String, Object> toMap(Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    /**
     * Converts a list of records into a list of plain maps.
     *
     * @param values typed values
     * @return plain maps
     */
    public static List<Map<String, Object>> toMaps(List<?> values) {
        return values.stream().map(JsonDocuments::toMap).toList();
    }

    /**
     * Converts any value into its plain form (map, list, string, number, boolean or null).
     *
     * @param value typed value
     * @return plain value
     */
    public static Object toPlain(Object value) {
        return MAPPER.convertValue(value, Object.class);
    }

    /**
     * Serializes a value to indented JSON.
     *
     * @param value value to write
     * @return JSON text
     * @throws JsonProcessingException when the value cannot be serialized
     */
    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
