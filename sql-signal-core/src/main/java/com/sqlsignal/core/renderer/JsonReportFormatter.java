package com.sqlsignal.core.renderer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Deterministic JSON serialization of analysis results.
 *
 * <p>snake_case field names, record component order, map entries sorted by key, two-space
 * indentation and a trailing newline. Identical results therefore serialize to identical bytes.
 */
public final class JsonReportFormatter {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .build();

    private JsonReportFormatter() {
        // Utility class
    }

    /**
     * Serializes a result.
     *
     * @param value report, call graph or callers result
     * @return JSON text ending in a newline
     * @throws IllegalStateException if the value cannot be serialized
     */
    public static String format(Object value) {
        try {
            return MAPPER.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Wraps a result into a JSON document.
     *
     * @param name file name stem
     * @param value result to serialize
     * @return JSON document
     */
    public static RenderedDocument document(String name, Object value) {
        return new RenderedDocument(name + ".json", format(value), RenderedDocument.JSON);
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
