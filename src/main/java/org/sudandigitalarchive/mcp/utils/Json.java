package org.sudandigitalarchive.mcp.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared ObjectMapper singleton for JSON serialization.
 * Configured with NON_NULL inclusion and snake_case naming to match the archive API and MCP conventions.
 * Unknown properties in remote payloads are ignored so new archive fields do not break decoding.
 */
public final class Json {
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
        (PropertyNamingStrategies.SnakeCaseStrategy) PropertyNamingStrategies.SNAKE_CASE;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .setPropertyNamingStrategy(SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private Json() {}

    /**
     * Convert a camelCase string to snake_case.
     * Single source of truth for naming conversion across the codebase.
     */
    public static String toSnakeCase(final String camel) {
        return SNAKE_CASE.translate(camel);
    }

    /**
     * Serialize an object to a JSON string.
     *
     * @param value the object to serialize
     * @return JSON string representation
     * @throws RuntimeException if serialization fails
     */
    public static String serialize(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization failed", e);
        }
    }

    /**
     * Serialize an object to an indented JSON string, used for human-readable tool output.
     */
    public static String prettyPrint(final Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization failed", e);
        }
    }

    /**
     * Deserialize a JSON string to the given type.
     *
     * @throws RuntimeException if deserialization fails
     */
    public static <T> T readValue(final String json, final Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON deserialization failed", e);
        }
    }

    /**
     * Deserialize a remote payload, surfacing the Jackson failure to the caller so it can be
     * classified rather than wrapped.
     */
    public static <T> T decode(final String json, final Class<T> type) throws JsonProcessingException {
        return MAPPER.readValue(json, type);
    }

    /**
     * Convert any value into a JSON tree.
     */
    public static JsonNode valueToTree(final Object value) {
        return MAPPER.valueToTree(value);
    }

    /**
     * Create an empty JSON object node.
     */
    public static ObjectNode createObject() {
        return MAPPER.createObjectNode();
    }

    /**
     * Parse a JSON string into a JsonNode tree.
     *
     * @param json the JSON string to parse
     * @return the parsed JsonNode, or null if the input is null or empty
     * @throws RuntimeException if parsing fails
     */
    public static JsonNode readTree(final String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON parsing failed", e);
        }
    }
}
