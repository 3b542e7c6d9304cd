package org.sudandigitalarchive.mcp.api;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sudandigitalarchive.mcp.normalize.ValidationException;
import org.sudandigitalarchive.mcp.utils.Json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps Java parameter types to JSON Schema types and binds JSON arguments to them.
 * Binding is strict: a number is never accepted for a string parameter and vice versa.
 */
public enum ParamType {
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    STRING_LIST("array");

    private final String jsonSchemaType;

    ParamType(String jsonSchemaType) {
        this.jsonSchemaType = jsonSchemaType;
    }

    /**
     * Infer ParamType from a Java reflection Type.
     *
     * @throws IllegalArgumentException for types a tool parameter cannot have
     */
    public static ParamType inferFrom(Type javaType) {
        if (javaType == String.class) return STRING;
        if (javaType == int.class || javaType == Integer.class) return INTEGER;
        if (javaType == boolean.class || javaType == Boolean.class) return BOOLEAN;

        if (javaType instanceof ParameterizedType pt
                && pt.getRawType() == List.class
                && pt.getActualTypeArguments()[0] == String.class) {
            return STRING_LIST;
        }

        throw new IllegalArgumentException("Unsupported tool parameter type: " + javaType.getTypeName());
    }

    /**
     * JSON Schema fragment for one parameter. The sentinel, if any, is advertised as the default.
     */
    public Map<String, Object> toJsonSchemaMap(String description, Object unsetValue) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", jsonSchemaType);
        if (this == STRING_LIST) {
            schema.put("items", Map.of("type", "string"));
        }
        if (description != null && !description.isEmpty()) {
            schema.put("description", description);
        }
        if (unsetValue != null) {
            schema.put("default", unsetValue);
        }
        return schema;
    }

    /**
     * Parse the sentinel text declared in {@link Param#unset()}.
     *
     * @throws IllegalArgumentException if the text is not a value of this type
     */
    public Object parseUnset(String raw) {
        return switch (this) {
            case STRING -> raw;
            case INTEGER -> Integer.parseInt(raw.trim());
            case BOOLEAN -> {
                if (!raw.equals("true") && !raw.equals("false")) {
                    throw new IllegalArgumentException("Not a boolean: " + raw);
                }
                yield Boolean.parseBoolean(raw);
            }
            case STRING_LIST -> {
                final JsonNode node = Json.readTree(raw);
                if (node == null) throw new IllegalArgumentException("Not a list: " + raw);
                yield bind("unset", node);
            }
        };
    }

    /**
     * Bind a JSON argument to a Java value of this type.
     *
     * @param name parameter name, reported in validation failures
     * @throws ValidationException if the node has the wrong JSON type or is out of range
     */
    public Object bind(String name, JsonNode node) {
        return switch (this) {
            case STRING -> {
                if (!node.isTextual()) throw mismatch(name, node);
                yield node.textValue();
            }
            case INTEGER -> {
                if (!node.isIntegralNumber()) throw mismatch(name, node);
                if (!node.canConvertToInt()) throw new ValidationException(name, "is out of range: " + node);
                yield node.intValue();
            }
            case BOOLEAN -> {
                if (!node.isBoolean()) throw mismatch(name, node);
                yield node.booleanValue();
            }
            case STRING_LIST -> {
                if (!node.isArray()) throw mismatch(name, node);
                final List<String> values = new ArrayList<>(node.size());
                for (final JsonNode item : node) {
                    if (!item.isTextual()) {
                        throw new ValidationException(name, "expected an array of strings, found " + describe(item) + " element");
                    }
                    values.add(item.textValue());
                }
                yield List.copyOf(values);
            }
        };
    }

    private ValidationException mismatch(String name, JsonNode node) {
        final String expected = this == STRING_LIST ? "an array of strings" : "a " + jsonSchemaType;
        return new ValidationException(name, "expected " + expected + ", found " + describe(node));
    }

    private static String describe(JsonNode node) {
        return switch (node.getNodeType()) {
            case STRING -> "a string";
            case NUMBER -> node.isIntegralNumber() ? "an integer" : "a number";
            case BOOLEAN -> "a boolean";
            case ARRAY -> "an array";
            case OBJECT, POJO -> "an object";
            default -> "null";
        };
    }
}
