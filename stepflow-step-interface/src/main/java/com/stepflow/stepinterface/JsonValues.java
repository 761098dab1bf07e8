package com.stepflow.stepinterface;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.Map;

/**
 * Jackson helpers for parameter values: JSON-representability checks and conversions between
 * parameter objects and plain maps.
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonValues() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Whether the value can be rendered as JSON. Maps need string keys; beans are accepted when
     * Jackson can serialize them.
     */
    public static boolean isJsonSerializable(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Number || value instanceof Character || value instanceof Enum) {
            return true;
        }
        if (value instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                if (!(e.getKey() instanceof String) || !isJsonSerializable(e.getValue())) return false;
            }
            return true;
        }
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (!isJsonSerializable(item)) return false;
            }
            return true;
        }
        try {
            MAPPER.writeValueAsString(value);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    /** Converts a value to its JSON-native form (maps, lists, strings, numbers, booleans, null). */
    public static Object toJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        try {
            return MAPPER.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            throw new StepInterfaceException("Value of type " + value.getClass().getName() + " is not JSON-representable", e);
        }
    }

    /**
     * Converts a JSON-native value (typically a map) into the given type.
     *
     * @throws StepInterfaceException if Jackson cannot bind the value
     */
    public static <T> T convert(Object value, Class<T> type) {
        try {
            return MAPPER.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new StepInterfaceException("Cannot convert value to " + type.getName() + ": " + e.getMessage(), e);
        }
    }
}
