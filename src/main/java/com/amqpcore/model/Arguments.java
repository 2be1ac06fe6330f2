package com.amqpcore.model;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for AMQP field tables used as declare and bind arguments.
 */
public final class Arguments {

    private Arguments() {
    }

    /**
     * Compares two argument tables, treating null as empty and integral numbers of
     * different widths as equal (a client may send 500 as a short, int or long).
     */
    public static boolean equivalent(Map<String, Object> left, Map<String, Object> right) {
        return normalize(left).equals(normalize(right));
    }

    public static boolean valuesEqual(Object expected, Object actual) {
        return Objects.equals(normalizeValue(expected), normalizeValue(actual));
    }

    public static Map<String, Object> copy(Map<String, Object> arguments) {
        return arguments != null ? new HashMap<>(arguments) : new HashMap<>();
    }

    private static Map<String, Object> normalize(Map<String, Object> arguments) {
        Map<String, Object> normalized = new HashMap<>();
        if (arguments != null) {
            for (Map.Entry<String, Object> entry : arguments.entrySet()) {
                normalized.put(entry.getKey(), normalizeValue(entry.getValue()));
            }
        }
        return normalized;
    }

    @SuppressWarnings("unchecked")
    private static Object normalizeValue(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        if (value instanceof Map) {
            return normalize((Map<String, Object>) value);
        }
        return value;
    }
}
