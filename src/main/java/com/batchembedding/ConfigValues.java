package com.batchembedding;

import java.util.HashMap;
import java.util.Map;

/**
 * Typed reads from a loosely typed configuration map. A missing or null value yields the default;
 * a value of the wrong type raises {@link IllegalArgumentException} naming the key.
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    public static String getString(Map<String, Object> config, String key, String defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof String) {
            return (String) value;
        }
        throw invalid(key, value, "a string");
    }

    public static int getInt(Map<String, Object> config, String key, int defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return Math.toIntExact(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "an integer");
            }
        }
        throw invalid(key, value, "an integer");
    }

    public static long getLong(Map<String, Object> config, String key, long defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "a long");
            }
        }
        throw invalid(key, value, "a long");
    }

    public static double getDouble(Map<String, Object> config, String key, double defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "a number");
            }
        }
        throw invalid(key, value, "a number");
    }

    public static boolean getBoolean(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if ("true".equals(value) || "false".equals(value)) {
            return Boolean.parseBoolean((String) value);
        }
        throw invalid(key, value, "a boolean");
    }

    public static Map<String, String> getStringMap(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw invalid(key, value, "a map of strings");
        }
        Map<String, String> result = new HashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String)) {
                throw invalid(key, value, "a map of strings");
            }
            result.put((String) entry.getKey(), (String) entry.getValue());
        }
        return result;
    }

    private static IllegalArgumentException invalid(String key, Object value, String expected) {
        return new IllegalArgumentException(ClientConstants.ERROR_INVALID_CONFIG + key + "]: expected "
            + expected + " but got " + value.getClass().getSimpleName());
    }
}
