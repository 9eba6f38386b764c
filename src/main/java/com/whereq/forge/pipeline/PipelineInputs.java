package com.whereq.forge.pipeline;

import java.util.Map;

/**
 * Typed reads of job input values, which arrive as untyped JSON
 */
final class PipelineInputs {

    private PipelineInputs() {
    }

    static int intValue(Map<String, Object> input, String key, int defaultValue) {
        Object value = input != null ? input.get(key) : null;
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.floor(asDouble)) {
                throw new IllegalArgumentException(key + " must be a whole number, got " + value);
            }
            // intValue() would wrap a long such as 2^32 + 1 into range
            if (asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(key + " is out of range: " + value);
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got " + value, e);
        }
    }

    static boolean booleanValue(Map<String, Object> input, String key, boolean defaultValue) {
        Object value = input != null ? input.get(key) : null;
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
