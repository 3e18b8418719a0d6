package com.tandem.dispatch.tools;

import com.tandem.core.error.InteractionException;

import java.util.Collections;
import java.util.Map;

/**
 * Typed access to a tool call's JSON argument object. Every failure is an
 * {@code INVALID_ARGUMENT} error naming the offending field.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public boolean has(String name) {
        Object value = values.get(name);
        return value != null && !(value instanceof String s && s.isBlank());
    }

    public String optionalString(String name) {
        Object value = values.get(name);
        return value == null ? null : String.valueOf(value);
    }

    public String requireString(String name) {
        if (!has(name)) {
            throw InteractionException.invalidArgument(name + " is required");
        }
        return optionalString(name);
    }

    /**
     * Accepts a JSON integer or a string of digits.
     */
    public long requireLong(String name) {
        if (!has(name)) {
            throw InteractionException.invalidArgument(name + " is required");
        }
        Object value = values.get(name);
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof String s && s.trim().matches("\\d+")) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw InteractionException.invalidArgument(name + " must be a valid integer");
            }
        }
        throw InteractionException.invalidArgument(name + " must be a valid integer");
    }

    /**
     * @return the value, or null when absent; fractional numbers are truncated
     */
    public Integer optionalInt(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw InteractionException.invalidArgument(name + " must be a number");
            }
            return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, d));
        }
        if (value instanceof String s) {
            try {
                return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Double.parseDouble(s.trim())));
            } catch (NumberFormatException e) {
                throw InteractionException.invalidArgument(name + " must be a number");
            }
        }
        throw InteractionException.invalidArgument(name + " must be a number");
    }

    public boolean optionalBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return false;
            }
        }
        throw InteractionException.invalidArgument(name + " must be a boolean");
    }
}
