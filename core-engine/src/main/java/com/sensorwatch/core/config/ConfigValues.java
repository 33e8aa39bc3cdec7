package com.sensorwatch.core.config;

import com.sensorwatch.core.error.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed accessors over the loosely typed option maps used to configure
 * sensors and notifiers.
 *
 * <p>
 * Numbers may arrive as any {@link Number} or as a numeric string (YAML and
 * hand-written maps both occur). Keys not asked for are simply ignored.
 * Missing or malformed required values fail with
 * {@link InvalidConfigurationException}; {@code context} names the entry in
 * the message.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigValues {

    private ConfigValues() {
        // utility class — not instantiable
    }

    public static double requiredDouble(Map<String, ?> params, String key, String context) {
        Objects.requireNonNull(params, "Configuration map must not be null");
        Object raw = params.get(key);
        if (raw == null) {
            throw new InvalidConfigurationException(context + " requires '" + key + "'");
        }
        return toDouble(raw, key, context);
    }

    public static double optionalDouble(Map<String, ?> params, String key, double defaultValue, String context) {
        Object raw = params.get(key);
        return raw == null ? defaultValue : toDouble(raw, key, context);
    }

    public static int optionalInt(Map<String, ?> params, String key, int defaultValue, String context) {
        Object raw = params.get(key);
        if (raw == null) {
            return defaultValue;
        }
        double value = toDouble(raw, key, context);
        if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new InvalidConfigurationException(
                    context + " requires an integer '" + key + "', got: " + raw);
        }
        return (int) value;
    }

    public static long optionalLong(Map<String, ?> params, String key, long defaultValue, String context) {
        Object raw = params.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                    context + " requires an integer '" + key + "', got: " + raw, e);
        }
    }

    public static String requiredString(Map<String, ?> params, String key, String context) {
        Objects.requireNonNull(params, "Configuration map must not be null");
        Object raw = params.get(key);
        if (raw == null || raw.toString().isBlank()) {
            throw new InvalidConfigurationException(context + " requires '" + key + "'");
        }
        return raw.toString().trim();
    }

    public static String optionalString(Map<String, ?> params, String key, String defaultValue) {
        Object raw = params.get(key);
        return raw == null || raw.toString().isBlank() ? defaultValue : raw.toString().trim();
    }

    /**
     * @return the numbers listed under {@code key}, or {@code null} when absent
     */
    public static double[] optionalDoubleList(Map<String, ?> params, String key, String context) {
        Object raw = params.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Collection<?> items) || items.isEmpty()) {
            throw new InvalidConfigurationException(
                    context + " requires '" + key + "' to be a non-empty list, got: " + raw);
        }
        List<Double> values = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item == null) {
                throw new InvalidConfigurationException(context + " has a null entry in '" + key + "'");
            }
            values.add(toDouble(item, key, context));
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double toDouble(Object raw, String key, String context) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException(
                        context + " requires a numeric '" + key + "', got: '" + s + "'", e);
            }
        }
        throw new InvalidConfigurationException(
                context + " requires a numeric '" + key + "', got: " + raw);
    }
}
