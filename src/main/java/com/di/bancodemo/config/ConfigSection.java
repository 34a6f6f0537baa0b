package com.di.bancodemo.config;

import com.di.bancodemo.exception.ConfigurationException;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One section of the data configuration file. Keys missing from the section fall back
 * to the DEFAULT section, the way INI-style configuration files behave.
 */
final class ConfigSection {

    private static final Set<String> TRUE_VALUES = Set.of("1", "yes", "true", "on");
    private static final Set<String> FALSE_VALUES = Set.of("0", "no", "false", "off");

    private final String name;
    private final Map<String, Object> values;
    private final Map<String, Object> defaults;

    ConfigSection(String name, Map<String, Object> values, Map<String, Object> defaults) {
        this.name = name;
        this.values = values != null ? values : Map.of();
        this.defaults = defaults != null ? defaults : Map.of();
    }

    String name() {
        return name;
    }

    Optional<String> get(String key) {
        Object value = values.containsKey(key) ? values.get(key) : defaults.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value instanceof Collection<?> items
                ? items.stream().map(String::valueOf).collect(Collectors.joining(","))
                : String.valueOf(value).trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    String getString(String key, String fallback) {
        return get(key).orElse(fallback);
    }

    String getRequiredString(String key) {
        return get(key).orElseThrow(() -> missing(key));
    }

    long getRequiredLong(String key) {
        return parseLong(key, getRequiredString(key));
    }

    int getInt(String key, int fallback) {
        return get(key).map(v -> toInt(key, parseLong(key, v))).orElse(fallback);
    }

    int getRequiredInt(String key) {
        return toInt(key, getRequiredLong(key));
    }

    boolean getBoolean(String key, boolean fallback) {
        return get(key).map(v -> parseBoolean(key, v)).orElse(fallback);
    }

    boolean getRequiredBoolean(String key) {
        return parseBoolean(key, getRequiredString(key));
    }

    private long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    String.format("[%s] %s must be an integer, got '%s'", name, key, value), e);
        }
    }

    private int toInt(String key, long value) {
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new ConfigurationException(
                    String.format("[%s] %s is out of range, got %d", name, key, value), e);
        }
    }

    private boolean parseBoolean(String key, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(lower)) return true;
        if (FALSE_VALUES.contains(lower)) return false;
        throw new ConfigurationException(
                String.format("[%s] %s must be a boolean, got '%s'", name, key, value));
    }

    private ConfigurationException missing(String key) {
        return new ConfigurationException(String.format("[%s] missing required key '%s'", name, key));
    }
}
