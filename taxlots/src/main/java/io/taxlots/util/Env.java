package io.taxlots.util;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Environment variable utilities.
 *
 * Lookup order: environment variable, then system property, then the default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    /**
     * @throws IllegalStateException if the value is set but not an integer
     */
    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public static Path getPath(String key, String defaultValue) {
        return Path.of(get(key, defaultValue));
    }

    /**
     * Comma-separated list, blank entries dropped.
     */
    public static List<String> getList(String key) {
        String value = get(key, null);
        if (value == null) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private Env() {}
}
