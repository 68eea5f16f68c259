package com.swipesentinel.core;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Environment lookups with defaults, shared by the {@code fromEnvironment()}
 * factories of the component configs.
 *
 * Unparseable numbers fall back to the default, matching how a blank variable
 * is treated.
 */
public final class EnvDefaults {

    private EnvDefaults() {}

    public static String envOrDefault(String key, String defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? val.trim() : defaultValue;
    }

    public static String envOrNull(String key) {
        return envOrDefault(key, null);
    }

    public static int intEnvOrDefault(String key, int defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long longEnvOrDefault(String key, long defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Long.parseLong(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static double doubleEnvOrDefault(String key, double defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Double.parseDouble(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    public static Path pathEnvOrDefault(String key, Path defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? Paths.get(val.trim()) : defaultValue;
    }
}
