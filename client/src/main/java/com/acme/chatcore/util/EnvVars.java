package com.acme.chatcore.util;

import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Startup-path only. Malformed values fall back to the default.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(String name, String defaultValue) {
        return getOrDefault(System.getenv(), name, defaultValue);
    }

    public static boolean getBoolean(String name, boolean defaultValue) {
        return getBoolean(System.getenv(), name, defaultValue);
    }

    public static int getIntClamped(String name, int defaultValue, int min, int max) {
        return getIntClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static Integer getOptionalInt(String name, int min, int max) {
        return getOptionalInt(System.getenv(), name, min, max);
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v;
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        Integer parsed = getOptionalInt(env, name, min, max);
        return parsed == null ? defaultValue : parsed;
    }

    /**
     * Returns the clamped value, or {@code null} when the variable is unset or malformed.
     * Used for options whose absence means "discover from the server".
     */
    public static Integer getOptionalInt(Map<String, String> env, String name, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
