package com.causalloops.common;

import java.util.Map;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    static IEnvGetter fromMap(Map<String, String> map) {
        return map::get;
    }

    // ------------------------------------------------------------------------
    // Required getters (throw if missing or blank)
    // ------------------------------------------------------------------------

    /**
     * Returns the value of the environment variable, throwing if missing or blank.
     */
    static String getString(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: " + name);
        }
        return value;
    }

    // ------------------------------------------------------------------------
    // Optional getters (default fallback)
    // ------------------------------------------------------------------------

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    static long getLongOr(IEnvGetter env, String name, long defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid long for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
