package com.hcltech.vocab.common;

/**
 * Abstraction for reading environment variables.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} so that tests can provide their own source.
 */
@FunctionalInterface
public interface IEnvGetter {
    IEnvGetter env = System::getenv;

    /** Returns the value of the given environment variable, or {@code null} if unset. */
    String get(String name);

    /**
     * Returns the value exactly as set, whitespace included, or the default if the variable is unset or empty.
     * Whitespace-only values are legitimate here (an indent separator is usually a space).
     */
    static String getVerbatimOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
