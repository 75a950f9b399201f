package com.docanalyzer.util;

import javax.annotation.Nonnull;

/**
 * Null-safe string helpers.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * Returns the value, or "unknown" when it is null or blank.
     */
    @Nonnull
    public static String safe(String value) {
        return safe(value, "unknown");
    }

    @Nonnull
    public static String safe(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue != null ? defaultValue : "unknown";
        }
        return value;
    }

    /**
     * Shortens text for log lines.
     */
    @Nonnull
    public static String abbreviate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
