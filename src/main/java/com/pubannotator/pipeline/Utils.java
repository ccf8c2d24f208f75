package com.pubannotator.pipeline;

/**
 * Utility class for common helper methods used by the pipeline and its exporters.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public final class Utils {
    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Truncates text for log lines and diagnostics, appending an ellipsis when shortened.
     * @param text Input text (may be null)
     * @param maxLength Maximum number of characters kept from the input
     * @return Truncated text, or an empty string for null input
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...";
    }

    /**
     * Reads a setting from the environment, falling back to a JVM system property and then to the default.
     * @param key Setting name, identical for environment variable and system property
     * @param defaultVal Value used when neither source defines the key
     * @return Resolved value
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }
}
