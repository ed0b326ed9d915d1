package com.doctex.core.output;

import java.util.Map;
import java.util.Objects;

/**
 * Where and how a rendered document is delivered.
 *
 * @param outputDirectory target directory path
 * @param documentName base name of the written document, without extension
 * @param settings renderer-specific settings
 */
public record OutputTarget(
    String outputDirectory,
    String documentName,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public OutputTarget {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (documentName == null || documentName.isBlank()) {
            throw new IllegalArgumentException("documentName must not be blank");
        }
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Gets a setting value.
     *
     * @param key setting key
     * @return setting value or null
     */
    public String getSetting(String key) {
        return settings.get(key);
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
