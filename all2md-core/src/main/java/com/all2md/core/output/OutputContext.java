package com.all2md.core.output;

import java.util.Map;
import java.util.Objects;

/**
 * Destination settings handed to an {@link OutputWriter}.
 *
 * @param outputDirectory target directory path
 * @param settings writer-specific settings
 */
public record OutputContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public OutputContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
