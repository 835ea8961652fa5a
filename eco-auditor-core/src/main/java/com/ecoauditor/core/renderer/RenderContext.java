package com.ecoauditor.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers.
 *
 * @param outputDirectory target directory; ignored by the console renderer
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static RenderContext of(String outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
