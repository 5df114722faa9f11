package com.sqlsignal.core.renderer;

import java.nio.file.Path;
import java.util.Map;

/**
 * Context provided to renderers during execution.
 *
 * @param outputDirectory target directory, or null for renderers that do not write files
 * @param settings renderer-specific settings
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static RenderContext console() {
        return new RenderContext(null, Map.of());
    }

    public static RenderContext directory(Path outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
