package com.columnhierarchy.core.emitter;

import java.util.Map;

/**
 * Settings passed to every emitter.
 *
 * @param packageName package or namespace for generated types, may be null
 * @param fieldType name of the uniform field type in generated sources
 * @param settings emitter-specific settings
 */
public record EmitterConfig(
    String packageName,
    String fieldType,
    Map<String, String> settings
) {
    public static final String DEFAULT_FIELD_TYPE = "String";

    /**
     * Compact constructor with defaults.
     */
    public EmitterConfig {
        if (packageName != null && packageName.isBlank()) {
            packageName = null;
        }
        if (fieldType == null || fieldType.isBlank()) {
            fieldType = DEFAULT_FIELD_TYPE;
        }
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Creates a default configuration: no package, {@code String} fields.
     *
     * @return default emitter config
     */
    public static EmitterConfig defaults() {
        return new EmitterConfig(null, DEFAULT_FIELD_TYPE, Map.of());
    }

    public static EmitterConfig forPackage(String packageName) {
        return new EmitterConfig(packageName, DEFAULT_FIELD_TYPE, Map.of());
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
