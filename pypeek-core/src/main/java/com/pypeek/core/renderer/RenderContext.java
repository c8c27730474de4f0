package com.pypeek.core.renderer;

import java.util.Map;

/**
 * Context provided to renderers during execution.
 *
 * @param settings renderer-specific settings (e.g., {@code console.conditions=true})
 */
public record RenderContext(Map<String, String> settings) {

    /** Show return conditions in console output. */
    public static final String CONSOLE_CONDITIONS = "console.conditions";

    /** Pretty-print JSON output. */
    public static final String JSON_PRETTY = "json.pretty";

    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /**
     * Creates a context with no settings.
     *
     * @return empty context
     */
    public static RenderContext empty() {
        return new RenderContext(Map.of());
    }

    /**
     * Gets a boolean setting.
     *
     * @param key setting key
     * @param defaultValue value used when the setting is absent
     * @return true if the setting is "true" (ignoring case)
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }
}
