package com.spformatter.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration loaded from YAML: a {@code general} section plus named option sections
 * ({@code spacing}, {@code braces}, {@code blankLines}, {@code includes}, {@code semicolons}).
 */
public class FormatterConfig {
    public static final String SPACING = "spacing";
    public static final String BRACES = "braces";
    public static final String BLANK_LINES = "blankLines";
    public static final String INCLUDES = "includes";
    public static final String SEMICOLONS = "semicolons";

    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> sectionConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> sectionConfigs) {
        this.generalConfig = generalConfig;
        this.sectionConfigs = sectionConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a deep copy of the section maps.
     */
    public Map<String, Map<String, Object>> getSectionConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : sectionConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getSectionConfig(String section, String key, T defaultValue) {
        Map<String, Object> sectionConfig = sectionConfigs.get(section);
        if (sectionConfig == null) {
            return defaultValue;
        }
        return _coerce(sectionConfig.get(key), defaultValue);
    }

    @SuppressWarnings("unchecked")
    public List<String> getIgnoreFiles() {
        Object value = generalConfig.get("ignoreFiles");
        if (value instanceof List) {
            return List.copyOf((List<String>) value);
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    private static <T> T _coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            try {
                return (T) value;
            } catch (ClassCastException e) {
                return defaultValue;
            }
        }

        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        } else if (defaultValue instanceof Integer && value instanceof String) {
            try {
                return (T) Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(((String) value).trim());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }
        return defaultValue;
    }
}
