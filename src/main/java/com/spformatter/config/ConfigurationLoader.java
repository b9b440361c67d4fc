package com.spformatter.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.spformatter.util.LoggerUtil;

/**
 * Loads {@code .spformatter.yml} files with validation and fallback to the bundled defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    private static final List<String> SECTIONS = List.of(
            FormatterConfig.SPACING, FormatterConfig.BRACES, FormatterConfig.BLANK_LINES,
            FormatterConfig.INCLUDES, FormatterConfig.SEMICOLONS);

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file, falling back to defaults when it is absent or unreadable.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            return _createConfigFromMap(config);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration, cached after the first call.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> sectionConfigs = new HashMap<>();
        for (String section : SECTIONS) {
            Object value = config.get(section);
            if (value instanceof Map) {
                sectionConfigs.put(section, new HashMap<>((Map<String, Object>) value));
            } else {
                if (value != null) {
                    logger.warning("Invalid configuration section '" + section + "', using defaults");
                }
                sectionConfigs.put(section, new HashMap<>());
            }
        }
        for (String key : config.keySet()) {
            if (!key.equals("general") && !SECTIONS.contains(key)) {
                logger.warning("Unknown configuration section '" + key + "' ignored");
            }
        }

        _validateConfigurationValues(generalConfig, sectionConfigs);
        return new FormatterConfig(generalConfig, sectionConfigs);
    }

    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> sectionConfigs) {
        _validateIntRange(generalConfig, "indentSize", 1, 8);
        _validateIntRange(generalConfig, "maxLineLength", 40, 400);

        Map<String, Object> blankLines = sectionConfigs.get(FormatterConfig.BLANK_LINES);
        _validateIntRange(blankLines, "maxConsecutiveEmptyLines", 0, 10);
        _validateIntRange(blankLines, "linesBetweenFunctions", 0, 5);

        Object lineEnding = generalConfig.get("lineEnding");
        if (lineEnding != null && !List.of("lf", "crlf", "cr", "system").contains(lineEnding.toString())) {
            logger.warning("Unknown lineEnding '" + lineEnding + "'. Using default value.");
            generalConfig.put("lineEnding", "lf");
        }
    }

    /**
     * Drops an integer value outside {@code [min, max]} so that its default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> sectionConfigs = new HashMap<>();
        for (String section : SECTIONS) {
            sectionConfigs.put(section, new HashMap<>());
        }
        return new FormatterConfig(generalConfig, sectionConfigs);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("indentSize") instanceof Number)) {
            generalConfig.put("indentSize", 4);
        }
        if (!(generalConfig.get("useTabs") instanceof Boolean)) {
            generalConfig.put("useTabs", false);
        }
        if (!(generalConfig.get("maxLineLength") instanceof Number)) {
            generalConfig.put("maxLineLength", 120);
        }
        if (!(generalConfig.get("lineEnding") instanceof String)) {
            generalConfig.put("lineEnding", "lf");
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    /**
     * Writes the configuration as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            Map<String, Map<String, Object>> sections = config.getSectionConfigsMap();
            for (String section : SECTIONS) {
                configMap.put(section, sections.getOrDefault(section, new HashMap<>()));
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
