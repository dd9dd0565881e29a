package com.raditha.optchain.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads detector configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > preset defaults.
 * <pre>
 * prefer_optional_chain:
 *   preset: default
 *   check_string: false
 *   require_nullish: true
 * </pre>
 */
public class DetectorSettings {

    private static final Logger logger = LoggerFactory.getLogger(DetectorSettings.class);

    public static final String CONFIG_KEY = "prefer_optional_chain";

    public static final String CHECK_ANY = "check_any";
    public static final String CHECK_UNKNOWN = "check_unknown";
    public static final String CHECK_STRING = "check_string";
    public static final String CHECK_NUMBER = "check_number";
    public static final String CHECK_BOOLEAN = "check_boolean";
    public static final String CHECK_BIGINT = "check_bigint";
    public static final String REQUIRE_NULLISH = "require_nullish";

    /** Every option key, in declaration order. */
    public static final List<String> OPTION_KEYS = List.of(
            CHECK_ANY, CHECK_UNKNOWN, CHECK_STRING, CHECK_NUMBER, CHECK_BOOLEAN, CHECK_BIGINT, REQUIRE_NULLISH);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private DetectorSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile   YAML file (null = no file)
     * @param presetCLI    CLI preset name (null = use YAML/default)
     * @param overridesCLI CLI option values keyed by option key; absent keys fall back to YAML
     * @return complete detector configuration
     * @throws IOException              if the file cannot be read or is not valid YAML
     * @throws IllegalArgumentException if the preset or an option key is unknown
     */
    public static DetectorConfig loadConfig(@Nullable Path configFile, @Nullable String presetCLI,
            Map<String, Boolean> overridesCLI) throws IOException {
        Map<String, Object> yaml = configFile == null ? Map.of() : readSection(configFile);

        // Determine preset (CLI > YAML)
        String preset = presetCLI != null ? presetCLI : getString(yaml, "preset", DetectorConfig.PRESET_DEFAULT);
        DetectorConfig config = DetectorConfig.preset(preset);

        for (String key : OPTION_KEYS) {
            Boolean value = overridesCLI.containsKey(key) ? overridesCLI.get(key) : getBoolean(yaml, key);
            if (value != null) {
                config = apply(config, key, value);
            }
        }
        for (String key : overridesCLI.keySet()) {
            if (!OPTION_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown option: " + key);
            }
        }

        logger.debug("Loaded configuration {} (preset {})", config, preset);
        return config;
    }

    /**
     * Load configuration from a YAML file without CLI overrides.
     */
    public static DetectorConfig loadConfig(Path configFile) throws IOException {
        return loadConfig(configFile, null, Map.of());
    }

    static DetectorConfig apply(DetectorConfig config, String key, boolean value) {
        return switch (key) {
            case CHECK_ANY -> config.withCheckAny(value);
            case CHECK_UNKNOWN -> config.withCheckUnknown(value);
            case CHECK_STRING -> config.withCheckString(value);
            case CHECK_NUMBER -> config.withCheckNumber(value);
            case CHECK_BOOLEAN -> config.withCheckBoolean(value);
            case CHECK_BIGINT -> config.withCheckBigInt(value);
            case REQUIRE_NULLISH -> config.withRequireNullish(value);
            default -> throw new IllegalArgumentException("Unknown option: " + key);
        };
    }

    private static Map<String, Object> readSection(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        Object root = YAML.readValue(configFile.toFile(), Object.class);
        if (!(root instanceof Map)) {
            logger.warn("Ignoring {}: top level is not a mapping", configFile);
            return Map.of();
        }
        Object section = ((Map<?, ?>) root).get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            logger.debug("No {} section in {}", CONFIG_KEY, configFile);
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        for (String key : config.keySet()) {
            if (!key.equals("preset") && !OPTION_KEYS.contains(key)) {
                logger.warn("Unknown key {} in {} section of {}", key, CONFIG_KEY, configFile);
            }
        }
        return config;
    }

    private static Boolean getBoolean(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("Option " + key + " must be true or false, got: " + value);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
