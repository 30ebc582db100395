package com.yamlguard.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.yamlguard.util.LoggerUtil;

/**
 * Loads {@code .yamlguard.yml} over the embedded defaults, validating values and
 * falling back to defaults for anything missing or invalid.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final List<String> CONFIG_FILE_NAMES = List.of(".yamlguard.yml", "yamlguard.yml");

    private static final Set<String> FORMATS = Set.of("stylish", "jsonl");
    private static final Set<String> FAIL_ON_LEVELS = Set.of("error", "warning", "info");

    private static GuardConfig _cachedDefaultConfig = null;

    /**
     * Looks for a configuration file in {@code start} and then in each parent directory.
     *
     * @return the first file found, or {@code null}
     */
    public static Path findConfig(Path start) {
        Path dir = start == null ? null : start.toAbsolutePath();
        while (dir != null) {
            for (String name : CONFIG_FILE_NAMES) {
                Path candidate = dir.resolve(name);
                if (Files.isRegularFile(candidate)) {
                    logger.fine("Found configuration file: " + candidate);
                    return candidate;
                }
            }
            dir = dir.getParent();
        }
        return null;
    }

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static GuardConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.fine("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            return _createConfigFromMap(config == null ? new HashMap<>() : config, loadDefaultConfig());
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized GuardConfig loadDefaultConfig() {
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

            _cachedDefaultConfig = _createConfigFromMap(config, _createEmptyConfig());
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Overlays a parsed file on {@code base} section by section, then validates.
     */
    @SuppressWarnings("unchecked")
    private static GuardConfig _createConfigFromMap(Map<String, Object> config, GuardConfig base) {
        Map<String, Map<String, Object>> sections = base.getSectionsMap();

        for (String section : List.of(GuardConfig.INDENT, GuardConfig.REPORTER, GuardConfig.FILES)) {
            Object value = config.get(section);
            if (value == null) {
                continue;
            }
            if (value instanceof Map) {
                sections.computeIfAbsent(section, k -> new HashMap<>())
                        .putAll((Map<String, Object>) value);
            } else {
                logger.warning("Invalid '" + section + "' section in config, using defaults");
            }
        }

        boolean ci = base.isCi();
        if (config.get("ci") instanceof Boolean) {
            ci = (Boolean) config.get("ci");
        }

        _validateConfigurationValues(sections, base);

        return new GuardConfig(sections, ci);
    }

    /**
     * Replaces out-of-range values with the base value.
     */
    private static void _validateConfigurationValues(Map<String, Map<String, Object>> sections, GuardConfig base) {
        Map<String, Object> indent = sections.get(GuardConfig.INDENT);
        Object step = indent.get("step");
        if (!(step instanceof Number) || ((Number) step).intValue() < 1 || ((Number) step).intValue() > 8) {
            logger.warning("Configuration value 'indent.step' must be an integer between 1 and 8, got "
                    + step + ". Using default value.");
            indent.put("step", base.getIndentStep());
        }
        if (!(indent.get("strict") instanceof Boolean)) {
            indent.put("strict", base.isStrict());
        }

        Map<String, Object> reporter = sections.get(GuardConfig.REPORTER);
        _validateChoice(reporter, "reporter.format", "format", FORMATS, base.getFormat());
        _validateChoice(reporter, "reporter.failOn", "failOn", FAIL_ON_LEVELS, base.getFailOn().label());
        if (!(reporter.get("color") instanceof Boolean)) {
            reporter.put("color", base.isColor());
        }
        if (!(reporter.get("verbose") instanceof Boolean)) {
            reporter.put("verbose", base.isVerbose());
        }

        Map<String, Object> files = sections.get(GuardConfig.FILES);
        if (!(files.get("include") instanceof List)) {
            files.put("include", base.getIncludePatterns());
        }
        if (!(files.get("exclude") instanceof List)) {
            files.put("exclude", base.getExcludePatterns());
        }
    }

    private static void _validateChoice(Map<String, Object> section, String name, String key,
                                        Set<String> allowed, String fallback) {
        Object value = section.get(key);
        if (value == null || !allowed.contains(value.toString().toLowerCase(Locale.ROOT))) {
            logger.warning("Configuration value '" + name + "' must be one of " + new TreeSet<>(allowed)
                    + ", got " + value + ". Using default value.");
            section.put(key, fallback);
        } else {
            section.put(key, value.toString().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Built-in defaults, used when the defaults resource is unavailable.
     */
    private static GuardConfig _createEmptyConfig() {
        Map<String, Map<String, Object>> sections = new HashMap<>();

        Map<String, Object> indent = new HashMap<>();
        indent.put("step", 2);
        indent.put("strict", true);
        sections.put(GuardConfig.INDENT, indent);

        Map<String, Object> reporter = new HashMap<>();
        reporter.put("format", "stylish");
        reporter.put("color", true);
        reporter.put("verbose", false);
        reporter.put("failOn", "error");
        sections.put(GuardConfig.REPORTER, reporter);

        Map<String, Object> files = new HashMap<>();
        files.put("include", new ArrayList<>(List.of("**/*.yaml", "**/*.yml")));
        files.put("exclude", new ArrayList<>(List.of("**/node_modules/**", "**/.git/**")));
        sections.put(GuardConfig.FILES, files);

        return new GuardConfig(sections, false);
    }

    /**
     * Writes the default configuration for {@code init}.
     *
     * @throws FileAlreadyExistsException if the file exists and {@code force} is false
     */
    public static void writeDefaultConfig(Path configPath, boolean force) throws IOException {
        if (Files.exists(configPath) && !force) {
            throw new FileAlreadyExistsException(configPath.toString(), null,
                    "configuration file already exists, use --force to overwrite");
        }
        saveConfig(loadDefaultConfig(), configPath);
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(GuardConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            Map<String, Map<String, Object>> sections = config.getSectionsMap();
            configMap.put(GuardConfig.INDENT, new TreeMap<>(sections.getOrDefault(GuardConfig.INDENT, Map.of())));
            configMap.put(GuardConfig.REPORTER, new TreeMap<>(sections.getOrDefault(GuardConfig.REPORTER, Map.of())));
            configMap.put(GuardConfig.FILES, new TreeMap<>(sections.getOrDefault(GuardConfig.FILES, Map.of())));
            configMap.put("ci", config.isCi());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
