package com.yamlguard.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.yamlguard.api.error.Severity;

/**
 * Configuration for the linter: the {@code indent}, {@code reporter} and
 * {@code files} sections of {@code .yamlguard.yml} plus the {@code ci} flag.
 */
public class GuardConfig {
    public static final String INDENT = "indent";
    public static final String REPORTER = "reporter";
    public static final String FILES = "files";

    private final Map<String, Map<String, Object>> sections;
    private final boolean ci;

    public GuardConfig(Map<String, Map<String, Object>> sections, boolean ci) {
        this.sections = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : sections.entrySet()) {
            this.sections.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        this.ci = ci;
    }

    /**
     * Gets a copy of the section maps.
     */
    public Map<String, Map<String, Object>> getSectionsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : sections.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String section, String key, T defaultValue) {
        Map<String, Object> values = sections.get(section);
        if (values == null) {
            return defaultValue;
        }

        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            } else if (defaultValue instanceof List && value instanceof List) {
                return (T) value;
            }
            return defaultValue;
        }

        return (T) value;
    }

    public int getIndentStep() {
        return get(INDENT, "step", 2);
    }

    public boolean isStrict() {
        return get(INDENT, "strict", true);
    }

    public String getFormat() {
        return get(REPORTER, "format", "stylish");
    }

    public boolean isColor() {
        return get(REPORTER, "color", true);
    }

    public boolean isVerbose() {
        return get(REPORTER, "verbose", false);
    }

    public Severity getFailOn() {
        return Severity.fromLabel(get(REPORTER, "failOn", "error"));
    }

    public List<String> getIncludePatterns() {
        return stringList(get(FILES, "include", List.of()));
    }

    public List<String> getExcludePatterns() {
        return stringList(get(FILES, "exclude", List.of()));
    }

    public boolean isCi() {
        return ci;
    }

    /**
     * A copy with one value replaced, used for command line overrides.
     */
    public GuardConfig with(String section, String key, Object value) {
        Map<String, Map<String, Object>> copy = getSectionsMap();
        copy.computeIfAbsent(section, k -> new HashMap<>()).put(key, value);
        return new GuardConfig(copy, ci);
    }

    public GuardConfig withCi(boolean ci) {
        return new GuardConfig(sections, ci);
    }

    private static List<String> stringList(List<?> values) {
        List<String> result = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
    }
}
