package com.yamlguard.util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamlguard.api.LintResult;
import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;

/**
 * Machine-readable report: one JSON object per finding, then a summary object.
 */
public class JsonLinesFormatter {
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * One line per finding of {@code file}, each prefixed with a {@code file} field.
     */
    public List<String> formatFile(Path file, LintResult result) {
        List<String> lines = new ArrayList<>();
        for (LintError error : result.getErrors()) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("file", file.toString());
            record.putAll(error.toMap());
            lines.add(write(record));
        }
        return lines;
    }

    /**
     * {@code {"type":"summary", ...}} with counts over all results.
     *
     * @param failOn lowest severity that makes the run unsuccessful
     */
    public String formatSummary(Map<Path, LintResult> results, Severity failOn) {
        long errors = 0;
        long warnings = 0;
        long infos = 0;
        boolean success = true;
        for (LintResult result : results.values()) {
            for (LintError error : result.getErrors()) {
                switch (error.getSeverity()) {
                    case FATAL, ERROR -> errors++;
                    case WARNING -> warnings++;
                    case INFO -> infos++;
                }
                if (error.getSeverity().isAtLeast(failOn)) {
                    success = false;
                }
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", "summary");
        summary.put("files", results.size());
        summary.put("errors", errors);
        summary.put("warnings", warnings);
        summary.put("info", infos);
        summary.put("success", success);
        return write(summary);
    }

    private String write(Map<String, Object> record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            // plain maps of strings, numbers and booleans always serialize
            throw new IllegalStateException("Failed to serialize report line", e);
        }
    }
}
