package com.yamlguard.api.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single finding reported for a document.
 * Subclasses add the fields specific to their check.
 */
public class LintError {
    public static final String TYPE_FILE = "file";
    public static final String TYPE_PARSE = "parse";

    private final String type;
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public LintError(String type, Severity severity, String message, int line, int column) {
        this(type, severity, message, line, column, null);
    }

    public LintError(String type, Severity severity, String message, int line, int column, String suggestion) {
        this.type = type;
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    // Getters
    public String getType() { return type; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    /**
     * Field map used by the machine-readable reporters.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("line", line);
        map.put("column", column);
        map.put("message", message);
        map.put("severity", severity.label());
        if (suggestion != null) {
            map.put("suggestion", suggestion);
        }
        return map;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + type + ", " + severity.label() + ", line=" + line
                + ", column=" + column + ", message='" + message + "')";
    }
}
