package com.yamlguard.plugins.yaml;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;

/**
 * An indentation mismatch. Line, column and both indents are 1-based columns.
 */
public final class IndentationError extends LintError {
    public static final String TYPE = "indentation";

    /** Ascending by line, then column. */
    public static final Comparator<IndentationError> DOCUMENT_ORDER =
            Comparator.comparingInt(IndentationError::getLine).thenComparingInt(IndentationError::getColumn);

    private final int expectedIndent;
    private final int actualIndent;
    private final String path;

    public IndentationError(int line, int column, int expectedIndent, int actualIndent,
                            String path, String message, Severity severity) {
        this(line, column, expectedIndent, actualIndent, path, message, severity, null);
    }

    public IndentationError(int line, int column, int expectedIndent, int actualIndent,
                            String path, String message, Severity severity, String suggestion) {
        super(TYPE, severity, message, line, column, suggestion);
        if (line < 1 || column < 1 || expectedIndent < 1 || actualIndent < 1) {
            throw new IllegalArgumentException("Positions are 1-based: line=" + line + ", column=" + column
                    + ", expected=" + expectedIndent + ", actual=" + actualIndent);
        }
        if (severity == Severity.FATAL) {
            throw new IllegalArgumentException("Indentation findings are never fatal");
        }
        this.expectedIndent = expectedIndent;
        this.actualIndent = actualIndent;
        this.path = path;
    }

    public int getExpectedIndent() { return expectedIndent; }
    public int getActualIndent() { return actualIndent; }
    public String getPath() { return path; }

    /**
     * A copy carrying the corrected line as its suggestion.
     */
    public IndentationError withSuggestion(String suggestion) {
        return new IndentationError(getLine(), getColumn(), expectedIndent, actualIndent, path,
                getMessage(), getSeverity(), suggestion);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", TYPE);
        map.put("line", getLine());
        map.put("column", getColumn());
        map.put("expected", expectedIndent);
        map.put("actual", actualIndent);
        map.put("path", path);
        map.put("message", getMessage());
        map.put("severity", getSeverity().label());
        return map;
    }

    @Override
    public String toString() {
        return "IndentationError(line=" + getLine() + ", column=" + getColumn() + ", expected=" + expectedIndent
                + ", actual=" + actualIndent + ", path='" + path + "')";
    }
}
