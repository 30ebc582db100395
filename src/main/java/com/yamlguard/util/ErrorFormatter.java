package com.yamlguard.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.yamlguard.api.LintResult;
import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;

/**
 * Human-readable "stylish" report: findings grouped under their file, then totals.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";
    public static final String ANSI_DIM = "\u001B[2m";

    private final boolean useColors;
    private final boolean verbose;

    /**
     * @param useColors whether to use colors in the output
     * @param verbose   whether to print suggestions under each finding
     */
    public ErrorFormatter(boolean useColors, boolean verbose) {
        this.useColors = useColors;
        this.verbose = verbose;
    }

    /**
     * Formats one finding as {@code line:column  severity  message  path}.
     */
    public String formatError(LintError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "fatal  ");
            case ERROR -> colorize(ANSI_RED, "error  ");
            case WARNING -> colorize(ANSI_YELLOW, "warning");
            case INFO -> colorize(ANSI_BLUE, "info   ");
        };

        sb.append("  ").append(colorize(ANSI_DIM, error.getLine() + ":" + error.getColumn()));
        sb.append("  ").append(severityStr);
        sb.append("  ").append(error.getMessage());

        Object path = error.toMap().get("path");
        if (path != null) {
            sb.append("  ").append(colorize(ANSI_DIM, path.toString()));
        }

        if (verbose && error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n    ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * All findings of one file under an underlined header, or an empty string when there are none.
     */
    public String formatFile(Path file, LintResult result) {
        List<LintError> errors = result.getErrors();
        if (errors.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, file.toString())).append("\n");
        for (LintError error : errors) {
            sb.append(formatError(error)).append("\n");
        }
        return sb.toString();
    }

    /**
     * Creates a summary of findings per file and in total.
     */
    public String formatErrorSummary(Map<Path, List<LintError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        long[] totals = new long[Severity.values().length];
        for (Map.Entry<Path, List<LintError>> entry : fileErrors.entrySet()) {
            List<LintError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            long[] counts = countBySeverity(errors);
            for (int i = 0; i < counts.length; i++) {
                totals[i] += counts[i];
            }
            sb.append(entry.getKey().getFileName()).append(": ").append(formatCounts(counts)).append("\n");
        }

        if (sb.length() == 0) {
            return colorize(ANSI_GREEN, "No problems found in " + fileErrors.size() + " files");
        }

        return colorize(ANSI_BOLD, "Summary:\n") + sb
                + "\nTotal: " + formatCounts(totals) + " in " + fileErrors.size() + " files";
    }

    private String formatCounts(long[] counts) {
        StringBuilder sb = new StringBuilder();
        appendCount(sb, counts[Severity.FATAL.ordinal()], " fatal", ANSI_RED);
        appendCount(sb, counts[Severity.ERROR.ordinal()], " errors", ANSI_RED);
        appendCount(sb, counts[Severity.WARNING.ordinal()], " warnings", ANSI_YELLOW);
        appendCount(sb, counts[Severity.INFO.ordinal()], " info", ANSI_BLUE);
        return sb.toString();
    }

    private void appendCount(StringBuilder sb, long count, String label, String color) {
        if (count == 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(colorize(color, count + label));
    }

    static long[] countBySeverity(List<LintError> errors) {
        long[] counts = new long[Severity.values().length];
        for (LintError error : errors) {
            counts[error.getSeverity().ordinal()]++;
        }
        return counts;
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
