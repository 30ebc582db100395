package com.yamlguard.plugins.yaml;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.yamlguard.api.AppliedFix;
import com.yamlguard.api.LintPlugin;
import com.yamlguard.api.LintResult;
import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;
import com.yamlguard.config.GuardConfig;

/**
 * Indentation checks and fixes for YAML files.
 */
public class YamlIndentationPlugin implements LintPlugin {
    private static final Comparator<LintError> BY_POSITION =
            Comparator.comparingInt(LintError::getLine).thenComparingInt(LintError::getColumn);

    private IndentationChecker checker;

    @Override
    public void initialize(GuardConfig config) {
        this.checker = new IndentationChecker(config.getIndentStep(), config.isStrict());
    }

    @Override
    public LintResult check(Path filePath, String content) {
        IndentationReport report = requireChecker().analyze(content);

        List<LintError> errors = new ArrayList<>();
        TextLines lines = TextLines.of(content.startsWith("\uFEFF") ? content.substring(1) : content);
        for (IndentationError error : report.getErrors()) {
            if (error.getLine() <= lines.size()) {
                String line = lines.content(error.getLine() - 1);
                errors.add(error.withSuggestion(checker.suggestFix(error, line).stripTrailing()));
            } else {
                errors.add(error);
            }
        }
        if (report.getStrategy() == IndentationReport.Strategy.HEURISTIC) {
            errors.add(fallbackNotice(report.getFailure()));
        }
        errors.sort(BY_POSITION);

        return LintResult.builder()
                .successful(errors.stream().noneMatch(e -> e.getSeverity().isAtLeast(Severity.ERROR)))
                .content(content)
                .errors(errors)
                .build();
    }

    @Override
    public LintResult fix(Path filePath, String content) {
        String fixed = requireChecker().fixIndentation(content);
        LintResult remaining = check(filePath, fixed);

        LintResult.Builder builder = LintResult.builder()
                .successful(remaining.isSuccessful())
                .content(fixed)
                .errors(remaining.getErrors());

        if (!fixed.equals(content)) {
            int[] range = changedLines(content, fixed);
            builder.addFix(new AppliedFix(AppliedFix.INDENTATION_FIX, range[0], range[1],
                    "Re-indented lines " + range[0] + "-" + range[1] + " to "
                            + checker.getIndentStep() + " spaces per level"));
        }
        return builder.build();
    }

    private IndentationChecker requireChecker() {
        if (checker == null) {
            throw new IllegalStateException("Plugin has not been initialized");
        }
        return checker;
    }

    private static LintError fallbackNotice(ParseFailure failure) {
        String message = switch (failure.getReason()) {
            case SYNTAX -> "document could not be parsed (" + failure.getMessage() + ")";
            case AMBIGUOUS_CONTINUATION -> "a plain scalar continues on a line that looks like a sequence item";
            case EXPLICIT_KEY -> "explicit '?' keys are present";
        };
        return new LintError(LintError.TYPE_PARSE, Severity.INFO,
                message + "; indentation was checked line by line",
                Math.max(1, failure.getLine()), Math.max(1, failure.getColumn()));
    }

    /**
     * First and last 1-based line that differ between the two texts.
     */
    static int[] changedLines(String before, String after) {
        List<String> a = TextLines.of(before).contents();
        List<String> b = TextLines.of(after).contents();
        int first = 0;
        while (first < a.size() && first < b.size() && a.get(first).equals(b.get(first))) {
            first++;
        }
        int lastA = a.size() - 1;
        int lastB = b.size() - 1;
        while (lastA > first && lastB > first && a.get(lastA).equals(b.get(lastB))) {
            lastA--;
            lastB--;
        }
        return new int[] {first + 1, Math.max(first, lastB) + 1};
    }
}
