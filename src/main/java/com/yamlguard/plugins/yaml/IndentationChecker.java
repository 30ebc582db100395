package com.yamlguard.plugins.yaml;

import java.util.List;
import java.util.logging.Logger;

import com.yamlguard.plugins.yaml.analyzers.FixGenerator;
import com.yamlguard.plugins.yaml.analyzers.HeuristicLineAnalyzer;
import com.yamlguard.plugins.yaml.analyzers.IndentationAnalyzer;
import com.yamlguard.util.LoggerUtil;

/**
 * Entry point for indentation checking and fixing of in-memory YAML text.
 * <p>
 * Texts the {@link TokenStreamProvider} can tokenize are walked structurally;
 * anything else goes to the {@link HeuristicLineAnalyzer}. No method throws for
 * malformed input. A leading byte order mark is ignored for column arithmetic and
 * kept in fixed output. Instances are immutable and thread-safe.
 */
public class IndentationChecker {
    private static final Logger logger = LoggerUtil.getLogger(IndentationChecker.class);
    private static final String BOM = "\uFEFF";

    public static final int DEFAULT_INDENT_STEP = 2;

    private final int indentStep;
    private final boolean strict;
    private final TokenStreamProvider provider;

    public IndentationChecker() {
        this(DEFAULT_INDENT_STEP, true);
    }

    public IndentationChecker(int indentStep, boolean strict) {
        this(indentStep, strict, new SnakeYamlTokenStreamProvider());
    }

    public IndentationChecker(int indentStep, boolean strict, TokenStreamProvider provider) {
        if (indentStep < 1 || indentStep > 8) {
            throw new IllegalArgumentException("Indent step must be between 1 and 8, got " + indentStep);
        }
        if (provider == null) {
            throw new IllegalArgumentException("Token stream provider must not be null");
        }
        this.indentStep = indentStep;
        this.strict = strict;
        this.provider = provider;
    }

    public int getIndentStep() {
        return indentStep;
    }

    /**
     * Not interpreted here; reporting layers decide what strict means.
     */
    public boolean isStrict() {
        return strict;
    }

    public List<IndentationError> checkContent(String text) {
        return analyze(text, indentStep).getErrors();
    }

    public List<IndentationError> checkContent(String text, int step) {
        return analyze(text, step).getErrors();
    }

    public IndentationReport analyze(String text) {
        return analyze(text, indentStep);
    }

    /**
     * Runs the structural walk, or the heuristic when the text cannot be tokenized.
     */
    public IndentationReport analyze(String text, int step) {
        String body = withoutBom(requireText(text));
        TokenizeResult tokenized = provider.tokenize(body);
        if (tokenized.isSuccess()) {
            return IndentationReport.structural(
                    new IndentationAnalyzer(step, strict).analyze(tokenized.getStream()));
        }

        ParseFailure failure = tokenized.getFailure();
        logger.fine(() -> "Falling back to line heuristics: " + failure);
        return IndentationReport.heuristic(new HeuristicLineAnalyzer(step).analyze(body), failure);
    }

    public String fixIndentation(String text) {
        return fixIndentation(text, indentStep);
    }

    /**
     * Re-indents {@code text} to {@code step} columns per level. Returns the input
     * unchanged when it cannot be tokenized or the rewrite cannot be verified.
     */
    public String fixIndentation(String text, int step) {
        requireText(text);
        if (text.startsWith(BOM)) {
            String body = text.substring(BOM.length());
            String fixed = new FixGenerator(provider, step).fix(body);
            return fixed.equals(body) ? text : BOM + fixed;
        }
        return new FixGenerator(provider, step).fix(text);
    }

    /**
     * The offending line rewritten so the reported token starts at the expected column.
     */
    public String suggestFix(IndentationError error, String lineContent) {
        return FixGenerator.suggestFix(error, lineContent);
    }

    private static String requireText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text must not be null");
        }
        return text;
    }

    private static String withoutBom(String text) {
        return text.startsWith(BOM) ? text.substring(BOM.length()) : text;
    }
}
