package com.yamlguard.plugins.yaml.analyzers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.yamlguard.plugins.yaml.IndentationError;
import com.yamlguard.plugins.yaml.LineRole;
import com.yamlguard.plugins.yaml.TextLines;
import com.yamlguard.plugins.yaml.TokenStream;
import com.yamlguard.plugins.yaml.TokenStreamProvider;
import com.yamlguard.plugins.yaml.TokenizeResult;
import com.yamlguard.util.LoggerUtil;

/**
 * Re-emits a document with every key, item and value on its required column.
 * <p>
 * Only leading whitespace (and the gap after a compact {@code -}) changes:
 * comments, blank lines, block scalar bodies and entry order are untouched.
 * Continuation lines move together with the structural line that owns them.
 * A rewrite that does not parse back to the same documents is discarded.
 */
public class FixGenerator {
    private static final Logger logger = LoggerUtil.getLogger(FixGenerator.class);

    private final TokenStreamProvider provider;
    private final IndentationAnalyzer analyzer;
    private final DocumentComparator comparator;

    public FixGenerator(TokenStreamProvider provider, int indentStep) {
        this.provider = provider;
        this.analyzer = new IndentationAnalyzer(indentStep, true);
        this.comparator = new DocumentComparator();
    }

    /**
     * Returns the re-indented text, or {@code text} itself when it is already
     * correct or cannot be rewritten safely.
     */
    public String fix(String text) {
        TokenizeResult tokenized = provider.tokenize(text);
        if (!tokenized.isSuccess()) {
            logger.fine(() -> "Not fixing, no token stream: " + tokenized.getFailure());
            return text;
        }

        String fixed = reindent(TextLines.of(text), tokenized.getStream());
        if (fixed.equals(text)) {
            return text;
        }

        if (!provider.tokenize(fixed).isSuccess() || !comparator.sameDocuments(text, fixed)) {
            logger.warning("Re-indented document does not match the original, leaving it unchanged");
            return text;
        }
        return fixed;
    }

    private String reindent(TextLines lines, TokenStream stream) {
        Map<Integer, List<Placement>> byLine = new HashMap<>();
        for (Placement placement : analyzer.place(stream)) {
            byLine.computeIfAbsent(placement.getEvent().getLine(), k -> new ArrayList<>()).add(placement);
        }

        StringBuilder out = new StringBuilder();
        int delta = 0;
        for (int i = 0; i < lines.size(); i++) {
            String content = lines.content(i);
            LineRole role = stream.roleOf(i);
            List<Placement> placements = byLine.get(i);

            if (role == LineRole.STRUCTURAL && placements != null) {
                out.append(rebuild(content, placements));
                Placement last = placements.get(placements.size() - 1);
                delta = last.getExpectedColumn() - last.getActualColumn();
            } else if (role == LineRole.MARKER) {
                delta = 0;
                out.append(content);
            } else if (role == LineRole.CONTINUATION && !TextLines.isBlank(content)) {
                out.append(shift(content, delta));
            } else {
                out.append(content);
            }
            out.append(lines.terminator(i));
        }
        return out.toString();
    }

    /**
     * Places each leading token of the line at its required column. Tokens after
     * the first keep at least one space of separation.
     */
    private static String rebuild(String content, List<Placement> placements) {
        StringBuilder line = new StringBuilder(spaces(placements.get(0).getExpectedColumn() - 1));
        for (int k = 0; k < placements.size(); k++) {
            int start = placements.get(k).getEvent().getColumn();
            if (k + 1 < placements.size()) {
                String segment = content.substring(start, placements.get(k + 1).getEvent().getColumn()).stripTrailing();
                line.append(segment);
                int target = placements.get(k + 1).getExpectedColumn() - 1;
                line.append(spaces(Math.max(1, target - line.length())));
            } else {
                line.append(content.substring(start));
            }
        }
        return line.toString();
    }

    private static String shift(String content, int delta) {
        if (delta > 0) {
            return spaces(delta) + content;
        }
        int remove = Math.min(-delta, TextLines.indentOf(content));
        return content.substring(remove);
    }

    /**
     * Rewrites one offending line. An under-indented line gets the missing columns
     * in front of its stripped text, an over-indented one is rebuilt with exactly
     * {@code expected - 1} leading spaces. For a key or item after a compact
     * {@code -} the gap after the dash is adjusted instead, keeping at least one space.
     */
    public static String suggestFix(IndentationError error, String lineContent) {
        int diff = error.getExpectedIndent() - error.getActualIndent();
        if (diff == 0) {
            return lineContent;
        }
        int tokenStart = Math.min(error.getActualIndent() - 1, lineContent.length());
        String prefix = lineContent.substring(0, tokenStart);
        if (!prefix.isBlank()) {
            String head = prefix.stripTrailing();
            int target = Math.max(0, error.getExpectedIndent() - 1);
            return head + spaces(Math.max(1, target - head.length())) + lineContent.substring(tokenStart);
        }

        String stripped = lineContent.stripLeading();
        if (diff > 0) {
            return spaces(diff) + stripped;
        }
        return spaces(error.getExpectedIndent() - 1) + stripped;
    }

    private static String spaces(int count) {
        return " ".repeat(Math.max(0, count));
    }
}
