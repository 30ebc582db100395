package com.yamlguard.plugins.yaml.analyzers;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.yamlguard.api.error.Severity;
import com.yamlguard.plugins.yaml.IndentationError;
import com.yamlguard.plugins.yaml.TextLines;
import com.yamlguard.plugins.yaml.YamlPath;
import com.yamlguard.util.LoggerUtil;

/**
 * Line-oriented fallback used when the text cannot be tokenized.
 * <p>
 * Works purely on lexical cues: a line starting with {@code "- "} is a sequence
 * item, a line with an unquoted {@code key:} is a mapping key, anything else must
 * sit on one of the currently open child columns. Never throws for any input.
 */
public class HeuristicLineAnalyzer {
    private static final Logger logger = LoggerUtil.getLogger(HeuristicLineAnalyzer.class);

    private static final Pattern BLOCK_SCALAR_HEADER = Pattern.compile("[|>][-+1-9]*(\\s+#.*)?");

    private final int indentStep;

    public HeuristicLineAnalyzer(int indentStep) {
        this.indentStep = IndentationAnalyzer.validateStep(indentStep);
    }

    public List<IndentationError> analyze(String text) {
        Scan scan = new Scan();
        TextLines lines = TextLines.of(text);
        for (int i = 0; i < lines.size(); i++) {
            scan.accept(i + 1, lines.content(i));
        }
        scan.errors.sort(IndentationError.DOCUMENT_ORDER);
        logger.fine(() -> "Heuristic analysis found " + scan.errors.size() + " indentation errors");
        return scan.errors;
    }

    /**
     * One open nesting level.
     * {@code leaf} levels belong to inline values and only host continuation lines.
     */
    private static final class Level {
        private final int ownerIndent;
        private final int childIndent;
        private final String segment;
        private final boolean leaf;
        private int itemCount;

        private Level(int ownerIndent, int childIndent, String segment, boolean leaf) {
            this.ownerIndent = ownerIndent;
            this.childIndent = childIndent;
            this.segment = segment;
            this.leaf = leaf;
        }
    }

    private final class Scan {
        private final List<IndentationError> errors = new ArrayList<>();
        private final List<Level> levels = new ArrayList<>();
        private int blockScalarOwner = -1;
        private int flowDepth;

        private Scan() {
            reset();
        }

        private void reset() {
            levels.clear();
            levels.add(new Level(-1, 0, null, false));
            blockScalarOwner = -1;
            flowDepth = 0;
        }

        private void accept(int lineNumber, String content) {
            if (TextLines.isBlank(content)) {
                return;
            }
            int indent = TextLines.indentOf(content);
            if (blockScalarOwner >= 0) {
                if (indent > blockScalarOwner) {
                    return;
                }
                blockScalarOwner = -1;
            }
            if (flowDepth > 0) {
                flowDepth += bracketBalance(content);
                return;
            }
            if (TextLines.isCommentOnly(content)) {
                return;
            }

            String body = content.substring(indent);
            if (indent == 0 && isDocumentMarker(body)) {
                reset();
                return;
            }

            if (isSequenceItem(body)) {
                sequenceItem(lineNumber, indent, body);
            } else if (keyIndicator(body) >= 0) {
                mappingKey(lineNumber, indent, body);
            } else {
                otherLine(lineNumber, indent, body);
            }
        }

        private void sequenceItem(int lineNumber, int indent, String body) {
            Level parent = enterStructuralLine(lineNumber, indent, "sequence item");
            int expected = parent.childIndent;
            String segment = YamlPath.indexSegment(parent.itemCount++);

            String rest = body.substring(1);
            int gap = TextLines.indentOf(rest);
            rest = rest.substring(gap);
            int contentColumn = indent + 1 + gap;

            if (rest.isEmpty() || rest.startsWith("#")) {
                levels.add(new Level(indent, expected + indentStep, segment, false));
            } else if (!isSequenceItem(rest) && keyIndicator(rest) >= 0) {
                levels.add(new Level(indent, expected + indentStep, segment, false));
                openValue(contentColumn, expected + 2 * indentStep, rest);
            } else if (isBlockScalarHeader(rest)) {
                blockScalarOwner = indent;
            } else {
                flowDepth = Math.max(0, bracketBalance(rest));
                levels.add(new Level(indent, expected + indentStep, segment, true));
            }
        }

        private void mappingKey(int lineNumber, int indent, String body) {
            Level parent = enterStructuralLine(lineNumber, indent, "key");
            openValue(indent, parent.childIndent + indentStep, body);
        }

        /**
         * Opens the level for the value following {@code key:} on a line whose key
         * starts at {@code ownerIndent}.
         */
        private void openValue(int ownerIndent, int childIndent, String keyText) {
            int colon = keyIndicator(keyText);
            String key = unquote(keyText.substring(0, colon).strip());
            String value = stripProperties(keyText.substring(colon + 1).strip());

            if (value.isEmpty() || value.startsWith("#")) {
                levels.add(new Level(ownerIndent, childIndent, key, false));
            } else if (isBlockScalarHeader(value)) {
                blockScalarOwner = ownerIndent;
            } else {
                flowDepth = Math.max(0, bracketBalance(value));
                levels.add(new Level(ownerIndent, childIndent, key, true));
            }
        }

        /**
         * Closes the levels a key or item at {@code indent} leaves and checks it
         * against the enclosing level. Returns the enclosing level.
         */
        private Level enterStructuralLine(int lineNumber, int indent, String what) {
            while (levels.size() > 1 && (top().leaf || top().ownerIndent >= indent)) {
                levels.remove(levels.size() - 1);
            }
            Level parent = top();
            if (indent != parent.childIndent) {
                report(lineNumber, indent, parent.childIndent, what + " indentation mismatch");
            }
            return parent;
        }

        private void otherLine(int lineNumber, int indent, String body) {
            flowDepth = Math.max(0, bracketBalance(body));
            int closest = -1;
            for (Level level : levels) {
                if (level.childIndent == indent) {
                    return;
                }
                int distance = Math.abs(level.childIndent - indent);
                if (closest < 0 || distance < Math.abs(closest - indent)
                        || (distance == Math.abs(closest - indent) && level.childIndent < closest)) {
                    closest = level.childIndent;
                }
            }
            report(lineNumber, indent, closest, "indentation mismatch");
        }

        private void report(int lineNumber, int indent, int expectedIndent, String what) {
            int expected = expectedIndent + 1;
            int actual = indent + 1;
            errors.add(new IndentationError(lineNumber, actual, expected, actual, currentPath(),
                    what + ": expected column " + expected + ", found " + actual, Severity.ERROR));
        }

        private String currentPath() {
            List<String> segments = new ArrayList<>();
            for (Level level : levels) {
                if (level.segment != null && !level.leaf) {
                    segments.add(level.segment);
                }
            }
            return YamlPath.render(segments);
        }

        private Level top() {
            return levels.get(levels.size() - 1);
        }
    }

    static boolean isSequenceItem(String body) {
        return body.startsWith("-") && (body.length() == 1 || Character.isWhitespace(body.charAt(1)));
    }

    /**
     * Position of the {@code :} that makes {@code body} a mapping key, or -1.
     * The colon must be outside quotes and comments, follow non-empty text and be
     * followed by whitespace or the end of the line.
     */
    static int keyIndicator(String body) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (inDouble) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inDouble = false;
                }
            } else if (inSingle) {
                if (c == '\'') {
                    inSingle = false;
                }
            } else if (c == '"') {
                inDouble = true;
            } else if (c == '\'') {
                inSingle = true;
            } else if (c == '#' && (i == 0 || Character.isWhitespace(body.charAt(i - 1)))) {
                return -1;
            } else if (c == ':' && (i + 1 == body.length() || Character.isWhitespace(body.charAt(i + 1)))
                    && !body.substring(0, i).isBlank()) {
                return i;
            }
        }
        return -1;
    }

    static boolean isBlockScalarHeader(String value) {
        return BLOCK_SCALAR_HEADER.matcher(value).matches();
    }

    private static boolean isDocumentMarker(String body) {
        return body.equals("---") || body.startsWith("--- ") || body.equals("...")
                || body.startsWith("... ") || body.startsWith("%");
    }

    /**
     * Opening minus closing flow brackets outside quotes and comments.
     */
    static int bracketBalance(String text) {
        int balance = 0;
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inDouble) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inDouble = false;
                }
            } else if (inSingle) {
                if (c == '\'') {
                    inSingle = false;
                }
            } else if (c == '"') {
                inDouble = true;
            } else if (c == '\'') {
                inSingle = true;
            } else if (c == '#' && (i == 0 || Character.isWhitespace(text.charAt(i - 1)))) {
                break;
            } else if (c == '[' || c == '{') {
                balance++;
            } else if (c == ']' || c == '}') {
                balance--;
            }
        }
        return balance;
    }

    /**
     * Drops leading anchors and tags so {@code &base} and {@code !!map} count as empty values.
     */
    private static String stripProperties(String value) {
        String rest = value;
        while (!rest.isEmpty() && (rest.charAt(0) == '&' || rest.charAt(0) == '!')) {
            int end = 0;
            while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
                end++;
            }
            rest = rest.substring(end).strip();
        }
        return rest;
    }

    private static String unquote(String key) {
        if (key.length() >= 2) {
            char first = key.charAt(0);
            char last = key.charAt(key.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return key.substring(1, key.length() - 1);
            }
        }
        return key;
    }
}
