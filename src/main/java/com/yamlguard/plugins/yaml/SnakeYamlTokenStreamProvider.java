package com.yamlguard.plugins.yaml;

import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.reader.StreamReader;
import org.yaml.snakeyaml.scanner.Scanner;
import org.yaml.snakeyaml.scanner.ScannerImpl;
import org.yaml.snakeyaml.tokens.AliasToken;
import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.Token;

import com.yamlguard.util.LoggerUtil;

/**
 * Token stream provider backed by SnakeYAML.
 * <p>
 * The document is first run through the full event parser so that only
 * well-formed streams are translated. The scanner's tokens are then mapped to
 * {@link StructureEvent}s: one start event per key or sequence item and one
 * {@link StructureEvent.Kind#LEVEL_END} when that key's value or that item is complete.
 * Flow collections are opaque apart from their opening bracket.
 */
public class SnakeYamlTokenStreamProvider implements TokenStreamProvider {
    private static final Logger logger = LoggerUtil.getLogger(SnakeYamlTokenStreamProvider.class);

    @Override
    public TokenizeResult tokenize(String text) {
        Objects.requireNonNull(text, "text");
        LoaderOptions options = newLoaderOptions();
        try {
            for (Event ignored : new Yaml(options).parse(new StringReader(text))) {
                // drained for validation only
            }

            List<Token> tokens = new ArrayList<>();
            Scanner scanner = new ScannerImpl(new StreamReader(text), options);
            while (scanner.checkToken()) {
                tokens.add(scanner.getToken());
            }

            return new EventBuilder(TextLines.of(text), tokens).build();
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            String problem = e.getProblem() != null ? e.getProblem() : e.getMessage();
            logger.fine("Structural parse failed: " + problem);
            return TokenizeResult.failure(new ParseFailure(ParseFailure.Reason.SYNTAX, problem,
                    mark != null ? mark.getLine() + 1 : 0,
                    mark != null ? mark.getColumn() + 1 : 0));
        } catch (YAMLException e) {
            logger.fine("Structural parse failed: " + e.getMessage());
            return TokenizeResult.failure(new ParseFailure(ParseFailure.Reason.SYNTAX, e.getMessage(), 0, 0));
        }
    }

    /**
     * SnakeYAML parsers and scanners are not thread-safe, so every call builds its own.
     */
    static LoaderOptions newLoaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(true);
        options.setProcessComments(false);
        return options;
    }

    private enum FrameKind {
        MAPPING,
        SEQUENCE,
        INDENTLESS_SEQUENCE
    }

    private static final class Frame {
        private final FrameKind kind;
        private boolean entryOpen;
        private int nextIndex;

        private Frame(FrameKind kind) {
            this.kind = kind;
        }
    }

    /**
     * Single forward pass over the scanner tokens of one document stream.
     */
    private static final class EventBuilder {
        private final TextLines lines;
        private final List<Token> tokens;
        private final List<StructureEvent> events = new ArrayList<>();
        private final LineRole[] roles;
        private final Deque<Frame> frames = new ArrayDeque<>();

        private int flowDepth;
        private int lastLine = -1;
        private boolean inKey;
        private Token previous;

        private EventBuilder(TextLines lines, List<Token> tokens) {
            this.lines = lines;
            this.tokens = tokens;
            this.roles = new LineRole[lines.size()];
            Arrays.fill(roles, LineRole.NONE);
        }

        private TokenizeResult build() {
            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                Token.ID id = token.getTokenId();

                if (_isSynthetic(id)) {
                    _handleSynthetic(token);
                    continue;
                }

                int line = token.getStartMark().getLine();
                int column = token.getStartMark().getColumn();
                boolean first = line > lastLine;
                boolean compact = !first && previous != null
                        && previous.getTokenId() == Token.ID.BlockEntry
                        && previous.getStartMark().getLine() == line;
                boolean block = flowDepth == 0;
                LineRole role = LineRole.CONTINUATION;

                switch (id) {
                    case Key -> {
                        if (block) {
                            if (_isExplicitKey(token)) {
                                return TokenizeResult.failure(new ParseFailure(ParseFailure.Reason.EXPLICIT_KEY,
                                        "explicit '?' keys are checked line by line", line + 1, column + 1));
                            }
                            _closeIndentlessSequence(token);
                            Frame frame = _currentFrame(FrameKind.MAPPING);
                            if (frame.entryOpen) {
                                events.add(StructureEvent.levelEnd(line, column));
                            }
                            events.add(StructureEvent.mappingKey(line, column, first || compact, _keyName(i)));
                            frame.entryOpen = true;
                            inKey = true;
                            role = LineRole.STRUCTURAL;
                        }
                    }
                    case BlockEntry -> {
                        Frame frame = frames.peek();
                        if (frame == null || frame.kind == FrameKind.MAPPING) {
                            frame = new Frame(FrameKind.INDENTLESS_SEQUENCE);
                            frames.push(frame);
                        }
                        if (frame.entryOpen) {
                            events.add(StructureEvent.levelEnd(line, column));
                        }
                        events.add(StructureEvent.sequenceItem(line, column, first || compact, frame.nextIndex++));
                        frame.entryOpen = true;
                        role = LineRole.STRUCTURAL;
                    }
                    case Value -> inKey = false;
                    case Scalar -> {
                        if (block) {
                            ParseFailure ambiguity = _findAmbiguousContinuation((ScalarToken) token);
                            if (ambiguity != null) {
                                return TokenizeResult.failure(ambiguity);
                            }
                        }
                        role = _valueStart(token, first, block);
                        _markContinuationLines(token);
                    }
                    case Alias, Anchor, Tag -> role = _valueStart(token, first, block);
                    case FlowSequenceStart, FlowMappingStart -> {
                        role = _valueStart(token, first, block);
                        flowDepth++;
                    }
                    case FlowSequenceEnd, FlowMappingEnd -> flowDepth = Math.max(0, flowDepth - 1);
                    case DocumentStart, DocumentEnd, Directive -> role = LineRole.MARKER;
                    default -> {
                        // FlowEntry and comments carry no indentation of their own
                    }
                }

                if (first) {
                    _setRole(line, role);
                }
                lastLine = Math.max(lastLine, _effectiveEndLine(token));
                previous = token;
            }

            return TokenizeResult.success(new TokenStream(events, roles));
        }

        private static boolean _isSynthetic(Token.ID id) {
            return switch (id) {
                case StreamStart, StreamEnd, BlockMappingStart, BlockSequenceStart, BlockEnd -> true;
                default -> false;
            };
        }

        private void _handleSynthetic(Token token) {
            switch (token.getTokenId()) {
                case BlockMappingStart -> frames.push(new Frame(FrameKind.MAPPING));
                case BlockSequenceStart -> frames.push(new Frame(FrameKind.SEQUENCE));
                case BlockEnd -> {
                    _closeIndentlessSequence(token);
                    Frame frame = frames.poll();
                    if (frame != null && frame.entryOpen) {
                        Mark mark = token.getStartMark();
                        events.add(StructureEvent.levelEnd(mark.getLine(), mark.getColumn()));
                    }
                }
                default -> {
                    // stream boundaries
                }
            }
        }

        private void _closeIndentlessSequence(Token at) {
            Frame frame = frames.peek();
            if (frame != null && frame.kind == FrameKind.INDENTLESS_SEQUENCE) {
                frames.pop();
                if (frame.entryOpen) {
                    Mark mark = at.getStartMark();
                    events.add(StructureEvent.levelEnd(mark.getLine(), mark.getColumn()));
                }
            }
        }

        private Frame _currentFrame(FrameKind expected) {
            Frame frame = frames.peek();
            if (frame == null) {
                // the parser accepted the stream, so this only guards against scanner quirks
                frame = new Frame(expected);
                frames.push(frame);
            }
            return frame;
        }

        private LineRole _valueStart(Token token, boolean first, boolean block) {
            if (first && block && !inKey) {
                Mark mark = token.getStartMark();
                events.add(StructureEvent.mappingValue(mark.getLine(), mark.getColumn()));
                return LineRole.STRUCTURAL;
            }
            return LineRole.CONTINUATION;
        }

        private static boolean _isExplicitKey(Token key) {
            // simple keys are zero-width tokens placed at the key's first character
            return key.getStartMark().getIndex() != key.getEndMark().getIndex();
        }

        private String _keyName(int keyIndex) {
            for (int j = keyIndex + 1; j < tokens.size(); j++) {
                Token candidate = tokens.get(j);
                switch (candidate.getTokenId()) {
                    case Anchor, Tag -> {
                        continue;
                    }
                    case Scalar -> {
                        return ((ScalarToken) candidate).getValue();
                    }
                    case Alias -> {
                        return "*" + ((AliasToken) candidate).getValue();
                    }
                    default -> {
                        return "<complex key>";
                    }
                }
            }
            return "<complex key>";
        }

        private ParseFailure _findAmbiguousContinuation(ScalarToken scalar) {
            if (!scalar.getPlain()) {
                return null;
            }
            int start = scalar.getStartMark().getLine();
            int end = Math.min(_effectiveEndLine(scalar), lines.size() - 1);
            for (int l = start + 1; l <= end; l++) {
                String stripped = lines.content(l).strip();
                if (stripped.startsWith("-")
                        && (stripped.length() == 1 || Character.isWhitespace(stripped.charAt(1)))) {
                    return new ParseFailure(ParseFailure.Reason.AMBIGUOUS_CONTINUATION,
                            "continuation of a plain scalar reads as a sequence item",
                            l + 1, TextLines.indentOf(lines.content(l)) + 1);
                }
            }
            return null;
        }

        private void _markContinuationLines(Token token) {
            int start = token.getStartMark().getLine();
            int end = _effectiveEndLine(token);
            for (int l = start + 1; l <= end; l++) {
                _setRole(l, LineRole.CONTINUATION);
            }
        }

        private void _setRole(int line, LineRole role) {
            if (line >= 0 && line < roles.length) {
                roles[line] = role;
            }
        }

        /**
         * Last line a token occupies. Block scalars end at column 0 of the line
         * after their body, which does not belong to them.
         */
        private static int _effectiveEndLine(Token token) {
            Mark start = token.getStartMark();
            Mark end = token.getEndMark();
            int line = end.getLine();
            if (line > start.getLine() && end.getColumn() == 0) {
                line--;
            }
            return line;
        }
    }
}
