package com.yamlguard.plugins.yaml;

/**
 * Why a structural event stream could not be produced. Line and column are
 * 1-based, or 0 when the parser did not report a position.
 */
public final class ParseFailure {

    public enum Reason {
        /** The scanner or parser rejected the text. */
        SYNTAX,
        /** A multi-line plain scalar has a continuation line that reads as a sequence item. */
        AMBIGUOUS_CONTINUATION,
        /** A {@code ?} complex key, whose value indicator aligns differently from implicit keys. */
        EXPLICIT_KEY
    }

    private final Reason reason;
    private final String message;
    private final int line;
    private final int column;

    public ParseFailure(Reason reason, String message, int line, int column) {
        this.reason = reason;
        this.message = message;
        this.line = line;
        this.column = column;
    }

    public Reason getReason() { return reason; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public String toString() {
        return reason + " at " + line + ":" + column + ": " + message;
    }
}
