package com.yamlguard.plugins.yaml;

import java.util.Objects;

/**
 * A position-annotated structural event. Lines and columns are 0-based.
 */
public final class StructureEvent {

    public enum Kind {
        SEQUENCE_ITEM_START("sequence item"),
        MAPPING_KEY_START("key"),
        MAPPING_VALUE_START("value"),
        LEVEL_END("level end");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final int line;
    private final int column;
    private final boolean leading;
    private final String key;
    private final int index;

    private StructureEvent(Kind kind, int line, int column, boolean leading, String key, int index) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.column = column;
        this.leading = leading;
        this.key = key;
        this.index = index;
    }

    public static StructureEvent sequenceItem(int line, int column, boolean leading, int index) {
        return new StructureEvent(Kind.SEQUENCE_ITEM_START, line, column, leading, null, index);
    }

    public static StructureEvent mappingKey(int line, int column, boolean leading, String key) {
        return new StructureEvent(Kind.MAPPING_KEY_START, line, column, leading, key, -1);
    }

    public static StructureEvent mappingValue(int line, int column) {
        return new StructureEvent(Kind.MAPPING_VALUE_START, line, column, true, null, -1);
    }

    public static StructureEvent levelEnd(int line, int column) {
        return new StructureEvent(Kind.LEVEL_END, line, column, false, null, -1);
    }

    public Kind getKind() { return kind; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    /**
     * Whether the column is an indentation position: the token is the first on
     * its line or directly follows a {@code -} on the same line.
     */
    public boolean isLeading() { return leading; }

    /** Key name for {@link Kind#MAPPING_KEY_START}, otherwise {@code null}. */
    public String getKey() { return key; }

    /** Item index for {@link Kind#SEQUENCE_ITEM_START}, otherwise {@code -1}. */
    public int getIndex() { return index; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructureEvent)) {
            return false;
        }
        StructureEvent other = (StructureEvent) o;
        return kind == other.kind && line == other.line && column == other.column
                && leading == other.leading && index == other.index && Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, line, column, leading, key, index);
    }

    @Override
    public String toString() {
        return kind + "(" + line + ":" + column + (key != null ? ", " + key : "")
                + (index >= 0 ? ", [" + index + "]" : "") + ")";
    }
}
