package com.yamlguard.plugins.yaml.analyzers;

import com.yamlguard.plugins.yaml.StructureEvent;

/**
 * Where a leading structural token is required to start.
 */
public final class Placement {
    private final StructureEvent event;
    private final int expectedColumn;
    private final String path;

    /**
     * @param event          the token's event
     * @param expectedColumn required 1-based column
     * @param path           path of the enclosing node
     */
    public Placement(StructureEvent event, int expectedColumn, String path) {
        this.event = event;
        this.expectedColumn = expectedColumn;
        this.path = path;
    }

    public StructureEvent getEvent() { return event; }
    public int getExpectedColumn() { return expectedColumn; }
    public String getPath() { return path; }

    public int getActualColumn() {
        return event.getColumn() + 1;
    }

    public boolean matches() {
        return getActualColumn() == expectedColumn;
    }
}
