package com.yamlguard.plugins.yaml;

import java.util.List;

/**
 * Ordered structural events of a document plus the role of each physical line.
 */
public final class TokenStream {
    private final List<StructureEvent> events;
    private final LineRole[] lineRoles;

    public TokenStream(List<StructureEvent> events, LineRole[] lineRoles) {
        this.events = List.copyOf(events);
        this.lineRoles = lineRoles.clone();
    }

    public List<StructureEvent> getEvents() {
        return events;
    }

    public int getLineCount() {
        return lineRoles.length;
    }

    public LineRole roleOf(int line) {
        if (line < 0 || line >= lineRoles.length) {
            return LineRole.NONE;
        }
        return lineRoles[line];
    }
}
