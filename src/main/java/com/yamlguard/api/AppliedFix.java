package com.yamlguard.api;

/**
 * Represents a fix that was applied to a document.
 */
public class AppliedFix {
    public static final String INDENTATION_FIX = "INDENTATION_FIX";

    private final String type;
    private final int startLine;
    private final int endLine;
    private final String description;

    public AppliedFix(String type, int startLine, int endLine, String description) {
        this.type = type;
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description;
    }

    // Getters
    public String getType() { return type; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }
}
