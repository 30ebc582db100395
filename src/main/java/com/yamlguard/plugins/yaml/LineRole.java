package com.yamlguard.plugins.yaml;

/**
 * What the structural parse says about a physical line.
 */
public enum LineRole {
    /** Starts with a key, sequence item or value whose column is checked. */
    STRUCTURAL,
    /** Belongs to a node started on an earlier line (scalar bodies, flow interiors). */
    CONTINUATION,
    /** Document markers and directives. */
    MARKER,
    /** No token starts here: blank or comment-only lines. */
    NONE
}
