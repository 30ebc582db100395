package com.yamlguard.plugins.yaml;

/**
 * Converts raw text into position-annotated structural events.
 * Implementations never throw for malformed input; they report a {@link ParseFailure}.
 */
public interface TokenStreamProvider {
    TokenizeResult tokenize(String text);
}
