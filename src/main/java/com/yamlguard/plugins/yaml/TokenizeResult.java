package com.yamlguard.plugins.yaml;

import java.util.Objects;

/**
 * Either a complete {@link TokenStream} or the {@link ParseFailure} that prevented one.
 */
public final class TokenizeResult {
    private final TokenStream stream;
    private final ParseFailure failure;

    private TokenizeResult(TokenStream stream, ParseFailure failure) {
        this.stream = stream;
        this.failure = failure;
    }

    public static TokenizeResult success(TokenStream stream) {
        return new TokenizeResult(Objects.requireNonNull(stream, "stream"), null);
    }

    public static TokenizeResult failure(ParseFailure failure) {
        return new TokenizeResult(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return stream != null;
    }

    /**
     * @throws IllegalStateException if tokenization failed
     */
    public TokenStream getStream() {
        if (stream == null) {
            throw new IllegalStateException("No token stream: " + failure);
        }
        return stream;
    }

    /**
     * @throws IllegalStateException if tokenization succeeded
     */
    public ParseFailure getFailure() {
        if (failure == null) {
            throw new IllegalStateException("Tokenization succeeded");
        }
        return failure;
    }
}
