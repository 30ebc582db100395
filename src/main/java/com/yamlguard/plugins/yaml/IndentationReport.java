package com.yamlguard.plugins.yaml;

import java.util.List;

/**
 * Errors of one check together with the strategy that produced them.
 */
public final class IndentationReport {

    public enum Strategy {
        STRUCTURAL,
        HEURISTIC
    }

    private final Strategy strategy;
    private final List<IndentationError> errors;
    private final ParseFailure failure;

    private IndentationReport(Strategy strategy, List<IndentationError> errors, ParseFailure failure) {
        this.strategy = strategy;
        this.errors = List.copyOf(errors);
        this.failure = failure;
    }

    static IndentationReport structural(List<IndentationError> errors) {
        return new IndentationReport(Strategy.STRUCTURAL, errors, null);
    }

    static IndentationReport heuristic(List<IndentationError> errors, ParseFailure failure) {
        return new IndentationReport(Strategy.HEURISTIC, errors, failure);
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public List<IndentationError> getErrors() {
        return errors;
    }

    /**
     * Why the structural walk was skipped, or {@code null} when it ran.
     */
    public ParseFailure getFailure() {
        return failure;
    }
}
