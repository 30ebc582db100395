package com.yamlguard.api;

import java.util.ArrayList;
import java.util.List;

import com.yamlguard.api.error.LintError;

/**
 * Result of checking or fixing one document.
 */
public class LintResult {
    private final boolean successful;
    private final String content;
    private final List<LintError> errors;
    private final List<AppliedFix> appliedFixes;

    private LintResult(Builder builder) {
        this.successful = builder.successful;
        this.content = builder.content;
        this.errors = List.copyOf(builder.errors);
        this.appliedFixes = List.copyOf(builder.appliedFixes);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * The document content after processing: the fixed text for fix runs,
     * the original text for check runs.
     */
    public String getContent() {
        return content;
    }

    public List<LintError> getErrors() {
        return errors;
    }

    public List<AppliedFix> getAppliedFixes() {
        return appliedFixes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String content;
        private List<LintError> errors = new ArrayList<>();
        private List<AppliedFix> appliedFixes = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder addError(LintError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<? extends LintError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder addFix(AppliedFix fix) {
            this.appliedFixes.add(fix);
            return this;
        }

        public LintResult build() {
            return new LintResult(this);
        }
    }
}
