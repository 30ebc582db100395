package com.yamlguard.api.error;

import java.util.Locale;

public enum Severity {
    FATAL,   // File could not be processed at all
    ERROR,   // Indentation that breaks the expected structure
    WARNING, // Non-blocking findings
    INFO;    // Informational messages, e.g. which analysis strategy ran

    /**
     * Lower-case name used in reports and configuration files.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether this severity is at least as serious as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return ordinal() <= threshold.ordinal();
    }

    public static Severity fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Severity label must not be null");
        }
        return Severity.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
