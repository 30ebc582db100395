package com.yamlguard.api;

import java.nio.file.Path;

import com.yamlguard.config.GuardConfig;

/**
 * Interface for file-type specific lint plugins.
 */
public interface LintPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(GuardConfig config);

    /**
     * Report findings without changing the content.
     */
    LintResult check(Path filePath, String content);

    /**
     * Produce corrected content together with the findings that remain.
     */
    LintResult fix(Path filePath, String content);
}
