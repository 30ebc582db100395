package com.yamlguard.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * The main linter interface that all implementations must provide.
 */
public interface YamlLinter {
    LintResult checkFile(Path filePath, String content);
    LintResult fixFile(Path filePath, String content);
    Map<Path, LintResult> checkDirectory(Path directory);
}
