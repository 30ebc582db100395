package com.yamlguard.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.yamlguard.api.LintPlugin;
import com.yamlguard.api.LintResult;
import com.yamlguard.api.YamlLinter;
import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;
import com.yamlguard.config.GuardConfig;
import com.yamlguard.plugins.FileType;
import com.yamlguard.plugins.yaml.YamlIndentationPlugin;
import com.yamlguard.util.LoggerUtil;

/**
 * Runs the registered plugins over files and directories.
 * <p>
 * Any failure while processing one file becomes a single file-level
 * {@link Severity#FATAL} error for that file and never stops the run.
 * Thread-safe; directories are processed on a fixed thread pool.
 */
public class YamlGuardEngine implements YamlLinter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(YamlGuardEngine.class);

    private final Map<FileType, LintPlugin> plugins = new ConcurrentHashMap<>();
    private static final Duration DEFAULT_PROCESSING_TIMEOUT = Duration.ofMinutes(30);

    private final GuardConfig config;
    private final Duration processingTimeout;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public YamlGuardEngine(GuardConfig config) {
        this(config, DEFAULT_PROCESSING_TIMEOUT);
    }

    YamlGuardEngine(GuardConfig config, Duration processingTimeout) {
        this.config = config;
        this.processingTimeout = processingTimeout;
        logger.fine("Engine initialized with indent step " + config.getIndentStep());
    }

    /**
     * An engine with the YAML indentation plugin registered.
     */
    public static YamlGuardEngine withDefaultPlugins(GuardConfig config) {
        YamlGuardEngine engine = new YamlGuardEngine(config);
        engine.registerPlugin(FileType.YAML, new YamlIndentationPlugin());
        return engine;
    }

    /**
     * Registers a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, LintPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    @Override
    public LintResult checkFile(Path filePath, String content) {
        return process(filePath, content, "check", LintPlugin::check);
    }

    @Override
    public LintResult fixFile(Path filePath, String content) {
        return process(filePath, content, "fix", LintPlugin::fix);
    }

    private LintResult process(Path filePath, String content, String operation,
                               PluginCall call) {
        FileType fileType = FileType.detect(filePath);
        LintPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return LintResult.builder()
                    .successful(false)
                    .content(content)
                    .addError(new LintError(LintError.TYPE_FILE, Severity.ERROR,
                            "No plugin registered for file type: " + fileType, 1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            LintResult result = call.apply(plugin, filePath, content);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("No blocking findings (" + operation + "): " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.fine(() -> "Findings in " + filePath + ": " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity().label() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error processing file: " + filePath, e);
            return fileError(content, e);
        }
    }

    @Override
    public Map<Path, LintResult> checkDirectory(Path directory) {
        return checkDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    public Map<Path, LintResult> checkDirectory(Path directory, int threadCount) {
        return checkFiles(findFiles(directory), threadCount);
    }

    public Map<Path, LintResult> checkFiles(List<Path> files, int threadCount) {
        return processFiles(files, threadCount, this::checkFile);
    }

    public Map<Path, LintResult> fixFiles(List<Path> files, int threadCount) {
        return processFiles(files, threadCount, this::fixFile);
    }

    /**
     * Reads and processes files on a thread pool. The result keeps the order of {@code files}.
     */
    private Map<Path, LintResult> processFiles(List<Path> files, int threadCount,
                                               BiFunction<Path, String, LintResult> operation) {
        Map<Path, LintResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return new LinkedHashMap<>();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threadCount, files.size())));
        try {
            for (Path file : files) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, operation.apply(file, content));
                    } catch (IOException | RuntimeException e) {
                        errorCount.incrementAndGet();
                        logger.log(Level.WARNING, "Failed to process file: " + file, e);
                        results.put(file, fileError(null, e));
                    }
                });
            }

            executor.shutdown();
            try {
                if (!executor.awaitTermination(processingTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }

        Map<Path, LintResult> ordered = new LinkedHashMap<>();
        for (Path file : files) {
            LintResult result = results.get(file);
            if (result == null) {
                errorCount.incrementAndGet();
                logger.warning("File was not processed before the engine stopped: " + file);
                result = fileError(null, "not processed within " + processingTimeout.toMillis() + " ms");
            }
            ordered.put(file, result);
        }
        logger.fine("Processed " + ordered.size() + " files");
        return ordered;
    }

    /**
     * Files under {@code root} matching the configured include patterns and none
     * of the exclude patterns, sorted. A regular file is returned as is when a
     * plugin handles its type.
     */
    public List<Path> findFiles(Path root) {
        if (Files.isRegularFile(root)) {
            return plugins.containsKey(FileType.detect(root)) ? List.of(root) : List.of();
        }
        if (!Files.isDirectory(root)) {
            logger.warning("Path does not exist or is not a directory: " + root);
            return List.of();
        }

        FileSystem fs = root.getFileSystem();
        List<PathMatcher> includes = matchers(fs, config.getIncludePatterns());
        List<PathMatcher> excludes = matchers(fs, config.getExcludePatterns());

        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> files = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        Path relative = root.relativize(path);
                        return anyMatch(includes, relative) && !anyMatch(excludes, relative)
                                && plugins.containsKey(FileType.detect(path));
                    })
                    .sorted()
                    .collect(Collectors.toList());
            logger.fine("Found " + files.size() + " files to process in " + root);
            return files;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + root, e);
            return new ArrayList<>();
        }
    }

    /**
     * Glob matchers; a leading {@code **}{@code /} also matches at the top level.
     */
    private static List<PathMatcher> matchers(FileSystem fs, List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            matchers.add(fs.getPathMatcher("glob:" + pattern));
            if (pattern.startsWith("**/")) {
                matchers.add(fs.getPathMatcher("glob:" + pattern.substring(3)));
            }
        }
        return matchers;
    }

    private static boolean anyMatch(List<PathMatcher> matchers, Path path) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static LintResult fileError(String content, Exception e) {
        return fileError(content, e.getMessage());
    }

    private static LintResult fileError(String content, String reason) {
        return LintResult.builder()
                .successful(false)
                .content(content)
                .addError(new LintError(LintError.TYPE_FILE, Severity.FATAL,
                        "Error processing file: " + reason, 1, 1))
                .build();
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Files with blocking findings or processing failures.
     */
    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    @Override
    public void close() {
        logger.fine("Closing engine: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());
        plugins.clear();
    }

    @FunctionalInterface
    private interface PluginCall {
        LintResult apply(LintPlugin plugin, Path filePath, String content);
    }
}
