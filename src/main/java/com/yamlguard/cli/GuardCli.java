package com.yamlguard.cli;

import com.yamlguard.api.AppliedFix;
import com.yamlguard.api.LintResult;
import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;
import com.yamlguard.config.ConfigurationLoader;
import com.yamlguard.config.GuardConfig;
import com.yamlguard.core.YamlGuardEngine;
import com.yamlguard.util.ErrorFormatter;
import com.yamlguard.util.JsonLinesFormatter;
import com.yamlguard.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface: {@code lint}, {@code fix} and {@code init}.
 * <p>
 * Exit codes: 0 when clean, 1 for findings at or above the fail-on level or
 * processing failures, 2 for usage errors.
 */
public class GuardCli {
    private static final Logger logger = LoggerUtil.getLogger(GuardCli.class);
    static final String VERSION = "1.0.0";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_USAGE = 2;

    private static final Set<String> FLAGS = Set.of(
            "--ci", "--no-color", "--verbose", "--in-place", "--backup", "--force");
    private static final Set<String> VALUE_OPTIONS = Set.of(
            "--config", "--indent", "--format", "--fail-on", "--threads");

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDir;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false, false);

    public GuardCli(PrintStream out, PrintStream err, Path workingDir) {
        this.out = out;
        this.err = err;
        this.workingDir = workingDir;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new GuardCli(System.out, System.err, Paths.get("").toAbsolutePath()).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        if (args.length < 1) {
            _printUsage(err);
            return EXIT_USAGE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean useColors = !_hasOption(args, "--no-color") && !_hasOption(args, "--ci");
        errorFormatter = new ErrorFormatter(useColors, verbose);
        if (verbose) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        }

        String command = args[0];
        try {
            return switch (command) {
                case "lint" -> _lint(args);
                case "fix" -> _fix(args);
                case "init" -> _initializeConfig(args);
                case "--version", "-v" -> {
                    out.println("yamlguard version " + VERSION);
                    yield EXIT_OK;
                }
                case "--help", "-h" -> {
                    _printUsage(out);
                    yield EXIT_OK;
                }
                default -> {
                    _printError("Unknown command: " + command);
                    _printUsage(err);
                    yield EXIT_USAGE;
                }
            };
        } catch (UsageException e) {
            _printError("Error: " + e.getMessage());
            err.println("Run 'yamlguard --help' for usage");
            return EXIT_USAGE;
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!verbose) {
                err.println("Use --verbose for details");
            }
            return EXIT_FINDINGS;
        }
    }

    private int _lint(String[] args) {
        _checkOptions(args, Set.of("--in-place", "--backup", "--force"));
        GuardConfig config = _loadConfig(args);
        boolean ciMode = config.isCi();
        List<Path> targets = _targets(args);

        try (YamlGuardEngine engine = YamlGuardEngine.withDefaultPlugins(config)) {
            boolean missing = false;
            Set<Path> files = new LinkedHashSet<>();
            for (Path target : targets) {
                if (!Files.exists(target)) {
                    _printError("Path does not exist: " + target);
                    missing = true;
                    continue;
                }
                files.addAll(engine.findFiles(target));
            }

            Instant start = Instant.now();
            Map<Path, LintResult> results = engine.checkFiles(new ArrayList<>(files), _threads(args));
            Duration duration = Duration.between(start, Instant.now());

            if ("jsonl".equals(config.getFormat())) {
                JsonLinesFormatter jsonl = new JsonLinesFormatter();
                results.forEach((file, result) -> jsonl.formatFile(_display(file), result).forEach(out::println));
                out.println(jsonl.formatSummary(results, config.getFailOn()));
            } else {
                _printStylish(out, results);
                if (config.isVerbose() || _hasOption(args, "--verbose")) {
                    _printInfo("Checked " + results.size() + " files in " + _formatDuration(duration));
                }
                if (ciMode) {
                    _printCiResult(results);
                }
            }

            return missing || _fails(results, config.getFailOn()) ? EXIT_FINDINGS : EXIT_OK;
        }
    }

    private int _fix(String[] args) throws IOException {
        _checkOptions(args, Set.of("--force"));
        boolean inPlace = _hasOption(args, "--in-place");
        boolean backup = _hasOption(args, "--backup");
        if (backup && !inPlace) {
            throw new UsageException("--backup requires --in-place");
        }

        GuardConfig config = _loadConfig(args);
        List<Path> targets = _targets(args);

        try (YamlGuardEngine engine = YamlGuardEngine.withDefaultPlugins(config)) {
            boolean missing = false;
            Set<Path> files = new LinkedHashSet<>();
            for (Path target : targets) {
                if (!Files.exists(target)) {
                    _printError("Path does not exist: " + target);
                    missing = true;
                    continue;
                }
                files.addAll(engine.findFiles(target));
            }

            Map<Path, LintResult> results = engine.fixFiles(new ArrayList<>(files), _threads(args));
            for (Map.Entry<Path, LintResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                LintResult result = entry.getValue();
                if (result.getContent() == null) {
                    continue;
                }

                if (inPlace) {
                    if (!result.getAppliedFixes().isEmpty()) {
                        if (backup) {
                            Files.copy(file, file.resolveSibling(file.getFileName() + ".bak"),
                                    StandardCopyOption.REPLACE_EXISTING);
                        }
                        Files.writeString(file, result.getContent(), StandardCharsets.UTF_8);
                        for (AppliedFix fix : result.getAppliedFixes()) {
                            _printSuccess("Fixed: " + file + " (" + fix.getDescription() + ")");
                        }
                    }
                } else {
                    if (results.size() > 1) {
                        out.println("# " + file);
                    }
                    out.print(result.getContent());
                }
            }

            // fixed content owns stdout unless files were rewritten
            PrintStream report = inPlace ? out : err;
            _printStylish(report, results);

            return missing || _fails(results, config.getFailOn()) ? EXIT_FINDINGS : EXIT_OK;
        }
    }

    private int _initializeConfig(String[] args) throws IOException {
        _checkOptions(args, Set.of("--in-place", "--backup", "--indent", "--format", "--fail-on", "--threads"));
        String configFile = _getOptionValue(args, "--config");
        Path configPath = workingDir.resolve(configFile != null ? configFile : ConfigurationLoader.CONFIG_FILE_NAMES.get(0));

        try {
            ConfigurationLoader.writeDefaultConfig(configPath, _hasOption(args, "--force"));
        } catch (FileAlreadyExistsException e) {
            _printWarning("Configuration file already exists: " + configPath);
            err.println("Use --force to overwrite it");
            return EXIT_FINDINGS;
        }
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    /**
     * Configuration from {@code --config}, or the nearest configuration file, with
     * command line overrides applied.
     */
    private GuardConfig _loadConfig(String[] args) {
        GuardConfig config;
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            Path configPath = workingDir.resolve(configFile);
            if (!Files.isRegularFile(configPath)) {
                throw new UsageException("Configuration file not found: " + configFile);
            }
            config = ConfigurationLoader.loadConfig(configPath);
        } else {
            config = ConfigurationLoader.loadConfig(ConfigurationLoader.findConfig(workingDir));
        }

        String indent = _getOptionValue(args, "--indent");
        if (indent != null) {
            int step = _parseInt("--indent", indent);
            if (step < 1 || step > 8) {
                throw new UsageException("--indent must be between 1 and 8");
            }
            config = config.with(GuardConfig.INDENT, "step", step);
        }

        String format = _getOptionValue(args, "--format");
        if (format != null) {
            if (!format.equals("stylish") && !format.equals("jsonl")) {
                throw new UsageException("--format must be stylish or jsonl");
            }
            config = config.with(GuardConfig.REPORTER, "format", format);
        }

        String failOn = _getOptionValue(args, "--fail-on");
        if (failOn != null) {
            if (!failOn.equals("error") && !failOn.equals("warning") && !failOn.equals("info")) {
                throw new UsageException("--fail-on must be error, warning or info");
            }
            config = config.with(GuardConfig.REPORTER, "failOn", failOn);
        }

        if (_hasOption(args, "--ci")) {
            config = config.withCi(true);
        }
        boolean colors = config.isColor() && !config.isCi() && !_hasOption(args, "--no-color");
        errorFormatter = new ErrorFormatter(colors, config.isVerbose() || _hasOption(args, "--verbose"));
        return config;
    }

    private List<Path> _targets(String[] args) {
        List<Path> targets = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            if (!args[i].startsWith("--")) {
                targets.add(workingDir.resolve(args[i]).normalize());
            }
        }
        if (targets.isEmpty()) {
            throw new UsageException("Missing path argument");
        }
        return targets;
    }

    private int _threads(String[] args) {
        String threads = _getOptionValue(args, "--threads");
        if (threads == null) {
            return Runtime.getRuntime().availableProcessors();
        }
        int count = _parseInt("--threads", threads);
        if (count < 1) {
            throw new UsageException("--threads must be at least 1");
        }
        return count;
    }

    private static int _parseInt(String option, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(option + " expects a number, got '" + value + "'");
        }
    }

    /**
     * Rejects unknown options and options that do not apply to the command.
     */
    private static void _checkOptions(String[] args, Set<String> notApplicable) {
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            String name = arg.contains("=") ? arg.substring(0, arg.indexOf('=')) : arg;
            boolean known = arg.contains("=") ? VALUE_OPTIONS.contains(name) : FLAGS.contains(name);
            if (!known || notApplicable.contains(name)) {
                throw new UsageException("Unknown option for " + args[0] + ": " + arg);
            }
        }
    }

    private static boolean _fails(Map<Path, LintResult> results, Severity failOn) {
        return results.values().stream()
                .flatMap(result -> result.getErrors().stream())
                .anyMatch(error -> error.getSeverity().isAtLeast(failOn));
    }

    private void _printStylish(PrintStream stream, Map<Path, LintResult> results) {
        Map<Path, List<LintError>> errorsByFile = new LinkedHashMap<>();
        for (Map.Entry<Path, LintResult> entry : results.entrySet()) {
            String report = errorFormatter.formatFile(_display(entry.getKey()), entry.getValue());
            if (!report.isEmpty()) {
                stream.println(report);
            }
            errorsByFile.put(entry.getKey(), entry.getValue().getErrors());
        }
        stream.println(errorFormatter.formatErrorSummary(errorsByFile));
    }

    private void _printCiResult(Map<Path, LintResult> results) {
        int errors = 0;
        int warnings = 0;
        int infos = 0;
        for (LintResult result : results.values()) {
            for (LintError error : result.getErrors()) {
                switch (error.getSeverity()) {
                    case FATAL, ERROR -> errors++;
                    case WARNING -> warnings++;
                    case INFO -> infos++;
                }
            }
        }
        out.println("RESULT:files=" + results.size() +
                ";errors=" + errors +
                ";warnings=" + warnings +
                ";info=" + infos);
    }

    private Path _display(Path file) {
        return file.startsWith(workingDir) ? workingDir.relativize(file) : file;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private void _printUsage(PrintStream stream) {
        stream.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "YAMLGuard v" + VERSION));
        stream.println("Usage:");
        stream.println("  yamlguard lint <path>...          - Report indentation problems");
        stream.println("  yamlguard fix <path>...           - Print re-indented content");
        stream.println("  yamlguard init [--force]          - Write a default .yamlguard.yml");
        stream.println("  yamlguard --help|-h               - Show this help");
        stream.println("  yamlguard --version|-v            - Show version information");
        stream.println();
        stream.println("Options:");
        stream.println("  --config=<file>                   - Use specific config file (default: nearest .yamlguard.yml)");
        stream.println("  --indent=<1-8>                    - Columns per nesting level");
        stream.println("  --format=stylish|jsonl            - Report format");
        stream.println("  --fail-on=error|warning|info      - Lowest severity that fails the run");
        stream.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        stream.println("  --in-place                        - Rewrite files (with fix)");
        stream.println("  --backup                          - Keep a .bak copy of rewritten files (with fix --in-place)");
        stream.println("  --ci                              - CI friendly output (no colors, RESULT line)");
        stream.println("  --no-color                        - Disable colored output");
        stream.println("  --verbose                         - Show suggestions and debug logging");
        stream.println("  --force                           - Force overwrite (with init)");
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }

    /**
     * Invalid command line; maps to {@link #EXIT_USAGE}.
     */
    private static final class UsageException extends RuntimeException {
        private UsageException(String message) {
            super(message);
        }
    }
}
