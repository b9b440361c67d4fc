package com.spformatter.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.spformatter.api.FormatterResult;
import com.spformatter.api.error.FormatterError;
import com.spformatter.api.error.Severity;
import com.spformatter.api.error.SyntaxError;
import com.spformatter.config.ConfigurationLoader;
import com.spformatter.config.FormatterConfig;
import com.spformatter.config.FormattingOptions;
import com.spformatter.core.DefaultCodeFormatter;
import com.spformatter.plugins.FileType;
import com.spformatter.plugins.sourcepawn.SourcePawnFormatter;
import com.spformatter.plugins.sourcepawn.SourcePawnPlugin;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.plugins.sourcepawn.render.RenderTracer;
import com.spformatter.plugins.sourcepawn.render.Renderer;
import com.spformatter.util.ErrorFormatter;
import com.spformatter.util.LoggerUtil;

/**
 * Command line interface for the SourcePawn formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".spformatter.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final PrintStream out;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);
    private RenderTracer tracer = RenderTracer.NONE;

    public FormatterCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new FormatterCli(System.out).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));
        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }

        if (_hasOption(args, "--trace")) {
            LoggerUtil.setConsoleLevel(Level.FINEST);
            tracer = RenderTracer.logging(LoggerUtil.getLogger(Renderer.class));
        } else {
            LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);
            tracer = RenderTracer.NONE;
        }
        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            LoggerUtil.enableFileLogging(Paths.get(logFile));
        }

        try {
            String command = args[0];
            return switch (command) {
                case "format" -> _formatFiles(args);
                case "check" -> _checkFiles(args);
                case "errors" -> _reportSyntaxErrors(args);
                case "init" -> _initializeConfig(args);
                case "--version", "-v" -> {
                    _printVersion();
                    yield EXIT_OK;
                }
                case "--help", "-h" -> {
                    _printUsage();
                    yield EXIT_OK;
                }
                default -> {
                    _printError("Unknown command: " + command);
                    _printUsage();
                    yield EXIT_FAILURE;
                }
            };
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_isVerbose(args)) {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_FAILURE;
        }
    }

    private void _printVersion() {
        out.println("SourcePawn Formatter version " + VERSION);
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "SourcePawn Formatter CLI v" + VERSION));
        out.println("Usage:");
        out.println("  spformatter init [dir] [--force]   - Create " + CONFIG_FILE_NAME);
        out.println("  spformatter format <path>          - Format .sp and .inc files in place");
        out.println("  spformatter check <path>           - Report files that are not formatted");
        out.println("  spformatter errors <path>          - List syntax errors with context");
        out.println("  spformatter --help|-h              - Show this help");
        out.println("  spformatter --version|-v           - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                    - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --verbose                          - Show detailed output");
        out.println("  --trace                            - Log every rendered node (implies --verbose)");
        out.println("  --no-color                         - Disable colored output");
        out.println("  --include=<glob>                   - Only include files whose name matches");
        out.println("  --threads=<num>                    - Worker threads (default: available processors)");
        out.println("  --log-file=<file>                  - Also write the full log to a file");
        out.println("  --dry-run                          - Print formatted output instead of writing");
        out.println("  --backup                           - Keep a .bak copy of every rewritten file");
        out.println("  --force                            - Overwrite an existing config (init)");
    }

    private int _formatFiles(String[] args) throws IOException {
        Path path = _requirePath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }

        boolean verbose = _isVerbose(args);
        boolean dryRun = _hasOption(args, "--dry-run");
        boolean backup = _hasOption(args, "--backup");
        FormatterConfig config = _loadConfig(args);

        Instant start = Instant.now();
        AtomicInteger changed = new AtomicInteger(0);
        AtomicInteger unchanged = new AtomicInteger(0);
        AtomicInteger failed = new AtomicInteger(0);
        Map<Path, List<FormatterError>> allErrors = new LinkedHashMap<>();

        try (DefaultCodeFormatter formatter = _createFormatter(config)) {
            Map<Path, FormatterResult> results = _formatAll(formatter, path, args);
            if (results.isEmpty()) {
                _printWarning("No SourcePawn files found in " + path);
                return EXIT_OK;
            }

            for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FormatterResult result = entry.getValue();
                if (!result.getErrors().isEmpty()) {
                    allErrors.put(file, result.getErrors());
                }
                if (!result.isSuccessful()) {
                    failed.incrementAndGet();
                    _printError("Failed: " + file);
                    _printErrors(result.getErrors());
                    continue;
                }

                String original = Files.readString(file, StandardCharsets.UTF_8);
                String formatted = result.getFormattedCode();
                if (dryRun) {
                    out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "==> " + file));
                    out.println(formatted);
                } else if (!formatted.equals(original)) {
                    if (backup) {
                        Files.copy(file, _backupPath(file), StandardCopyOption.REPLACE_EXISTING);
                    }
                    Files.writeString(file, formatted, StandardCharsets.UTF_8);
                }

                if (formatted.equals(original)) {
                    unchanged.incrementAndGet();
                    if (verbose) {
                        _printInfo("Unchanged: " + file);
                    }
                } else {
                    changed.incrementAndGet();
                    _printSuccess((dryRun ? "Would format: " : "Formatted: ") + file);
                }
                if (result.isRecovered()) {
                    _printWarning("  Recovered from syntax errors, review " + file.getFileName());
                }
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        out.println();
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Formatting Summary:"));
        out.println("  Formatted: " + changed.get());
        out.println("  Unchanged: " + unchanged.get());
        out.println("  Failed:    " + failed.get());
        out.println("  Time:      " + _formatDuration(duration));
        if (!allErrors.isEmpty()) {
            out.println(errorFormatter.formatErrorSummary(allErrors));
        }

        return failed.get() > 0 ? EXIT_FAILURE : EXIT_OK;
    }

    private int _checkFiles(String[] args) throws IOException {
        Path path = _requirePath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }

        FormatterConfig config = _loadConfig(args);
        AtomicInteger needsFormatting = new AtomicInteger(0);
        AtomicInteger failed = new AtomicInteger(0);
        int checked;

        try (DefaultCodeFormatter formatter = _createFormatter(config)) {
            Map<Path, FormatterResult> results = _formatAll(formatter, path, args);
            checked = results.size();
            for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FormatterResult result = entry.getValue();
                if (!result.isSuccessful()) {
                    failed.incrementAndGet();
                    _printError("Cannot format: " + file);
                    _printErrors(result.getErrors());
                    continue;
                }
                String original = Files.readString(file, StandardCharsets.UTF_8);
                if (!original.equals(result.getFormattedCode())) {
                    needsFormatting.incrementAndGet();
                    _printWarning("Needs formatting: " + file);
                }
            }
        }

        out.println();
        out.println("Checked " + checked + " files: " + needsFormatting.get() + " need formatting, "
                + failed.get() + " failed");
        if (needsFormatting.get() == 0 && failed.get() == 0) {
            _printSuccess("All files are formatted");
            return EXIT_OK;
        }
        return EXIT_FAILURE;
    }

    private int _reportSyntaxErrors(String[] args) throws IOException {
        Path path = _requirePath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }

        FormatterConfig config = _loadConfig(args);
        List<Path> files;
        try (DefaultCodeFormatter registry = _createFormatter(config)) {
            files = _selectFiles(registry, path, _getOptionValue(args, "--include"));
        }

        int total = 0;
        try (SourcePawnFormatter formatter = new SourcePawnFormatter(FormattingOptions.fromConfig(config),
                new SourcePawnParser(), tracer)) {
            for (Path file : files) {
                List<SyntaxError> errors = formatter.getSyntaxErrors(Files.readString(file, StandardCharsets.UTF_8));
                if (errors.isEmpty()) {
                    continue;
                }
                total += errors.size();
                out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, file + ":"));
                for (SyntaxError error : errors) {
                    out.println("  " + errorFormatter.formatSyntaxError(error));
                }
            }
        }

        if (total == 0) {
            _printSuccess("No syntax errors in " + files.size() + " files");
            return EXIT_OK;
        }
        _printError(total + " syntax errors found");
        return EXIT_FAILURE;
    }

    private int _initializeConfig(String[] args) throws IOException {
        Path directory = args.length > 1 && !args[1].startsWith("--") ? Paths.get(args[1]) : Paths.get("");
        Path configPath = directory.resolve(CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            _printInfo("Use --force to overwrite");
            return EXIT_FAILURE;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private Map<Path, FormatterResult> _formatAll(DefaultCodeFormatter formatter, Path path, String[] args)
            throws IOException {
        List<Path> files = _selectFiles(formatter, path, _getOptionValue(args, "--include"));
        logger.fine("Selected " + files.size() + " files under " + path);
        return new TreeMap<>(formatter.formatFiles(files, _threadCount(args)));
    }

    private List<Path> _selectFiles(DefaultCodeFormatter formatter, Path path, String includePattern)
            throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        PathMatcher include = includePattern == null || includePattern.isEmpty()
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + includePattern);
        return formatter.findFiles(path).stream()
                .filter(file -> include == null || include.matches(file.getFileName()))
                .collect(Collectors.toList());
    }

    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = configFile != null ? Paths.get(configFile) : Paths.get(CONFIG_FILE_NAME);
        return ConfigurationLoader.loadConfig(configPath);
    }

    private DefaultCodeFormatter _createFormatter(FormatterConfig config) {
        DefaultCodeFormatter formatter = new DefaultCodeFormatter(config);
        SourcePawnPlugin plugin = new SourcePawnPlugin(tracer);
        formatter.registerPlugin(FileType.SOURCEPAWN, plugin);
        formatter.registerPlugin(FileType.INCLUDE, plugin);
        return formatter;
    }

    private Path _requirePath(String[] args) {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return null;
        }
        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return null;
        }
        return path;
    }

    private static Path _backupPath(Path file) {
        return file.resolveSibling(file.getFileName() + ".bak");
    }

    private int _threadCount(String[] args) {
        String value = _getOptionValue(args, "--threads");
        if (value == null) {
            return Runtime.getRuntime().availableProcessors();
        }
        try {
            return Math.max(1, Integer.parseInt(value));
        } catch (NumberFormatException e) {
            _printWarning("Invalid thread count: " + value + ", using available processors");
            return Runtime.getRuntime().availableProcessors();
        }
    }

    private static boolean _isVerbose(String[] args) {
        return _hasOption(args, "--verbose") || _hasOption(args, "--trace");
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

    private void _printErrors(List<FormatterError> errors) {
        Map<Severity, List<FormatterError>> bySeverity = errorFormatter.groupBySeverity(errors);
        for (Severity severity : Severity.values()) {
            for (FormatterError error : bySeverity.getOrDefault(severity, List.of())) {
                String line = "  " + errorFormatter.formatError(error);
                switch (severity) {
                    case FATAL, ERROR -> _printError(line);
                    case WARNING -> _printWarning(line);
                    case INFO -> _printInfo(line);
                }
            }
        }
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        long minutes = seconds / 60;
        return String.format("%d min %d sec", minutes, seconds % 60);
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
