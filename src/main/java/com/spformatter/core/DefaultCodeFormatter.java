package com.spformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.spformatter.api.CodeFormatter;
import com.spformatter.api.FormatterPlugin;
import com.spformatter.api.FormatterResult;
import com.spformatter.api.error.FormatterError;
import com.spformatter.api.error.Severity;
import com.spformatter.config.FormatterConfig;
import com.spformatter.plugins.FileType;
import com.spformatter.util.LoggerUtil;

/**
 * Dispatches files to the plugin registered for their {@link FileType} and formats whole
 * directories on a worker pool.
 */
public class DefaultCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(DefaultCodeFormatter.class);
    private static final long DIRECTORY_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;
    private final List<PathMatcher> ignoreMatchers = new ArrayList<>();

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public DefaultCodeFormatter(FormatterConfig config) {
        this.config = config;
        for (String pattern : config.getIgnoreFiles()) {
            ignoreMatchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        logger.fine("Code formatter initialized with " + ignoreMatchers.size() + " ignore patterns");
    }

    /**
     * Registers a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Formats a single file using the appropriate plugin.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Successfully formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);

            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Unexpected error: " + e.getMessage(),
                            1, 1))
                    .build();
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every supported file under {@code directory} with {@code threadCount} workers.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try {
            filesToProcess = findFiles(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        results.putAll(formatFiles(filesToProcess, threadCount));
        logger.info("Processed " + results.size() + " files");
        return results;
    }

    /**
     * Formats the given files in parallel. Each file is read, formatted and reported on its own.
     * A file whose task failed or did not finish in time gets a fatal result.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        Map<Path, Future<FormatterResult>> futures = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : files) {
                futures.put(file, executor.submit(() -> _formatPath(file)));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(DIRECTORY_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        for (Map.Entry<Path, Future<FormatterResult>> entry : futures.entrySet()) {
            results.put(entry.getKey(), _collect(entry.getKey(), entry.getValue()));
        }
        return results;
    }

    private FormatterResult _collect(Path file, Future<FormatterResult> future) {
        if (!future.isDone() || future.isCancelled()) {
            errorCount.incrementAndGet();
            logger.warning("File processing did not complete: " + file);
            return _fatal("Processing did not complete");
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error while formatting " + file, e.getCause());
            return _fatal("Unexpected error: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errorCount.incrementAndGet();
            return _fatal("Processing interrupted");
        }
    }

    private static FormatterResult _fatal(String message) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(null)
                .addError(new FormatterError(Severity.FATAL, message, 1, 1))
                .build();
    }

    /**
     * Supported files under {@code directory} that no ignore pattern excludes, in path order.
     */
    public List<Path> findFiles(Path directory) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> !isIgnored(directory.relativize(path)))
                    .filter(path -> {
                        FileType type = FileType.detect(path);
                        return type != FileType.UNKNOWN && plugins.containsKey(type);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * True when a configured ignore pattern matches the path, given relative to the scanned root.
     */
    public boolean isIgnored(Path relativePath) {
        for (PathMatcher matcher : ignoreMatchers) {
            if (matcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    private FormatterResult _formatPath(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Failed to read file: " + e.getMessage(),
                            1, 1))
                    .build();
        }
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    /**
     * Checks if a plugin is registered for the given file type.
     */
    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    /**
     * Closes all plugins and releases resources. A plugin that fails to close is logged and skipped.
     */
    @Override
    public void close() {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                }
            }
        }
        plugins.clear();
    }
}
