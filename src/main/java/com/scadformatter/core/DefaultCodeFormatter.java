package com.scadformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.scadformatter.api.CodeFormatter;
import com.scadformatter.api.FormatterPlugin;
import com.scadformatter.api.FormatterResult;
import com.scadformatter.api.error.FormatterError;
import com.scadformatter.api.error.Severity;
import com.scadformatter.config.FormatterConfig;
import com.scadformatter.plugins.FileType;
import com.scadformatter.util.LoggerUtil;

/**
 * Thread-safe formatter front end. Dispatches each file to the plugin
 * registered for its {@link FileType} and formats directory trees on a
 * fixed thread pool.
 */
public class DefaultCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(DefaultCodeFormatter.class);

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;
    private final List<PathMatcher> ignoreMatchers;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public DefaultCodeFormatter(FormatterConfig config) {
        this.config = config;
        this.ignoreMatchers = _ignoreMatchers(config);
        logger.info("Code formatter initialized with " + ignoreMatchers.size() + " ignore pattern(s)");
    }

    /**
     * Registers a plugin for a specific file type and initializes it with
     * this formatter's configuration.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.info("Registered plugin for file type: " + fileType.getDescription());
    }

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
        } catch (Exception e) {
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
     * Formats every supported, non-ignored file below {@code directory}.
     * Files are read but not written; callers decide what to do with results.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.exists(directory)) {
            logger.warning("Directory does not exist: " + directory);
            return results;
        }
        if (!Files.isDirectory(directory)) {
            logger.warning("Path is not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try (Stream<Path> walk = Files.walk(directory)) {
            filesToProcess = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        FileType type = FileType.detect(path);
                        return type != FileType.UNKNOWN && plugins.containsKey(type);
                    })
                    .filter(path -> !isIgnored(directory.relativize(path)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, formatFile(file, content));
                    } catch (IOException e) {
                        errorCount.incrementAndGet();
                        results.put(file, _fatalResult("Failed to read file: " + e.getMessage()));
                    } catch (RuntimeException | Error e) {
                        // the task's Future is never read
                        logger.log(Level.SEVERE, "Formatting task failed for " + file, e);
                        errorCount.incrementAndGet();
                        results.put(file, _fatalResult("Formatting failed: " + e));
                    }
                });
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    private static FormatterResult _fatalResult(String message) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(null)
                .addError(new FormatterError(Severity.FATAL, message, 1, 1))
                .build();
    }

    /**
     * Whether a path, relative to the formatted root, matches one of the
     * configured {@code ignoreFiles} globs.
     */
    public boolean isIgnored(Path relativePath) {
        for (PathMatcher matcher : ignoreMatchers) {
            if (matcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> _ignoreMatchers(FormatterConfig config) {
        List<?> patterns = config.getGeneralConfig("ignoreFiles", new ArrayList<Object>());
        List<PathMatcher> matchers = new ArrayList<>();
        for (Object pattern : patterns) {
            try {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            } catch (IllegalArgumentException e) {
                logger.log(Level.WARNING, "Ignoring invalid ignoreFiles pattern: " + pattern, e);
            }
        }
        return matchers;
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

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    /**
     * Closes all plugins that hold resources.
     */
    @Override
    public void close() throws Exception {
        logger.info("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;

        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    logger.fine("Closing plugin for file type: " + entry.getKey());
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
