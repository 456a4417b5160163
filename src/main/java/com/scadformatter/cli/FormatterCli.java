package com.scadformatter.cli;

import com.scadformatter.api.FormatOptions;
import com.scadformatter.api.FormatterResult;
import com.scadformatter.api.error.FormatterError;
import com.scadformatter.api.error.Severity;
import com.scadformatter.config.ConfigurationLoader;
import com.scadformatter.config.FormatterConfig;
import com.scadformatter.core.DefaultCodeFormatter;
import com.scadformatter.plugins.FileType;
import com.scadformatter.plugins.openscad.OpenScadFormatterPlugin;
import com.scadformatter.plugins.openscad.ScadFormatter;
import com.scadformatter.plugins.openscad.syntax.ScadSyntaxProvider;
import com.scadformatter.util.ErrorFormatter;
import com.scadformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface for the OpenSCAD formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".scadformat.yml";

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public FormatterCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new FormatterCli(System.in, System.out, System.err).run(args);
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
            _printUsage();
            return 1;
        }

        boolean useColors = !_hasOption(args, "--no-color") && !_hasOption(args, "--stdin");
        errorFormatter = new ErrorFormatter(useColors);

        try {
            if (_hasOption(args, "--verbose")) {
                LoggerUtil.setConsoleLevel(Level.FINE);
            } else if (_hasOption(args, "--stdin")) {
                LoggerUtil.setConsoleLevel(Level.WARNING);
            } else {
                LoggerUtil.setConsoleLevel(Level.INFO);
            }

            if (_hasOption(args, "--stdin")) {
                return _formatStdin(args);
            }

            String command = args[0];
            switch (command) {
                case "format":
                    return _formatFiles(args);
                case "check":
                    return _checkFiles(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace(err);
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return 1;
        }
    }

    private void _printVersion() {
        out.println("SCAD Formatter version " + VERSION);
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "SCAD Formatter CLI v" + VERSION));
        out.println("Usage:");
        out.println("  scadformat init [--force]         - Write a default " + CONFIG_FILE_NAME);
        out.println("  scadformat format <path>          - Format .scad files in path");
        out.println("  scadformat check <path>           - Report files that are not formatted");
        out.println("  scadformat --stdin                - Format standard input to standard output");
        out.println("  scadformat --help|-h              - Show this help");
        out.println("  scadformat --version|-v           - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --indent-size=<n>                 - Spaces per indentation level");
        out.println("  --print-width=<n>                 - Preferred maximum line width");
        out.println("  --use-tabs                        - Indent with tabs");
        out.println("  --verbose                         - Show detailed output");
        out.println("  --ci                              - CI friendly output (simplified)");
        out.println("  --no-color                        - Disable colored output");
        out.println("  --include=<glob>                  - Only include files matching pattern");
        out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        out.println("  --force                           - Force overwrite (with init command)");
    }

    /**
     * Editor entry point: the whole document arrives on stdin and its
     * formatted form, or the untouched input on failure, goes to stdout.
     */
    /**
     * Editor entry point. Input must be UTF-8; anything that cannot be
     * decoded or formatted is written back byte for byte.
     */
    private int _formatStdin(String[] args) throws IOException {
        byte[] bytes = in.readAllBytes();
        String source;
        try {
            source = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            logger.warning("Standard input is not valid UTF-8: " + e.getMessage());
            err.println(errorFormatter.formatError(
                    new FormatterError(Severity.FATAL, "Input is not valid UTF-8", 1, 1)));
            _writeBytes(bytes);
            return 0;
        }

        FormatterConfig config = _loadConfig(args);
        ScadFormatter formatter = new ScadFormatter(ScadSyntaxProvider.init());
        FormatterResult result = formatter.formatDetailed(source, FormatOptions.fromConfig(config));

        if (!result.isSuccessful()) {
            result.getErrors().forEach(e -> err.println(errorFormatter.formatError(e)));
            _writeBytes(bytes);
        } else {
            _writeBytes(result.getFormattedCode().getBytes(StandardCharsets.UTF_8));
        }
        return 0;
    }

    private void _writeBytes(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        out.flush();
    }

    private int _formatFiles(String[] args) throws Exception {
        Path path = _targetPath(args);
        if (path == null) {
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (DefaultCodeFormatter formatter = _createFormatter(config)) {
            int fileCount = 0;
            int errorCount = 0;
            int changedCount = 0;
            long totalLines = 0;
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();

            Instant start = Instant.now();
            Map<Path, FormatterResult> results = _collectResults(formatter, path, args);
            _printInfo("Found " + results.size() + " files to format");

            for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FormatterResult result = entry.getValue();
                fileCount++;

                if (!result.isSuccessful()) {
                    _printError("Failed to format: " + file);
                    errorsByFile.put(file, result.getErrors());
                    result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                    errorCount++;
                    continue;
                }

                try {
                    String source = Files.readString(file, StandardCharsets.UTF_8);
                    totalLines += source.lines().count();

                    if (!source.equals(result.getFormattedCode())) {
                        Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                        _printSuccess("Formatted: " + file);
                        changedCount++;
                    } else if (verbose) {
                        _printInfo("  Already formatted: " + file);
                    }
                } catch (IOException e) {
                    _printError("Error writing file: " + file);
                    _printError("  " + e.getMessage());
                    logger.log(Level.SEVERE, "Error writing file: " + file, e);
                    errorsByFile.put(file, List.of(new FormatterError(
                            Severity.FATAL,
                            "Exception: " + e.getMessage(),
                            1, 1,
                            "Check the log file for details")));
                    errorCount++;
                }
            }

            Duration duration = Duration.between(start, Instant.now());

            out.println("\nFormatting complete in " + _formatDuration(duration) + ":");
            out.println("  Processed files: " + fileCount);
            out.println("  Changed files: " + changedCount);
            out.println("  Files with errors: " + errorCount);
            out.println("  Total lines processed: " + totalLines);

            if (!errorsByFile.isEmpty() && !ciMode) {
                out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }
            if (ciMode) {
                out.println("RESULT:files=" + fileCount + ";changed=" + changedCount + ";errors=" + errorCount);
            }

            return errorCount > 0 ? 1 : 0;
        }
    }

    private int _checkFiles(String[] args) throws Exception {
        Path path = _targetPath(args);
        if (path == null) {
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (DefaultCodeFormatter formatter = _createFormatter(config)) {
            int fileCount = 0;
            int nonCompliantCount = 0;
            int errorCount = 0;
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();

            Instant start = Instant.now();
            Map<Path, FormatterResult> results = _collectResults(formatter, path, args);
            _printInfo("Found " + results.size() + " files to check");

            for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FormatterResult result = entry.getValue();
                fileCount++;

                if (!result.isSuccessful()) {
                    _printError("Cannot format: " + file);
                    errorsByFile.put(file, result.getErrors());
                    Map<Severity, List<FormatterError>> bySeverity = errorFormatter.groupBySeverity(result.getErrors());
                    _printErrorsBySeverity(bySeverity, Severity.FATAL);
                    _printErrorsBySeverity(bySeverity, Severity.ERROR);
                    _printErrorsBySeverity(bySeverity, Severity.WARNING);
                    _printErrorsBySeverity(bySeverity, Severity.INFO);
                    errorCount++;
                    continue;
                }

                String source = Files.readString(file, StandardCharsets.UTF_8);
                if (!source.equals(result.getFormattedCode())) {
                    _printWarning("File needs formatting: " + file);
                    nonCompliantCount++;
                } else if (verbose) {
                    _printSuccess("  OK: " + file);
                }
            }

            Duration duration = Duration.between(start, Instant.now());

            out.println("\nCheck complete in " + _formatDuration(duration) + ":");
            out.println("  Checked files: " + fileCount);
            out.println("  Files needing formatting: " + nonCompliantCount);
            out.println("  Files with errors: " + errorCount);

            if (!errorsByFile.isEmpty() && !ciMode) {
                out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }
            if (ciMode) {
                out.println("RESULT:files=" + fileCount + ";unformatted=" + nonCompliantCount
                        + ";errors=" + errorCount);
            }

            return nonCompliantCount > 0 || errorCount > 0 ? 1 : 0;
        }
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return 0;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    private Path _targetPath(String[] args) {
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

    /**
     * Loads the configuration file and applies command line overrides.
     */
    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config = ConfigurationLoader.loadConfig(
                Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME));

        Map<String, Object> overrides = new HashMap<>();
        _putIntOverride(overrides, "indentSize", _getOptionValue(args, "--indent-size"));
        _putIntOverride(overrides, "printWidth", _getOptionValue(args, "--print-width"));
        if (_hasOption(args, "--use-tabs")) {
            overrides.put("useTabs", true);
        }
        return overrides.isEmpty() ? config : config.withGeneralOverrides(overrides);
    }

    private void _putIntOverride(Map<String, Object> overrides, String key, String value) {
        if (value == null) {
            return;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new NumberFormatException("not positive");
            }
            overrides.put(key, parsed);
        } catch (NumberFormatException e) {
            logger.warning("Invalid value for " + key + ": " + value + ", using configured value");
        }
    }

    private DefaultCodeFormatter _createFormatter(FormatterConfig config) {
        DefaultCodeFormatter formatter = new DefaultCodeFormatter(config);
        formatter.registerPlugin(FileType.OPENSCAD, new OpenScadFormatterPlugin());
        return formatter;
    }

    /**
     * Formats a single file or a whole directory, sorted by path.
     */
    private Map<Path, FormatterResult> _collectResults(DefaultCodeFormatter formatter, Path path, String[] args)
            throws IOException {
        Map<Path, FormatterResult> sorted = new TreeMap<>();

        if (Files.isRegularFile(path)) {
            String source = Files.readString(path, StandardCharsets.UTF_8);
            sorted.put(path, formatter.formatFile(path, source));
            return sorted;
        }

        int threads = Runtime.getRuntime().availableProcessors();
        String threadsStr = _getOptionValue(args, "--threads");
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }

        String includePattern = _getOptionValue(args, "--include");
        for (Map.Entry<Path, FormatterResult> entry : formatter.formatDirectory(path, threads).entrySet()) {
            if (_matchesIncludePattern(entry.getKey(), includePattern)) {
                sorted.put(entry.getKey(), entry.getValue());
            }
        }
        return sorted;
    }

    private static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            String extension = includePattern.substring(1);
            return fileName.endsWith(extension);
        } else if (includePattern.contains("*")) {
            String regex = includePattern
                    .replace(".", "\\.")
                    .replace("*", ".*")
                    .replace("?", ".");
            return fileName.matches(regex);
        } else {
            return fileName.contains(includePattern);
        }
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

    private void _printErrorsBySeverity(Map<Severity, List<FormatterError>> errorsBySeverity, Severity severity) {
        if (errorsBySeverity.containsKey(severity)) {
            for (FormatterError error : errorsBySeverity.get(severity)) {
                switch (severity) {
                    case FATAL:
                    case ERROR:
                        _printError("  " + errorFormatter.formatError(error));
                        break;
                    case WARNING:
                        _printWarning("  " + errorFormatter.formatError(error));
                        break;
                    case INFO:
                        _printInfo("  " + errorFormatter.formatError(error));
                        break;
                }
            }
        }
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
