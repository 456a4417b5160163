package com.scadformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.*;

/**
 * Configures java.util.logging for the formatter. Configuration comes from the
 * bundled {@code /logging.properties}; without it a console handler and a
 * {@code scad-formatter.log} file handler are installed.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;
    private static Path logFilePath = Paths.get("scad-formatter.log");

    /**
     * Initializes the logging system once per process.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            e.printStackTrace();
        }
    }

    private static void configureBasicLogging() throws IOException {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.addHandler(fileHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the console logging level. The CLI lowers it to FINE for --verbose.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;

        if (!initialized) {
            initialize();
        }
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        Logger.getLogger("com.scadformatter").setLevel(level.intValue() < Level.INFO.intValue() ? level : Level.INFO);
    }

    /**
     * Sets the log file path, replacing any installed file handler.
     */
    public static synchronized void setLogFilePath(Path path) {
        logFilePath = path;

        if (initialized) {
            try {
                for (Handler handler : rootLogger.getHandlers()) {
                    if (handler instanceof FileHandler) {
                        rootLogger.removeHandler(handler);
                        handler.close();
                    }
                }

                FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                rootLogger.addHandler(fileHandler);
            } catch (IOException e) {
                Logger.getLogger(LoggerUtil.class.getName()).log(
                        Level.SEVERE, "Failed to update log file path", e);
            }
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    /**
     * Gets a logger for a specific name.
     */
    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }
}
