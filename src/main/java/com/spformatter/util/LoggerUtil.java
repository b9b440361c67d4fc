package com.spformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Configures java.util.logging for the formatter and hands out loggers.
 * The classpath {@code /logging.properties} wins when present; otherwise a console
 * handler is installed. File logging is opt-in through {@link #enableFileLogging(Path)}.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;
    private static FileHandler fileHandler;

    /**
     * Initializes the logging system once per JVM.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                _configureConsoleLogging();
            }
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            _configureConsoleLogging();
        }
        initialized = true;
    }

    private static void _configureConsoleLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the console logging level, e.g. FINE for {@code --verbose}.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        initialize();

        Logger.getLogger("com.spformatter").setLevel(level);
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    /**
     * Adds (or moves) a file handler that records every level.
     */
    public static synchronized void enableFileLogging(Path path) {
        initialize();
        try {
            if (fileHandler != null) {
                rootLogger.removeHandler(fileHandler);
                fileHandler.close();
            }
            fileHandler = new FileHandler(path.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to open log file: " + path, e);
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static synchronized void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
        fileHandler = null;
    }
}
