package com.mccmaze.maze.util;

import com.mccmaze.maze.configuration.MazeConfiguration;

import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Centralized logging for maze generation and analysis.
 * Thin static wrapper over java.util.logging with a single named logger.
 *
 * Console output goes to stdout, except SEVERE records which go to stderr.
 * Every record carries the name of the thread that logged it, since
 * population analysis runs on a worker pool.
 */
public class LoggingUtil {

    public static final String LOGGER_NAME = "com.mccmaze.maze";
    private static final String DEFAULT_LOG_FILE = "maze-structure.log";

    private static final Logger logger = Logger.getLogger(LOGGER_NAME);
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static String activeLogFile;

    /**
     * Single-line format: time, level, thread, message and any stack trace.
     */
    static class MazeLogFormatter extends Formatter {
        private final SimpleFormatter traceFormatter = new SimpleFormatter();

        @Override
        public String format(LogRecord record) {
            StringBuilder line = new StringBuilder();
            line.append(String.format("%1$tF %1$tT.%1$tL %2$-7s [%3$s] %4$s%n",
                    record.getMillis(), record.getLevel().getName(),
                    Thread.currentThread().getName(), formatMessage(record)));
            if (record.getThrown() != null) {
                line.append(traceFormatter.format(record));
            }
            return line.toString();
        }
    }

    // Flushes per record so progress lines from worker threads appear in order
    private static class ConsoleStreamHandler extends StreamHandler {
        private final Level ceiling;

        ConsoleStreamHandler(PrintStream stream, Level floor, Level ceiling) {
            super(stream, new MazeLogFormatter());
            this.ceiling = ceiling;
            setLevel(floor);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            if (ceiling != null && record.getLevel().intValue() >= ceiling.intValue()) {
                return;
            }
            super.publish(record);
            flush();
        }
    }

    /**
     * Initialize logging from the maze configuration.
     */
    public static void initialize(MazeConfiguration config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    /**
     * Initialize logging explicitly. Later calls are ignored.
     *
     * @param levelStr SEVERE/ERROR, WARNING/WARN, INFO, DEBUG or TRACE
     * @param consoleEnabled Log to stdout/stderr
     * @param fileEnabled Log to a file
     * @param fileName Log file name when file logging is enabled
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled,
                                               String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }

        if (consoleEnabled) {
            logger.addHandler(new ConsoleStreamHandler(System.out, currentLevel, Level.SEVERE));
            logger.addHandler(new ConsoleStreamHandler(System.err, Level.SEVERE, null));
        }

        String fileProblem = null;
        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new MazeLogFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                activeLogFile = fileName;
            } catch (IOException e) {
                fileProblem = "Failed to open log file " + fileName + ": " + e.getMessage();
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        if (fileProblem != null) {
            logger.warning(fileProblem);
        }
        logger.fine("Logging initialized: level=" + currentLevel.getName()
                + ", console=" + consoleEnabled
                + ", file=" + (activeLogFile != null ? activeLogFile : "disabled"));
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            default:
                return Level.INFO;
        }
    }

    public static void debug(String message) {
        log(Level.FINE, message, null);
    }

    public static void info(String message) {
        log(Level.INFO, message, null);
    }

    public static void warn(String message) {
        log(Level.WARNING, message, null);
    }

    public static void warn(String message, Throwable t) {
        log(Level.WARNING, message, t);
    }

    public static void error(String message, Throwable t) {
        log(Level.SEVERE, message, t);
    }

    private static void log(Level level, String message, Throwable t) {
        if (!initialized) {
            initialize("INFO", true, false, DEFAULT_LOG_FILE);
        }
        if (t == null) {
            logger.log(level, message);
        } else {
            logger.log(level, message, t);
        }
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    public static boolean isInitialized() {
        return initialized;
    }
}
