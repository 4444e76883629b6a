package com.mathparse.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Central logging for the parser, a thin static layer over java.util.logging.
 * Levels are named INFO, WARNING, SEVERE, DEBUG (FINE) and TRACE (FINEST).
 */
public class LoggingUtil {
    private static final Logger logger = Logger.getLogger("com.mathparse");
    private static volatile boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static String logFileName = null;

    private static class FlushingStreamHandler extends StreamHandler {
        FlushingStreamHandler(java.io.PrintStream stream, Level level) {
            super(stream, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Configure logging from parser settings. Replaces any earlier configuration.
     */
    public static void initialize(ParserSettings settings) {
        configure(settings.getLoggingLevel(),
                settings.isConsoleLoggingEnabled(),
                settings.isFileLoggingEnabled(),
                settings.getLogFileName());
    }

    public static synchronized void configure(String levelStr, boolean consoleEnabled,
                                              boolean fileEnabled, String fileName) {
        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        logFileName = null;
        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                logFileName = fileName;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        logger.fine("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (logFileName != null ? logFileName : "disabled"));
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) return Level.INFO;
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

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            // console handlers wrap System.out/err, which must stay open
            if (handler instanceof FileHandler) {
                handler.close();
            } else {
                handler.flush();
            }
        }
    }

    // SEVERE goes to stderr only, everything else to stdout
    private static void setupConsoleHandlers() {
        FlushingStreamHandler out = new FlushingStreamHandler(System.out, currentLevel);
        out.setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
        logger.addHandler(out);
        logger.addHandler(new FlushingStreamHandler(System.err, Level.SEVERE));
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static boolean isDebugEnabled() {
        ensureInitialized();
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    public static Level getLevel() {
        ensureInitialized();
        return currentLevel;
    }

    private static void ensureInitialized() {
        if (!initialized) {
            configure("INFO", true, false, null);
        }
    }
}
