package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class MatcherLogger {
    public static final String LOG_FILE_PROPERTY = "matcher.log.file";

    private static Logger logger;

    static {
        try {
            logger = Logger.getLogger(MatcherLogger.class.getName());
            logger.setUseParentHandlers(false); // Disable default console handler

            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setLevel(Level.INFO);
            logger.addHandler(consoleHandler);

            // File output only when the property names a file
            String logFile = System.getProperty(LOG_FILE_PROPERTY);
            if (logFile != null && !logFile.isBlank()) {
                FileHandler fileHandler = new FileHandler(logFile, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            }

            logger.setLevel(Level.ALL);

        } catch (Exception e) {
            System.err.println("Failed to initialize logger: " + e.getMessage());
        }
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable t) {
        logger.log(Level.SEVERE, msg, t);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }
}
