package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class KmpLogger {
    // System property naming an optional log file, opened in append mode.
    public static final String LOG_FILE_PROPERTY = "kmp.log.file";

    private static Logger logger;

    static {
        try {
            logger = Logger.getLogger(KmpLogger.class.getName());
            logger.setUseParentHandlers(false);

            // Console output goes to stderr and must not mix with the report on stdout
            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setLevel(Level.WARNING);
            logger.addHandler(consoleHandler);

            String logFile = System.getProperty(LOG_FILE_PROPERTY);
            if (logFile != null && !logFile.isBlank()) {
                FileHandler fileHandler = new FileHandler(logFile, true);
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            }

            logger.setLevel(Level.ALL);

        } catch (Exception e) {
            System.err.println("Failed to initialize logger: " + e.getMessage());
        }
    }

    public static Logger logger() {
        return logger;
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

}
