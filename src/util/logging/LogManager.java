package util.logging;

import driver.Config;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates loggers and routes their lines to the console and the log file.
 * Both appenders are off unless {@code log.console} / {@code log.file} is set.
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static volatile LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    private static boolean consoleEnabled = false;
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    private LogManager() {
    }

    public static Logger getLogger(String name) {
        if (!initialized) {
            init();
        }
        return loggers.computeIfAbsent(name, SimpleLogger::new);
    }

    /**
     * Initialize the logging system from {@link Config}.
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }

        Config config = Config.getInstance();
        rootLevel = config.logLevel;
        consoleEnabled = config.logToConsole;
        if (config.logToFile) {
            openLogFile();
        }

        initialized = true;
    }

    private static void openLogFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("Cannot create log directory " + logDir.getAbsolutePath());
            return;
        }

        try {
            File logFile = new File(logDir, "structure" + System.currentTimeMillis() + ".log");
            synchronized (FILE_LOCK) {
                fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
            }
        } catch (IOException e) {
            System.err.println("Cannot open log file: " + e.getMessage());
        }
    }

    public static LogLevel getRootLevel() {
        return rootLevel;
    }

    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.passes(LogLevel.WARN)) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.println(message);
            }
        }
    }

    /**
     * Close the log file
     */
    public static void shutdown() {
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }
}
