package util;

import util.logging.LogManager;
import util.logging.Logger;

/**
 * Entry point the passes use to obtain loggers
 */
public final class LoggingManager {
    private LoggingManager() {
    }

    public static Logger getLogger(Class<?> cls) {
        return LogManager.getLogger(cls.getName());
    }

    /**
     * Flush and close the log file once a run is over
     */
    public static void shutdown() {
        LogManager.shutdown();
    }
}
