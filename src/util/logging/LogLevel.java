package util.logging;

/**
 * Log levels ordered from the most verbose to the most severe.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    /**
     * @return true if a logger configured at {@code threshold} prints messages of this level
     */
    public boolean passes(LogLevel threshold) {
        return this != OFF && compareTo(threshold) >= 0;
    }

    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        try {
            return LogLevel.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
