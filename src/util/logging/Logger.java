package util.logging;

/**
 * Named logger with {@code {}} placeholder formatting. Implementations only
 * decide whether a level is enabled and how a formatted line is written.
 */
public interface Logger {
    String getName();

    boolean isEnabled(LogLevel level);

    void log(LogLevel level, String format, Object... args);

    default void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    default void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    default void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    default void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    default void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    default boolean isDebugEnabled() {
        return isEnabled(LogLevel.DEBUG);
    }
}
