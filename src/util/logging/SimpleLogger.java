package util.logging;

import driver.StructureDriver;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Logger following the root level of {@link LogManager}. Every line is tagged
 * with the listing being structured and the calling method.
 */
public class SimpleLogger implements Logger {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

    private final String name;

    public SimpleLogger(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return level.passes(LogManager.getRootLevel());
    }

    @Override
    public void log(LogLevel level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }

        StackTraceElement caller = getCaller();
        String methodInfo = caller == null ? ""
                : String.format("[%s:%d] ", caller.getMethodName(), caller.getLineNumber());
        String source = StructureDriver.getInstance().getSource();

        LogManager.writeLog(level, String.format("%s %s [%s] %s - %s%s",
                source != null ? source : "-",
                LocalDateTime.now().format(TIMESTAMP),
                level,
                name,
                methodInfo,
                format(format, args)));
    }

    // first frame outside the logging classes
    private static StackTraceElement getCaller() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        boolean inLogger = false;
        for (StackTraceElement element : stackTrace) {
            boolean logging = element.getClassName().startsWith("util.logging.");
            if (inLogger && !logging) {
                return element;
            }
            inLogger |= logging;
        }
        return null;
    }

    static String format(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder(format.length() + 16 * args.length);
        int argIndex = 0;
        int from = 0;
        int at;
        while ((at = format.indexOf("{}", from)) >= 0) {
            sb.append(format, from, at);
            sb.append(argIndex < args.length ? String.valueOf(args[argIndex++]) : "{}");
            from = at + 2;
        }
        sb.append(format, from, format.length());
        return sb.toString();
    }
}
