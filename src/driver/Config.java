package driver;

import solver.OracleType;
import util.logging.LogLevel;

/*
 * configuration of the structurer, read from system properties
 */
public class Config {
    private static Config config = new Config();

    public static final int DEFAULT_SOLVER_TIMEOUT_MS = 5000;
    public static final int DEFAULT_MAX_ITERATIONS = 64;

    public boolean isDebug = false;
    public boolean logToConsole = false;
    public boolean logToFile = false;
    public boolean verify = true;
    public LogLevel logLevel = LogLevel.INFO;

    public OracleType oracle = OracleType.Z3;
    public int solverTimeoutMs = DEFAULT_SOLVER_TIMEOUT_MS;
    public int maxIterations = DEFAULT_MAX_ITERATIONS;

    private Config() {
        isDebug = getFlag("debug");
        logToConsole = getFlag("log.console");
        logToFile = getFlag("log.file");
        logLevel = LogLevel.parse(System.getProperty("log.level"), isDebug ? LogLevel.DEBUG : LogLevel.INFO);
        verify = !"false".equalsIgnoreCase(System.getProperty("verify"));
        oracle = OracleType.fromName(System.getProperty("oracle"), OracleType.Z3);
        solverTimeoutMs = getInt("solver.timeout", DEFAULT_SOLVER_TIMEOUT_MS);
        maxIterations = getInt("max.iterations", DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    /**
     * Read a positive integer system property.
     * @param name the system property name
     * @param fallback value used when the property is absent or malformed
     */
    public static int getInt(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        int value = parsePositive(raw);
        return value > 0 ? value : fallback;
    }

    /**
     * Parse a positive integer, 0 when {@code raw} is not one.
     */
    public static int parsePositive(String raw) {
        try {
            int value = Integer.parseInt(raw.trim());
            return Math.max(value, 0);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static Config getInstance() {
        return config;
    }

    /**
     * Re-read the system properties (used by tests that change them)
     */
    public static void reload() {
        config = new Config();
    }
}
