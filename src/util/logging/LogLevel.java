package util.logging;

/**
 * Severity levels, ordered from most to least verbose.
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5),
    OFF(6);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if this level would be filtered out by a logger set to {@code threshold}
     */
    public boolean isLessSpecificThan(LogLevel threshold) {
        return value < threshold.value;
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
