package util.logging;

/**
 * Severity of a log record, ordered from the most verbose to the most severe.
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /* true if records at this level are filtered out by a logger set to threshold */
    public boolean isLessSpecificThan(LogLevel threshold) {
        return this.value < threshold.value;
    }

    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
