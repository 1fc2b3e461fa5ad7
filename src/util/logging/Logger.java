package util.logging;

/**
 * Logger facade, {} in a format string is replaced by the next argument.
 */
public interface Logger {
    void trace(String format, Object... args);
    void debug(String format, Object... args);
    void info(String format, Object... args);
    void warn(String format, Object... args);
    void error(String format, Object... args);

    /* error with the stack trace of cause appended */
    void error(String message, Throwable cause);

    boolean isEnabled(LogLevel level);

    default boolean isTraceEnabled() { return isEnabled(LogLevel.TRACE); }
    default boolean isDebugEnabled() { return isEnabled(LogLevel.DEBUG); }
}
