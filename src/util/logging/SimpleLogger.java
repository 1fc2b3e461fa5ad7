package util.logging;

import driver.CompilerDriver;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Implementation of the Logger interface
 */
public class SimpleLogger implements Logger {
    private final String name;
    private volatile LogLevel level;
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");

    public SimpleLogger(String name, LogLevel level) {
        this.name = name;
        this.level = level;
    }

    void setLevel(LogLevel level) {
        this.level = level;
    }

    @Override
    public void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    @Override
    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    @Override
    public void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    @Override
    public void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    @Override
    public void error(String message, Throwable cause) {
        if (!isEnabled(LogLevel.ERROR)) {
            return;
        }
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        write(LogLevel.ERROR, message + System.lineSeparator() + trace);
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return !level.isLessSpecificThan(this.level);
    }

    private void log(LogLevel level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        write(level, formatMessage(format, args));
    }

    private void write(LogLevel level, String message) {
        // Get caller information
        StackTraceElement caller = getCaller();
        String methodInfo = "";

        if (caller != null) {
            methodInfo = String.format("[%s:%d] ", caller.getMethodName(), caller.getLineNumber());
        }

        String source = CompilerDriver.getInstance().getSource();
        String timestamp = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss,SSS").format(new Date());
        String logMessage = String.format("%s %s [%s] %s - %s%s",
                source != null ? source : "-",
                timestamp,
                level,
                name,
                methodInfo,
                message);

        // Send to appenders
        LogManager.writeLog(level, logMessage);
    }

    /**
     * Gets the calling class/method from the stack trace
     */
    private StackTraceElement getCaller() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();

        // Find the first element after this logging class
        String loggerClassName = SimpleLogger.class.getName();
        boolean foundLogger = false;

        for (StackTraceElement element : stackTrace) {
            if (foundLogger && !element.getClassName().equals(loggerClassName)
                    && !element.getClassName().startsWith("java.lang.reflect.")
                    && !element.getClassName().equals(LogManager.class.getName())) {
                return element;
            }

            if (element.getClassName().equals(loggerClassName)) {
                foundLogger = true;
            }
        }

        return null;
    }

    private String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);

        while (matcher.find()) {
            if (argIndex < args.length) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(args[argIndex++])));
            } else {
                matcher.appendReplacement(result, "{}");
            }
        }
        matcher.appendTail(result);

        return result.toString();
    }
}
