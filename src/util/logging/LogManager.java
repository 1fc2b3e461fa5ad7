package util.logging;

import driver.Config;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manager for creating and configuring Logger instances.
 * <p>
 * Console output always goes to stderr, stdout carries the IR the tool prints.
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, SimpleLogger> loggers = new ConcurrentHashMap<>();
    private static LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    // 配置选项
    private static boolean consoleEnabled = true;
    // records below this level never reach the console
    private static LogLevel consoleLevel = LogLevel.WARN;
    private static boolean fileEnabled = false;
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    private LogManager() {
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    /**
     * Get a logger for the specified name
     * @param name The logger name
     * @param level fixed level of the logger, null to follow the root level
     * @return A Logger instance
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }

        return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, level != null ? level : rootLevel));
    }

    /**
     * Initialize the logging system from {@link Config}
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }

        Config config = Config.getInstance();
        if (config.isDebug) {
            rootLevel = LogLevel.DEBUG;
            consoleLevel = LogLevel.DEBUG;
        }
        consoleEnabled = config.logConsole;
        fileEnabled = config.logFile;

        if (fileEnabled) {
            openLogFile();
        }

        initialized = true;
    }

    private static void openLogFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("warning: cannot create log directory " + logDir.getAbsolutePath());
            fileEnabled = false;
            return;
        }

        try {
            File logFile = new File(logDir, "irsan" + System.currentTimeMillis() + ".log");
            fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
        } catch (IOException e) {
            System.err.println("warning: cannot open log file: " + e.getMessage());
            fileEnabled = false;
        }
    }

    /**
     * Set the root log level, loggers created earlier follow it too
     * @param level The new log level
     */
    public static synchronized void setRootLevel(LogLevel level) {
        rootLevel = level;
        for (SimpleLogger logger : loggers.values()) {
            logger.setLevel(level);
        }
    }

    /**
     * Write log message to configured appenders
     * @param level Log level of the message
     * @param message The formatted log message
     */
    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled && !level.isLessSpecificThan(consoleLevel)) {
            System.err.println(message);
        }

        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }
}
