package util;

import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.Logger;
import driver.Config;

/**
 * Entry point the rest of the code uses to get a logger
 */
public class LoggingManager {
    private static boolean inited = false;

    public static synchronized void init() {
        if (inited) return;

        LogManager.init();

        if (Config.getInstance().isDebug) {
            LogManager.setRootLevel(LogLevel.DEBUG);
        }

        inited = true;
    }

    public static Logger getLogger(Class<?> cls) {
        if (!inited) init();
        return LogManager.getLogger(cls);
    }

    public static Logger getLogger(Class<?> cls, LogLevel level) {
        if (!inited) init();
        return LogManager.getLogger(cls, level);
    }
}
