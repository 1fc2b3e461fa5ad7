package driver;

/*
 * configuration of the sanitizer, read from system properties at startup;
 * command line flags override the fields afterwards
 */
public class Config {
    private static Config config = new Config();

    public static final String DEFAULT_ENTRY = "main";

    public boolean isDebug = false;
    // refuse to remove calls that pass pointers instead of warning
    public boolean isStrict = false;
    // function whose first instruction receives the nondet initializers
    public String entryName = DEFAULT_ENTRY;
    public boolean logConsole = true;
    public boolean logFile = false;

    private Config() {
        isDebug = getFlag("debug");
        isStrict = getFlag("strict");
        String entry = System.getProperty("entry");
        if (entry != null && !entry.isBlank()) {
            entryName = entry.trim();
        }
        String console = System.getProperty("log.console");
        logConsole = console == null || console.equalsIgnoreCase("true");
        logFile = getFlag("log.file");
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

    public static Config getInstance() {
        return config;
    }

    /* only for test !!! */
    public static void reset() {
        config = new Config();
    }
}
