package driver;

/*
 * process-wide flags of the decompiler, read from system properties
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug = false;
    public boolean logToConsole = false;
    public boolean logToFile = false;
    public String logLevel = "INFO";
    /* worker threads used for per-function pass dispatch, 1 = sequential */
    public int threads = 1;
    public boolean verifyEachPass = true;

    private Config() {
        isDebug = getFlag("debug");
        logToConsole = getFlag("log.console");
        logToFile = getFlag("log.file");
        logLevel = System.getProperty("log.level", "INFO");
        threads = getInt("threads", 1);
        verifyEachPass = !getFlag("no.verify");
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
     * @return the value, or {@code fallback} when unset or not a positive number
     */
    public static int getInt(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static Config getInstance() {
        return config;
    }
}
