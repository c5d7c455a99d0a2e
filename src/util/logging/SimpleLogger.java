package util.logging;

import java.time.Instant;

/**
 * Logger whose threshold is the {@link LogManager} root level and whose
 * records go to every registered sink.
 */
public class SimpleLogger implements Logger {
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
        return level != LogLevel.OFF && !level.isLessSpecificThan(LogManager.getRootLevel());
    }

    @Override
    public void log(LogLevel level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        Throwable thrown = null;
        if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable t
                && countPlaceholders(format) < args.length) {
            thrown = t;
        }
        LogManager.dispatch(new LogRecord(Instant.now(), level, name, Thread.currentThread().getName(),
                formatMessage(format, args), thrown));
    }

    /**
     * Substitutes {@code {}} placeholders left to right; surplus placeholders stay literal.
     */
    static String formatMessage(String format, Object... args) {
        if (format == null) {
            return "null";
        }
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder(format.length() + 16 * args.length);
        int argIndex = 0;
        int from = 0;
        int at;
        while ((at = format.indexOf("{}", from)) >= 0 && argIndex < args.length) {
            sb.append(format, from, at).append(args[argIndex++]);
            from = at + 2;
        }
        sb.append(format, from, format.length());
        return sb.toString();
    }

    private static int countPlaceholders(String format) {
        int n = 0;
        if (format == null) {
            return 0;
        }
        for (int at = format.indexOf("{}"); at >= 0; at = format.indexOf("{}", at + 2)) {
            n++;
        }
        return n;
    }
}
