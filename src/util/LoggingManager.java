package util;

import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.LogSink;
import util.logging.Logger;

/**
 * Entry point classes use to obtain loggers; initializes {@link LogManager} once.
 */
public class LoggingManager {
    private static boolean inited = false;

    private LoggingManager() {
    }

    public static synchronized void init() {
        if (!inited) {
            LogManager.init();
            inited = true;
        }
    }

    public static Logger getLogger(Class<?> cls) {
        init();
        return LogManager.getLogger(cls);
    }

    public static void setLevel(LogLevel level) {
        init();
        LogManager.setRootLevel(level);
    }

    /**
     * Routes records to {@code sink} until the returned handle is closed.
     */
    public static Capture capture(LogSink sink) {
        init();
        LogManager.addSink(sink);
        return () -> LogManager.removeSink(sink);
    }

    public interface Capture extends AutoCloseable {
        @Override
        void close();
    }
}
