package util.logging;

/**
 * Destination for log records. Called from whichever thread logged, so
 * implementations must be thread safe.
 */
@FunctionalInterface
public interface LogSink {
    void accept(LogRecord record);
}
