package util.logging;

import java.time.Instant;

/**
 * One formatted log event as handed to a {@link LogSink}.
 */
public record LogRecord(Instant time, LogLevel level, String loggerName, String thread, String message,
        Throwable thrown) {

    /**
     * @return the record in the layout written to the console and the log file
     */
    public String format() {
        String shortName = loggerName.substring(loggerName.lastIndexOf('.') + 1);
        return time + " [" + thread + "] " + level + " " + shortName + " - " + message;
    }
}
