package util.logging;

import driver.Config;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the root level and the sinks. Nothing is written until a sink is
 * added, either from {@link Config} (-Dlog.console=true, -Dlog.file=true) or
 * through {@link #addSink}.
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static final List<LogSink> sinks = new CopyOnWriteArrayList<>();
    private static volatile LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;
    private static PrintWriter fileWriter;

    private LogManager() {
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static synchronized Logger getLogger(String name) {
        if (!initialized) {
            init();
        }
        return loggers.computeIfAbsent(name, SimpleLogger::new);
    }

    public static synchronized void init() {
        if (initialized) {
            return;
        }
        Config config = Config.getInstance();
        rootLevel = config.isDebug ? LogLevel.DEBUG : LogLevel.parse(config.logLevel, LogLevel.INFO);
        if (config.logToConsole) {
            addSink(LogManager::writeConsole);
        }
        if (config.logToFile) {
            openLogFile();
        }
        initialized = true;
    }

    private static void openLogFile() {
        Path dir = Path.of(LOG_DIRECTORY);
        try {
            Files.createDirectories(dir);
            Path file = dir.resolve("nldec" + System.currentTimeMillis() + ".log");
            PrintWriter writer = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), true);
            synchronized (LogManager.class) {
                fileWriter = writer;
            }
            addSink(record -> {
                synchronized (LogManager.class) {
                    if (fileWriter != null) {
                        fileWriter.println(record.format());
                        if (record.thrown() != null) {
                            record.thrown().printStackTrace(fileWriter);
                        }
                    }
                }
            });
        } catch (IOException e) {
            System.err.println("cannot open log file in " + dir.toAbsolutePath() + ": " + e.getMessage());
        }
    }

    private static void writeConsole(LogRecord record) {
        if (record.level().isLessSpecificThan(LogLevel.WARN)) {
            System.out.println(record.format());
        } else {
            System.err.println(record.format());
            if (record.thrown() != null) {
                record.thrown().printStackTrace(System.err);
            }
        }
    }

    public static void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    public static LogLevel getRootLevel() {
        return rootLevel;
    }

    public static void addSink(LogSink sink) {
        sinks.add(sink);
    }

    public static void removeSink(LogSink sink) {
        sinks.remove(sink);
    }

    static void dispatch(LogRecord record) {
        for (LogSink sink : sinks) {
            sink.accept(record);
        }
    }

    /**
     * Closes the log file, if one was opened.
     */
    public static synchronized void shutdown() {
        if (fileWriter != null) {
            fileWriter.close();
            fileWriter = null;
        }
    }
}
