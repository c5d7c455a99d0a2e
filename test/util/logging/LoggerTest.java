package util.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import util.LoggingManager;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class LoggerTest {
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private LogLevel saved;

    @BeforeEach
    public void setUp() {
        saved = LogManager.getRootLevel();
        LoggingManager.setLevel(LogLevel.INFO);
    }

    @AfterEach
    public void tearDown() {
        LoggingManager.setLevel(saved);
    }

    @Test
    public void testPlaceholdersAndThreshold() {
        Logger log = LoggingManager.getLogger(LoggerTest.class);
        try (LoggingManager.Capture ignored = LoggingManager.capture(records::add)) {
            log.debug("hidden {}", 1);
            log.info("block {} of {}", 3, "main");
            log.warn("no args {}");
        }
        log.info("after close");
        assertEquals(2, records.size());
        assertEquals(LogLevel.INFO, records.get(0).level());
        assertEquals("block 3 of main", records.get(0).message());
        assertEquals(LoggerTest.class.getName(), records.get(0).loggerName());
        assertEquals("no args {}", records.get(1).message());
        assertTrue(records.get(0).format().contains("block 3 of main"));
    }

    @Test
    public void testTrailingThrowable() {
        Logger log = LoggingManager.getLogger(LoggerTest.class);
        IllegalStateException boom = new IllegalStateException("boom");
        try (LoggingManager.Capture ignored = LoggingManager.capture(records::add)) {
            log.error("pass {} failed", "dead-code", boom);
        }
        assertEquals(1, records.size());
        assertEquals("pass dead-code failed", records.get(0).message());
        assertSame(boom, records.get(0).thrown());
    }

    @Test
    public void testLevels() {
        assertTrue(LogLevel.DEBUG.isLessSpecificThan(LogLevel.INFO));
        assertFalse(LogLevel.ERROR.isLessSpecificThan(LogLevel.WARN));
        Logger log = LoggingManager.getLogger(LoggerTest.class);
        assertTrue(log.isEnabled(LogLevel.WARN));
        assertFalse(log.isDebugEnabled());
        LoggingManager.setLevel(LogLevel.DEBUG);
        assertTrue(log.isDebugEnabled());
    }
}
