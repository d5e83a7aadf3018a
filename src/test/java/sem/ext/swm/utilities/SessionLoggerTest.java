package sem.ext.swm.utilities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SessionLoggerTest {

    private static final Logger logger = LoggerFactory.getLogger(SessionLoggerTest.class);

    @TempDir
    Path tempDir;

    @Test
    void testWritesSessionLog() throws IOException {
        Path logFile;
        try (SessionLogger.Session session = SessionLogger.start(tempDir)) {
            assertTrue(session.isActive());
            logFile = session.getLogFile();
            logger.info("inside the session");
        }
        logger.info("after the session");

        assertEquals(tempDir.resolve(SessionLogger.LOG_FILE_NAME), logFile);
        String content = Files.readString(logFile);
        assertTrue(content.contains("inside the session"), content);
        assertFalse(content.contains("after the session"), content);
    }

    @Test
    void testInvalidDirectoryGivesInactiveSession() {
        try (SessionLogger.Session session = SessionLogger.start(tempDir.resolve("missing"))) {
            assertFalse(session.isActive());
            assertNull(session.getLogFile());
        }
        try (SessionLogger.Session session = SessionLogger.start(null)) {
            assertFalse(session.isActive());
        }
    }
}
