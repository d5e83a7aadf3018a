package sem.ext.swm.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copies log output of a discovery run into the session folder.
 *
 * <p>While a session is open, everything logged under {@code sem.ext.swm} is also written
 * to {@code <session-directory>/discovery.log}, next to the collections it describes.</p>
 *
 * <pre>{@code
 * try (SessionLogger.Session session = SessionLogger.start(sessionDir)) {
 *     discovery.discoverAll(store);
 * }
 * }</pre>
 *
 * <p>Logging problems never fail the run; an inactive session is returned instead.</p>
 */
public class SessionLogger {
    private static final Logger logger = LoggerFactory.getLogger(SessionLogger.class);

    public static final String LOG_FILE_NAME = "discovery.log";
    static final String BASE_LOGGER = "sem.ext.swm";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private SessionLogger() {
    }

    /**
     * Starts writing to {@code <directory>/discovery.log}.
     *
     * @param directory existing session directory
     * @return the session; close it to detach the file
     */
    public static Session start(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            logger.warn("Cannot enable session logging: invalid directory: {}", directory);
            return new Session(null);
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.warn("Session logging needs Logback as the SLF4J backend");
            return new Session(null);
        }

        try {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(PATTERN);
            encoder.start();

            FileAppender<ILoggingEvent> appender = new FileAppender<>();
            appender.setContext(context);
            appender.setName("SESSION_" + directory.getFileName());
            appender.setFile(directory.resolve(LOG_FILE_NAME).toString());
            appender.setAppend(true);
            appender.setEncoder(encoder);
            appender.start();

            context.getLogger(BASE_LOGGER).addAppender(appender);
            logger.info("Session logging enabled: {}", directory.resolve(LOG_FILE_NAME));
            return new Session(appender);
        } catch (Exception e) {
            logger.warn("Could not enable session logging in {}", directory, e);
            return new Session(null);
        }
    }

    /**
     * Open session log. Closing detaches and stops the file appender.
     */
    public static class Session implements AutoCloseable {
        private final FileAppender<ILoggingEvent> appender;

        private Session(FileAppender<ILoggingEvent> appender) {
            this.appender = appender;
        }

        public boolean isActive() {
            return appender != null && appender.isStarted();
        }

        public Path getLogFile() {
            return appender == null ? null : Path.of(appender.getFile());
        }

        @Override
        public void close() {
            if (appender == null) {
                return;
            }
            logger.info("Session logging disabled: {}", appender.getFile());
            LoggerContext context = (LoggerContext) appender.getContext();
            context.getLogger(BASE_LOGGER).detachAppender(appender);
            appender.stop();
        }
    }
}
