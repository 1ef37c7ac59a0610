package org.scalebaron.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the log of a batch run into its output folder.
 *
 * <p>While enabled, every log event also goes to {@code <output>/scalebaron_batch.log}, so the
 * reasons for failed samples stay next to the artifacts they concern:
 * <pre>{@code
 * try (BatchLogger.Session session = BatchLogger.start(outputFolder)) {
 *     controller.processAllElements();
 * }
 * }</pre>
 *
 * <p>The folder is also published as the system property {@value #PROPERTY_NAME} for
 * configurations that reference it.
 *
 * @author Mike Nelson
 * @since 0.3
 */
public class BatchLogger {
    private static final Logger logger = LoggerFactory.getLogger(BatchLogger.class);

    public static final String PROPERTY_NAME = "scalebaron.batch.logdir";
    public static final String LOG_FILE = "scalebaron_batch.log";
    private static final String APPENDER_NAME = "BATCH_LOG";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private static FileAppender<ILoggingEvent> appender;
    private static Path currentDir;

    private BatchLogger() {
    }

    /**
     * Starts logging into {@code outputDir}, creating it if needed. A previous batch log is closed
     * first.
     *
     * @return true if the batch log is active
     */
    public static synchronized boolean enable(Path outputDir) {
        if (outputDir == null) {
            logger.warn("Cannot enable batch logging: output folder is null");
            return false;
        }
        if (appender != null) {
            disable();
        }
        try {
            Files.createDirectories(outputDir);
        } catch (java.io.IOException e) {
            logger.warn("Cannot enable batch logging: could not create {}", outputDir, e);
            return false;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.warn("Batch logging needs Logback; found {}", LoggerFactory.getILoggerFactory().getClass().getName());
            return false;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setContext(context);
        fileAppender.setName(APPENDER_NAME);
        fileAppender.setFile(outputDir.resolve(LOG_FILE).toString());
        fileAppender.setAppend(true);
        fileAppender.setEncoder(encoder);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
        appender = fileAppender;
        currentDir = outputDir;
        System.setProperty(PROPERTY_NAME, outputDir.toString());
        logger.info("Batch logging enabled: {}", outputDir.resolve(LOG_FILE));
        return true;
    }

    /**
     * Stops the batch log. Does nothing if none is active.
     */
    public static synchronized void disable() {
        if (appender == null) {
            return;
        }
        logger.info("Batch logging disabled: {}", currentDir.resolve(LOG_FILE));
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(appender);
        }
        appender.stop();
        appender = null;
        currentDir = null;
        System.clearProperty(PROPERTY_NAME);
    }

    public static synchronized boolean isEnabled() {
        return appender != null;
    }

    /**
     * @return the folder currently logged to, or null
     */
    public static synchronized Path getCurrentDir() {
        return currentDir;
    }

    public static Session start(Path outputDir) {
        return new Session(outputDir);
    }

    /**
     * Batch log session for try-with-resources.
     */
    public static class Session implements AutoCloseable {
        private final boolean active;

        private Session(Path outputDir) {
            this.active = enable(outputDir);
        }

        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            if (active) {
                disable();
            }
        }
    }
}
