package com.phillippitts.actiontracker.service.sink;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.layout.PatternLayout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File channel for non-accumulated formats: appends each summary to a dedicated file through a
 * Log4j2 {@link FileAppender} registered at runtime.
 *
 * <p>Lines look like {@code [2025-10-17 15:42:32] INFO: <summary>}. The logger is not additive,
 * so summaries do not also reach the application's root appenders.
 */
public final class FileLogSummarySink implements SummarySink, AutoCloseable {

    static final String PATTERN = "[%d{yyyy-MM-dd HH:mm:ss}] %level: %msg%n";
    private static final String LOGGER_PREFIX = "action-tracker.file.";

    private final LoggerContext context;
    private final FileAppender appender;
    private final String loggerName;
    private final Logger logger;

    /**
     * @param logFile target file; parent directories are created
     * @throws UncheckedIOException if the parent directory cannot be created
     */
    public FileLogSummarySink(Path logFile) {
        Path target = logFile.toAbsolutePath().normalize();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create log directory for " + target, e);
        }
        this.context = (LoggerContext) LogManager.getContext(false);
        this.loggerName = LOGGER_PREFIX + Integer.toHexString(target.hashCode());
        Configuration config = context.getConfiguration();

        PatternLayout layout = PatternLayout.newBuilder()
                .withConfiguration(config)
                .withPattern(PATTERN)
                .build();
        this.appender = FileAppender.newBuilder()
                .setName(loggerName)
                .withFileName(target.toString())
                .withAppend(true)
                .setLayout(layout)
                .setConfiguration(config)
                .build();
        appender.start();
        config.addAppender(appender);

        LoggerConfig loggerConfig = new LoggerConfig(loggerName, Level.INFO, false);
        loggerConfig.addAppender(appender, Level.INFO, null);
        config.addLogger(loggerName, loggerConfig);
        context.updateLoggers();
        this.logger = context.getLogger(loggerName);
    }

    @Override
    public void write(String text) {
        logger.info("\n{}", text);
    }

    /** Detaches the logger and stops the appender. */
    @Override
    public void close() {
        Configuration config = context.getConfiguration();
        config.removeLogger(loggerName);
        context.updateLoggers();
        appender.stop();
    }
}
