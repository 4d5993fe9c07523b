package com.phillippitts.actiontracker.service.sink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Print channel: writes summaries at INFO to the {@value #LOGGER_NAME} logger, starting on a new
 * line so multi-line tables stay aligned under the log prefix.
 */
public final class LoggerSummarySink implements SummarySink {

    public static final String LOGGER_NAME = "action-tracker";

    private final Logger logger;

    public LoggerSummarySink() {
        this(LogManager.getLogger(LOGGER_NAME));
    }

    LoggerSummarySink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void write(String text) {
        logger.info("\n{}", text);
    }
}
