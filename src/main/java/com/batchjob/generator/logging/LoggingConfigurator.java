package com.batchjob.generator.logging;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Runtime adjustments to the logback configuration loaded from logback.xml.
 */
public final class LoggingConfigurator {

    static final String APPLICATION_LOGGER = "com.batchjob";

    private LoggingConfigurator() {
    }

    /**
     * Switches the application loggers to DEBUG.
     */
    public static void enableVerbose() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            Logger logger = context.getLogger(APPLICATION_LOGGER);
            logger.setLevel(Level.DEBUG);
        }
    }
}
