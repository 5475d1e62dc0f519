package com.metricsentinel.service.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class LoggingSetup {
    static final String ROOT_LOGGER = "com.metricsentinel";

    // strong reference so the configured level is not lost to logger GC
    private static final Logger APP_LOGGER = Logger.getLogger(ROOT_LOGGER);

    private LoggingSetup() {
    }

    public static void initialize() {
        try (InputStream in = LoggingSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            APP_LOGGER.warning("Could not read bundled logging.properties: " + e.getMessage());
        }
    }

    public static void apply(LogLevel level) {
        APP_LOGGER.setLevel(level.julLevel());
    }

    static Logger appLogger() {
        return APP_LOGGER;
    }
}
