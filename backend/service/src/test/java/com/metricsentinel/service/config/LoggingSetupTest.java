package com.metricsentinel.service.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingSetupTest {
    @AfterEach
    void restore() {
        LoggingSetup.apply(LogLevel.INFO);
    }

    @Test
    void mapsConfiguredLevelOntoApplicationLoggers() {
        LoggingSetup.apply(LogLevel.DEBUG);
        assertEquals(Level.FINE, LoggingSetup.appLogger().getLevel());
        assertTrue(Logger.getLogger("com.metricsentinel.service.runtime.CollectionLoop").isLoggable(Level.FINE));

        LoggingSetup.apply(LogLevel.ERROR);
        assertFalse(Logger.getLogger("com.metricsentinel.collectors.delivery.DeliveryClient").isLoggable(Level.WARNING));
    }

    @Test
    void parsesLevelNamesCaseInsensitively() {
        assertEquals(LogLevel.WARNING, LogLevel.fromName(" warning "));
        assertEquals(LogLevel.INFO, LogLevel.fromName(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.fromName("TRACE"));
    }
}
