package com.metricsentinel.service.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;
import java.util.logging.Level;

public enum LogLevel {
    DEBUG(Level.FINE),
    INFO(Level.INFO),
    WARNING(Level.WARNING),
    ERROR(Level.SEVERE);

    private final Level julLevel;

    LogLevel(Level julLevel) {
        this.julLevel = julLevel;
    }

    public Level julLevel() {
        return julLevel;
    }

    @JsonCreator
    public static LogLevel fromName(String name) {
        if (name == null) {
            return INFO;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
