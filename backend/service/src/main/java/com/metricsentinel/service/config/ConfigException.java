package com.metricsentinel.service.config;

import java.util.List;

/**
 * Configuration could not be read or failed validation. Fatal at startup; a reload that hits it keeps the old config.
 */
public class ConfigException extends IllegalStateException {
    private final List<String> problems;

    public ConfigException(String message, List<String> problems) {
        super(message);
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of();
    }

    public List<String> problems() {
        return problems;
    }
}
