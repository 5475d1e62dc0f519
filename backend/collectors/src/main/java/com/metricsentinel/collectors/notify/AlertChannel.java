package com.metricsentinel.collectors.notify;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum AlertChannel {
    LOG,
    SLACK,
    EMAIL;

    @JsonCreator
    public static AlertChannel fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("alert channel name is required");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
