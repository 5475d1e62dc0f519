package com.metricsentinel.core.events;

import java.time.Instant;

public record AlertFired(
        Instant timestamp,
        String key,
        double value,
        double threshold,
        String hostname
) implements Event {
    @Override
    public String type() {
        return "AlertFired";
    }
}
