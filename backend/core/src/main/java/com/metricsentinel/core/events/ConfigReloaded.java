package com.metricsentinel.core.events;

import java.time.Instant;

public record ConfigReloaded(Instant timestamp, String source, int intervalSeconds) implements Event {
    @Override
    public String type() {
        return "ConfigReloaded";
    }
}
