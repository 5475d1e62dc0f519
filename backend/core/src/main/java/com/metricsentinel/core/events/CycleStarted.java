package com.metricsentinel.core.events;

import java.time.Instant;

public record CycleStarted(Instant timestamp, long cycle) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}
