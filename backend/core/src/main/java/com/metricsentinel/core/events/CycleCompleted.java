package com.metricsentinel.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        long cycle,
        boolean success,
        long durationMillis,
        int alertsFired,
        String error
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
