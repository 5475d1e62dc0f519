package com.metricsentinel.core.events;

import java.time.Instant;

public record TickSkipped(Instant timestamp, long inFlightCycle) implements Event {
    @Override
    public String type() {
        return "TickSkipped";
    }
}
