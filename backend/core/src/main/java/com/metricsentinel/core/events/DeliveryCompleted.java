package com.metricsentinel.core.events;

import java.time.Instant;

public record DeliveryCompleted(
        Instant timestamp,
        boolean success,
        int attempts,
        int lastStatus,
        String error
) implements Event {
    @Override
    public String type() {
        return "DeliveryCompleted";
    }
}
