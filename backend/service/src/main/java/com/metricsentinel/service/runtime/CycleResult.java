package com.metricsentinel.service.runtime;

import com.metricsentinel.collectors.delivery.DeliveryOutcome;

public record CycleResult(
        long cycle,
        boolean success,
        String message,
        int candidates,
        int alertsFired,
        DeliveryOutcome delivery
) {
    public static CycleResult delivered(long cycle, int candidates, int alertsFired, DeliveryOutcome delivery) {
        String message = delivery.success()
                ? "Delivered after " + delivery.attempts() + " attempt(s)"
                : "Delivery failed after " + delivery.attempts() + " attempt(s): " + delivery.error();
        return new CycleResult(cycle, delivery.success(), message, candidates, alertsFired, delivery);
    }

    public static CycleResult failure(long cycle, String message) {
        return new CycleResult(cycle, false, message, 0, 0, null);
    }
}
