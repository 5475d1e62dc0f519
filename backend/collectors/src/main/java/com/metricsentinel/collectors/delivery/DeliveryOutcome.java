package com.metricsentinel.collectors.delivery;

import java.time.Duration;

/**
 * Result of one delivery. {@code lastStatus} is 0 when no response was received.
 */
public record DeliveryOutcome(boolean success, int attempts, int lastStatus, String error, Duration elapsed) {
    public static DeliveryOutcome success(int attempts, int status, Duration elapsed) {
        return new DeliveryOutcome(true, attempts, status, null, elapsed);
    }

    public static DeliveryOutcome failure(int attempts, int lastStatus, String error, Duration elapsed) {
        return new DeliveryOutcome(false, attempts, lastStatus, error, elapsed);
    }
}
