package com.metricsentinel.collectors.delivery;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

public record EndpointConfig(URI url, Duration timeout, int maxRetries, Duration retryDelay) {
    public EndpointConfig {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(timeout, "timeout is required");
        Objects.requireNonNull(retryDelay, "retryDelay is required");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0");
        }
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Longest a single delivery can hold the cycle: every attempt timing out plus every retry wait.
     */
    public Duration worstCaseDuration() {
        return timeout.multipliedBy(maxAttempts()).plus(retryDelay.multipliedBy(maxRetries));
    }
}
