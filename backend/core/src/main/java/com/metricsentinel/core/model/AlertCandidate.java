package com.metricsentinel.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record AlertCandidate(String key, double value, double threshold, Instant timestamp) {
    public AlertCandidate {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public String describe() {
        return String.format(Locale.ROOT, "%s at %.1f%% exceeds threshold %.1f%%", key, value, threshold);
    }
}
