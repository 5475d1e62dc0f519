package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Upper bounds per metric name, in the order they were declared.
 */
public record ThresholdConfig(Map<String, Double> bounds) {
    public ThresholdConfig {
        Objects.requireNonNull(bounds, "bounds is required");
        LinkedHashMap<String, Double> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : bounds.entrySet()) {
            ordered.put(
                    Objects.requireNonNull(entry.getKey(), "threshold name is required"),
                    Objects.requireNonNull(entry.getValue(), "threshold for " + entry.getKey() + " is required")
            );
        }
        bounds = Collections.unmodifiableMap(ordered);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ThresholdConfig of(Map<String, Double> bounds) {
        return new ThresholdConfig(bounds == null ? Map.of() : bounds);
    }

    public static ThresholdConfig empty() {
        return new ThresholdConfig(Map.of());
    }

    @JsonValue
    @Override
    public Map<String, Double> bounds() {
        return bounds;
    }

    public boolean isEmpty() {
        return bounds.isEmpty();
    }
}
