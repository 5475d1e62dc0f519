package com.metricsentinel.collectors.alerts;

import com.metricsentinel.core.model.AlertCandidate;
import com.metricsentinel.core.model.MetricSnapshot;
import com.metricsentinel.core.model.ThresholdConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares snapshot readings against configured upper bounds.
 * <p>
 * A threshold named {@code cpu} is matched against the reading {@code cpu_percent}, falling back to a reading
 * named exactly {@code cpu}. Only values strictly above the bound produce a candidate, and candidates come out in
 * threshold declaration order. Thresholds without a matching reading are skipped.
 */
public final class ThresholdEvaluator {
    private static final String PERCENT_SUFFIX = "_percent";

    public List<AlertCandidate> evaluate(MetricSnapshot snapshot, ThresholdConfig thresholds) {
        Map<String, Double> readings = snapshot.readings();
        List<AlertCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, Double> threshold : thresholds.bounds().entrySet()) {
            Double value = lookup(readings, threshold.getKey());
            if (value == null) {
                continue;
            }
            double bound = threshold.getValue();
            if (value > bound) {
                candidates.add(new AlertCandidate(threshold.getKey(), value, bound, snapshot.timestamp()));
            }
        }
        return List.copyOf(candidates);
    }

    private static Double lookup(Map<String, Double> readings, String key) {
        Double value = readings.get(key + PERCENT_SUFFIX);
        return value != null ? value : readings.get(key);
    }
}
