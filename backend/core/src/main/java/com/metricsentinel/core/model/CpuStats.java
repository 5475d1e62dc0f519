package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CpuStats(
        double percent,
        int count,
        @JsonProperty("count_logical") int countLogical,
        @JsonProperty("load_avg") List<Double> loadAverage
) {
    public CpuStats {
        loadAverage = loadAverage == null ? null : List.copyOf(loadAverage);
    }

    public static CpuStats ofPercent(double percent) {
        int processors = Runtime.getRuntime().availableProcessors();
        return new CpuStats(percent, processors, processors, null);
    }
}
