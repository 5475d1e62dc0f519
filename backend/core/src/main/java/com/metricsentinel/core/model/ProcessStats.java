package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProcessStats(
        long pid,
        String name,
        @JsonProperty("cpu_percent") double cpuPercent,
        @JsonProperty("memory_percent") double memoryPercent
) {
}
