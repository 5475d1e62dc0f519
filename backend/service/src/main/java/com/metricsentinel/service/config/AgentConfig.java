package com.metricsentinel.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricsentinel.core.model.ThresholdConfig;

/**
 * Whole agent configuration as read from YAML. Instances are never modified; a reload builds a new one.
 */
public record AgentConfig(
        EndpointSettings endpoint,
        @JsonProperty("interval_seconds") Integer intervalSeconds,
        @JsonProperty("log_level") LogLevel logLevel,
        MetricsSettings metrics,
        AlertsSettings alerts,
        ThresholdConfig thresholds,
        String hostname
) {
    public AgentConfig {
        logLevel = logLevel == null ? LogLevel.INFO : logLevel;
        metrics = metrics == null ? MetricsSettings.defaults() : metrics;
        alerts = alerts == null ? AlertsSettings.defaults() : alerts;
        thresholds = thresholds == null ? ThresholdConfig.empty() : thresholds;
    }
}
