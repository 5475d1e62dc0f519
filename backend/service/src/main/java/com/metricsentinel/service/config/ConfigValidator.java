package com.metricsentinel.service.config;

import com.metricsentinel.collectors.notify.AlertChannel;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class ConfigValidator {
    private ConfigValidator() {
    }

    static List<String> problems(AgentConfig config) {
        List<String> problems = new ArrayList<>();
        EndpointSettings endpoint = config.endpoint();
        if (endpoint == null || endpoint.url() == null || endpoint.url().isBlank()) {
            problems.add("endpoint.url is required");
        } else {
            if (!isHttpUrl(endpoint.url())) {
                problems.add("endpoint.url must be an http(s) URL: " + endpoint.url());
            }
            if (endpoint.timeout() <= 0) {
                problems.add("endpoint.timeout must be > 0");
            }
            if (endpoint.maxRetries() < 0) {
                problems.add("endpoint.max_retries must be >= 0");
            }
            if (endpoint.retryDelay() < 0) {
                problems.add("endpoint.retry_delay must be >= 0");
            }
        }

        if (config.intervalSeconds() == null) {
            problems.add("interval_seconds is required");
        } else if (config.intervalSeconds() <= 0) {
            problems.add("interval_seconds must be > 0");
        }

        AlertsSettings alerts = config.alerts();
        if (alerts.cooldownMinutes() < 0) {
            problems.add("alerts.cooldown_minutes must be >= 0");
        }
        if (alerts.channels().contains(AlertChannel.SLACK)) {
            if (alerts.slackWebhookUrl() == null || alerts.slackWebhookUrl().isBlank()) {
                problems.add("alerts.slack_webhook_url is required when the slack channel is enabled");
            } else if (!isHttpUrl(alerts.slackWebhookUrl().trim())) {
                problems.add("alerts.slack_webhook_url must be an http(s) URL");
            }
        }

        for (Map.Entry<String, Double> threshold : config.thresholds().bounds().entrySet()) {
            double bound = threshold.getValue();
            if (Double.isNaN(bound) || bound < 0 || bound > 100) {
                problems.add("thresholds." + threshold.getKey() + " must be between 0 and 100");
            }
        }
        return problems;
    }

    /**
     * Settings that load fine but deserve attention.
     */
    static List<String> warnings(AgentConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config.alerts().channels().contains(AlertChannel.EMAIL)) {
            warnings.add("alerts.channels: email is not implemented and will be ignored");
        }
        if (config.alerts().enabled() && config.thresholds().isEmpty()) {
            warnings.add("alerts are enabled but no thresholds are configured");
        }
        Duration delivery = config.endpoint().toEndpointConfig().worstCaseDuration();
        Duration notification = worstCaseNotification(config);
        Duration worstCase = delivery.plus(notification);
        if (worstCase.getSeconds() >= config.intervalSeconds()) {
            String breakdown = notification.isZero()
                    ? ""
                    : " (delivery " + delivery.getSeconds() + "s, slack " + notification.getSeconds() + "s)";
            warnings.add("worst-case cycle time " + worstCase.getSeconds() + "s" + breakdown
                    + " is not below interval_seconds=" + config.intervalSeconds()
                    + "; ticks will be skipped while the endpoint is failing");
        }
        return warnings;
    }

    /**
     * Slack posts run before delivery, one per fired alert, each bounded by the endpoint timeout. At most one alert
     * per threshold fires in a cycle.
     */
    static Duration worstCaseNotification(AgentConfig config) {
        if (!config.alerts().enabled() || !config.alerts().channels().contains(AlertChannel.SLACK)) {
            return Duration.ZERO;
        }
        return Duration.ofSeconds(config.endpoint().timeout()).multipliedBy(config.thresholds().bounds().size());
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = URI.create(value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return (scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
