package com.metricsentinel.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricsentinel.collectors.notify.AlertChannel;

import java.net.URI;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record AlertsSettings(
        Boolean enabled,
        @JsonProperty("cooldown_minutes") Integer cooldownMinutes,
        List<AlertChannel> channels,
        @JsonProperty("slack_webhook_url") String slackWebhookUrl
) {
    static final int DEFAULT_COOLDOWN_MINUTES = 5;

    public AlertsSettings {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        cooldownMinutes = cooldownMinutes == null ? DEFAULT_COOLDOWN_MINUTES : cooldownMinutes;
        channels = channels == null ? List.of(AlertChannel.LOG) : List.copyOf(channels);
    }

    public static AlertsSettings defaults() {
        return new AlertsSettings(null, null, null, null);
    }

    public Duration cooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }

    public Set<AlertChannel> channelSet() {
        return channels.isEmpty() ? EnumSet.noneOf(AlertChannel.class) : EnumSet.copyOf(channels);
    }

    public URI slackWebhookUri() {
        return slackWebhookUrl == null || slackWebhookUrl.isBlank() ? null : URI.create(slackWebhookUrl.trim());
    }
}
