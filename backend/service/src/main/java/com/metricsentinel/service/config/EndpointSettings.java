package com.metricsentinel.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricsentinel.collectors.delivery.EndpointConfig;

import java.net.URI;
import java.time.Duration;

public record EndpointSettings(
        String url,
        Integer timeout,
        @JsonProperty("max_retries") Integer maxRetries,
        @JsonProperty("retry_delay") Integer retryDelay
) {
    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int DEFAULT_MAX_RETRIES = 3;
    static final int DEFAULT_RETRY_DELAY_SECONDS = 5;

    public EndpointSettings {
        url = url == null ? null : url.trim();
        timeout = timeout == null ? DEFAULT_TIMEOUT_SECONDS : timeout;
        maxRetries = maxRetries == null ? DEFAULT_MAX_RETRIES : maxRetries;
        retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY_SECONDS : retryDelay;
    }

    public EndpointConfig toEndpointConfig() {
        return new EndpointConfig(
                URI.create(url),
                Duration.ofSeconds(timeout),
                maxRetries,
                Duration.ofSeconds(retryDelay)
        );
    }
}
