package com.metricsentinel.collectors.notify;

import com.metricsentinel.core.model.AlertCandidate;
import com.metricsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Posts alerts to a Slack incoming webhook.
 */
public final class SlackNotifier implements Notifier {
    private final HttpClient httpClient;
    private final URI webhookUrl;
    private final Duration requestTimeout;

    public SlackNotifier(HttpClient httpClient, URI webhookUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.webhookUrl = webhookUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public void notify(AlertCandidate alert, String hostname) throws NotificationException {
        String body = JsonUtils.toJson(Map.of("text", messageFor(alert, hostname)));
        HttpRequest request = HttpRequest.newBuilder(webhookUrl)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new NotificationException("Slack webhook returned HTTP " + response.statusCode()
                        + " for alert " + alert.key());
            }
        } catch (IOException e) {
            throw new NotificationException("Slack webhook request failed for alert " + alert.key(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while notifying Slack for alert " + alert.key(), e);
        }
    }

    static String messageFor(AlertCandidate alert, String hostname) {
        return ":warning: *" + hostname + "*: " + alert.describe() + " (" + alert.timestamp() + ")";
    }
}
