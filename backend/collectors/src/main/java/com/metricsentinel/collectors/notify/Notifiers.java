package com.metricsentinel.collectors.notify;

import com.metricsentinel.core.model.AlertCandidate;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Notifiers {
    private static final Logger LOGGER = Logger.getLogger(Notifiers.class.getName());

    private Notifiers() {
    }

    /**
     * Builds one notifier per supported channel, in a fixed order. {@code EMAIL} has no implementation and is
     * skipped; {@code SLACK} needs a webhook URL.
     */
    public static List<Notifier> create(
            Collection<AlertChannel> channels,
            URI slackWebhookUrl,
            HttpClient httpClient,
            Duration requestTimeout
    ) {
        List<Notifier> notifiers = new ArrayList<>();
        if (channels.contains(AlertChannel.LOG)) {
            notifiers.add(new LogNotifier());
        }
        if (channels.contains(AlertChannel.SLACK)) {
            if (slackWebhookUrl == null) {
                throw new IllegalArgumentException("Slack channel requires a webhook URL");
            }
            notifiers.add(new SlackNotifier(httpClient, slackWebhookUrl, requestTimeout));
        }
        return List.copyOf(notifiers);
    }

    /**
     * Hands every alert to every notifier. A failing notifier is logged and does not stop the others.
     *
     * @return number of failed notifications
     */
    public static int dispatch(List<Notifier> notifiers, List<AlertCandidate> alerts, String hostname) {
        int failures = 0;
        for (AlertCandidate alert : alerts) {
            for (Notifier notifier : notifiers) {
                try {
                    notifier.notify(alert, hostname);
                } catch (NotificationException | RuntimeException e) {
                    failures++;
                    LOGGER.log(Level.WARNING, "Notifier " + notifier.name() + " failed for alert " + alert.key(), e);
                }
            }
        }
        return failures;
    }
}
