package com.metricsentinel.collectors.notify;

import com.metricsentinel.core.model.AlertCandidate;

/**
 * A destination for fired alerts.
 */
public interface Notifier {
    String name();

    void notify(AlertCandidate alert, String hostname) throws NotificationException;
}
