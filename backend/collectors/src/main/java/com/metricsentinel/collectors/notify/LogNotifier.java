package com.metricsentinel.collectors.notify;

import com.metricsentinel.core.model.AlertCandidate;

import java.util.logging.Logger;

public final class LogNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(LogNotifier.class.getName());

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(AlertCandidate alert, String hostname) {
        LOGGER.warning("ALERT [" + hostname + "] " + alert.describe() + " at " + alert.timestamp());
    }
}
