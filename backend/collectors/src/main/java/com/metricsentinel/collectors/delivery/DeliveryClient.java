package com.metricsentinel.collectors.delivery;

import com.metricsentinel.core.model.AlertCandidate;
import com.metricsentinel.core.model.MetricSnapshot;
import com.metricsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pushes one snapshot, with the alerts fired in the same cycle, to the ingestion endpoint.
 * <p>
 * Each attempt is bounded by the endpoint timeout. Timeouts, transport errors and non-2xx responses are retried
 * up to {@code maxRetries} more times with a fixed delay in between; the first 2xx ends the loop. The client never
 * throws for delivery problems: it reports them in the returned {@link DeliveryOutcome}. An interrupt during an
 * attempt or a retry wait ends delivery immediately with a failed outcome and the interrupt flag set.
 */
public class DeliveryClient {
    private static final Logger LOGGER = Logger.getLogger(DeliveryClient.class.getName());

    private final IngestTransport transport;
    private final Sleeper sleeper;
    private final Clock clock;

    public DeliveryClient(IngestTransport transport, Sleeper sleeper, Clock clock) {
        this.transport = transport;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public DeliveryOutcome send(MetricSnapshot snapshot, List<AlertCandidate> firedAlerts, EndpointConfig endpoint) {
        String body = JsonUtils.toJson(IngestPayload.of(snapshot, firedAlerts));
        return send(body, endpoint);
    }

    DeliveryOutcome send(String body, EndpointConfig endpoint) {
        Instant startedAt = clock.instant();
        int maxAttempts = endpoint.maxAttempts();
        int lastStatus = 0;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                int status = transport.post(endpoint.url(), body, endpoint.timeout());
                lastStatus = status;
                if (status >= 200 && status < 300) {
                    int attemptsMade = attempt;
                    LOGGER.fine(() -> "Delivered metrics to " + endpoint.url() + " with status " + status
                            + " on attempt " + attemptsMade + "/" + maxAttempts);
                    return DeliveryOutcome.success(attempt, status, elapsedSince(startedAt));
                }
                lastError = "HTTP " + status;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return aborted(endpoint, attempt, lastStatus, startedAt);
            } catch (IOException | RuntimeException e) {
                lastError = classifyFailureMessage(endpoint.url(), e);
            }

            LOGGER.warning("Delivery attempt " + attempt + "/" + maxAttempts + " to " + endpoint.url()
                    + " failed: " + lastError);

            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(endpoint.retryDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return aborted(endpoint, attempt, lastStatus, startedAt);
                }
            }
        }

        Duration elapsed = elapsedSince(startedAt);
        LOGGER.log(Level.SEVERE, "Giving up delivery to " + endpoint.url() + " after " + maxAttempts
                + " attempts in " + elapsed.toMillis() + "ms; last error: " + lastError + ". Snapshot dropped.");
        return DeliveryOutcome.failure(maxAttempts, lastStatus, lastError, elapsed);
    }

    private DeliveryOutcome aborted(EndpointConfig endpoint, int attempts, int lastStatus, Instant startedAt) {
        LOGGER.warning("Delivery to " + endpoint.url() + " interrupted after " + attempts + " attempt(s)");
        return DeliveryOutcome.failure(attempts, lastStatus, "interrupted", elapsedSince(startedAt));
    }

    private Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }

    static String classifyFailureMessage(URI url, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (error instanceof HttpTimeoutException || root instanceof HttpTimeoutException || lowered.contains("timed out")) {
            return "timed out posting to " + url;
        }
        if (root instanceof UnknownHostException || lowered.contains("unknown host")) {
            return "DNS/unknown host for " + url + ": " + rootText;
        }
        if (root instanceof java.net.ConnectException) {
            return "connection refused by " + url + ": " + rootText;
        }
        return root.getClass().getSimpleName() + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
