package com.metricsentinel.collectors.delivery;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Sends one JSON body and reports the response status.
 */
@FunctionalInterface
public interface IngestTransport {
    /**
     * @throws java.net.http.HttpTimeoutException when no response arrives within {@code timeout}
     * @throws IOException on any other transport failure
     */
    int post(URI url, String jsonBody, Duration timeout) throws IOException, InterruptedException;
}
