package com.metricsentinel.collectors.delivery;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class HttpIngestTransport implements IngestTransport {
    private final HttpClient httpClient;

    public HttpIngestTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public int post(URI url, String jsonBody, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();

        CompletableFuture<HttpResponse<Void>> pending = httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            return pending.get().statusCode();
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                throw new HttpTimeoutException("Request to " + url + " timed out after " + timeout.toMillis() + "ms");
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Request to " + url + " failed: " + cause, cause);
        }
    }
}
