package com.metricsentinel.service.http;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the one {@link HttpClient} shared by delivery and webhook notifiers.
 * <p>
 * Redirects are not followed: the ingestion endpoint answering 3xx counts as a failed attempt. See
 * {@link IngestTrustStore} for trusting a private ingestion CA.
 */
public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER);
        IngestTrustStore.fromEnvironment(environment).ifPresent(trustStore -> {
            builder.sslContext(trustStore.sslContext());
            LOGGER.info("Trusting ingestion certificates from " + trustStore.path() + " (" + trustStore.type() + ")");
        });
        return builder.build();
    }
}
