package com.metricsentinel.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Trust material for an ingestion endpoint signed by a private CA, taken from the environment:
 * {@code INGEST_TRUSTSTORE_PATH}, {@code INGEST_TRUSTSTORE_PASSWORD} and optionally {@code INGEST_TRUSTSTORE_TYPE}
 * ({@code JKS} or {@code PKCS12}; guessed from the file extension when unset).
 */
record IngestTrustStore(Path path, char[] password, String type) {
    static final String PATH_ENV = "INGEST_TRUSTSTORE_PATH";
    static final String PASSWORD_ENV = "INGEST_TRUSTSTORE_PASSWORD";
    static final String TYPE_ENV = "INGEST_TRUSTSTORE_TYPE";

    /**
     * @throws IllegalStateException when a path is given without a password or the file is missing
     */
    static Optional<IngestTrustStore> fromEnvironment(Map<String, String> environment) {
        String location = environment.get(PATH_ENV);
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(PASSWORD_ENV);
        if (password == null) {
            throw new IllegalStateException(PASSWORD_ENV + " must be set when " + PATH_ENV + " is configured");
        }
        Path path = Path.of(location.trim());
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Ingest truststore file does not exist: " + path);
        }
        String explicitType = environment.get(TYPE_ENV);
        String type = explicitType == null || explicitType.isBlank()
                ? typeFromExtension(path)
                : explicitType.trim().toUpperCase(Locale.ROOT);
        return Optional.of(new IngestTrustStore(path, password.toCharArray(), type));
    }

    SSLContext sslContext() {
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore keyStore = KeyStore.getInstance(type);
            keyStore.load(in, password);
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build SSL context from ingest truststore " + path
                    + " (" + type + ")", e);
        }
    }

    private static String typeFromExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".p12") || name.endsWith(".pfx") ? "PKCS12" : "JKS";
    }
}
