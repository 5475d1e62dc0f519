package com.metricsentinel.collectors.delivery;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpIngestTransportTest {
    private HttpServer server;
    private final HttpIngestTransport transport = new HttpIngestTransport(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build()
    );

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void postsJsonAndReturnsStatus() throws Exception {
        AtomicReference<String> receivedBody = new AtomicReference<>();
        AtomicReference<String> receivedMethod = new AtomicReference<>();
        AtomicReference<String> contentType = new AtomicReference<>();
        startServer(exchange -> {
            receivedMethod.set(exchange.getRequestMethod());
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            writeResponse(exchange, 202, "{\"status\":\"success\"}");
        });

        int status = transport.post(url(), "{\"hostname\":\"host-a\"}", Duration.ofSeconds(2));

        assertEquals(202, status);
        assertEquals("POST", receivedMethod.get());
        assertEquals("application/json", contentType.get());
        assertEquals("{\"hostname\":\"host-a\"}", receivedBody.get());
    }

    @Test
    void errorStatusIsReturnedNotThrown() throws Exception {
        startServer(exchange -> writeResponse(exchange, 500, "{\"detail\":\"Failed to store metrics\"}"));

        assertEquals(500, transport.post(url(), "{}", Duration.ofSeconds(2)));
    }

    @Test
    void slowEndpointTimesOut() throws Exception {
        startServer(exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "late");
        });

        assertThrows(HttpTimeoutException.class, () -> transport.post(url(), "{}", Duration.ofMillis(150)));
    }

    @Test
    void refusedConnectionSurfacesAsIoException() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        IOException error = assertThrows(IOException.class,
                () -> transport.post(URI.create("http://localhost:" + closedPort + "/ingest"), "{}", Duration.ofSeconds(1)));
        assertTrue(DeliveryClient.classifyFailureMessage(URI.create("http://localhost"), error).length() > 0);
    }

    private URI url() {
        return URI.create("http://localhost:" + server.getAddress().getPort() + "/ingest");
    }

    private void startServer(Handler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/ingest", exchange -> handler.handle(exchange));
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
