package com.sitewatch.polling.fetch;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpFetcherTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private HttpServer server;
    private final HttpFetcher fetcher = new HttpFetcher(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
            Clock.systemUTC(),
            () -> new Random(7)
    );

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void successfulFetchReturnsBodyAndSendsBrowserUserAgent() throws Exception {
        AtomicReference<String> userAgent = new AtomicReference<>();
        startServer("/page", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            writeResponse(exchange, 200, "<html>hello</html>");
        });

        FetchResult result = fetcher.fetch(url("/page"), TIMEOUT).join();

        assertTrue(result.success());
        assertEquals(200, result.statusCode());
        assertEquals("<html>hello</html>", result.content());
        assertNull(result.error());
        assertTrue(HttpFetcher.USER_AGENTS.contains(userAgent.get()));
    }

    @Test
    void errorStatusIsAFailure() throws Exception {
        startServer("/broken", exchange -> writeResponse(exchange, 503, "busy"));

        FetchResult result = fetcher.fetch(url("/broken"), TIMEOUT).join();

        assertFalse(result.success());
        assertEquals(503, result.statusCode());
        assertNull(result.content());
        assertTrue(result.error().contains("HTTP status 503"));
    }

    @Test
    void slowResponseTimesOut() throws Exception {
        startServer("/slow", exchange -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "late");
        });

        FetchResult result = fetcher.fetch(url("/slow"), Duration.ofMillis(200)).join();

        assertFalse(result.success());
        assertEquals("Request timed out while fetching " + url("/slow"), result.error());
    }

    @Test
    void refusedConnectionIsAFailureNotAnException() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        FetchResult result = fetcher.fetch("http://localhost:" + closedPort + "/", TIMEOUT).join();

        assertFalse(result.success());
        assertTrue(result.error().contains("http://localhost:" + closedPort + "/"));
    }

    @Test
    void malformedUrlFailsImmediately() {
        FetchResult result = fetcher.fetch("http://exa mple.com/", TIMEOUT).join();

        assertFalse(result.success());
        assertTrue(result.error().startsWith("Invalid URL"));
    }

    @Test
    void classifiesDnsAndTimeoutFailures() {
        String url = "https://nowhere.invalid/";

        assertTrue(HttpFetcher.classifyFailureMessage(url, new CompletionException(new UnknownHostException("nowhere.invalid")))
                .startsWith("DNS/unknown host while fetching " + url));
        assertEquals("Request timed out while fetching " + url,
                HttpFetcher.classifyFailureMessage(url, new HttpTimeoutException("request timed out")));
        assertEquals("Fetch failure for " + url + ": reset",
                HttpFetcher.classifyFailureMessage(url, new IOException("reset")));
    }

    private void startServer(String path, ExchangeHandler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext(path, exchange -> handler.handle(exchange));
        server.start();
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
