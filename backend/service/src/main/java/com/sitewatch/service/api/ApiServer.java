package com.sitewatch.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteRequest;
import com.sitewatch.core.model.Update;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.polling.registry.SiteRegistry;
import com.sitewatch.polling.registry.SiteRejectedException;
import com.sitewatch.polling.store.StorageException;
import com.sitewatch.polling.store.UpdateStore;
import com.sitewatch.service.DefaultSites;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String SITES_PREFIX = "/api/sites";
    private static final String CONTENT_PREFIX = "/api/content";

    private final int port;
    private final SiteRegistry registry;
    private final UpdateStore store;
    private final SseStreamHandler sseStreamHandler;
    private final DiagnosticsTracker diagnosticsTracker;
    private final List<SiteRequest> defaultSites;
    private final int previewLength;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            SiteRegistry registry,
            UpdateStore store,
            SseStreamHandler sseStreamHandler,
            DiagnosticsTracker diagnosticsTracker,
            List<SiteRequest> defaultSites,
            int previewLength
    ) {
        this.port = port;
        this.registry = registry;
        this.store = store;
        this.sseStreamHandler = sseStreamHandler;
        this.diagnosticsTracker = diagnosticsTracker;
        this.defaultSites = List.copyOf(defaultSites);
        this.previewLength = previewLength;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/health", exchange -> guarded(exchange, this::handleHealth));
            server.createContext(SITES_PREFIX, exchange -> guarded(exchange, this::handleSites));
            server.createContext(CONTENT_PREFIX, exchange -> guarded(exchange, this::handleContent));
            server.createContext("/api/reset-db", exchange -> guarded(exchange, this::handleReset));
            server.createContext("/api/metrics", exchange -> guarded(exchange, this::handleMetrics));
            server.createContext("/api/updates/stream", sseStreamHandler::handle);
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleSites(HttpExchange exchange) throws IOException {
        List<String> segments = segmentsAfter(exchange, SITES_PREFIX);
        if (segments.isEmpty()) {
            if (!ensureMethod(exchange, "GET", "POST")) {
                return;
            }
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, 200, registry.listSites());
            } else {
                addSite(exchange);
            }
            return;
        }

        Optional<Long> siteId = parseId(segments.get(0));
        if (siteId.isEmpty() || segments.size() > 2 || (segments.size() == 2 && !"updates".equals(segments.get(1)))) {
            writeError(exchange, 404, "not_found", "No such resource");
            return;
        }
        if (segments.size() == 2) {
            if (ensureMethod(exchange, "GET")) {
                listUpdates(exchange, siteId.get());
            }
            return;
        }
        if (!ensureMethod(exchange, "GET", "DELETE")) {
            return;
        }
        if ("DELETE".equalsIgnoreCase(exchange.getRequestMethod())) {
            registry.removeSite(siteId.get());
            diagnosticsTracker.forgetSite(siteId.get());
            sendEmpty(exchange, 204);
            return;
        }
        Optional<Site> site = registry.getSite(siteId.get());
        if (site.isPresent()) {
            writeJson(exchange, 200, site.get());
        } else {
            writeError(exchange, 404, "site_not_found", "Unknown site " + siteId.get());
        }
    }

    private void addSite(HttpExchange exchange) throws IOException {
        SiteRequest request;
        try (InputStream in = exchange.getRequestBody()) {
            byte[] body = in.readAllBytes();
            if (body.length == 0) {
                writeError(exchange, 400, "invalid_request", "Request body is required");
                return;
            }
            request = JsonUtils.objectMapper().readValue(body, SiteRequest.class);
        } catch (JsonProcessingException e) {
            writeError(exchange, 400, "invalid_json", e.getOriginalMessage());
            return;
        }
        Site created = registry.addSite(request);
        writeJson(exchange, 201, created);
    }

    private void listUpdates(HttpExchange exchange, long siteId) throws IOException {
        if (registry.getSite(siteId).isEmpty()) {
            writeError(exchange, 404, "site_not_found", "Unknown site " + siteId);
            return;
        }
        List<UpdateSummary> summaries = new ArrayList<>();
        for (Update update : store.listUpdates(siteId)) {
            summaries.add(UpdateSummary.of(update, previewLength));
        }
        writeJson(exchange, 200, summaries);
    }

    private void handleContent(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<String> segments = segmentsAfter(exchange, CONTENT_PREFIX);
        Optional<Long> siteId = segments.size() == 2 ? parseId(segments.get(0)) : Optional.empty();
        if (siteId.isEmpty()) {
            writeError(exchange, 404, "not_found", "Expected /api/content/{site_id}/{update_id or timestamp}");
            return;
        }
        String key = segments.get(1);
        Optional<Update> update;
        Optional<Long> updateId = parseId(key);
        if (updateId.isPresent()) {
            update = store.getUpdate(siteId.get(), updateId.get());
        } else {
            Optional<Instant> timestamp = parseTimestamp(key);
            if (timestamp.isEmpty()) {
                writeError(exchange, 400, "invalid_key", "Expected an update id or an RFC 3339 timestamp: " + key);
                return;
            }
            update = store.getUpdateAt(siteId.get(), timestamp.get());
        }
        if (update.isPresent()) {
            writeJson(exchange, 200, update.get());
        } else {
            writeError(exchange, 404, "content_not_found", "No stored content for site " + siteId.get() + " at " + key);
        }
    }

    private void handleReset(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET", "POST")) {
            return;
        }
        registry.resetAll();
        diagnosticsTracker.forgetAllSites();
        int seeded = DefaultSites.seed(registry, defaultSites);
        writeJson(exchange, 200, Map.of("status", "reset", "default_sites_added", seeded));
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> metrics = diagnosticsTracker.metricsSnapshot();
        metrics.put("sites_watched", registry.size());
        writeJson(exchange, 200, metrics);
    }

    private void guarded(HttpExchange exchange, ExchangeHandler handler) throws IOException {
        try {
            handler.handle(exchange);
        } catch (SiteRejectedException e) {
            int status = e.reason() == SiteRejectedException.Reason.DUPLICATE_URL ? 409 : 400;
            writeError(exchange, status, e.reason().name().toLowerCase(Locale.ROOT), e.getMessage());
        } catch (StorageException e) {
            LOGGER.log(Level.WARNING, "Storage failure serving " + exchange.getRequestURI(), e);
            writeError(exchange, 503, "storage_unavailable", e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unexpected failure serving " + exchange.getRequestURI(), e);
            writeError(exchange, 500, "internal_error", "Unexpected server error");
        }
    }

    private boolean ensureMethod(HttpExchange exchange, String... allowed) throws IOException {
        String method = exchange.getRequestMethod();
        if ("OPTIONS".equalsIgnoreCase(method)) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", String.join(",", allowed) + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            sendEmpty(exchange, 204);
            return false;
        }
        for (String candidate : allowed) {
            if (candidate.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", allowed));
        writeError(exchange, 405, "method_not_allowed", method + " is not supported here");
        return false;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private void writeError(HttpExchange exchange, int status, String error, String message) throws IOException {
        writeJson(exchange, status, Map.of("error", error, "message", message == null ? "" : message));
    }

    private void sendEmpty(HttpExchange exchange, int status) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }

    private static List<String> segmentsAfter(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        List<String> segments = new ArrayList<>();
        for (String segment : rest.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static Optional<Long> parseId(String raw) {
        if (raw.isEmpty() || !raw.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<Instant> parseTimestamp(String raw) {
        try {
            return Optional.of(OffsetDateTime.parse(raw).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
