package com.sitewatch.service.api;

import com.sitewatch.core.events.UpdateEvent;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.polling.broadcast.Subscription;
import com.sitewatch.polling.broadcast.UpdateBroadcaster;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relays the update stream to one browser per request as Server-Sent Events. Each connection owns
 * its own broadcaster subscription; the stream ends when the client disconnects or the
 * subscription is dropped for falling behind.
 */
public class SseStreamHandler {
    private static final Logger LOGGER = Logger.getLogger(SseStreamHandler.class.getName());
    public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(15);

    private final UpdateBroadcaster broadcaster;
    private final Duration keepAlive;

    public SseStreamHandler(UpdateBroadcaster broadcaster) {
        this(broadcaster, DEFAULT_KEEP_ALIVE);
    }

    public SseStreamHandler(UpdateBroadcaster broadcaster, Duration keepAlive) {
        this.broadcaster = broadcaster;
        this.keepAlive = keepAlive;
    }

    public void handle(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        OutputStream out = exchange.getResponseBody();
        Subscription subscription = broadcaster.subscribe();
        try {
            write(out, ": connected\n\n");
            while (!Thread.currentThread().isInterrupted()) {
                UpdateEvent event = subscription.poll(keepAlive);
                if (event != null) {
                    write(out, toMessage(event));
                } else if (subscription.isOpen()) {
                    write(out, ": keepalive\n\n");
                } else {
                    LOGGER.info("Closing update stream " + subscription.id() + ": " + subscription.closeReason());
                    break;
                }
            }
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Update stream client " + subscription.id() + " disconnected", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            subscription.close();
            closeQuietly(out);
            exchange.close();
        }
    }

    static String toMessage(UpdateEvent event) throws IOException {
        return "data: " + JsonUtils.objectMapper().writeValueAsString(event) + "\n\n";
    }

    private static void write(OutputStream out, String data) throws IOException {
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static void closeQuietly(OutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINEST, "Update stream already closed", e);
        }
    }
}
