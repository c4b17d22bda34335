package com.sitewatch.polling.fetch;

import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

public class HttpFetcher implements Fetcher {
    static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64)",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7)",
            "Mozilla/5.0 (X11; Linux x86_64)",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 14_0 like Mac OS X)"
    );

    private final HttpClient httpClient;
    private final Clock clock;
    private final Supplier<Random> random;

    public HttpFetcher(HttpClient httpClient, Clock clock) {
        this(httpClient, clock, ThreadLocalRandom::current);
    }

    HttpFetcher(HttpClient httpClient, Clock clock, Supplier<Random> random) {
        this.httpClient = httpClient;
        this.clock = clock;
        this.random = random;
    }

    @Override
    public CompletableFuture<FetchResult> fetch(String url, Duration timeout) {
        Instant startedAt = clock.instant();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENTS.get(random.get().nextInt(USER_AGENTS.size())))
                    .build();
        } catch (IllegalArgumentException invalidUrl) {
            return CompletableFuture.completedFuture(
                    FetchResult.failure(0, "Invalid URL " + url + ": " + invalidUrl.getMessage(), 0));
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
                    if (error != null) {
                        return FetchResult.failure(0, classifyFailureMessage(url, error), durationMillis);
                    }
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        return FetchResult.failure(status, "HTTP status " + status + " from " + url, durationMillis);
                    }
                    return FetchResult.success(status, response.body(), durationMillis);
                });
    }

    static String classifyFailureMessage(String url, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("not known")
                || lowered.contains("nodename")) {
            return "DNS/unknown host while fetching " + url + ": " + rootText;
        }
        if (root instanceof TimeoutException
                || root instanceof HttpTimeoutException
                || lowered.contains("timed out")) {
            return "Request timed out while fetching " + url;
        }
        return "Fetch failure for " + url + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
