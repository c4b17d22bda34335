package com.sitewatch.polling.support;

import com.sitewatch.polling.fetch.FetchResult;
import com.sitewatch.polling.fetch.Fetcher;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted fetcher: each URL answers with whatever its supplier currently returns. Unknown URLs
 * fail like a refused connection.
 */
public class StubFetcher implements Fetcher {
    private final Map<String, Supplier<CompletableFuture<FetchResult>>> responses = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    public void respond(String url, String body) {
        responses.put(url, () -> CompletableFuture.completedFuture(FetchResult.success(200, body, 5)));
    }

    public void fail(String url, String error) {
        responses.put(url, () -> CompletableFuture.completedFuture(FetchResult.failure(0, error, 5)));
    }

    public void respondWith(String url, Supplier<CompletableFuture<FetchResult>> response) {
        responses.put(url, response);
    }

    public int calls(String url) {
        AtomicInteger count = calls.get(url);
        return count == null ? 0 : count.get();
    }

    @Override
    public CompletableFuture<FetchResult> fetch(String url, Duration timeout) {
        calls.computeIfAbsent(url, ignored -> new AtomicInteger()).incrementAndGet();
        Supplier<CompletableFuture<FetchResult>> response = responses.get(url);
        if (response == null) {
            return CompletableFuture.completedFuture(FetchResult.failure(0, "Fetch failure for " + url + ": Connection refused", 1));
        }
        return response.get();
    }
}
