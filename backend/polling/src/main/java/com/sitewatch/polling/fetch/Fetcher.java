package com.sitewatch.polling.fetch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Performs a single retrieval of a URL. Implementations never retry and never complete the
 * returned future exceptionally: every problem is reported as a failed {@link FetchResult}.
 */
public interface Fetcher {
    CompletableFuture<FetchResult> fetch(String url, Duration timeout);
}
