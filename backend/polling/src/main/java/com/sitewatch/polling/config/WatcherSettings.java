package com.sitewatch.polling.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine parameters, read once at startup and handed to the scheduler, store and broadcaster.
 */
public record WatcherSettings(
        int updateCacheSize,
        int defaultIntervalSecs,
        long intervalJitterMaxMs,
        Duration fetchTimeout,
        Duration backoffCap,
        int previewLength,
        int subscriberQueueCapacity,
        int workerThreads
) {
    public static final int MIN_INTERVAL_SECS = 1;
    public static final int MAX_INTERVAL_SECS = 3000;

    public static final int DEFAULT_UPDATE_CACHE_SIZE = 5;
    public static final int DEFAULT_INTERVAL_SECS = 1;
    public static final long DEFAULT_JITTER_MAX_MS = 1500;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_BACKOFF_CAP = Duration.ofHours(24);
    public static final int DEFAULT_PREVIEW_LENGTH = 400;
    public static final int DEFAULT_SUBSCRIBER_QUEUE_CAPACITY = 256;
    public static final int DEFAULT_WORKER_THREADS = 4;

    public WatcherSettings {
        Objects.requireNonNull(fetchTimeout, "fetchTimeout is required");
        Objects.requireNonNull(backoffCap, "backoffCap is required");
        if (updateCacheSize < 1) {
            throw new IllegalArgumentException("update_cache_size must be >= 1, was " + updateCacheSize);
        }
        if (defaultIntervalSecs < MIN_INTERVAL_SECS || defaultIntervalSecs > MAX_INTERVAL_SECS) {
            throw new IllegalArgumentException("default_interval_secs must be within ["
                    + MIN_INTERVAL_SECS + ", " + MAX_INTERVAL_SECS + "], was " + defaultIntervalSecs);
        }
        if (intervalJitterMaxMs < 0) {
            throw new IllegalArgumentException("interval_jitter_max_ms must be >= 0, was " + intervalJitterMaxMs);
        }
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetch_timeout must be positive");
        }
        if (backoffCap.getSeconds() < MAX_INTERVAL_SECS) {
            throw new IllegalArgumentException("backoff_cap must be at least " + MAX_INTERVAL_SECS + " seconds");
        }
        if (previewLength < 1 || subscriberQueueCapacity < 1 || workerThreads < 1) {
            throw new IllegalArgumentException("preview_length, subscriber_queue_capacity and worker_threads must be >= 1");
        }
    }

    public static WatcherSettings defaults() {
        return new WatcherSettings(
                DEFAULT_UPDATE_CACHE_SIZE,
                DEFAULT_INTERVAL_SECS,
                DEFAULT_JITTER_MAX_MS,
                DEFAULT_FETCH_TIMEOUT,
                DEFAULT_BACKOFF_CAP,
                DEFAULT_PREVIEW_LENGTH,
                DEFAULT_SUBSCRIBER_QUEUE_CAPACITY,
                DEFAULT_WORKER_THREADS
        );
    }

    public WatcherSettings withUpdateCacheSize(int size) {
        return new WatcherSettings(size, defaultIntervalSecs, intervalJitterMaxMs, fetchTimeout, backoffCap,
                previewLength, subscriberQueueCapacity, workerThreads);
    }

    public WatcherSettings withIntervalJitterMaxMs(long jitterMaxMs) {
        return new WatcherSettings(updateCacheSize, defaultIntervalSecs, jitterMaxMs, fetchTimeout, backoffCap,
                previewLength, subscriberQueueCapacity, workerThreads);
    }

    public WatcherSettings withSubscriberQueueCapacity(int capacity) {
        return new WatcherSettings(updateCacheSize, defaultIntervalSecs, intervalJitterMaxMs, fetchTimeout, backoffCap,
                previewLength, capacity, workerThreads);
    }
}
