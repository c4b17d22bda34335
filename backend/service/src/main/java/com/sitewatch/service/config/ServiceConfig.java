package com.sitewatch.service.config;

import com.sitewatch.core.model.SiteRequest;
import com.sitewatch.polling.config.WatcherSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Contents of {@code config/watcher.json}. Every key is optional; absent keys fall back to the
 * defaults in {@link WatcherSettings}.
 */
public record ServiceConfig(
        Integer updateCacheSize,
        Integer defaultIntervalSecs,
        Long intervalJitterMaxMs,
        Duration fetchTimeout,
        Duration backoffCap,
        Integer previewLength,
        Integer subscriberQueueCapacity,
        Integer workerThreads,
        Integer port,
        String stateFile,
        List<SiteRequest> defaultSites
) {
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_STATE_FILE = "state/watcher.json";

    public static ServiceConfig defaults() {
        return new ServiceConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    public WatcherSettings toSettings() {
        return new WatcherSettings(
                updateCacheSize != null ? updateCacheSize : WatcherSettings.DEFAULT_UPDATE_CACHE_SIZE,
                defaultIntervalSecs != null ? defaultIntervalSecs : WatcherSettings.DEFAULT_INTERVAL_SECS,
                intervalJitterMaxMs != null ? intervalJitterMaxMs : WatcherSettings.DEFAULT_JITTER_MAX_MS,
                fetchTimeout != null ? fetchTimeout : WatcherSettings.DEFAULT_FETCH_TIMEOUT,
                backoffCap != null ? backoffCap : WatcherSettings.DEFAULT_BACKOFF_CAP,
                previewLength != null ? previewLength : WatcherSettings.DEFAULT_PREVIEW_LENGTH,
                subscriberQueueCapacity != null ? subscriberQueueCapacity : WatcherSettings.DEFAULT_SUBSCRIBER_QUEUE_CAPACITY,
                workerThreads != null ? workerThreads : WatcherSettings.DEFAULT_WORKER_THREADS
        );
    }

    public int resolvedPort() {
        return port != null ? port : DEFAULT_PORT;
    }

    public Path resolvedStateFile() {
        return Path.of(stateFile != null && !stateFile.isBlank() ? stateFile : DEFAULT_STATE_FILE);
    }

    public List<SiteRequest> resolvedDefaultSites() {
        return defaultSites != null ? List.copyOf(defaultSites) : List.of();
    }
}
