package com.sitewatch.service;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.polling.broadcast.UpdateBroadcaster;
import com.sitewatch.polling.config.WatcherSettings;
import com.sitewatch.polling.fetch.HttpFetcher;
import com.sitewatch.polling.registry.SiteRegistry;
import com.sitewatch.polling.schedule.PollContext;
import com.sitewatch.polling.schedule.PollScheduler;
import com.sitewatch.service.api.ApiServer;
import com.sitewatch.service.api.DiagnosticsTracker;
import com.sitewatch.service.api.SseStreamHandler;
import com.sitewatch.service.config.ConfigLoader;
import com.sitewatch.service.config.ServiceConfig;
import com.sitewatch.service.http.HttpClientFactory;
import com.sitewatch.service.store.JsonFileUpdateStore;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Map<String, String> env = System.getenv();
        Path configDir = ConfigLoader.configDir(env);
        ServiceConfig config = ConfigLoader.load(configDir);
        WatcherSettings settings = config.toSettings();
        Clock clock = Clock.systemUTC();

        JsonFileUpdateStore store = new JsonFileUpdateStore(config.resolvedStateFile(), settings.updateCacheSize());
        if (resetRequested(env)) {
            LOGGER.warning("RESET_DB is set; wiping stored sites and updates in " + store.file());
            store.resetAll();
        }

        EventBus eventBus = new EventBus();
        UpdateBroadcaster broadcaster = new UpdateBroadcaster(settings.subscriberQueueCapacity());
        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        PollContext context = new PollContext(
                new HttpFetcher(httpClient, clock),
                store,
                broadcaster,
                eventBus,
                clock,
                settings
        );
        PollScheduler scheduler = new PollScheduler(context);
        SiteRegistry registry = new SiteRegistry(scheduler);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock, broadcaster);

        if (registry.start() == 0) {
            DefaultSites.seed(registry, config.resolvedDefaultSites());
        }

        ApiServer apiServer = new ApiServer(
                config.resolvedPort(),
                registry,
                store,
                new SseStreamHandler(broadcaster),
                diagnosticsTracker,
                config.resolvedDefaultSites(),
                settings.previewLength()
        );
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            registry.shutdown();
            broadcaster.closeAll();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static boolean resetRequested(Map<String, String> env) {
        String value = env.get("RESET_DB");
        return value != null && !value.isBlank();
    }
}
