package com.sitewatch.polling.registry;

import com.sitewatch.core.model.PollStyle;
import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteDefinition;
import com.sitewatch.core.model.SiteRequest;
import com.sitewatch.core.model.Update;
import com.sitewatch.polling.config.WatcherSettings;
import com.sitewatch.polling.schedule.PollScheduler;
import com.sitewatch.polling.schedule.SiteTask;
import com.sitewatch.polling.store.UpdateStore;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The live set of watched sites. Each registered site has exactly one polling task; adding a
 * site persists it and starts its task, removing it stops the task before its stored data is
 * deleted.
 *
 * <p>Site views returned here come from the running tasks, so they stay accurate when the store
 * is failing.
 */
public class SiteRegistry {
    private static final Logger LOGGER = Logger.getLogger(SiteRegistry.class.getName());

    private final PollScheduler scheduler;
    private final UpdateStore store;
    private final WatcherSettings settings;
    private final Map<Long, SiteTask> tasks = new LinkedHashMap<>();

    public SiteRegistry(PollScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is required");
        this.store = scheduler.context().store();
        this.settings = scheduler.context().settings();
    }

    /**
     * Schedules every site already in the store, seeding change detection with the newest stored
     * fingerprint of each.
     *
     * @return number of sites scheduled
     */
    public synchronized int start() {
        int started = 0;
        for (Site site : store.listSites()) {
            if (tasks.containsKey(site.id())) {
                continue;
            }
            tasks.put(site.id(), scheduler.spawn(site, lastHash(site.id())));
            started++;
        }
        LOGGER.info("Restored " + started + " watched sites");
        return started;
    }

    /**
     * Validates and registers a new site. Polling starts immediately.
     *
     * @throws SiteRejectedException if the request is invalid or the URL is already watched
     * @throws com.sitewatch.polling.store.StorageException if the site could not be persisted
     */
    public Site addSite(SiteRequest request) {
        SiteDefinition definition = validate(request);
        synchronized (this) {
            for (SiteTask task : tasks.values()) {
                if (task.url().equals(definition.url())) {
                    throw new SiteRejectedException(SiteRejectedException.Reason.DUPLICATE_URL,
                            "Site already exists: " + definition.url());
                }
            }
            long id = store.upsertSite(definition);
            Site site = store.getSite(id).orElseGet(() -> Site.pending(id, definition));
            SiteTask task = scheduler.spawn(site, lastHash(id));
            tasks.put(id, task);
            LOGGER.info("Added site " + id + ": " + definition.url() + " every " + definition.intervalSecs()
                    + "s (" + definition.style().wireName() + ")");
            return task.view();
        }
    }

    /**
     * Stops polling a site and deletes its stored data. Removing an unknown id is not an error.
     *
     * @return whether a running site was removed
     */
    public synchronized boolean removeSite(long siteId) {
        SiteTask task = tasks.remove(siteId);
        if (task != null) {
            task.cancel();
        }
        store.deleteSite(siteId);
        if (task != null) {
            LOGGER.info("Removed site " + siteId + ": " + task.url());
        }
        return task != null;
    }

    public List<Site> listSites() {
        List<SiteTask> running;
        synchronized (this) {
            running = new ArrayList<>(tasks.values());
        }
        List<Site> views = new ArrayList<>(running.size());
        for (SiteTask task : running) {
            views.add(task.view());
        }
        views.sort(Comparator.comparingLong(Site::id));
        return views;
    }

    public Optional<Site> getSite(long siteId) {
        SiteTask task;
        synchronized (this) {
            task = tasks.get(siteId);
        }
        return task == null ? Optional.empty() : Optional.of(task.view());
    }

    public synchronized int size() {
        return tasks.size();
    }

    /**
     * Stops every task and wipes all sites and updates from the store.
     */
    public synchronized void resetAll() {
        cancelAll();
        store.resetAll();
        LOGGER.warning("All sites and updates were reset");
    }

    public synchronized void shutdown() {
        cancelAll();
        scheduler.close();
    }

    SiteDefinition validate(SiteRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new SiteRejectedException(SiteRejectedException.Reason.INVALID_URL, "URL is required");
        }
        String url = request.url().trim();
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new SiteRejectedException(SiteRejectedException.Reason.INVALID_URL,
                        "URL must use http or https: " + url);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new SiteRejectedException(SiteRejectedException.Reason.INVALID_URL, "URL has no host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new SiteRejectedException(SiteRejectedException.Reason.INVALID_URL, "Malformed URL: " + url);
        }

        int interval = request.intervalSecs() == null ? settings.defaultIntervalSecs() : request.intervalSecs();
        if (interval < WatcherSettings.MIN_INTERVAL_SECS || interval > WatcherSettings.MAX_INTERVAL_SECS) {
            throw new SiteRejectedException(SiteRejectedException.Reason.INVALID_INTERVAL,
                    "interval_secs must be between " + WatcherSettings.MIN_INTERVAL_SECS + " and "
                            + WatcherSettings.MAX_INTERVAL_SECS + ", was " + interval);
        }

        PollStyle style = PollStyle.RANDOM;
        if (request.style() != null && !request.style().isBlank()) {
            try {
                style = PollStyle.parse(request.style());
            } catch (IllegalArgumentException e) {
                throw new SiteRejectedException(SiteRejectedException.Reason.INVALID_STYLE,
                        "style must be one of random, exponential, none; was " + request.style());
            }
        }
        return new SiteDefinition(url, interval, style);
    }

    // Caller holds the monitor.
    private void cancelAll() {
        for (SiteTask task : tasks.values()) {
            task.cancel();
        }
        tasks.clear();
    }

    private String lastHash(long siteId) {
        return store.latestUpdate(siteId).map(Update::contentHash).orElse(null);
    }
}
