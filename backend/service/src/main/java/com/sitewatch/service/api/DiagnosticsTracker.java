package com.sitewatch.service.api;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.CheckOutcome;
import com.sitewatch.core.events.SiteChecked;
import com.sitewatch.polling.broadcast.UpdateBroadcaster;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Check counters and per-site health for {@code /api/metrics}, fed from the event bus.
 */
public final class DiagnosticsTracker {
    private final Clock clock;
    private final UpdateBroadcaster broadcaster;
    private final LongAdder checksTotal = new LongAdder();
    private final LongAdder changesTotal = new LongAdder();
    private final LongAdder failuresTotal = new LongAdder();
    private final ArrayDeque<Instant> recentChecks = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<Long, SiteHealth> siteHealth = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock, UpdateBroadcaster broadcaster) {
        this.clock = clock;
        this.broadcaster = broadcaster;
        eventBus.subscribe(SiteChecked.class, this::onSiteChecked);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("checks_total", checksTotal.longValue());
        metrics.put("changes_total", changesTotal.longValue());
        metrics.put("failures_total", failuresTotal.longValue());
        metrics.put("recent_checks_per_minute", recentChecksPerMinute());
        metrics.put("subscribers_connected", broadcaster.subscriberCount());
        metrics.put("subscribers_dropped", broadcaster.droppedCount());
        metrics.put("updates_published", broadcaster.publishedCount());
        metrics.put("sites", sitesSnapshot());
        return metrics;
    }

    public Map<String, Object> sitesSnapshot() {
        Map<String, Object> sites = new TreeMap<>();
        for (Map.Entry<Long, SiteHealth> entry : siteHealth.entrySet()) {
            sites.put(String.valueOf(entry.getKey()), entry.getValue().toMap());
        }
        return sites;
    }

    public void forgetSite(long siteId) {
        siteHealth.remove(siteId);
    }

    public void forgetAllSites() {
        siteHealth.clear();
    }

    private void onSiteChecked(SiteChecked event) {
        checksTotal.increment();
        if (event.outcome() == CheckOutcome.CHANGED) {
            changesTotal.increment();
        } else if (event.outcome() == CheckOutcome.FAILED) {
            failuresTotal.increment();
        }
        synchronized (recentLock) {
            recentChecks.addLast(event.timestamp());
            trimOld(clock.instant());
        }
        siteHealth.compute(event.siteId(), (id, current) -> {
            SiteHealth health = current == null ? SiteHealth.empty() : current;
            return health.withCheck(event);
        });
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"site".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        Object siteId = event.details().get("siteId");
        if (!(siteId instanceof Long id)) {
            return;
        }
        siteHealth.compute(id, (key, current) -> {
            SiteHealth health = current == null ? SiteHealth.empty() : current;
            return health.withLastErrorMessage(event.message());
        });
    }

    private int recentChecksPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentChecks.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentChecks.isEmpty()) {
            Instant first = recentChecks.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentChecks.removeFirst();
            } else {
                break;
            }
        }
    }

    private record SiteHealth(
            Instant lastCheckedAt,
            Long lastDurationMillis,
            CheckOutcome lastOutcome,
            Long nextDelayMillis,
            String lastErrorMessage
    ) {
        private static SiteHealth empty() {
            return new SiteHealth(null, null, null, null, null);
        }

        private SiteHealth withCheck(SiteChecked event) {
            String error = event.outcome() == CheckOutcome.FAILED ? lastErrorMessage : null;
            return new SiteHealth(event.timestamp(), event.durationMillis(), event.outcome(), event.nextDelayMillis(), error);
        }

        private SiteHealth withLastErrorMessage(String message) {
            return new SiteHealth(lastCheckedAt, lastDurationMillis, lastOutcome, nextDelayMillis, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("last_checked_at", lastCheckedAt == null ? null : lastCheckedAt.toString());
            map.put("last_duration_millis", lastDurationMillis);
            map.put("last_outcome", lastOutcome == null ? null : lastOutcome.name().toLowerCase(Locale.ROOT));
            map.put("next_delay_millis", nextDelayMillis);
            map.put("last_error_message", lastErrorMessage);
            return map;
        }
    }
}
