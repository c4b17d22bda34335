package com.sitewatch.polling.schedule;

import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.CheckOutcome;
import com.sitewatch.core.events.SiteChecked;
import com.sitewatch.core.events.UpdateEvent;
import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteStatus;
import com.sitewatch.core.util.HashingUtils;
import com.sitewatch.core.util.PreviewExtractor;
import com.sitewatch.polling.fetch.FetchResult;
import com.sitewatch.polling.store.StorageException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The polling loop of a single site: fetch, compare, record, notify, wait, repeat.
 *
 * <p>Every effect of a cycle (store writes, broadcasts, state changes) is applied while holding
 * {@code lock} and only after checking {@code cancelled}. {@link #cancel()} takes the same lock,
 * so once it returns the task writes nothing more for this site.
 */
public final class SiteTask {
    private static final Logger LOGGER = Logger.getLogger(SiteTask.class.getName());

    private final long siteId;
    private final String url;
    private final PollContext context;
    private final ScheduledExecutorService timer;
    private final Executor workers;
    private final DelayPolicy delayPolicy;

    private final ReentrantLock lock = new ReentrantLock();
    private final SiteState state;
    private boolean cancelled;
    private ScheduledFuture<?> pendingTimer;
    private CompletableFuture<FetchResult> inFlight;
    private volatile Site view;

    SiteTask(
            Site site,
            String lastHash,
            PollContext context,
            ScheduledExecutorService timer,
            Executor workers,
            DelayPolicy delayPolicy
    ) {
        this.siteId = site.id();
        this.url = site.url();
        this.context = context;
        this.timer = timer;
        this.workers = workers;
        this.delayPolicy = delayPolicy;
        this.state = new SiteState(site, lastHash);
        this.state.setCurrentBackoffSecs(delayPolicy.currentDelay().toSeconds());
        this.view = state.view();
    }

    public long siteId() {
        return siteId;
    }

    public String url() {
        return url;
    }

    /**
     * Latest snapshot of the site as seen by this task, including the working backoff delay.
     */
    public Site view() {
        return view;
    }

    /**
     * Stops the loop. Waits for a cycle that is currently applying its results; an outstanding
     * fetch is abandoned and its result ignored. Calling it again has no effect.
     */
    public void cancel() {
        lock.lock();
        try {
            if (cancelled) {
                return;
            }
            cancelled = true;
            if (pendingTimer != null) {
                pendingTimer.cancel(false);
                pendingTimer = null;
            }
            if (inFlight != null) {
                inFlight.cancel(true);
                inFlight = null;
            }
        } finally {
            lock.unlock();
        }
        LOGGER.fine(() -> "Stopped polling site " + siteId + " (" + url + ")");
    }

    void schedule(Duration delay) {
        lock.lock();
        try {
            if (cancelled) {
                return;
            }
            pendingTimer = timer.schedule(this::runCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.fine(() -> "Scheduler is shut down; site " + siteId + " will not be polled again");
        } finally {
            lock.unlock();
        }
    }

    private void runCycle() {
        CompletableFuture<FetchResult> fetch;
        lock.lock();
        try {
            if (cancelled) {
                return;
            }
            pendingTimer = null;
            try {
                fetch = context.fetcher().fetch(url, context.settings().fetchTimeout());
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Fetcher failed for " + url, e);
                fetch = CompletableFuture.completedFuture(FetchResult.failure(0, "Fetch failure for " + url + ": " + e, 0));
            }
            inFlight = fetch;
        } finally {
            lock.unlock();
        }
        try {
            fetch.whenCompleteAsync(this::complete, workers);
        } catch (RejectedExecutionException e) {
            LOGGER.fine(() -> "Worker pool is shut down; dropping result for site " + siteId);
        }
    }

    private void complete(FetchResult result, Throwable error) {
        Duration next;
        lock.lock();
        try {
            if (cancelled) {
                return;
            }
            inFlight = null;
            Instant now = context.clock().instant().truncatedTo(ChronoUnit.MILLIS);
            FetchResult fetched = error == null
                    ? result
                    : FetchResult.failure(0, "Fetch failure for " + url + ": " + error, 0);

            CheckOutcome outcome;
            try {
                outcome = apply(fetched, now);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Unexpected failure while checking " + url, e);
                state.markChecked(SiteStatus.ERROR, now);
                outcome = CheckOutcome.FAILED;
            }

            next = delayPolicy.nextDelay(outcome != CheckOutcome.FAILED);
            state.setCurrentBackoffSecs(delayPolicy.currentDelay().toSeconds());
            view = state.view();
            context.eventBus().publish(new SiteChecked(now, siteId, url, outcome, fetched.durationMillis(), next.toMillis()));
        } finally {
            lock.unlock();
        }
        schedule(next);
    }

    // Caller holds the lock.
    private CheckOutcome apply(FetchResult fetched, Instant now) {
        if (!fetched.success()) {
            state.markChecked(SiteStatus.ERROR, now);
            recordErrorCheck(now);
            raiseAlert(now, fetched.error());
            return CheckOutcome.FAILED;
        }
        try {
            String hash = HashingUtils.contentFingerprint(fetched.content());
            if (hash.equals(state.lastHash())) {
                context.store().recordCheck(siteId, SiteStatus.OK, now);
                state.markChecked(SiteStatus.OK, now);
                return CheckOutcome.UNCHANGED;
            }

            context.store().appendUpdate(siteId, now, hash, fetched.content())
                    .orElseThrow(() -> new StorageException("Site " + siteId + " is not in the store"));
            state.markChanged(hash, now);
            context.broadcaster().publish(new UpdateEvent(
                    siteId,
                    url,
                    now,
                    hash,
                    PreviewExtractor.preview(fetched.content(), context.settings().previewLength()),
                    true
            ));
            context.store().recordCheck(siteId, SiteStatus.OK, now);
            context.store().recordChange(siteId, now);
            LOGGER.info(() -> "Change detected for " + url + " (" + hash.substring(0, 12) + ")");
            return CheckOutcome.CHANGED;
        } catch (StorageException e) {
            LOGGER.log(Level.WARNING, "Storage failure while recording check of " + url, e);
            state.markChecked(SiteStatus.ERROR, now);
            raiseAlert(now, "Storage failure for " + url + ": " + e.getMessage());
            return CheckOutcome.FAILED;
        }
    }

    private void recordErrorCheck(Instant now) {
        try {
            context.store().recordCheck(siteId, SiteStatus.ERROR, now);
        } catch (StorageException e) {
            LOGGER.log(Level.WARNING, "Could not persist failed check of " + url, e);
        }
    }

    private void raiseAlert(Instant now, String message) {
        LOGGER.warning(message);
        context.eventBus().publish(new AlertRaised(now, "site", message, Map.of("siteId", siteId, "url", url)));
    }
}
