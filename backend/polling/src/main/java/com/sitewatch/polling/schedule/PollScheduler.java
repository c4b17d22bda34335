package com.sitewatch.polling.schedule;

import com.sitewatch.core.model.Site;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Owns the threads that drive site tasks: one timer thread that only fires wake-ups, and a fixed
 * worker pool that applies fetch results. Fetches themselves are asynchronous, so a slow site never
 * holds a thread while waiting.
 */
public class PollScheduler implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(PollScheduler.class.getName());

    private final PollContext context;
    private final Random random;
    private final ScheduledThreadPoolExecutor timer;
    private final ExecutorService workers;

    public PollScheduler(PollContext context) {
        this(context, new Random());
    }

    public PollScheduler(PollContext context, Random random) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.random = Objects.requireNonNull(random, "random is required");
        this.timer = new ScheduledThreadPoolExecutor(1, daemonThreads("site-poll-timer"));
        this.timer.setRemoveOnCancelPolicy(true);
        this.workers = Executors.newFixedThreadPool(context.settings().workerThreads(), daemonThreads("site-poll-worker"));
    }

    public PollContext context() {
        return context;
    }

    /**
     * Starts polling {@code site}; the first check runs immediately.
     *
     * @param lastHash fingerprint of the newest stored update, or {@code null} when there is none
     */
    public SiteTask spawn(Site site, String lastHash) {
        DelayPolicy policy = DelayPolicy.forStyle(site.style(), site.intervalSecs(), context.settings(), random);
        SiteTask task = new SiteTask(site, lastHash, context, timer, workers, policy);
        task.schedule(Duration.ZERO);
        LOGGER.fine(() -> "Polling site " + site.id() + " (" + site.url() + ") every " + site.intervalSecs()
                + "s, style " + site.style().wireName());
        return task;
    }

    @Override
    public void close() {
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
