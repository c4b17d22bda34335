package com.sitewatch.polling.broadcast;

import com.sitewatch.core.events.UpdateEvent;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One subscriber's view of the update stream: a bounded buffer filled by the broadcaster and
 * drained by the subscriber at its own pace.
 */
public final class Subscription implements AutoCloseable {
    public enum CloseReason {
        UNSUBSCRIBED,
        OVERLOADED,
        SHUTDOWN
    }

    private final long id;
    private final BlockingQueue<UpdateEvent> queue;
    private final Consumer<Subscription> onClose;
    private volatile CloseReason closeReason;

    Subscription(long id, int capacity, Consumer<Subscription> onClose) {
        this.id = id;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    public long id() {
        return id;
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or {@code null} when none arrived in time or the subscription is
     *         closed and drained
     */
    public UpdateEvent poll(Duration timeout) throws InterruptedException {
        UpdateEvent next = queue.poll();
        if (next != null || !isOpen()) {
            return next;
        }
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isOpen() {
        return closeReason == null;
    }

    public CloseReason closeReason() {
        return closeReason;
    }

    @Override
    public void close() {
        closeWith(CloseReason.UNSUBSCRIBED);
    }

    boolean offer(UpdateEvent event) {
        return isOpen() && queue.offer(event);
    }

    void closeWith(CloseReason reason) {
        synchronized (this) {
            if (closeReason != null) {
                return;
            }
            closeReason = reason;
        }
        onClose.accept(this);
    }
}
