package com.sitewatch.polling.broadcast;

import com.sitewatch.core.events.UpdateEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Fans update events out to every open subscription. Publishing never blocks on a subscriber: a
 * subscriber whose buffer is full is disconnected instead of slowing everyone else down.
 *
 * <p>Publish and subscribe share one short lock, so all subscribers observe the same event order
 * and an event reaches exactly the subscribers registered before it was published.
 */
public class UpdateBroadcaster {
    private static final Logger LOGGER = Logger.getLogger(UpdateBroadcaster.class.getName());

    private final int queueCapacity;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Object publishLock = new Object();
    private final AtomicLong nextId = new AtomicLong(1);
    private final LongAdder published = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    public UpdateBroadcaster(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        this.queueCapacity = queueCapacity;
    }

    public Subscription subscribe() {
        Subscription subscription = new Subscription(nextId.getAndIncrement(), queueCapacity, subscriptions::remove);
        synchronized (publishLock) {
            subscriptions.add(subscription);
        }
        return subscription;
    }

    public void publish(UpdateEvent event) {
        synchronized (publishLock) {
            published.increment();
            for (Subscription subscription : subscriptions) {
                if (!subscription.offer(event) && subscription.isOpen()) {
                    dropped.increment();
                    subscription.closeWith(Subscription.CloseReason.OVERLOADED);
                    LOGGER.info("Disconnected subscriber " + subscription.id() + " after its queue of "
                            + queueCapacity + " events filled up");
                }
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public long publishedCount() {
        return published.sum();
    }

    public long droppedCount() {
        return dropped.sum();
    }

    public void closeAll() {
        for (Subscription subscription : subscriptions) {
            subscription.closeWith(Subscription.CloseReason.SHUTDOWN);
        }
    }
}
