package com.sitewatch.polling.schedule;

import java.time.Duration;

/**
 * Doubles the delay after every failure, up to {@code cap}, and returns to the base interval on
 * the first success.
 */
final class ExponentialBackoffPolicy implements DelayPolicy {
    private final Duration interval;
    private final Duration cap;
    private Duration current;

    ExponentialBackoffPolicy(Duration interval, Duration cap) {
        this.interval = interval;
        this.cap = cap;
        this.current = interval;
    }

    @Override
    public Duration nextDelay(boolean success) {
        if (success) {
            current = interval;
        } else {
            Duration doubled = current.multipliedBy(2);
            current = doubled.compareTo(cap) > 0 ? cap : doubled;
        }
        return current;
    }

    @Override
    public Duration currentDelay() {
        return current;
    }
}
