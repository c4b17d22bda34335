package com.sitewatch.polling.schedule;

import java.time.Duration;
import java.util.Random;

/**
 * Base interval plus a uniform random jitter in {@code [0, jitterMaxMs]}, drawn anew every cycle
 * whatever the outcome.
 */
final class JitterDelayPolicy implements DelayPolicy {
    private final Duration interval;
    private final long jitterMaxMs;
    private final Random random;

    JitterDelayPolicy(Duration interval, long jitterMaxMs, Random random) {
        this.interval = interval;
        this.jitterMaxMs = jitterMaxMs;
        this.random = random;
    }

    @Override
    public Duration nextDelay(boolean success) {
        if (jitterMaxMs == 0) {
            return interval;
        }
        long jitter = (long) Math.floor(random.nextDouble() * (jitterMaxMs + 1));
        return interval.plusMillis(Math.min(jitter, jitterMaxMs));
    }

    @Override
    public Duration currentDelay() {
        return interval;
    }
}
