package com.sitewatch.polling.schedule;

import java.time.Duration;

final class FixedDelayPolicy implements DelayPolicy {
    private final Duration interval;

    FixedDelayPolicy(Duration interval) {
        this.interval = interval;
    }

    @Override
    public Duration nextDelay(boolean success) {
        return interval;
    }

    @Override
    public Duration currentDelay() {
        return interval;
    }
}
