package com.sitewatch.polling.schedule;

import com.sitewatch.core.model.PollStyle;
import com.sitewatch.polling.config.WatcherSettings;

import java.time.Duration;
import java.util.Random;

/**
 * Computes the wait before a site's next poll. Instances keep per-site state and are only used
 * by the task that owns them.
 */
public interface DelayPolicy {
    /**
     * @param success whether the cycle that just finished succeeded
     * @return the delay before the next cycle
     */
    Duration nextDelay(boolean success);

    /**
     * The working delay without jitter: the base interval, or the current backoff after failures.
     */
    Duration currentDelay();

    static DelayPolicy forStyle(PollStyle style, int intervalSecs, WatcherSettings settings, Random random) {
        Duration interval = Duration.ofSeconds(intervalSecs);
        switch (style) {
            case RANDOM:
                return new JitterDelayPolicy(interval, settings.intervalJitterMaxMs(), random);
            case EXPONENTIAL:
                return new ExponentialBackoffPolicy(interval, settings.backoffCap());
            case NONE:
            default:
                return new FixedDelayPolicy(interval);
        }
    }
}
