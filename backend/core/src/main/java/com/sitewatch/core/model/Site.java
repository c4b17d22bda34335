package com.sitewatch.core.model;

import java.time.Instant;

/**
 * One monitored target. Instances are immutable; every status or timestamp change produces a new
 * record so readers never observe a partially updated site.
 *
 * <p>{@code currentBackoffSecs} is runtime scheduling state and is only populated on views built
 * by the scheduler; stored records leave it {@code null}.
 */
public record Site(
        long id,
        String url,
        int intervalSecs,
        PollStyle style,
        SiteStatus status,
        Instant lastChecked,
        Instant lastUpdated,
        Long currentBackoffSecs
) {
    public static Site pending(long id, SiteDefinition definition) {
        return new Site(id, definition.url(), definition.intervalSecs(), definition.style(),
                SiteStatus.PENDING, null, null, null);
    }

    public Site withCheck(SiteStatus newStatus, Instant checkedAt) {
        return new Site(id, url, intervalSecs, style, newStatus, checkedAt, lastUpdated, currentBackoffSecs);
    }

    public Site withChange(Instant changedAt) {
        return new Site(id, url, intervalSecs, style, status, lastChecked, changedAt, currentBackoffSecs);
    }

    public Site withDefinition(SiteDefinition definition) {
        return new Site(id, url, definition.intervalSecs(), definition.style(), status, lastChecked, lastUpdated,
                currentBackoffSecs);
    }

    public Site withBackoff(Long backoffSecs) {
        return new Site(id, url, intervalSecs, style, status, lastChecked, lastUpdated, backoffSecs);
    }
}
