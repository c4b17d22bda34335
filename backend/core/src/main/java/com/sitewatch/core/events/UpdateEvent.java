package com.sitewatch.core.events;

import java.time.Instant;

/**
 * Live notification that a site's content changed. Carries a bounded preview only; the full
 * snapshot stays in the update store and is fetched by site id and timestamp.
 */
public record UpdateEvent(
        long siteId,
        String url,
        Instant timestamp,
        String diffHash,
        String contentPreview,
        boolean hasFullContent
) implements Event {
    @Override
    public String type() {
        return "SiteUpdated";
    }
}
