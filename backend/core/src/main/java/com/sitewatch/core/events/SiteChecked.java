package com.sitewatch.core.events;

import java.time.Instant;

public record SiteChecked(
        Instant timestamp,
        long siteId,
        String url,
        CheckOutcome outcome,
        long durationMillis,
        long nextDelayMillis
) implements Event {
    @Override
    public String type() {
        return "SiteChecked";
    }
}
