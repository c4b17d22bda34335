package com.sitewatch.core.model;

import java.time.Instant;

public record Update(
        long id,
        long siteId,
        Instant timestamp,
        String contentHash,
        String content
) {
}
