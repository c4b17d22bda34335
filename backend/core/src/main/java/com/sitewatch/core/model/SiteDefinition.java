package com.sitewatch.core.model;

import java.util.Objects;

public record SiteDefinition(String url, int intervalSecs, PollStyle style) {
    public SiteDefinition {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(style, "style is required");
    }
}
