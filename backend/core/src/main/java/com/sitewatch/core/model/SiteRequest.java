package com.sitewatch.core.model;

/**
 * Unvalidated request to watch a URL. Missing interval and style fall back to configured
 * defaults when the registry accepts the request.
 */
public record SiteRequest(String url, Integer intervalSecs, String style) {
    public static SiteRequest of(String url) {
        return new SiteRequest(url, null, null);
    }
}
