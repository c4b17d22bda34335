package com.sitewatch.polling.fetch;

public record FetchResult(boolean success, int statusCode, String content, String error, long durationMillis) {
    public static FetchResult success(int statusCode, String content, long durationMillis) {
        return new FetchResult(true, statusCode, content == null ? "" : content, null, durationMillis);
    }

    public static FetchResult failure(int statusCode, String error, long durationMillis) {
        return new FetchResult(false, statusCode, null, error, durationMillis);
    }
}
