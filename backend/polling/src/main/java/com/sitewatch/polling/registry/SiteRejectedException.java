package com.sitewatch.polling.registry;

/**
 * Thrown when a site cannot be registered. {@link #reason()} tells callers which input was wrong.
 */
public class SiteRejectedException extends IllegalArgumentException {
    public enum Reason {
        INVALID_URL,
        INVALID_INTERVAL,
        INVALID_STYLE,
        DUPLICATE_URL
    }

    private final Reason reason;

    public SiteRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
