package com.sitewatch.core.events;

public enum CheckOutcome {
    CHANGED,
    UNCHANGED,
    FAILED
}
