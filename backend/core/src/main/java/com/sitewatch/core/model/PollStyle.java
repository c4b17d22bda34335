package com.sitewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PollStyle {
    RANDOM,
    EXPONENTIAL,
    NONE;

    @JsonCreator
    public static PollStyle parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Poll style is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown poll style: " + raw, e);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
