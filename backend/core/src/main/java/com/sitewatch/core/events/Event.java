package com.sitewatch.core.events;

import java.time.Instant;

public interface Event {
    String type();

    Instant timestamp();
}
