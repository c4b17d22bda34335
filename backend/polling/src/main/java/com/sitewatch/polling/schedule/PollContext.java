package com.sitewatch.polling.schedule;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.polling.broadcast.UpdateBroadcaster;
import com.sitewatch.polling.config.WatcherSettings;
import com.sitewatch.polling.fetch.Fetcher;
import com.sitewatch.polling.store.UpdateStore;

import java.time.Clock;
import java.util.Objects;

public record PollContext(
        Fetcher fetcher,
        UpdateStore store,
        UpdateBroadcaster broadcaster,
        EventBus eventBus,
        Clock clock,
        WatcherSettings settings
) {
    public PollContext {
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(broadcaster, "broadcaster is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}
