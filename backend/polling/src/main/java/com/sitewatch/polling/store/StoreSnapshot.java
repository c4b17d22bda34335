package com.sitewatch.polling.store;

import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.Update;

import java.util.List;

public record StoreSnapshot(List<Site> sites, List<Update> updates, long nextSiteId, long nextUpdateId) {
    public StoreSnapshot {
        sites = sites == null ? List.of() : List.copyOf(sites);
        updates = updates == null ? List.of() : List.copyOf(updates);
    }

    public static StoreSnapshot empty() {
        return new StoreSnapshot(List.of(), List.of(), 1, 1);
    }
}
