package com.sitewatch.service;

import com.sitewatch.core.model.SiteRequest;
import com.sitewatch.polling.registry.SiteRegistry;
import com.sitewatch.polling.store.StorageException;

import java.util.List;
import java.util.logging.Logger;

/**
 * Registers the configured starter sites. Entries that are rejected or fail to persist are
 * logged and skipped.
 */
public final class DefaultSites {
    private static final Logger LOGGER = Logger.getLogger(DefaultSites.class.getName());

    private DefaultSites() {
    }

    public static int seed(SiteRegistry registry, List<SiteRequest> defaults) {
        int added = 0;
        for (SiteRequest request : defaults) {
            try {
                registry.addSite(request);
                added++;
            } catch (IllegalArgumentException | StorageException e) {
                LOGGER.warning("Skipping default site " + (request == null ? null : request.url()) + ": " + e.getMessage());
            }
        }
        if (added > 0) {
            LOGGER.info("Added " + added + " default sites");
        }
        return added;
    }
}
