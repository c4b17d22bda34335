package com.sitewatch.polling.store;

import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteDefinition;
import com.sitewatch.core.model.SiteStatus;
import com.sitewatch.core.model.Update;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Sites and their bounded change history. Every mutation replaces records whole, so concurrent
 * readers never see a half-applied change. Writes against a site that no longer exists are
 * ignored rather than recreating it.
 *
 * <p>Implementations report persistence problems with {@link StorageException}.
 */
public interface UpdateStore {
    /**
     * Inserts a new pending site, or updates interval and style of the site that already has
     * this URL.
     *
     * @return the id of the inserted or updated site
     */
    long upsertSite(SiteDefinition definition);

    /**
     * Removes the site and all of its updates. Unknown ids are ignored.
     */
    void deleteSite(long siteId);

    List<Site> listSites();

    Optional<Site> getSite(long siteId);

    /**
     * @return {@code false} when the site does not exist, in which case nothing is written
     */
    boolean recordCheck(long siteId, SiteStatus status, Instant checkedAt);

    /**
     * @return {@code false} when the site does not exist, in which case nothing is written
     */
    boolean recordChange(long siteId, Instant changedAt);

    /**
     * Stores a new update and, in the same step, evicts the oldest updates of that site beyond
     * the configured cache size.
     *
     * @return the stored update, or empty when the site does not exist
     */
    Optional<Update> appendUpdate(long siteId, Instant timestamp, String contentHash, String content);

    Optional<Update> getUpdate(long siteId, long updateId);

    Optional<Update> getUpdateAt(long siteId, Instant timestamp);

    /**
     * @return the stored updates of the site, oldest first
     */
    List<Update> listUpdates(long siteId);

    Optional<Update> latestUpdate(long siteId);

    /**
     * Deletes every site and update. Intended for operator recovery only.
     */
    void resetAll();
}
