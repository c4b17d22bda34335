package com.sitewatch.polling.schedule;

import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteStatus;

import java.time.Instant;

/**
 * Runtime status of one site, written only by the site's own task.
 */
final class SiteState {
    private Site site;
    private String lastHash;
    private long currentBackoffSecs;

    SiteState(Site site, String lastHash) {
        this.site = site.withBackoff(null);
        this.lastHash = lastHash;
        this.currentBackoffSecs = site.intervalSecs();
    }

    void markChecked(SiteStatus status, Instant checkedAt) {
        site = site.withCheck(status, checkedAt);
    }

    void markChanged(String hash, Instant changedAt) {
        lastHash = hash;
        site = site.withCheck(SiteStatus.OK, changedAt).withChange(changedAt);
    }

    void setCurrentBackoffSecs(long seconds) {
        currentBackoffSecs = seconds;
    }

    String lastHash() {
        return lastHash;
    }

    Site view() {
        return site.withBackoff(currentBackoffSecs);
    }
}
