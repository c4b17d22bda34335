package com.sitewatch.polling.store;

import com.sitewatch.core.model.PollStyle;
import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteDefinition;
import com.sitewatch.core.model.SiteStatus;
import com.sitewatch.core.model.Update;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryUpdateStoreTest {
    private static final Instant T0 = Instant.parse("2026-02-09T20:00:00Z");

    @Test
    void appendEvictsOldestBeyondCacheSize() {
        InMemoryUpdateStore store = new InMemoryUpdateStore(5);
        long siteId = store.upsertSite(definition("https://example.com/a"));

        for (int i = 0; i < 7; i++) {
            assertTrue(store.appendUpdate(siteId, T0.plusSeconds(i), "h" + i, "body " + i).isPresent());
        }

        List<Update> kept = store.listUpdates(siteId);
        assertEquals(5, kept.size());
        assertEquals(List.of("h2", "h3", "h4", "h5", "h6"), kept.stream().map(Update::contentHash).toList());
        assertEquals("h6", store.latestUpdate(siteId).orElseThrow().contentHash());
        assertTrue(store.getUpdateAt(siteId, T0.plusSeconds(1)).isEmpty());
        assertEquals("body 4", store.getUpdateAt(siteId, T0.plusSeconds(4)).orElseThrow().content());
    }

    @Test
    void writesAgainstMissingSitesAreIgnored() {
        InMemoryUpdateStore store = new InMemoryUpdateStore(5);
        long siteId = store.upsertSite(definition("https://example.com/a"));
        store.deleteSite(siteId);

        assertTrue(store.appendUpdate(siteId, T0, "h", "body").isEmpty());
        assertFalse(store.recordCheck(siteId, SiteStatus.OK, T0));
        assertFalse(store.recordChange(siteId, T0));
        assertTrue(store.getSite(siteId).isEmpty());
        assertTrue(store.listUpdates(siteId).isEmpty());
    }

    @Test
    void deleteIsIdempotentAndRemovesOwnedUpdates() {
        InMemoryUpdateStore store = new InMemoryUpdateStore(5);
        long keep = store.upsertSite(definition("https://example.com/keep"));
        long drop = store.upsertSite(definition("https://example.com/drop"));
        store.appendUpdate(keep, T0, "k", "keep");
        store.appendUpdate(drop, T0, "d", "drop");

        store.deleteSite(drop);
        store.deleteSite(drop);

        assertEquals(List.of(keep), store.listSites().stream().map(Site::id).toList());
        assertTrue(store.listUpdates(drop).isEmpty());
        assertEquals(1, store.listUpdates(keep).size());
    }

    @Test
    void upsertReturnsExistingIdForSameUrl() {
        InMemoryUpdateStore store = new InMemoryUpdateStore(5);
        long first = store.upsertSite(new SiteDefinition("https://example.com", 10, PollStyle.NONE));
        long second = store.upsertSite(new SiteDefinition("https://example.com", 60, PollStyle.EXPONENTIAL));

        assertEquals(first, second);
        Site site = store.getSite(first).orElseThrow();
        assertEquals(60, site.intervalSecs());
        assertEquals(PollStyle.EXPONENTIAL, site.style());
        assertEquals(SiteStatus.PENDING, site.status());
    }

    @Test
    void recordCheckAndChangeReplaceTheSiteRecord() {
        InMemoryUpdateStore store = new InMemoryUpdateStore(5);
        long siteId = store.upsertSite(definition("https://example.com"));

        assertTrue(store.recordCheck(siteId, SiteStatus.OK, T0));
        assertTrue(store.recordChange(siteId, T0));
        assertTrue(store.recordCheck(siteId, SiteStatus.ERROR, T0.plusSeconds(5)));

        Site site = store.getSite(siteId).orElseThrow();
        assertEquals(SiteStatus.ERROR, site.status());
        assertEquals(T0.plusSeconds(5), site.lastChecked());
        assertEquals(T0, site.lastUpdated());
    }

    @Test
    void concurrentAppendsNeverExceedCacheSize() throws Exception {
        InMemoryUpdateStore store = new InMemoryUpdateStore(5);
        long siteId = store.upsertSite(definition("https://example.com"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < 50; i++) {
                        ids.add(store.appendUpdate(siteId, T0.plusMillis(thread * 1000L + i), "h", "c").orElseThrow().id());
                        assertTrue(store.listUpdates(siteId).size() <= 5);
                    }
                    return ids;
                }));
            }
            start.countDown();

            Set<Long> allIds = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                allIds.addAll(future.get());
            }
            assertEquals(400, allIds.size());
            assertEquals(5, store.listUpdates(siteId).size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void restoreTrimsHistoriesDropsOrphansAndContinuesSequences() {
        Site site = Site.pending(3, definition("https://example.com"));
        List<Update> updates = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            updates.add(new Update(i, 3, T0.plusSeconds(i), "h" + i, "c" + i));
        }
        updates.add(new Update(9, 42, T0, "orphan", "gone"));

        InMemoryUpdateStore store = InMemoryUpdateStore.restore(2, new StoreSnapshot(List.of(site), updates, 1, 1));

        assertEquals(List.of(3L, 4L), store.listUpdates(3).stream().map(Update::id).toList());
        assertTrue(store.listUpdates(42).isEmpty());
        assertEquals(4, store.upsertSite(definition("https://example.org")));
        assertEquals(5, store.appendUpdate(3, T0.plusSeconds(10), "h", "c").orElseThrow().id());
    }

    @Test
    void resetAllWipesEverything() {
        InMemoryUpdateStore store = new InMemoryUpdateStore(5);
        long siteId = store.upsertSite(definition("https://example.com"));
        store.appendUpdate(siteId, T0, "h", "c");

        store.resetAll();

        assertTrue(store.listSites().isEmpty());
        assertTrue(store.listUpdates(siteId).isEmpty());
        assertTrue(store.snapshot().updates().isEmpty());
    }

    @Test
    void rejectsNonPositiveCacheSize() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryUpdateStore(0));
    }

    private static SiteDefinition definition(String url) {
        return new SiteDefinition(url, 30, PollStyle.NONE);
    }
}
