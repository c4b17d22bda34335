package com.sitewatch.polling.store;

import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteDefinition;
import com.sitewatch.core.model.SiteStatus;
import com.sitewatch.core.model.Update;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Sites and update history held in memory. All mutations run under one lock, so append-then-evict
 * is a single step per site and id sequences are handed out in creation order.
 */
public class InMemoryUpdateStore implements UpdateStore {
    private final int updateCacheSize;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Site> sites = new ConcurrentHashMap<>();
    private final Map<Long, Deque<Update>> updates = new HashMap<>();
    private long nextSiteId = 1;
    private long nextUpdateId = 1;

    public InMemoryUpdateStore(int updateCacheSize) {
        if (updateCacheSize < 1) {
            throw new IllegalArgumentException("updateCacheSize must be >= 1");
        }
        this.updateCacheSize = updateCacheSize;
    }

    /**
     * Rebuilds a store from a snapshot. Histories longer than {@code updateCacheSize} are cut
     * back to their newest entries, and updates of unknown sites are dropped.
     */
    public static InMemoryUpdateStore restore(int updateCacheSize, StoreSnapshot snapshot) {
        InMemoryUpdateStore store = new InMemoryUpdateStore(updateCacheSize);
        long maxSiteId = 0;
        for (Site site : snapshot.sites()) {
            store.sites.put(site.id(), site.withBackoff(null));
            maxSiteId = Math.max(maxSiteId, site.id());
        }
        long maxUpdateId = 0;
        List<Update> ordered = new ArrayList<>(snapshot.updates());
        ordered.sort(Comparator.comparingLong(Update::id));
        for (Update update : ordered) {
            if (!store.sites.containsKey(update.siteId())) {
                continue;
            }
            store.append(update);
            maxUpdateId = Math.max(maxUpdateId, update.id());
        }
        store.nextSiteId = Math.max(snapshot.nextSiteId(), maxSiteId + 1);
        store.nextUpdateId = Math.max(snapshot.nextUpdateId(), maxUpdateId + 1);
        return store;
    }

    public StoreSnapshot snapshot() {
        lock.lock();
        try {
            List<Update> allUpdates = new ArrayList<>();
            for (Deque<Update> history : updates.values()) {
                allUpdates.addAll(history);
            }
            allUpdates.sort(Comparator.comparingLong(Update::id));
            return new StoreSnapshot(listSites(), allUpdates, nextSiteId, nextUpdateId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long upsertSite(SiteDefinition definition) {
        lock.lock();
        try {
            for (Site existing : sites.values()) {
                if (existing.url().equals(definition.url())) {
                    sites.put(existing.id(), existing.withDefinition(definition));
                    return existing.id();
                }
            }
            long id = nextSiteId++;
            sites.put(id, Site.pending(id, definition));
            return id;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteSite(long siteId) {
        lock.lock();
        try {
            sites.remove(siteId);
            updates.remove(siteId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Site> listSites() {
        List<Site> all = new ArrayList<>(sites.values());
        all.sort(Comparator.comparingLong(Site::id));
        return all;
    }

    @Override
    public Optional<Site> getSite(long siteId) {
        return Optional.ofNullable(sites.get(siteId));
    }

    @Override
    public boolean recordCheck(long siteId, SiteStatus status, Instant checkedAt) {
        return replaceSite(siteId, site -> site.withCheck(status, checkedAt));
    }

    @Override
    public boolean recordChange(long siteId, Instant changedAt) {
        return replaceSite(siteId, site -> site.withChange(changedAt));
    }

    @Override
    public Optional<Update> appendUpdate(long siteId, Instant timestamp, String contentHash, String content) {
        lock.lock();
        try {
            if (!sites.containsKey(siteId)) {
                return Optional.empty();
            }
            Update update = new Update(nextUpdateId++, siteId, timestamp, contentHash, content);
            append(update);
            return Optional.of(update);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Update> getUpdate(long siteId, long updateId) {
        return findUpdate(siteId, update -> update.id() == updateId);
    }

    @Override
    public Optional<Update> getUpdateAt(long siteId, Instant timestamp) {
        return findUpdate(siteId, update -> update.timestamp().equals(timestamp));
    }

    @Override
    public List<Update> listUpdates(long siteId) {
        lock.lock();
        try {
            Deque<Update> history = updates.get(siteId);
            return history == null ? List.of() : List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Update> latestUpdate(long siteId) {
        lock.lock();
        try {
            Deque<Update> history = updates.get(siteId);
            return history == null ? Optional.empty() : Optional.ofNullable(history.peekLast());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resetAll() {
        lock.lock();
        try {
            sites.clear();
            updates.clear();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void append(Update update) {
        Deque<Update> history = updates.computeIfAbsent(update.siteId(), ignored -> new ArrayDeque<>());
        history.addLast(update);
        while (history.size() > updateCacheSize) {
            history.removeFirst();
        }
    }

    private boolean replaceSite(long siteId, UnaryOperator<Site> change) {
        lock.lock();
        try {
            Site current = sites.get(siteId);
            if (current == null) {
                return false;
            }
            sites.put(siteId, change.apply(current));
            return true;
        } finally {
            lock.unlock();
        }
    }

    private Optional<Update> findUpdate(long siteId, Predicate<Update> matcher) {
        lock.lock();
        try {
            Deque<Update> history = updates.get(siteId);
            if (history == null) {
                return Optional.empty();
            }
            return history.stream().filter(matcher).findFirst();
        } finally {
            lock.unlock();
        }
    }
}
