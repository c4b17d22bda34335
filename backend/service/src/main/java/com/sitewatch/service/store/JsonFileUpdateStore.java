package com.sitewatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitewatch.core.model.Site;
import com.sitewatch.core.model.SiteDefinition;
import com.sitewatch.core.model.SiteStatus;
import com.sitewatch.core.model.Update;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.polling.store.InMemoryUpdateStore;
import com.sitewatch.polling.store.StorageException;
import com.sitewatch.polling.store.StoreSnapshot;
import com.sitewatch.polling.store.UpdateStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Update store persisted as a single JSON document. Reads are served from memory. A mutation is
 * applied to a copy of the tables, written through a temporary sibling and an atomic rename, and
 * only then becomes visible; a failed write leaves both memory and disk at the previous state.
 *
 * <p>A check that leaves the site's status unchanged only updates memory. Its {@code last_checked}
 * reaches the file with the next persisted mutation.
 */
public class JsonFileUpdateStore implements UpdateStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final int updateCacheSize;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile InMemoryUpdateStore delegate;

    public JsonFileUpdateStore(Path file, int updateCacheSize) {
        this.file = file;
        this.updateCacheSize = updateCacheSize;
        this.delegate = InMemoryUpdateStore.restore(updateCacheSize, loadIfPresent(file));
    }

    public Path file() {
        return file;
    }

    @Override
    public long upsertSite(SiteDefinition definition) {
        return mutate(copy -> copy.upsertSite(definition));
    }

    @Override
    public void deleteSite(long siteId) {
        mutate(copy -> {
            copy.deleteSite(siteId);
            return null;
        });
    }

    @Override
    public List<Site> listSites() {
        return delegate.listSites();
    }

    @Override
    public Optional<Site> getSite(long siteId) {
        return delegate.getSite(siteId);
    }

    @Override
    public boolean recordCheck(long siteId, SiteStatus status, Instant checkedAt) {
        lock.lock();
        try {
            Optional<Site> current = delegate.getSite(siteId);
            if (current.isEmpty()) {
                return false;
            }
            if (current.get().status() == status) {
                return delegate.recordCheck(siteId, status, checkedAt);
            }
            return mutate(copy -> copy.recordCheck(siteId, status, checkedAt));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean recordChange(long siteId, Instant changedAt) {
        return mutate(copy -> copy.recordChange(siteId, changedAt));
    }

    @Override
    public Optional<Update> appendUpdate(long siteId, Instant timestamp, String contentHash, String content) {
        return mutate(copy -> copy.appendUpdate(siteId, timestamp, contentHash, content));
    }

    @Override
    public Optional<Update> getUpdate(long siteId, long updateId) {
        return delegate.getUpdate(siteId, updateId);
    }

    @Override
    public Optional<Update> getUpdateAt(long siteId, Instant timestamp) {
        return delegate.getUpdateAt(siteId, timestamp);
    }

    @Override
    public List<Update> listUpdates(long siteId) {
        return delegate.listUpdates(siteId);
    }

    @Override
    public Optional<Update> latestUpdate(long siteId) {
        return delegate.latestUpdate(siteId);
    }

    @Override
    public void resetAll() {
        mutate(copy -> {
            copy.resetAll();
            return null;
        });
    }

    private <T> T mutate(Function<InMemoryUpdateStore, T> change) {
        lock.lock();
        try {
            InMemoryUpdateStore copy = InMemoryUpdateStore.restore(updateCacheSize, delegate.snapshot());
            T result = change.apply(copy);
            persist(copy.snapshot());
            delegate = copy;
            return result;
        } finally {
            lock.unlock();
        }
    }

    private static StoreSnapshot loadIfPresent(Path file) {
        if (!Files.exists(file)) {
            return StoreSnapshot.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            StoreSnapshot loaded = MAPPER.readValue(in, StoreSnapshot.class);
            return loaded == null ? StoreSnapshot.empty() : loaded;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading watcher state from " + file, e);
        }
    }

    // Caller holds the lock.
    private void persist(StoreSnapshot snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(temp)) {
                    MAPPER.writeValue(out, snapshot);
                }
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new StorageException("Failed writing watcher state to " + file, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
