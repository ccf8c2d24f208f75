package com.pubannotator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store with the same upsert semantics as {@link PostgresService}. Used for dry
 * runs and tests.
 */
public class InMemoryPersistenceService implements PersistenceServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryPersistenceService.class);

    private final ConcurrentHashMap<String, PersistedEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void createTables() {
        logger.debug("In-memory store needs no tables.");
    }

    @Override
    public boolean alreadyProcessed(String id) throws PersistenceException {
        PersistedEntry entry = entries.get(id);
        return entry != null && entry.hasAnnotation();
    }

    @Override
    public boolean markedFailed(String id) throws PersistenceException {
        PersistedEntry entry = entries.get(id);
        return entry != null && entry.status() == RecordStatus.FAILED;
    }

    @Override
    public Map<String, String> idsByIdentityKey() throws PersistenceException {
        List<PersistedEntry> oldestFirst = new ArrayList<>(entries.values());
        oldestFirst.sort(Comparator.comparing(PersistedEntry::createdAt).thenComparing(PersistedEntry::id));
        Map<String, String> ids = new HashMap<>();
        for (PersistedEntry entry : oldestFirst) {
            ids.putIfAbsent(entry.identityKey(), entry.id());
        }
        return ids;
    }

    @Override
    public void upsert(PersistedEntry entry) throws PersistenceException {
        if (entry == null) {
            throw new PersistenceException("Cannot upsert a null entry");
        }
        entries.compute(entry.id(), (id, existing) -> {
            if (existing == null) return entry;
            if (existing.sameContentAs(entry)) return existing;
            return entry.withTimestamps(existing.createdAt(), entry.updatedAt());
        });
    }

    @Override
    public Optional<PersistedEntry> find(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public int count() {
        return entries.size();
    }

    /** Snapshot of all entries ordered by id. */
    public List<PersistedEntry> entries() {
        List<PersistedEntry> all = new ArrayList<>(entries.values());
        all.sort(Comparator.comparing(PersistedEntry::id));
        return all;
    }
}
