package com.pubannotator.pipeline;

import java.util.Map;
import java.util.Optional;

/**
 * Interface for the keyed store holding annotated records.
 * <p>
 * Writes are upserts keyed by entry id: writing an id again replaces its fields and
 * {@code updatedAt} but keeps {@code createdAt}. Implementations never retry internally; every
 * failure surfaces as a {@link PersistenceException}. Calls for different ids may run concurrently.
 */
public interface PersistenceServiceInterface {
    /**
     * Creates the backing table if it doesn't already exist.
     */
    void createTables() throws PersistenceException;

    /**
     * @param id Record id
     * @return true if an entry with a non-null annotation is stored for this id
     */
    boolean alreadyProcessed(String id) throws PersistenceException;

    /**
     * @param id Record id
     * @return true if the stored entry carries the permanent {@link RecordStatus#FAILED} marker
     */
    boolean markedFailed(String id) throws PersistenceException;

    /**
     * Ids already assigned to stored entries, keyed by identity key. A run reuses these so a
     * record keeps its id even when the input around it changes.
     * @return identity key to id; when several entries share a key, the oldest one
     */
    Map<String, String> idsByIdentityKey() throws PersistenceException;

    /**
     * Inserts or replaces the entry with the same id.
     * @param entry Entry to write
     */
    void upsert(PersistedEntry entry) throws PersistenceException;

    Optional<PersistedEntry> find(String id) throws PersistenceException;

    int count() throws PersistenceException;
}
