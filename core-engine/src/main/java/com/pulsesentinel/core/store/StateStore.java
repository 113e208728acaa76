package com.pulsesentinel.core.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for the engine's collections.
 *
 * <p>
 * Each collection is stored as a whole JSON-serialisable list. Implementations
 * must be safe for concurrent use and must throw {@link PersistenceException}
 * on I/O failure instead of returning partial data.
 * </p>
 */
public interface StateStore {

    /**
     * @param key collection to read
     * @return the stored list, or empty if the collection was never saved
     * @throws PersistenceException if the collection exists but cannot be read
     */
    <T> Optional<List<T>> load(StoreKey<T> key);

    /**
     * Replace a collection.
     *
     * @param key   collection to write
     * @param items new contents, in retention order (oldest first)
     * @throws PersistenceException if the write fails
     */
    <T> void save(StoreKey<T> key, List<T> items);
}
