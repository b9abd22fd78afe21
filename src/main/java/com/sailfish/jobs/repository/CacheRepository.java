package com.sailfish.jobs.repository;

import com.sailfish.jobs.model.CacheEntry;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Key/value storage with expiry, backing the database cache.
 */
public interface CacheRepository {

    /**
     * Finds an entry that has not expired at {@code now}.
     */
    Optional<CacheEntry> findLive(String id, LocalDateTime now);

    /**
     * Inserts the entry or replaces the value and expiry of an existing one.
     */
    void upsert(CacheEntry entry);

    boolean deleteById(String id);

    /**
     * Deletes entries whose expiry is before {@code now}.
     *
     * @return The number of deleted entries.
     */
    int deleteExpired(LocalDateTime now);

    /**
     * @return The number of deleted entries.
     */
    int deleteAll();
}
