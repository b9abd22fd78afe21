package com.sailfish.jobs.service;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Database-backed key/value cache with expiry. Values are stored as JSON.
 */
public interface Cache {

    /**
     * @return The stored value decoded as {@code type}, or empty if there is no unexpired entry.
     *         A stored {@code null} also reads as empty; use {@link #contains} to tell the two apart.
     */
    <T> Optional<T> get(String key, Class<T> type);

    <T> Optional<T> get(String key, TypeReference<T> type);

    /**
     * Stores {@code value} under {@code key}, replacing any existing entry, until {@code ttl} elapses.
     */
    void set(String key, Object value, Duration ttl);

    /**
     * @return true if an unexpired entry exists for {@code key}, even one holding {@code null}.
     */
    boolean contains(String key);

    void delete(String key);

    /**
     * Returns the cached value or, on a miss, computes it with {@code fallback}, stores it and
     * returns it decoded from its stored form, exactly as a later {@link #get} would.
     *
     * <p>An unexpired entry holding {@code null} is a hit: the fallback does not run again.
     *
     * <p>There is no mutual exclusion: callers that miss at the same time each run the fallback.
     */
    <T> T getOrCompute(String key, Class<T> type, Duration ttl, Supplier<?> fallback);

    <T> T getOrCompute(String key, TypeReference<T> type, Duration ttl, Supplier<?> fallback);

    /**
     * Deletes entries that have expired.
     *
     * @return The number of deleted entries.
     */
    int deleteExpired();

    /**
     * Deletes every entry.
     *
     * @return The number of deleted entries.
     */
    int clear();
}
