package com.sailfish.jobs.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.sailfish.jobs.model.CacheEntry;
import com.sailfish.jobs.repository.CacheRepository;
import com.sailfish.jobs.service.Cache;
import com.sailfish.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache stored in the shared database so every process sees the same entries.
 *
 * <p>{@link #getOrCompute} takes no lock. When several callers miss the same key at once,
 * each of them runs the fallback and the last write wins.
 */
public class DatabaseCache implements Cache {

    private static final Logger log = LoggerFactory.getLogger(DatabaseCache.class);

    private final CacheRepository cacheRepository;
    private final Clock clock;

    public DatabaseCache(CacheRepository cacheRepository, Clock clock) {
        this.cacheRepository = Objects.requireNonNull(cacheRepository, "cacheRepository cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return read(key, Json.type(type));
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return read(key, Json.type(type));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        write(key, Json.writeBytes(value), ttl);
    }

    @Override
    public boolean contains(String key) {
        requireKey(key);
        return cacheRepository.findLive(key, LocalDateTime.now(clock)).isPresent();
    }

    @Override
    public void delete(String key) {
        requireKey(key);
        cacheRepository.deleteById(key);
    }

    @Override
    public <T> T getOrCompute(String key, Class<T> type, Duration ttl, Supplier<?> fallback) {
        return getOrCompute(key, Json.type(type), ttl, fallback);
    }

    @Override
    public <T> T getOrCompute(String key, TypeReference<T> type, Duration ttl, Supplier<?> fallback) {
        return getOrCompute(key, Json.type(type), ttl, fallback);
    }

    @Override
    public int deleteExpired() {
        int deleted = cacheRepository.deleteExpired(LocalDateTime.now(clock));
        log.debug("Deleted {} expired cache entries.", deleted);
        return deleted;
    }

    @Override
    public int clear() {
        int deleted = cacheRepository.deleteAll();
        log.info("Cleared cache, {} entries deleted.", deleted);
        return deleted;
    }

    private <T> T getOrCompute(String key, JavaType type, Duration ttl, Supplier<?> fallback) {
        Objects.requireNonNull(fallback, "fallback cannot be null");
        requireKey(key);
        Optional<CacheEntry> cached = cacheRepository.findLive(key, LocalDateTime.now(clock));
        if (cached.isPresent()) {
            // a stored null is a hit as well
            return Json.readBytes(cached.get().getPayload(), type);
        }
        log.debug("Cache miss for '{}', computing.", key);
        byte[] bytes = Json.writeBytes(fallback.get());
        write(key, bytes, ttl);
        // decode what was stored so the caller sees the same shape a later get returns
        return Json.readBytes(bytes, type);
    }

    private <T> Optional<T> read(String key, JavaType type) {
        requireKey(key);
        Optional<CacheEntry> entry = cacheRepository.findLive(key, LocalDateTime.now(clock));
        if (!entry.isPresent()) {
            return Optional.empty();
        }
        T value = Json.readBytes(entry.get().getPayload(), type);
        return Optional.ofNullable(value);
    }

    private void write(String key, byte[] bytes, Duration ttl) {
        requireKey(key);
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl cannot be negative");
        }
        cacheRepository.upsert(new CacheEntry(key, bytes, LocalDateTime.now(clock).plus(ttl)));
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("cache key cannot be empty");
        }
    }
}
