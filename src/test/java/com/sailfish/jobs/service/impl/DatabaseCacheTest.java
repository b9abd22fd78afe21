package com.sailfish.jobs.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sailfish.jobs.MutableClock;
import com.sailfish.jobs.TestDatabase;
import com.sailfish.jobs.repository.JpaCacheRepository;
import com.sailfish.jobs.repository.JpaTransactions;
import jakarta.persistence.EntityManagerFactory;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DatabaseCacheTest {

    private EntityManagerFactory emf;
    private MutableClock clock;
    private DatabaseCache cache;

    @BeforeEach
    void setUp() {
        emf = TestDatabase.create();
        clock = new MutableClock(LocalDateTime.of(2024, 3, 19, 13, 0));
        cache = new DatabaseCache(new JpaCacheRepository(new JpaTransactions(emf)), clock);
    }

    @AfterEach
    void tearDown() {
        emf.close();
    }

    @Test
    @DisplayName("A value is readable until its time to live elapses")
    void valueExpires() {
        cache.set("greeting", "hello", Duration.ofMinutes(5));

        assertEquals("hello", cache.get("greeting", String.class).orElseThrow());

        clock.advance(Duration.ofMinutes(4));
        assertTrue(cache.get("greeting", String.class).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertFalse(cache.get("greeting", String.class).isPresent());
    }

    @Test
    @DisplayName("Setting an existing key replaces its value and expiry")
    void setReplaces() {
        cache.set("counter", 1, Duration.ofMinutes(1));
        cache.set("counter", 2, Duration.ofHours(1));

        clock.advance(Duration.ofMinutes(30));
        assertEquals(2, cache.get("counter", Integer.class).orElseThrow());
    }

    @Test
    @DisplayName("getOrCompute runs the fallback only on a miss")
    void getOrComputeCachesResult() {
        AtomicInteger calls = new AtomicInteger();
        TypeReference<List<String>> type = new TypeReference<List<String>>() { };

        List<String> first = cache.getOrCompute("names", type, Duration.ofMinutes(10), () -> {
            calls.incrementAndGet();
            return List.of("ada", "grace");
        });
        List<String> second = cache.getOrCompute("names", type, Duration.ofMinutes(10), () -> {
            calls.incrementAndGet();
            return List.of("other");
        });

        assertEquals(List.of("ada", "grace"), first);
        assertEquals(first, second);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("getOrCompute returns the stored form of a freshly computed value")
    void getOrComputeReturnsStoredShape() {
        TypeReference<Map<String, Object>> type = new TypeReference<Map<String, Object>>() { };

        Map<String, Object> computed = cache.getOrCompute("stats", type, Duration.ofMinutes(1), () -> Map.of("total", 42L));
        Map<String, Object> read = cache.get("stats", type).orElseThrow();

        assertEquals(read, computed);
        assertEquals(42, computed.get("total"));
    }

    @Test
    @DisplayName("A computed null is cached and not recomputed")
    void nullIsCached() {
        AtomicInteger calls = new AtomicInteger();

        assertNull(cache.getOrCompute("absent-user", String.class, Duration.ofHours(1), () -> {
            calls.incrementAndGet();
            return null;
        }));
        assertNull(cache.getOrCompute("absent-user", String.class, Duration.ofHours(1), () -> {
            calls.incrementAndGet();
            return "late";
        }));

        assertEquals(1, calls.get());
        assertTrue(cache.contains("absent-user"));
        assertFalse(cache.get("absent-user", String.class).isPresent());
    }

    @Test
    @DisplayName("contains sees stored nulls but not missing or expired keys")
    void containsTracksLiveEntries() {
        cache.set("nothing", null, Duration.ofMinutes(1));

        assertTrue(cache.contains("nothing"));
        assertFalse(cache.contains("missing"));

        clock.advance(Duration.ofMinutes(1));
        assertFalse(cache.contains("nothing"));
    }

    @Test
    @DisplayName("An expired entry is recomputed")
    void expiredEntryIsRecomputed() {
        cache.set("token", "old", Duration.ofSeconds(30));
        clock.advance(Duration.ofMinutes(1));

        assertEquals("new", cache.getOrCompute("token", String.class, Duration.ofMinutes(1), () -> "new"));
    }

    @Test
    @DisplayName("delete removes a single entry")
    void deleteRemovesEntry() {
        cache.set("a", "1", Duration.ofMinutes(1));
        cache.set("b", "2", Duration.ofMinutes(1));

        cache.delete("a");
        cache.delete("missing");

        assertFalse(cache.get("a", String.class).isPresent());
        assertTrue(cache.get("b", String.class).isPresent());
    }

    @Test
    @DisplayName("deleteExpired removes only expired entries and clear removes the rest")
    void deleteExpiredAndClear() {
        cache.set("short", "x", Duration.ofMinutes(1));
        cache.set("long", "y", Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, cache.deleteExpired());
        assertEquals(0, cache.deleteExpired());
        assertEquals(1, cache.clear());
        assertFalse(cache.get("long", String.class).isPresent());
    }

    @Test
    @DisplayName("Empty keys and negative lifetimes are rejected")
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> cache.set("", "x", Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class, () -> cache.get(null, String.class));
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "x", Duration.ofSeconds(-1)));
    }
}
