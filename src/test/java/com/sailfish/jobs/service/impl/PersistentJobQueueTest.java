package com.sailfish.jobs.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.JobContext;
import com.sailfish.jobs.MutableClock;
import com.sailfish.jobs.TestDatabase;
import com.sailfish.jobs.model.JobPriority;
import com.sailfish.jobs.model.JobRecord;
import com.sailfish.jobs.registry.JobRegistry;
import com.sailfish.jobs.repository.JpaJobRepository;
import com.sailfish.jobs.repository.JpaTransactions;
import com.sailfish.jobs.service.JobOutcome;
import com.sailfish.jobs.util.Json;
import jakarta.persistence.EntityManagerFactory;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PersistentJobQueueTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 19, 13, 0);

    private EntityManagerFactory emf;
    private JpaJobRepository repository;
    private MutableClock clock;
    private PersistentJobQueue queue;
    private final AtomicInteger direct = new AtomicInteger();

    @BeforeEach
    void setUp() {
        emf = TestDatabase.create();
        repository = new JpaJobRepository(new JpaTransactions(emf));
        clock = new MutableClock(START);
        JobRegistry registry = JobRegistry.builder()
                .register("leaderboard", (ctx, args) -> direct.incrementAndGet())
                .build();
        JobRunner runner = new JobRunner(registry, (name, args) -> new JobContext(name, null, null, registry, null));
        queue = new PersistentJobQueue(repository, runner, clock);
    }

    @AfterEach
    void tearDown() {
        emf.close();
    }

    @Test
    @DisplayName("enqueue stores a low priority job due now with its arguments")
    void enqueueStoresJob() {
        String id = queue.enqueue("leaderboard", JobArgs.of("day", "2024-03-19"));

        List<JobRecord> claimed = repository.claimDue(clock.now(), 5);
        assertEquals(1, claimed.size());
        JobRecord record = claimed.get(0);
        assertEquals(id, record.getId());
        assertEquals("leaderboard", record.getName());
        assertEquals(JobPriority.LOW, record.getPriority());
        assertEquals(START, record.getRunAt());
        assertEquals(JobArgs.of("day", "2024-03-19"), JobArgs.of(Json.readMap(record.getArgs())));
    }

    @Test
    @DisplayName("A delayed job becomes claimable only once its delay has passed")
    void delayedJob() {
        queue.delay("leaderboard", JobArgs.empty(), Duration.ofMinutes(10), JobPriority.MEDIUM);

        assertTrue(repository.claimDue(clock.now(), 5).isEmpty());
        clock.advance(Duration.ofMinutes(10));
        List<JobRecord> claimed = repository.claimDue(clock.now(), 5);
        assertEquals(1, claimed.size());
        assertEquals(JobPriority.MEDIUM, claimed.get(0).getPriority());
    }

    @Test
    @DisplayName("Invalid submissions are rejected before anything is stored")
    void rejectsInvalidSubmissions() {
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(" ", JobArgs.empty()));
        assertThrows(IllegalArgumentException.class, () -> queue.delay("leaderboard", JobArgs.empty(), Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> queue.enqueue("leaderboard", JobArgs.empty(), null));
        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("Jobs unknown to this process are still stored")
    void unknownJobIsStored() {
        queue.enqueue("registered-elsewhere", null);

        assertEquals(1, repository.count());
    }

    @Test
    @DisplayName("runJob executes synchronously without touching storage")
    void runJobIsSynchronous() {
        assertEquals(JobOutcome.COMPLETED, queue.runJob("leaderboard", JobArgs.empty()));
        assertEquals(1, direct.get());
        assertEquals(0, repository.count());
    }
}
