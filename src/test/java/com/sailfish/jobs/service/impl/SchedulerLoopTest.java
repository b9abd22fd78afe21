package com.sailfish.jobs.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.MutableClock;
import com.sailfish.jobs.TestDatabase;
import com.sailfish.jobs.model.JobPriority;
import com.sailfish.jobs.model.ScheduleRecord;
import com.sailfish.jobs.registry.ScheduleRegistry;
import com.sailfish.jobs.repository.JpaScheduleRepository;
import com.sailfish.jobs.repository.JpaTransactions;
import com.sailfish.jobs.schedule.IntervalAlignedNextRunPolicy;
import com.sailfish.jobs.service.JobOutcome;
import com.sailfish.jobs.service.JobQueue;
import jakarta.persistence.EntityManagerFactory;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SchedulerLoopTest {

    private static final LocalDateTime T13_00 = LocalDateTime.of(2024, 3, 19, 13, 0);

    private EntityManagerFactory emf;
    private JpaScheduleRepository repository;
    private MutableClock clock;
    private RecordingQueue queue;
    private ScheduleRegistry registry;
    private final List<SchedulerLoop> loops = new ArrayList<>();
    private final AtomicReference<Throwable> fatalError = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        emf = TestDatabase.create();
        repository = new JpaScheduleRepository(new JpaTransactions(emf));
        clock = new MutableClock(T13_00.plusMinutes(2));
        queue = new RecordingQueue();
        registry = ScheduleRegistry.builder()
                .register("cleanup", Duration.ofHours(1))
                .register("report", Duration.ofMinutes(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        loops.forEach(SchedulerLoop::stop);
        emf.close();
        assertNull(fatalError.get(), "scheduler loop failed");
    }

    private SchedulerLoop newLoop() {
        SchedulerLoop loop = new SchedulerLoop(new JpaScheduleRepository(new JpaTransactions(emf)), registry, queue,
                new IntervalAlignedNextRunPolicy(), clock, (component, e) -> fatalError.compareAndSet(null, e),
                Duration.ofMillis(50), Duration.ofSeconds(5));
        loops.add(loop);
        return loop;
    }

    private Map<String, ScheduleRecord> stored() {
        return repository.findAll().stream().collect(Collectors.toMap(ScheduleRecord::getId, Function.identity()));
    }

    @Test
    @DisplayName("Reconciliation deletes unregistered rows, creates missing ones and fires them once")
    void reconcileSyncsStorage() {
        repository.insertIfAbsent(new ScheduleRecord("stale", T13_00, T13_00.plusHours(1)));
        repository.insertIfAbsent(new ScheduleRecord("cleanup", T13_00, T13_00.plusHours(1)));

        newLoop().reconcile();

        Map<String, ScheduleRecord> rows = stored();
        assertEquals(Set.of("cleanup", "report"), rows.keySet());
        assertEquals(T13_00.plusHours(1), rows.get("cleanup").getNextRun());
        // 13:02 + 5m = 13:07, nearest 5 minute boundary is 13:05
        assertEquals(T13_00.plusMinutes(5), rows.get("report").getNextRun());
        assertEquals(List.of("report@HIGH"), queue.enqueued);
    }

    @Test
    @DisplayName("A second reconciliation creates nothing and fires nothing")
    void reconcileIsIdempotent() {
        newLoop().reconcile();
        queue.enqueued.clear();

        newLoop().reconcile();

        assertEquals(2, stored().size());
        assertTrue(queue.enqueued.isEmpty());
    }

    @Test
    @DisplayName("A due schedule fires once and moves to the next aligned boundary")
    void tickFiresAndAligns() {
        repository.insertIfAbsent(new ScheduleRecord("cleanup", T13_00.minusHours(1), T13_00));
        SchedulerLoop loop = newLoop();

        assertEquals(1, loop.tick());
        assertEquals(List.of("cleanup@HIGH"), queue.enqueued);
        ScheduleRecord row = stored().get("cleanup");
        assertEquals(T13_00.plusHours(1), row.getNextRun());
        assertEquals(T13_00.plusMinutes(2), row.getLastRan());

        assertEquals(0, loop.tick());
        assertEquals(1, queue.enqueued.size());
    }

    @Test
    @DisplayName("Nothing is enqueued while no schedule is due")
    void tickWithNothingDue() {
        repository.insertIfAbsent(new ScheduleRecord("cleanup", T13_00, T13_00.plusHours(1)));

        assertEquals(0, newLoop().tick());
        assertTrue(queue.enqueued.isEmpty());
    }

    @Test
    @DisplayName("Two schedulers racing for the same occurrence enqueue it exactly once")
    void racingSchedulersFireOnce() {
        repository.insertIfAbsent(new ScheduleRecord("cleanup", T13_00.minusHours(1), T13_00));
        SchedulerLoop first = newLoop();
        SchedulerLoop second = newLoop();
        LocalDateTime now = clock.now();

        List<ScheduleRecord> seenByFirst = first.dueSchedules(now);
        List<ScheduleRecord> seenBySecond = second.dueSchedules(now);
        assertEquals(1, seenByFirst.size());
        assertEquals(1, seenBySecond.size());

        boolean firstWon = first.claimOccurrence(seenByFirst.get(0), now);
        boolean secondWon = second.claimOccurrence(seenBySecond.get(0), now);

        assertTrue(firstWon);
        assertFalse(secondWon);
        assertEquals(List.of("cleanup@HIGH"), queue.enqueued);
    }

    @Test
    @DisplayName("Due rows of schedules not registered here are left alone")
    void unregisteredScheduleIsSkipped() {
        repository.insertIfAbsent(new ScheduleRecord("other-deployment", T13_00.minusHours(1), T13_00));

        assertEquals(0, newLoop().tick());
        assertTrue(queue.enqueued.isEmpty());
        assertEquals(T13_00, stored().get("other-deployment").getNextRun());
    }

    @Test
    @DisplayName("A started scheduler reconciles and then fires due schedules")
    void startedLoopReconcilesAndTicks() throws InterruptedException {
        repository.insertIfAbsent(new ScheduleRecord("cleanup", T13_00.minusHours(1), T13_00));
        SchedulerLoop loop = newLoop();

        loop.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (queue.enqueued.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        loop.stop();

        assertTrue(loop.isStopped());
        assertEquals(Set.of("report@HIGH", "cleanup@HIGH"), Set.copyOf(queue.enqueued));
        assertEquals(2, queue.enqueued.size());
    }

    /** Queue that only remembers what was enqueued. */
    private static final class RecordingQueue implements JobQueue {

        final List<String> enqueued = Collections.synchronizedList(new ArrayList<>());

        @Override
        public String enqueue(String name, JobArgs args) {
            return enqueue(name, args, JobPriority.LOW);
        }

        @Override
        public String enqueue(String name, JobArgs args, JobPriority priority) {
            enqueued.add(name + "@" + priority);
            return "job-" + enqueued.size();
        }

        @Override
        public String delay(String name, JobArgs args, Duration delay) {
            return enqueue(name, args);
        }

        @Override
        public String delay(String name, JobArgs args, Duration delay, JobPriority priority) {
            return enqueue(name, args, priority);
        }

        @Override
        public JobOutcome runJob(String name, JobArgs args) {
            return JobOutcome.COMPLETED;
        }
    }
}
