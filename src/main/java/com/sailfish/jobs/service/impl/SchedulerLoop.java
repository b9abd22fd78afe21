package com.sailfish.jobs.service.impl;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.model.JobPriority;
import com.sailfish.jobs.model.ScheduleRecord;
import com.sailfish.jobs.registry.ScheduleRegistry;
import com.sailfish.jobs.repository.ScheduleRepository;
import com.sailfish.jobs.schedule.NextRunPolicy;
import com.sailfish.jobs.service.FatalErrorHandler;
import com.sailfish.jobs.service.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically turns due schedules into high-priority jobs.
 *
 * <p>Any number of processes may run this loop against the same database. An occurrence is
 * owned by the process whose conditional update moves the schedule's next run forward; the
 * others see their update affect nothing and skip it. No in-memory locking is involved.
 *
 * <p>The first iteration reconciles storage with the {@link ScheduleRegistry}: rows of
 * schedules no longer registered are deleted and missing rows are created.
 */
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_SHUTDOWN_WARNING = Duration.ofSeconds(30);

    private final ScheduleRepository scheduleRepository;
    private final ScheduleRegistry scheduleRegistry;
    private final JobQueue jobQueue;
    private final NextRunPolicy nextRunPolicy;
    private final Clock clock;
    private final FatalErrorHandler fatalErrorHandler;
    private final Duration tickInterval;
    private final Duration shutdownWarning;

    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> scheduledTask;
    private volatile boolean stopping;
    private boolean reconciled;

    public SchedulerLoop(ScheduleRepository scheduleRepository,
                         ScheduleRegistry scheduleRegistry,
                         JobQueue jobQueue,
                         NextRunPolicy nextRunPolicy,
                         Clock clock,
                         FatalErrorHandler fatalErrorHandler) {
        this(scheduleRepository, scheduleRegistry, jobQueue, nextRunPolicy, clock, fatalErrorHandler,
                DEFAULT_TICK_INTERVAL, DEFAULT_SHUTDOWN_WARNING);
    }

    public SchedulerLoop(ScheduleRepository scheduleRepository,
                         ScheduleRegistry scheduleRegistry,
                         JobQueue jobQueue,
                         NextRunPolicy nextRunPolicy,
                         Clock clock,
                         FatalErrorHandler fatalErrorHandler,
                         Duration tickInterval,
                         Duration shutdownWarning) {
        this.scheduleRepository = Objects.requireNonNull(scheduleRepository, "scheduleRepository cannot be null");
        this.scheduleRegistry = Objects.requireNonNull(scheduleRegistry, "scheduleRegistry cannot be null");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue cannot be null");
        this.nextRunPolicy = Objects.requireNonNull(nextRunPolicy, "nextRunPolicy cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler cannot be null");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval cannot be null");
        this.shutdownWarning = Objects.requireNonNull(shutdownWarning, "shutdownWarning cannot be null");
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        this.executor = LoopExecutors.singleThread("jobs-scheduler");
        log.info("SchedulerLoop initialized with tickInterval={} and {} schedules", tickInterval, scheduleRegistry.asMap().size());
    }

    @PostConstruct
    public synchronized void start() {
        if (scheduledTask != null) {
            log.warn("SchedulerLoop already started.");
            return;
        }
        scheduledTask = executor.scheduleWithFixedDelay(this::runIteration, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("SchedulerLoop started. Checking schedules every {}", tickInterval);
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping SchedulerLoop...");
        stopping = true;
        synchronized (this) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false); // let the running iteration complete
            }
        }
        LoopExecutors.shutdownAndWait("SchedulerLoop", executor, shutdownWarning);
        log.info("SchedulerLoop stopped.");
    }

    public boolean isStopped() {
        return executor.isTerminated();
    }

    private void runIteration() {
        if (stopping) {
            return;
        }
        try {
            if (!reconciled) {
                reconcile();
                reconciled = true;
            }
            tick();
        } catch (RuntimeException | Error e) {
            stopping = true;
            synchronized (this) {
                scheduledTask.cancel(false);
            }
            executor.shutdown();
            fatalErrorHandler.onFatalError("SchedulerLoop", e);
        }
    }

    /**
     * Deletes stored schedules that are no longer registered and creates rows for registered
     * schedules that have none. A process that creates a row also enqueues the schedule's job
     * once, so a new schedule does not wait a full interval for its first run.
     */
    void reconcile() {
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Duration> registered = scheduleRegistry.asMap();
        Set<String> existing = new HashSet<>();

        for (ScheduleRecord record : scheduleRepository.findAll()) {
            if (!registered.containsKey(record.getId())) {
                if (scheduleRepository.deleteById(record.getId())) {
                    log.info("Deleted schedule '{}' which is no longer registered.", record.getId());
                }
                continue;
            }
            existing.add(record.getId());
        }

        for (Map.Entry<String, Duration> entry : registered.entrySet()) {
            if (existing.contains(entry.getKey())) {
                continue;
            }
            LocalDateTime nextRun = nextRunPolicy.nextRun(now, entry.getValue());
            if (scheduleRepository.insertIfAbsent(new ScheduleRecord(entry.getKey(), now, nextRun))) {
                log.info("Created schedule '{}' every {}, next run at {}", entry.getKey(), entry.getValue(), nextRun);
                jobQueue.enqueue(entry.getKey(), JobArgs.empty(), JobPriority.HIGH);
            }
        }
    }

    /**
     * Fires every schedule that is due and not claimed by another instance.
     *
     * @return The number of occurrences this instance claimed.
     */
    int tick() {
        LocalDateTime now = LocalDateTime.now(clock);
        int fired = 0;
        for (ScheduleRecord candidate : dueSchedules(now)) {
            if (stopping) {
                break;
            }
            if (claimOccurrence(candidate, now)) {
                fired++;
            }
        }
        return fired;
    }

    List<ScheduleRecord> dueSchedules(LocalDateTime now) {
        return scheduleRepository.findDue(now);
    }

    /**
     * Tries to take the current occurrence of a due schedule and enqueues its job if this
     * instance won.
     */
    boolean claimOccurrence(ScheduleRecord candidate, LocalDateTime now) {
        Optional<Duration> interval = scheduleRegistry.interval(candidate.getId());
        if (!interval.isPresent()) {
            // Registered by another deployment; reconciliation of that deployment owns it.
            log.debug("Skipping schedule '{}' which is not registered in this process.", candidate.getId());
            return false;
        }

        LocalDateTime nextRun = nextRunPolicy.nextRun(now, interval.get());
        if (!scheduleRepository.tryAdvance(candidate.getId(), now, nextRun)) {
            log.debug("Occurrence of schedule '{}' due at {} was claimed elsewhere.", candidate.getId(), candidate.getNextRun());
            return false;
        }

        String jobId = jobQueue.enqueue(candidate.getId(), JobArgs.empty(), JobPriority.HIGH);
        log.info("Schedule '{}' fired as job {}, next run at {}", candidate.getId(), jobId, nextRun);
        return true;
    }
}
