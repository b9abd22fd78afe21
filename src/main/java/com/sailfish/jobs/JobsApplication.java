package com.sailfish.jobs;

import com.sailfish.jobs.module.JobModule;
import com.sailfish.jobs.registry.JobRegistry;
import com.sailfish.jobs.registry.ScheduleRegistry;
import com.sailfish.jobs.repository.JpaCacheRepository;
import com.sailfish.jobs.repository.JpaJobRepository;
import com.sailfish.jobs.repository.JpaScheduleRepository;
import com.sailfish.jobs.repository.JpaTransactions;
import com.sailfish.jobs.schedule.IntervalAlignedNextRunPolicy;
import com.sailfish.jobs.service.BackgroundService;
import com.sailfish.jobs.service.Cache;
import com.sailfish.jobs.service.FatalErrorHandler;
import com.sailfish.jobs.service.JobOutcome;
import com.sailfish.jobs.service.JobQueue;
import com.sailfish.jobs.service.impl.DatabaseCache;
import com.sailfish.jobs.service.impl.JobRunner;
import com.sailfish.jobs.service.impl.PersistentJobQueue;
import com.sailfish.jobs.service.impl.SchedulerLoop;
import com.sailfish.jobs.service.impl.WorkerLoop;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;

/**
 * Wires the registries, storage, queue, cache and background loops of one process and
 * provides the command-line entry point.
 *
 * <p>The first command-line argument names a job to run once on the calling thread; the
 * {@code start} job runs both loops until the JVM shuts down. Remaining {@code key=value}
 * arguments become the job's arguments.
 */
public class JobsApplication implements BackgroundService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobsApplication.class);

    public static final String PERSISTENCE_UNIT = "sailfish-jobs";

    private final JobsConfig config;
    private final EntityManagerFactory entityManagerFactory;
    private final JobRegistry jobRegistry;
    private final ScheduleRegistry scheduleRegistry;
    private final Cache cache;
    private final JobQueue queue;
    private final WorkerLoop workerLoop;
    private final SchedulerLoop schedulerLoop;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private boolean started;
    private boolean stopped;

    public JobsApplication(JobsConfig config,
                           EntityManagerFactory entityManagerFactory,
                           List<? extends JobModule> modules,
                           Clock clock,
                           FatalErrorHandler fatalErrorHandler) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.entityManagerFactory = Objects.requireNonNull(entityManagerFactory, "entityManagerFactory cannot be null");
        Objects.requireNonNull(modules, "modules cannot be null");
        Objects.requireNonNull(clock, "clock cannot be null");
        Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler cannot be null");

        JobRegistry.Builder jobs = JobRegistry.builder();
        ScheduleRegistry.Builder schedules = ScheduleRegistry.builder();
        for (JobModule module : modules) {
            log.debug("Registering jobs from {}", module.getClass().getName());
            module.register(jobs, schedules);
        }
        this.jobRegistry = jobs.build();
        this.scheduleRegistry = schedules.build();

        JpaTransactions transactions = new JpaTransactions(entityManagerFactory);
        JpaJobRepository jobRepository = new JpaJobRepository(transactions);
        JobRunner jobRunner = new JobRunner(jobRegistry, this::newContext);

        this.cache = new DatabaseCache(new JpaCacheRepository(transactions), clock);
        this.queue = new PersistentJobQueue(jobRepository, jobRunner, clock);
        this.workerLoop = new WorkerLoop(jobRepository, jobRunner, clock, fatalErrorHandler,
                config.workerBatchSize(), config.workerIdleDelay(), config.shutdownWarning());
        this.schedulerLoop = new SchedulerLoop(new JpaScheduleRepository(transactions), scheduleRegistry, queue,
                new IntervalAlignedNextRunPolicy(), clock, fatalErrorHandler,
                config.schedulerTick(), config.shutdownWarning());
    }

    /**
     * Creates the application from the {@value #PERSISTENCE_UNIT} persistence unit and every
     * {@link JobModule} found on the class path.
     */
    public static JobsApplication create(JobsConfig config) {
        EntityManagerFactory entityManagerFactory =
                Persistence.createEntityManagerFactory(PERSISTENCE_UNIT, config.persistenceProperties());
        List<JobModule> modules = new ArrayList<>();
        ServiceLoader.load(JobModule.class).forEach(modules::add);
        try {
            return new JobsApplication(config, entityManagerFactory, modules, Clock.systemUTC(), FatalErrorHandler.exitProcess());
        } catch (RuntimeException e) {
            entityManagerFactory.close();
            throw e;
        }
    }

    public static void main(String[] args) {
        JobsConfig config = JobsConfig.fromEnvironment(System.getenv());
        log.info("Starting with {}", config);
        JobOutcome outcome;
        try (JobsApplication application = create(config)) {
            Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "jobs-shutdown"));
            outcome = application.runCli(args);
        }
        if (outcome != JobOutcome.COMPLETED) {
            System.exit(1);
        }
    }

    /**
     * Runs the job named by the first argument, {@code start} in production and {@code help}
     * elsewhere when there is none.
     */
    public JobOutcome runCli(String[] args) {
        String jobName = args.length > 0 && !args[0].isEmpty()
                ? args[0]
                : (config.isProduction() ? "start" : "help");
        JobArgs jobArgs = JobArgs.parse(Arrays.asList(args).subList(Math.min(1, args.length), args.length));
        return queue.runJob(jobName, jobArgs);
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.warn("Background loops already started.");
            return;
        }
        started = true;
        schedulerLoop.start();
        workerLoop.start();
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        schedulerLoop.stop();
        workerLoop.stop();
        terminated.countDown();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    @Override
    public void close() {
        stop();
        if (entityManagerFactory.isOpen()) {
            entityManagerFactory.close();
        }
    }

    public JobQueue queue() {
        return queue;
    }

    public Cache cache() {
        return cache;
    }

    public JobRegistry jobRegistry() {
        return jobRegistry;
    }

    public ScheduleRegistry scheduleRegistry() {
        return scheduleRegistry;
    }

    private JobContext newContext(String jobName, JobArgs args) {
        return new JobContext(jobName, queue, cache, jobRegistry, this);
    }
}
