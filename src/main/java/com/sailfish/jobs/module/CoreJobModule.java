package com.sailfish.jobs.module;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.JobContext;
import com.sailfish.jobs.registry.JobRegistry;
import com.sailfish.jobs.registry.ScheduleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Jobs every process provides: the command-line helpers, the {@code start} entry point and the
 * hourly cache cleanup.
 */
public class CoreJobModule implements JobModule {

    private static final Logger log = LoggerFactory.getLogger(CoreJobModule.class);

    public static final String HELP = "help";
    public static final String START = "start";
    public static final String CLEANUP = "cleanup";
    public static final String CACHE_CLEAR = "cache-clear";
    public static final String GENERATE_SECRET = "generate-secret";

    static final Duration CLEANUP_INTERVAL = Duration.ofHours(1);
    private static final int SECRET_BYTES = 32;

    private final PrintStream out;
    private final SecureRandom random = new SecureRandom();

    public CoreJobModule() {
        this(System.out);
    }

    public CoreJobModule(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    @Override
    public void register(JobRegistry.Builder jobs, ScheduleRegistry.Builder schedules) {
        jobs.register(HELP, this::help);
        jobs.register(START, this::start);
        jobs.register(CLEANUP, this::cleanup);
        jobs.register(CACHE_CLEAR, this::cacheClear);
        jobs.register(GENERATE_SECRET, this::generateSecret);
        schedules.register(CLEANUP, CLEANUP_INTERVAL);
    }

    void help(JobContext context, JobArgs args) {
        out.println();
        for (String name : context.jobs().names()) {
            out.println("  " + name);
        }
        out.println();
    }

    void start(JobContext context, JobArgs args) throws InterruptedException {
        context.background().start();
        context.background().awaitTermination();
    }

    void cleanup(JobContext context, JobArgs args) {
        int deleted = context.cache().deleteExpired();
        log.info("Cleanup removed {} expired cache entries.", deleted);
    }

    void cacheClear(JobContext context, JobArgs args) {
        context.cache().clear();
    }

    void generateSecret(JobContext context, JobArgs args) {
        byte[] secret = new byte[SECRET_BYTES];
        random.nextBytes(secret);
        out.println();
        out.println(HexFormat.of().formatHex(secret));
        out.println();
    }
}
