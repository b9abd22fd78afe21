package com.sailfish.jobs;

import com.sailfish.jobs.service.impl.SchedulerLoop;
import com.sailfish.jobs.service.impl.WorkerLoop;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process settings. Every value has a default; {@link #fromEnvironment(Map)} overrides them
 * from environment variables.
 */
public final class JobsConfig {

    public static final String DEFAULT_ENVIRONMENT = "development";
    public static final String DEFAULT_DATABASE_URL = "jdbc:postgresql://localhost:5432/app";
    public static final String DEFAULT_SCHEMA_ACTION = "update";
    public static final Duration DEFAULT_SHUTDOWN_WARNING = Duration.ofSeconds(30);

    private final String environment;
    private final String databaseUrl;
    private final String databaseUser;
    private final String databasePassword;
    private final String schemaAction;
    private final int workerBatchSize;
    private final Duration workerIdleDelay;
    private final Duration schedulerTick;
    private final Duration shutdownWarning;

    private JobsConfig(Builder builder) {
        this.environment = Objects.requireNonNull(builder.environment, "environment cannot be null");
        this.databaseUrl = Objects.requireNonNull(builder.databaseUrl, "databaseUrl cannot be null");
        this.databaseUser = builder.databaseUser;
        this.databasePassword = builder.databasePassword;
        this.schemaAction = Objects.requireNonNull(builder.schemaAction, "schemaAction cannot be null");
        this.workerIdleDelay = requirePositive(builder.workerIdleDelay, "workerIdleDelay");
        this.schedulerTick = requirePositive(builder.schedulerTick, "schedulerTick");
        this.shutdownWarning = requirePositive(builder.shutdownWarning, "shutdownWarning");
        if (builder.workerBatchSize <= 0) {
            throw new IllegalArgumentException("workerBatchSize must be positive");
        }
        this.workerBatchSize = builder.workerBatchSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code ENV}, {@code DATABASE_URL}, {@code DATABASE_USER}, {@code DATABASE_PASSWORD},
     * {@code DATABASE_SCHEMA_ACTION}, {@code WORKER_BATCH_SIZE}, {@code WORKER_IDLE_DELAY_MS},
     * {@code SCHEDULER_TICK_MS} and {@code SHUTDOWN_WARNING_SECONDS}. Empty values count as unset.
     */
    public static JobsConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String value;
        if ((value = env(env, "ENV")) != null) builder.environment(value);
        if ((value = env(env, "DATABASE_URL")) != null) builder.databaseUrl(value);
        if ((value = env(env, "DATABASE_USER")) != null) builder.databaseUser(value);
        if ((value = env(env, "DATABASE_PASSWORD")) != null) builder.databasePassword(value);
        if ((value = env(env, "DATABASE_SCHEMA_ACTION")) != null) builder.schemaAction(value);
        if ((value = env(env, "WORKER_BATCH_SIZE")) != null) builder.workerBatchSize(parseInt("WORKER_BATCH_SIZE", value));
        if ((value = env(env, "WORKER_IDLE_DELAY_MS")) != null) builder.workerIdleDelay(Duration.ofMillis(parseInt("WORKER_IDLE_DELAY_MS", value)));
        if ((value = env(env, "SCHEDULER_TICK_MS")) != null) builder.schedulerTick(Duration.ofMillis(parseInt("SCHEDULER_TICK_MS", value)));
        if ((value = env(env, "SHUTDOWN_WARNING_SECONDS")) != null) builder.shutdownWarning(Duration.ofSeconds(parseInt("SHUTDOWN_WARNING_SECONDS", value)));
        return builder.build();
    }

    public boolean isProduction() {
        return "production".equals(environment);
    }

    /**
     * @return JPA properties overriding the persistence unit defaults.
     */
    public Map<String, Object> persistenceProperties() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("jakarta.persistence.jdbc.url", databaseUrl);
        if (databaseUser != null) {
            properties.put("jakarta.persistence.jdbc.user", databaseUser);
        }
        if (databasePassword != null) {
            properties.put("jakarta.persistence.jdbc.password", databasePassword);
        }
        properties.put("hibernate.hbm2ddl.auto", schemaAction);
        return properties;
    }

    public String environment() {
        return environment;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int workerBatchSize() {
        return workerBatchSize;
    }

    public Duration workerIdleDelay() {
        return workerIdleDelay;
    }

    public Duration schedulerTick() {
        return schedulerTick;
    }

    public Duration shutdownWarning() {
        return shutdownWarning;
    }

    @Override
    public String toString() {
        return "JobsConfig{" +
               "environment='" + environment + '\'' +
               ", databaseUrl='" + databaseUrl + '\'' +
               ", schemaAction='" + schemaAction + '\'' +
               ", workerBatchSize=" + workerBatchSize +
               ", workerIdleDelay=" + workerIdleDelay +
               ", schedulerTick=" + schedulerTick +
               '}';
    }

    private static String env(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isEmpty() ? null : value;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public static final class Builder {
        private String environment = DEFAULT_ENVIRONMENT;
        private String databaseUrl = DEFAULT_DATABASE_URL;
        private String databaseUser;
        private String databasePassword;
        private String schemaAction = DEFAULT_SCHEMA_ACTION;
        private int workerBatchSize = WorkerLoop.DEFAULT_BATCH_SIZE;
        private Duration workerIdleDelay = WorkerLoop.DEFAULT_IDLE_DELAY;
        private Duration schedulerTick = SchedulerLoop.DEFAULT_TICK_INTERVAL;
        private Duration shutdownWarning = DEFAULT_SHUTDOWN_WARNING;

        private Builder() {
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder databaseUrl(String databaseUrl) {
            this.databaseUrl = databaseUrl;
            return this;
        }

        public Builder databaseUser(String databaseUser) {
            this.databaseUser = databaseUser;
            return this;
        }

        public Builder databasePassword(String databasePassword) {
            this.databasePassword = databasePassword;
            return this;
        }

        public Builder schemaAction(String schemaAction) {
            this.schemaAction = schemaAction;
            return this;
        }

        public Builder workerBatchSize(int workerBatchSize) {
            this.workerBatchSize = workerBatchSize;
            return this;
        }

        public Builder workerIdleDelay(Duration workerIdleDelay) {
            this.workerIdleDelay = workerIdleDelay;
            return this;
        }

        public Builder schedulerTick(Duration schedulerTick) {
            this.schedulerTick = schedulerTick;
            return this;
        }

        public Builder shutdownWarning(Duration shutdownWarning) {
            this.shutdownWarning = shutdownWarning;
            return this;
        }

        public JobsConfig build() {
            return new JobsConfig(this);
        }
    }
}
