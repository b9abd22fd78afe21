package com.sailfish.jobs.registry;

import com.sailfish.jobs.JobHandler;
import com.sailfish.jobs.exception.RegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from job name to {@link JobHandler}.
 *
 * <p>Handlers are collected through a {@link Builder} during application startup. Job names
 * are a global contract between the code that enqueues a job and the code that runs it, so
 * registering a name twice is a programming error and fails the build of the registry.
 */
public final class JobRegistry {

    private final Map<String, JobHandler> handlers;

    private JobRegistry(Map<String, JobHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<JobHandler> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(name));
    }

    public boolean contains(String name) {
        return name != null && handlers.containsKey(name);
    }

    /**
     * @return The registered job names in alphabetical order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(handlers.keySet());
        Collections.sort(names);
        return names;
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Collects job registrations. Not thread-safe; meant to be filled from the startup thread.
     */
    public static final class Builder {

        private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

        private final Map<String, JobHandler> handlers = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * Registers a handler under the given job name.
         *
         * @throws RegistrationException if the name is blank, already registered, or the
         *                               registry has already been built.
         */
        public Builder register(String name, JobHandler handler) {
            if (built) {
                throw new RegistrationException("Job registry is already built, cannot register job: " + name);
            }
            if (name == null || name.trim().isEmpty()) {
                throw new RegistrationException("Job name cannot be blank");
            }
            if (handler == null) {
                throw new RegistrationException("Job handler cannot be null: " + name);
            }
            if (handlers.containsKey(name)) {
                throw new RegistrationException("Job already registered: " + name);
            }
            log.debug("Registering job '{}': {}", name, handler.getClass().getName());
            handlers.put(name, handler);
            return this;
        }

        public boolean contains(String name) {
            return handlers.containsKey(name);
        }

        public JobRegistry build() {
            built = true;
            log.info("Job registry built with {} jobs", handlers.size());
            return new JobRegistry(handlers);
        }
    }
}
