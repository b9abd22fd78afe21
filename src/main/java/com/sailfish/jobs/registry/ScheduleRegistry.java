package com.sailfish.jobs.registry;

import com.sailfish.jobs.exception.RegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from schedule name to run interval. A schedule enqueues the job with the
 * same name once per interval.
 */
public final class ScheduleRegistry {

    private final Map<String, Duration> intervals;

    private ScheduleRegistry(Map<String, Duration> intervals) {
        this.intervals = Collections.unmodifiableMap(new LinkedHashMap<>(intervals));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Duration> interval(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(intervals.get(name));
    }

    public boolean contains(String name) {
        return name != null && intervals.containsKey(name);
    }

    public Map<String, Duration> asMap() {
        return intervals;
    }

    /**
     * Collects schedule registrations during startup.
     */
    public static final class Builder {

        private static final Logger log = LoggerFactory.getLogger(ScheduleRegistry.class);

        private final Map<String, Duration> intervals = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * @throws RegistrationException if the name is blank or already registered, the interval
         *                               is not positive, or the registry has already been built.
         */
        public Builder register(String name, Duration interval) {
            if (built) {
                throw new RegistrationException("Schedule registry is already built, cannot register schedule: " + name);
            }
            if (name == null || name.trim().isEmpty()) {
                throw new RegistrationException("Schedule name cannot be blank");
            }
            if (interval == null || interval.isNegative() || interval.isZero()) {
                throw new RegistrationException("Schedule interval must be positive: " + name);
            }
            if (intervals.containsKey(name)) {
                throw new RegistrationException("Schedule already registered: " + name);
            }
            log.debug("Registering schedule '{}' every {}", name, interval);
            intervals.put(name, interval);
            return this;
        }

        public ScheduleRegistry build() {
            built = true;
            log.info("Schedule registry built with {} schedules", intervals.size());
            return new ScheduleRegistry(intervals);
        }
    }
}
