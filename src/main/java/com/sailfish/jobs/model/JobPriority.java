package com.sailfish.jobs.model;

/**
 * Claim order among due jobs. Lower levels are claimed first.
 */
public enum JobPriority {
    /**
     * Used by the scheduler for periodic jobs.
     */
    HIGH(1),
    MEDIUM(2),
    /**
     * Default for jobs enqueued by application code.
     */
    LOW(3);

    private final int level;

    JobPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static JobPriority fromLevel(int level) {
        for (JobPriority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown job priority level: " + level);
    }
}
