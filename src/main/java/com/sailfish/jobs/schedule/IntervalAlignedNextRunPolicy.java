package com.sailfish.jobs.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Places the next run on the interval grid: {@code now + interval}, rounded to the nearest
 * multiple of the interval counted from the epoch (UTC), halves rounding up.
 *
 * <p>For an hourly schedule claimed at 13:02 the next run is 14:00, not 14:02, so late or
 * restarted schedulers do not drift. The result is always at least half an interval after
 * {@code now}.
 */
public class IntervalAlignedNextRunPolicy implements NextRunPolicy {

    @Override
    public LocalDateTime nextRun(LocalDateTime now, Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        long intervalMillis = interval.toMillis();
        if (intervalMillis == 0) {
            throw new IllegalArgumentException("interval must be at least one millisecond");
        }

        long target = now.toInstant(ZoneOffset.UTC).toEpochMilli() + intervalMillis;
        long remainder = Math.floorMod(target, intervalMillis);
        long aligned = target - remainder;
        if (remainder * 2 >= intervalMillis) {
            aligned += intervalMillis;
        }
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(aligned), ZoneOffset.UTC);
    }
}
