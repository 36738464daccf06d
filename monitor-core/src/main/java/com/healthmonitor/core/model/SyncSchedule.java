package com.healthmonitor.core.model;

import java.time.Duration;

/**
 * How often a pipeline runs and when its data counts as stale.
 *
 * Invariants:
 * - intervalMinutes > 0
 * - staleThresholdMinutes >= intervalMinutes
 */
public record SyncSchedule(
    int intervalMinutes,
    int staleThresholdMinutes
) {
    public SyncSchedule {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be positive");
        }
        if (staleThresholdMinutes < intervalMinutes) {
            throw new IllegalArgumentException("staleThresholdMinutes must not be shorter than the interval");
        }
    }

    public Duration interval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    public Duration staleThreshold() {
        return Duration.ofMinutes(staleThresholdMinutes);
    }
}
