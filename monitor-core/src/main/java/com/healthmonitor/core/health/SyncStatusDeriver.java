package com.healthmonitor.core.health;

import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.model.SyncSchedule;

import java.time.Duration;
import java.time.Instant;

/**
 * Derives an instance's status from its latest execution and schedule.
 *
 * Order of precedence: DISABLED, FAILING, STALE, HEALTHY. An instance is
 * stale once its next scheduled sync is overdue by at least the pipeline's
 * stale threshold.
 */
public final class SyncStatusDeriver {

    private SyncStatusDeriver() {
    }

    /**
     * @param latestStatus Status of the newest execution, or null if none ran yet
     * @param schedule Pipeline schedule
     * @param nextScheduledSync When the next run is due, or null if unknown
     * @param enabled Whether the instance is switched on
     * @param now Evaluation time
     */
    public static SyncInstanceStatus deriveStatus(
            SyncExecutionStatus latestStatus,
            SyncSchedule schedule,
            Instant nextScheduledSync,
            boolean enabled,
            Instant now) {
        if (!enabled) {
            return SyncInstanceStatus.DISABLED;
        }
        if (latestStatus == SyncExecutionStatus.FAILED) {
            return SyncInstanceStatus.FAILING;
        }
        if (isOverdue(schedule, nextScheduledSync, now)) {
            return SyncInstanceStatus.STALE;
        }
        return SyncInstanceStatus.HEALTHY;
    }

    static boolean isOverdue(SyncSchedule schedule, Instant nextScheduledSync, Instant now) {
        if (nextScheduledSync == null || !now.isAfter(nextScheduledSync)) {
            return false;
        }
        Duration overdueBy = Duration.between(nextScheduledSync, now);
        return overdueBy.compareTo(schedule.staleThreshold()) >= 0;
    }
}
