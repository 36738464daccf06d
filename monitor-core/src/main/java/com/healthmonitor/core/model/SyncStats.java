package com.healthmonitor.core.model;

import java.util.Collection;

/**
 * Rolling statistics over a window of sync executions.
 * Success and partial runs count as successful; an empty window is 100% successful.
 */
public record SyncStats(
    int totalSyncs,
    int successfulSyncs,
    int failedSyncs,
    double successRate,
    double avgDurationMs,
    long totalRecordsProcessed
) {
    private static final SyncStats EMPTY = new SyncStats(0, 0, 0, 100.0, 0.0, 0L);

    public static SyncStats empty() {
        return EMPTY;
    }

    /**
     * Summarize the given executions. Callers apply the time window.
     */
    public static SyncStats of(Collection<SyncExecution> executions) {
        if (executions.isEmpty()) {
            return EMPTY;
        }

        int successful = 0;
        int failed = 0;
        long totalDuration = 0;
        long totalRecords = 0;

        for (SyncExecution execution : executions) {
            if (execution.status().countsAsSuccessful()) {
                successful++;
            } else if (execution.isFailed()) {
                failed++;
            }
            totalDuration += execution.durationMs();
            totalRecords += execution.results().recordsFetched();
        }

        int total = executions.size();
        return new SyncStats(
            total,
            successful,
            failed,
            successful * 100.0 / total,
            (double) totalDuration / total,
            totalRecords
        );
    }

    /**
     * Seven-day view derived from a 24h window: the sync count is scaled
     * by seven and every other figure is carried over. Generated history
     * only covers one day, so this is an estimate.
     */
    public SyncStats weeklyEstimate() {
        return new SyncStats(
            totalSyncs * 7,
            successfulSyncs,
            failedSyncs,
            successRate,
            avgDurationMs,
            totalRecordsProcessed
        );
    }
}
