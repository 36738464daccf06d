package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.UUID;

/**
 * One run of a pipeline for one instance, with the sanitized request, the
 * response (absent while running) and processing results.
 *
 * Primary Key: id
 * Index: (instanceId, startedAt)
 *
 * Invariants:
 * - completedAt and response are null iff status is RUNNING
 * - immutable once completed
 */
public record SyncExecution(
    UUID id,

    // References
    String instanceId,
    String pipelineId,
    String clientId,
    String clientName,
    SyncPipeline pipeline,

    // Timing
    Instant startedAt,
    Instant completedAt,

    // Outcome
    SyncExecutionStatus status,
    SyncTrigger triggeredBy,

    // Detail
    SyncRequest request,
    SyncResponse response,
    SyncResults results
) {
    /**
     * Response duration, or 0 when there is no response yet.
     */
    public long durationMs() {
        return response != null ? response.durationMs() : 0L;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == SyncExecutionStatus.FAILED;
    }

    public SyncExecutionSummary toSummary() {
        return new SyncExecutionSummary(
            id,
            instanceId,
            pipelineId,
            startedAt,
            completedAt,
            status,
            durationMs(),
            results.recordsFetched(),
            results.errors().size(),
            results.warnings().size()
        );
    }
}
