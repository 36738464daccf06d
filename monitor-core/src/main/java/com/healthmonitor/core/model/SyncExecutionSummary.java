package com.healthmonitor.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * List view of a sync execution.
 */
public record SyncExecutionSummary(
    UUID id,
    String instanceId,
    String pipelineId,
    Instant startedAt,
    Instant completedAt,
    SyncExecutionStatus status,
    long durationMs,
    int recordsProcessed,
    int errors,
    int warnings
) {}
