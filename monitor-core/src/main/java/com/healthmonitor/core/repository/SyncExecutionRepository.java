package com.healthmonitor.core.repository;

import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for sync executions. Completed executions are never modified.
 */
public interface SyncExecutionRepository {

    void save(SyncExecution execution);

    void saveAll(List<SyncExecution> executions);

    Optional<SyncExecution> findById(UUID executionId);

    /**
     * Find executions matching all non-null filters, newest first by start time.
     *
     * @param instanceId Instance filter (nullable)
     * @param pipelineId Pipeline filter (nullable)
     * @param status Status filter (nullable)
     * @param limit Maximum results, or 0 for no limit
     * @return Matching executions
     */
    List<SyncExecution> find(String instanceId, String pipelineId, SyncExecutionStatus status, int limit);

    /**
     * All executions of one instance, newest first.
     */
    default List<SyncExecution> findByInstance(String instanceId) {
        return find(instanceId, null, null, 0);
    }

    /**
     * Executions started strictly after the given instant.
     */
    List<SyncExecution> findStartedAfter(Instant after);

    void deleteAll();
}
