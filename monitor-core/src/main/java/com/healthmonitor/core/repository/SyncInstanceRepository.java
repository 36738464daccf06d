package com.healthmonitor.core.repository;

import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for sync instances. Iteration follows insertion order.
 */
public interface SyncInstanceRepository {

    /**
     * Insert or replace an instance.
     */
    void save(SyncInstance instance);

    Optional<SyncInstance> findById(String instanceId);

    /**
     * Find instances matching all non-null filters.
     *
     * @param clientId Client filter (nullable)
     * @param pipelineId Pipeline filter (nullable)
     * @param status Status filter (nullable)
     * @return Matching instances in insertion order
     */
    List<SyncInstance> find(String clientId, String pipelineId, SyncInstanceStatus status);

    default List<SyncInstance> findAll() {
        return find(null, null, null);
    }

    /**
     * Count instances per status.
     */
    Map<SyncInstanceStatus, Long> countByStatus();

    void deleteAll();
}
