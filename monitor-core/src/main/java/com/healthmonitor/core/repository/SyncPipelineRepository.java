package com.healthmonitor.core.repository;

import com.healthmonitor.core.model.SyncPipeline;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the pipeline catalog.
 */
public interface SyncPipelineRepository {

    /**
     * All pipelines in catalog order.
     */
    List<SyncPipeline> findAll();

    Optional<SyncPipeline> findById(String pipelineId);
}
