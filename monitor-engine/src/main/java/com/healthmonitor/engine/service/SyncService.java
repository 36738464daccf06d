package com.healthmonitor.engine.service;

import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.model.SyncPipeline;

import java.util.List;
import java.util.UUID;

/**
 * Sync pipelines, per-client instances and their executions.
 */
public interface SyncService {

    List<SyncPipeline> listPipelines();

    /**
     * @throws com.healthmonitor.core.exception.NotFoundException if the pipeline is unknown
     */
    SyncPipeline getPipeline(String pipelineId);

    /**
     * Distinct clients that own at least one instance, in first-seen order.
     */
    List<Client> listClients();

    /**
     * List instances matching all non-null filters.
     */
    List<SyncInstance> listInstances(String clientId, String pipelineId, SyncInstanceStatus status);

    /**
     * @throws com.healthmonitor.core.exception.NotFoundException if the instance is unknown
     */
    SyncInstance getInstance(String instanceId);

    /**
     * List executions matching all non-null filters, newest first.
     *
     * @param limit Maximum results, or null for all
     */
    List<SyncExecution> listExecutions(String instanceId, String pipelineId, SyncExecutionStatus status, Integer limit);

    /**
     * @throws com.healthmonitor.core.exception.NotFoundException if the execution is unknown
     */
    SyncExecution getExecution(UUID executionId);

    /**
     * Run one manual sync of an instance immediately.
     *
     * @param instanceId The instance ID
     * @return The new execution
     * @throws com.healthmonitor.core.exception.NotFoundException if the instance is unknown
     */
    SyncExecution triggerSync(String instanceId);

    /**
     * Replace all instances and executions with generated history.
     *
     * @param request Generation parameters
     * @return Counts of what was generated
     */
    GenerationSummary generateMockData(GenerateMockDataRequest request);

    /**
     * A client that owns sync instances.
     */
    record Client(String id, String name) {}

    /**
     * Request to generate mock sync data.
     */
    record GenerateMockDataRequest(
        int clientCount,
        boolean introduceFailures
    ) {
        public static GenerateMockDataRequest defaults() {
            return new GenerateMockDataRequest(5, true);
        }
    }

    record GenerationSummary(
        int clients,
        int instances,
        int executions
    ) {}
}
