package com.healthmonitor.engine.service;

import com.healthmonitor.core.model.IntegrationStatus;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.SyncPipeline;

import java.time.Instant;
import java.util.List;

/**
 * Read-only health rollups over the event store and the sync model.
 */
public interface HealthService {

    /**
     * Health of one integration from its trailing 24h events.
     */
    IntegrationHealth getIntegrationHealth(IntegrationType integration);

    /**
     * Health of every integration in catalog order.
     */
    List<IntegrationHealth> getAllIntegrationHealth();

    /**
     * Count of integrations per status.
     */
    OverallHealth getOverallHealth();

    /**
     * System-wide sync rollup, recomputed from execution history on each call.
     */
    SyncSystemOverview getSystemOverview();

    record IntegrationHealth(
        String id,
        String name,
        String description,
        IntegrationStatus status,
        Instant lastSync,
        int successRate,
        int eventsLast24h,
        int errorsLast24h
    ) {}

    record OverallHealth(
        int totalIntegrations,
        int healthy,
        int degraded,
        int down
    ) {}

    /**
     * Sync rollup.
     *
     * overallHealth is the success percentage of all executions started in
     * the trailing 24h (100 when none); status applies the health thresholds
     * to it and to the number of failed executions in the same window.
     */
    record SyncSystemOverview(
        double overallHealth,
        IntegrationStatus status,
        int activeClients,
        int totalSyncsLast24h,
        double syncsPerHour,
        int healthyInstances,
        int failingInstances,
        int staleInstances,
        List<PipelineStat> pipelineStats,
        List<FailingInstanceSummary> recentFailures
    ) {}

    record PipelineStat(
        SyncPipeline pipeline,
        int totalInstances,
        int healthyInstances,
        int staleInstances,
        int failingInstances,
        double successRate,
        int syncsLast24h,
        double avgDurationMs,
        IntegrationStatus health
    ) {}

    /**
     * A failing instance. consecutiveFailures counts failed executions from
     * the newest backwards; failingSince is when the oldest of them started.
     */
    record FailingInstanceSummary(
        String instanceId,
        String clientId,
        String clientName,
        SyncPipeline pipeline,
        String lastError,
        Instant failingSince,
        int consecutiveFailures
    ) {}
}
