package com.healthmonitor.engine.coordinator;

import com.healthmonitor.core.health.HealthThresholds;
import com.healthmonitor.core.model.IntegrationStatus;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.model.SyncPipeline;
import com.healthmonitor.core.repository.SyncExecutionRepository;
import com.healthmonitor.core.repository.SyncInstanceRepository;
import com.healthmonitor.core.repository.SyncPipelineRepository;
import com.healthmonitor.engine.persistence.SyncStoreLock;
import com.healthmonitor.engine.service.EventService;
import com.healthmonitor.engine.service.EventService.EventStats;
import com.healthmonitor.engine.service.HealthService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines event statistics and the sync model into health reports.
 * Nothing here is cached: every call reads the stores as they are now.
 * The sync overview is built under the read side of {@link SyncStoreLock}.
 */
public class HealthCoordinator implements HealthService {

    static final int MAX_RECENT_FAILURES = 10;
    static final String UNKNOWN_ERROR = "Unknown error";
    private static final Duration DAY = Duration.ofHours(24);

    private final EventService eventService;
    private final SyncPipelineRepository pipelineRepository;
    private final SyncInstanceRepository instanceRepository;
    private final SyncExecutionRepository executionRepository;
    private final SyncStoreLock storeLock;
    private final Clock clock;

    public HealthCoordinator(
            EventService eventService,
            SyncPipelineRepository pipelineRepository,
            SyncInstanceRepository instanceRepository,
            SyncExecutionRepository executionRepository,
            SyncStoreLock storeLock,
            Clock clock) {
        this.eventService = eventService;
        this.pipelineRepository = pipelineRepository;
        this.instanceRepository = instanceRepository;
        this.executionRepository = executionRepository;
        this.storeLock = storeLock;
        this.clock = clock;
    }

    @Override
    public IntegrationHealth getIntegrationHealth(IntegrationType integration) {
        EventStats stats = eventService.getEventStats(integration);
        return new IntegrationHealth(
            integration.id(),
            integration.displayName(),
            integration.description(),
            HealthThresholds.calculateStatus(stats.successRate(), stats.errorsLast24h()),
            stats.lastSync(),
            stats.successRate(),
            stats.eventsLast24h(),
            stats.errorsLast24h()
        );
    }

    @Override
    public List<IntegrationHealth> getAllIntegrationHealth() {
        List<IntegrationHealth> all = new ArrayList<>();
        for (IntegrationType integration : IntegrationType.values()) {
            all.add(getIntegrationHealth(integration));
        }
        return all;
    }

    @Override
    public OverallHealth getOverallHealth() {
        List<IntegrationHealth> all = getAllIntegrationHealth();
        return new OverallHealth(
            all.size(),
            countIntegrations(all, IntegrationStatus.HEALTHY),
            countIntegrations(all, IntegrationStatus.DEGRADED),
            countIntegrations(all, IntegrationStatus.DOWN)
        );
    }

    @Override
    public SyncSystemOverview getSystemOverview() {
        return storeLock.read(this::buildSystemOverview);
    }

    private SyncSystemOverview buildSystemOverview() {
        Instant now = clock.instant();
        List<SyncInstance> instances = instanceRepository.findAll();
        List<SyncExecution> recent = executionRepository.findStartedAfter(now.minus(DAY));

        List<PipelineStat> pipelineStats = new ArrayList<>();
        for (SyncPipeline pipeline : pipelineRepository.findAll()) {
            pipelineStats.add(pipelineStat(pipeline, instances, recent));
        }

        Set<String> clients = new HashSet<>();
        for (SyncInstance instance : instances) {
            clients.add(instance.clientId());
        }

        List<FailingInstanceSummary> recentFailures = instances.stream()
            .filter(i -> i.status() == SyncInstanceStatus.FAILING)
            .limit(MAX_RECENT_FAILURES)
            .map(i -> failingSummary(i, now))
            .collect(Collectors.toList());

        double overallHealth = successRate(recent);
        return new SyncSystemOverview(
            overallHealth,
            HealthThresholds.calculateStatus(overallHealth, countFailed(recent)),
            clients.size(),
            recent.size(),
            recent.size() / 24.0,
            countInstances(instances, SyncInstanceStatus.HEALTHY),
            countInstances(instances, SyncInstanceStatus.FAILING),
            countInstances(instances, SyncInstanceStatus.STALE),
            pipelineStats,
            recentFailures
        );
    }

    private PipelineStat pipelineStat(SyncPipeline pipeline, List<SyncInstance> instances, List<SyncExecution> recent) {
        List<SyncInstance> scoped = instances.stream()
            .filter(i -> i.pipelineId().equals(pipeline.id()))
            .collect(Collectors.toList());
        List<SyncExecution> executions = recent.stream()
            .filter(e -> e.pipelineId().equals(pipeline.id()))
            .collect(Collectors.toList());

        double successRate = successRate(executions);
        double avgDuration = executions.isEmpty() ? 0.0
            : executions.stream().mapToLong(SyncExecution::durationMs).average().orElse(0.0);

        return new PipelineStat(
            pipeline,
            scoped.size(),
            countInstances(scoped, SyncInstanceStatus.HEALTHY),
            countInstances(scoped, SyncInstanceStatus.STALE),
            countInstances(scoped, SyncInstanceStatus.FAILING),
            successRate,
            executions.size(),
            avgDuration,
            HealthThresholds.calculateStatus(successRate, countFailed(executions))
        );
    }

    /**
     * Walks the instance's executions newest first and counts the unbroken
     * run of failures at the head.
     */
    private FailingInstanceSummary failingSummary(SyncInstance instance, Instant now) {
        List<SyncExecution> history = executionRepository.findByInstance(instance.id());

        int consecutive = 0;
        Instant failingSince = null;
        String lastError = null;
        for (SyncExecution execution : history) {
            if (!execution.isFailed()) {
                break;
            }
            if (consecutive == 0) {
                lastError = execution.results().firstErrorMessage();
            }
            consecutive++;
            failingSince = execution.startedAt();
        }

        return new FailingInstanceSummary(
            instance.id(),
            instance.clientId(),
            instance.clientName(),
            instance.pipeline(),
            lastError != null ? lastError : UNKNOWN_ERROR,
            failingSince != null ? failingSince : lastSyncStart(instance, now),
            consecutive
        );
    }

    private static Instant lastSyncStart(SyncInstance instance, Instant now) {
        return instance.lastSync() != null ? instance.lastSync().startedAt() : now;
    }

    private static double successRate(List<SyncExecution> executions) {
        if (executions.isEmpty()) {
            return 100.0;
        }
        long successful = executions.stream().filter(e -> e.status().countsAsSuccessful()).count();
        return successful * 100.0 / executions.size();
    }

    private static long countFailed(List<SyncExecution> executions) {
        return executions.stream().filter(SyncExecution::isFailed).count();
    }

    private static int countIntegrations(List<IntegrationHealth> all, IntegrationStatus status) {
        return (int) all.stream().filter(h -> h.status() == status).count();
    }

    private static int countInstances(List<SyncInstance> instances, SyncInstanceStatus status) {
        return (int) instances.stream().filter(i -> i.status() == status).count();
    }
}
