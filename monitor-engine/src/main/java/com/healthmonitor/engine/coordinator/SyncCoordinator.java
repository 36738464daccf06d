package com.healthmonitor.engine.coordinator;

import com.healthmonitor.core.exception.NotFoundException;
import com.healthmonitor.core.health.SyncStatusDeriver;
import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.model.SyncPipeline;
import com.healthmonitor.core.model.SyncStats;
import com.healthmonitor.core.model.SyncTrigger;
import com.healthmonitor.core.repository.SyncExecutionRepository;
import com.healthmonitor.core.repository.SyncInstanceRepository;
import com.healthmonitor.core.repository.SyncPipelineRepository;
import com.healthmonitor.engine.logging.LoggingContext;
import com.healthmonitor.engine.metrics.MonitorMetrics;
import com.healthmonitor.engine.persistence.SyncStoreLock;
import com.healthmonitor.engine.service.SyncService;
import com.healthmonitor.engine.sync.ExecutionSynthesizer;
import com.healthmonitor.engine.sync.ExecutionSynthesizer.ExecutionTarget;
import com.healthmonitor.engine.sync.MockSyncGenerator;
import com.healthmonitor.engine.sync.MockSyncGenerator.GeneratedSyncData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sync model operations: catalog and instance lookups, manual triggers and
 * mock generation.
 *
 * Triggers and regeneration run under the write side of the shared
 * {@link SyncStoreLock}; lookups run under its read side.
 */
public class SyncCoordinator implements SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncCoordinator.class);

    static final double MANUAL_SUCCESS_RATE = 0.9;
    private static final Duration DAY = Duration.ofHours(24);

    private final SyncPipelineRepository pipelineRepository;
    private final SyncInstanceRepository instanceRepository;
    private final SyncExecutionRepository executionRepository;
    private final MockSyncGenerator generator;
    private final ExecutionSynthesizer synthesizer;
    private final SyncStoreLock storeLock;
    private final MonitorMetrics metrics;
    private final Random random;
    private final Clock clock;

    public SyncCoordinator(
            SyncPipelineRepository pipelineRepository,
            SyncInstanceRepository instanceRepository,
            SyncExecutionRepository executionRepository,
            SyncStoreLock storeLock,
            MonitorMetrics metrics,
            Random random,
            Clock clock) {
        this.pipelineRepository = pipelineRepository;
        this.instanceRepository = instanceRepository;
        this.executionRepository = executionRepository;
        this.storeLock = storeLock;
        this.metrics = metrics;
        this.random = random;
        this.clock = clock;
        this.synthesizer = new ExecutionSynthesizer(random);
        this.generator = new MockSyncGenerator(synthesizer, random, clock);
    }

    @Override
    public List<SyncPipeline> listPipelines() {
        return pipelineRepository.findAll();
    }

    @Override
    public SyncPipeline getPipeline(String pipelineId) {
        return pipelineRepository.findById(pipelineId)
            .orElseThrow(() -> new NotFoundException("Pipeline", pipelineId));
    }

    @Override
    public List<Client> listClients() {
        Map<String, String> clients = new LinkedHashMap<>();
        for (SyncInstance instance : storeLock.read(instanceRepository::findAll)) {
            clients.putIfAbsent(instance.clientId(), instance.clientName());
        }
        return clients.entrySet().stream()
            .map(e -> new Client(e.getKey(), e.getValue()))
            .collect(Collectors.toList());
    }

    @Override
    public List<SyncInstance> listInstances(String clientId, String pipelineId, SyncInstanceStatus status) {
        return storeLock.read(() -> instanceRepository.find(clientId, pipelineId, status));
    }

    @Override
    public SyncInstance getInstance(String instanceId) {
        return storeLock.read(() -> instanceRepository.findById(instanceId))
            .orElseThrow(() -> new NotFoundException("Sync instance", instanceId));
    }

    @Override
    public List<SyncExecution> listExecutions(
            String instanceId, String pipelineId, SyncExecutionStatus status, Integer limit) {
        int max = limit != null ? limit : 0;
        return storeLock.read(() -> executionRepository.find(instanceId, pipelineId, status, max));
    }

    @Override
    public SyncExecution getExecution(UUID executionId) {
        return storeLock.read(() -> executionRepository.findById(executionId))
            .orElseThrow(() -> new NotFoundException("Sync execution", executionId.toString()));
    }

    @Override
    public SyncExecution triggerSync(String instanceId) {
        return storeLock.write(() -> recordManualSync(getInstance(instanceId)));
    }

    private SyncExecution recordManualSync(SyncInstance instance) {
        try (var ctx = LoggingContext.forInstance(instance)) {
            Instant now = clock.instant();
            SyncExecutionStatus outcome = random.nextDouble() < MANUAL_SUCCESS_RATE
                ? SyncExecutionStatus.SUCCESS
                : SyncExecutionStatus.FAILED;

            ExecutionTarget target = new ExecutionTarget(
                instance.id(), instance.clientId(), instance.clientName(), instance.pipeline());
            SyncExecution execution = synthesizer.synthesize(target, now, outcome, SyncTrigger.MANUAL);
            LoggingContext.setExecution(execution);
            executionRepository.save(execution);

            Instant nextSync = now.plus(instance.pipeline().schedule().interval());
            SyncInstanceStatus status = SyncStatusDeriver.deriveStatus(
                execution.status(), instance.pipeline().schedule(), nextSync, instance.enabled(), now);

            SyncInstance updated = instance.withExecutionRecorded(execution.toSummary())
                .toBuilder()
                .status(status)
                .nextScheduledSync(nextSync)
                .stats(SyncInstance.Stats.fromDay(dayStats(instance.id(), now)))
                .build();
            instanceRepository.save(updated);

            metrics.syncExecutionRecorded(execution);
            log.info("Manual sync finished {} ({}ms), instance now {}",
                execution.status().value(), execution.durationMs(), status.value());
            return execution;
        }
    }

    @Override
    public GenerationSummary generateMockData(GenerateMockDataRequest request) {
        GeneratedSyncData data = storeLock.write(() -> {
            GeneratedSyncData generated = generator.generate(
                pipelineRepository.findAll(), request.clientCount(), request.introduceFailures());
            instanceRepository.deleteAll();
            executionRepository.deleteAll();
            generated.instances().forEach(instanceRepository::save);
            executionRepository.saveAll(generated.executions());
            return generated;
        });

        metrics.mockDataGenerated(request.clientCount(), data.executions().size());
        log.info("Generated mock sync data: {} clients, {} instances, {} executions (failures={})",
            request.clientCount(), data.instances().size(), data.executions().size(), request.introduceFailures());
        return new GenerationSummary(request.clientCount(), data.instances().size(), data.executions().size());
    }

    private SyncStats dayStats(String instanceId, Instant now) {
        Instant cutoff = now.minus(DAY);
        return SyncStats.of(executionRepository.findByInstance(instanceId).stream()
            .filter(e -> e.startedAt().isAfter(cutoff))
            .collect(Collectors.toList()));
    }
}
