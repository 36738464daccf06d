package com.healthmonitor.engine.sync;

import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncExecutionSummary;
import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.model.SyncPipeline;
import com.healthmonitor.core.model.SyncStats;
import com.healthmonitor.core.model.SyncTrigger;
import com.healthmonitor.engine.sync.ExecutionSynthesizer.ExecutionTarget;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Backfills a day of synthetic execution history for every client and pipeline.
 *
 * This is a demo and test-fixture generator, not a scheduler. With failures
 * enabled roughly 5% of instances are forced failing (their newest execution
 * fails) and a further 7% are forced stale (their next scheduled sync is
 * pushed past the stale threshold).
 */
public class MockSyncGenerator {

    static final int MAX_EXECUTIONS_PER_INSTANCE = 20;
    static final double FORCED_FAILING_ABOVE = 0.95;
    static final double FORCED_STALE_ABOVE = 0.88;
    static final double RANDOM_FAILURE_ABOVE = 0.97;
    static final double RANDOM_PARTIAL_ABOVE = 0.95;

    private static final Duration DAY = Duration.ofHours(24);

    private final ExecutionSynthesizer synthesizer;
    private final Random random;
    private final Clock clock;

    public MockSyncGenerator(ExecutionSynthesizer synthesizer, Random random, Clock clock) {
        this.synthesizer = synthesizer;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Generate instances and their execution history.
     *
     * @param pipelines Pipelines every client is bound to
     * @param clientCount Number of synthetic clients
     * @param introduceFailures Whether to force some instances failing or stale
     */
    public GeneratedSyncData generate(List<SyncPipeline> pipelines, int clientCount, boolean introduceFailures) {
        if (clientCount < 0) {
            throw new IllegalArgumentException("clientCount must not be negative");
        }
        Instant now = clock.instant();
        List<SyncInstance> instances = new ArrayList<>();
        List<SyncExecution> executions = new ArrayList<>();

        for (int i = 0; i < clientCount; i++) {
            String clientId = PipelineCatalog.clientId(i);
            String clientName = PipelineCatalog.clientName(i);

            for (SyncPipeline pipeline : pipelines) {
                ExecutionTarget target = new ExecutionTarget(
                    SyncInstance.instanceId(clientId, pipeline), clientId, clientName, pipeline);
                GeneratedInstance generated = generateInstance(target, introduceFailures, now);
                instances.add(generated.instance());
                executions.addAll(generated.executions());
            }
        }
        return new GeneratedSyncData(instances, executions);
    }

    private GeneratedInstance generateInstance(ExecutionTarget target, boolean introduceFailures, Instant now) {
        SyncPipeline pipeline = target.pipeline();

        SyncInstanceStatus status = SyncInstanceStatus.HEALTHY;
        if (introduceFailures) {
            double roll = random.nextDouble();
            if (roll > FORCED_FAILING_ABOVE) {
                status = SyncInstanceStatus.FAILING;
            } else if (roll > FORCED_STALE_ABOVE) {
                status = SyncInstanceStatus.STALE;
            }
        }

        int perDay = (int) (DAY.toMinutes() / pipeline.schedule().intervalMinutes());
        int count = Math.min(perDay, MAX_EXECUTIONS_PER_INSTANCE);

        // Newest first
        List<SyncExecution> history = new ArrayList<>(count);
        for (int j = 0; j < count; j++) {
            Instant startedAt = now.minus(pipeline.schedule().interval().multipliedBy(j));
            SyncExecutionStatus outcome = j == 0 && status == SyncInstanceStatus.FAILING
                ? SyncExecutionStatus.FAILED
                : randomOutcome();
            history.add(synthesizer.synthesize(target, startedAt, outcome, SyncTrigger.SCHEDULE));
        }

        Instant cutoff = now.minus(DAY);
        SyncStats last24h = SyncStats.of(history.stream()
            .filter(e -> e.startedAt().isAfter(cutoff))
            .collect(Collectors.toList()));

        SyncExecution latest = history.isEmpty() ? null : history.get(0);
        Instant lastSyncTime = latest == null ? now
            : latest.completedAt() != null ? latest.completedAt() : latest.startedAt();

        Instant nextSync = lastSyncTime.plus(pipeline.schedule().interval());
        if (status == SyncInstanceStatus.STALE) {
            long staleMinutes = pipeline.schedule().staleThresholdMinutes() + random.nextInt(30);
            nextSync = now.minus(Duration.ofMinutes(staleMinutes));
        }

        List<SyncExecutionSummary> recent = history.stream()
            .limit(SyncInstance.MAX_RECENT_EXECUTIONS)
            .map(SyncExecution::toSummary)
            .collect(Collectors.toList());

        SyncInstance instance = SyncInstance.builder()
            .id(target.instanceId())
            .client(target.clientId(), target.clientName())
            .pipeline(pipeline)
            .status(status)
            .enabled(true)
            .lastSync(latest == null ? null : latest.toSummary())
            .nextScheduledSync(nextSync)
            .stats(SyncInstance.Stats.fromDay(last24h))
            .recentExecutions(recent)
            .build();

        return new GeneratedInstance(instance, history);
    }

    private SyncExecutionStatus randomOutcome() {
        if (random.nextDouble() > RANDOM_FAILURE_ABOVE) {
            return SyncExecutionStatus.FAILED;
        }
        if (random.nextDouble() > RANDOM_PARTIAL_ABOVE) {
            return SyncExecutionStatus.PARTIAL;
        }
        return SyncExecutionStatus.SUCCESS;
    }

    private record GeneratedInstance(SyncInstance instance, List<SyncExecution> executions) {}

    /**
     * Instances in generation order with all of their executions.
     */
    public record GeneratedSyncData(
        List<SyncInstance> instances,
        List<SyncExecution> executions
    ) {}
}
