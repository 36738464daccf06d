package com.healthmonitor.engine.sync;

import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.model.SyncTrigger;
import com.healthmonitor.core.test.TimeController;
import com.healthmonitor.engine.sync.MockSyncGenerator.GeneratedSyncData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockSyncGeneratorTest {

    private TimeController clock;
    private MockSyncGenerator generator;

    @BeforeEach
    void setUp() {
        clock = TimeController.frozenAt(Instant.parse("2024-06-01T12:00:00Z"));
        Random random = new Random(2024);
        generator = new MockSyncGenerator(new ExecutionSynthesizer(random), random, clock);
    }

    @Test
    void generate_shouldCapHistoryPerInstance() {
        GeneratedSyncData data = generator.generate(PipelineCatalog.defaultPipelines(), 2, false);

        Map<String, List<SyncExecution>> byInstance = byInstance(data);
        assertThat(data.instances()).hasSize(14);
        assertThat(byInstance).hasSize(14);
        assertThat(byInstance.values())
            .allSatisfy(history -> assertThat(history).hasSizeLessThanOrEqualTo(MockSyncGenerator.MAX_EXECUTIONS_PER_INSTANCE));
        assertThat(data.executions())
            .allSatisfy(e -> {
                assertThat(e.triggeredBy()).isEqualTo(SyncTrigger.SCHEDULE);
                assertThat(e.startedAt()).isAfter(clock.now().minus(Duration.ofHours(24)));
                assertThat(e.startedAt()).isBeforeOrEqualTo(clock.now());
            });
    }

    @Test
    void generate_shouldKeepTenMostRecentSummaries() {
        GeneratedSyncData data = generator.generate(PipelineCatalog.defaultPipelines(), 1, false);
        Map<String, List<SyncExecution>> byInstance = byInstance(data);

        for (SyncInstance instance : data.instances()) {
            List<SyncExecution> history = new ArrayList<>(byInstance.get(instance.id()));
            history.sort(Comparator.comparing(SyncExecution::startedAt).reversed());

            assertThat(instance.recentExecutions()).hasSizeLessThanOrEqualTo(SyncInstance.MAX_RECENT_EXECUTIONS);
            assertThat(instance.recentExecutions().get(0).id()).isEqualTo(history.get(0).id());
            assertThat(instance.lastSync().id()).isEqualTo(history.get(0).id());
            assertThat(instance.stats().last24h().totalSyncs()).isEqualTo(history.size());
        }
    }

    @Test
    void generate_withFailures_shouldForceFailingAndStaleInstances() {
        GeneratedSyncData data = generator.generate(PipelineCatalog.defaultPipelines(), 40, true);
        Map<String, List<SyncExecution>> byInstance = byInstance(data);

        List<SyncInstance> failing = withStatus(data, SyncInstanceStatus.FAILING);
        List<SyncInstance> stale = withStatus(data, SyncInstanceStatus.STALE);
        assertThat(failing).isNotEmpty();
        assertThat(stale).isNotEmpty();

        for (SyncInstance instance : failing) {
            SyncExecution newest = byInstance.get(instance.id()).stream()
                .max(Comparator.comparing(SyncExecution::startedAt))
                .orElseThrow();
            assertThat(newest.status()).isEqualTo(SyncExecutionStatus.FAILED);
            assertThat(instance.lastSync().status()).isEqualTo(SyncExecutionStatus.FAILED);
        }
        for (SyncInstance instance : stale) {
            Duration overdue = Duration.between(instance.nextScheduledSync(), clock.now());
            assertThat(overdue).isGreaterThanOrEqualTo(instance.pipeline().schedule().staleThreshold());
        }
    }

    @Test
    void generate_withoutFailures_shouldScheduleNextSyncInTheFuture() {
        GeneratedSyncData data = generator.generate(PipelineCatalog.defaultPipelines(), 3, false);

        assertThat(data.instances())
            .allSatisfy(instance -> {
                assertThat(instance.status()).isEqualTo(SyncInstanceStatus.HEALTHY);
                assertThat(instance.nextScheduledSync()).isAfter(clock.now());
            });
    }

    @Test
    void generate_zeroClients_shouldProduceNothing() {
        GeneratedSyncData data = generator.generate(PipelineCatalog.defaultPipelines(), 0, true);

        assertThat(data.instances()).isEmpty();
        assertThat(data.executions()).isEmpty();
    }

    @Test
    void generate_negativeClients_shouldBeRejected() {
        assertThatThrownBy(() -> generator.generate(PipelineCatalog.defaultPipelines(), -1, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generate_sameSeed_shouldReproduceOutcomes() {
        Random first = new Random(99);
        Random second = new Random(99);
        GeneratedSyncData a = new MockSyncGenerator(new ExecutionSynthesizer(first), first, clock)
            .generate(PipelineCatalog.defaultPipelines(), 4, true);
        GeneratedSyncData b = new MockSyncGenerator(new ExecutionSynthesizer(second), second, clock)
            .generate(PipelineCatalog.defaultPipelines(), 4, true);

        assertThat(a.instances()).extracting(SyncInstance::status)
            .containsExactlyElementsOf(b.instances().stream().map(SyncInstance::status).collect(Collectors.toList()));
        assertThat(a.executions()).extracting(SyncExecution::status)
            .containsExactlyElementsOf(b.executions().stream().map(SyncExecution::status).collect(Collectors.toList()));
    }

    private static Map<String, List<SyncExecution>> byInstance(GeneratedSyncData data) {
        return data.executions().stream().collect(Collectors.groupingBy(SyncExecution::instanceId));
    }

    private static List<SyncInstance> withStatus(GeneratedSyncData data, SyncInstanceStatus status) {
        return data.instances().stream()
            .filter(i -> i.status() == status)
            .collect(Collectors.toList());
    }
}
