package com.healthmonitor.engine.coordinator;

import com.healthmonitor.core.exception.NotFoundException;
import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.model.SyncTrigger;
import com.healthmonitor.core.test.TimeController;
import com.healthmonitor.engine.metrics.MonitorMetrics;
import com.healthmonitor.engine.persistence.InMemorySyncExecutionRepository;
import com.healthmonitor.engine.persistence.InMemorySyncInstanceRepository;
import com.healthmonitor.engine.persistence.InMemorySyncPipelineRepository;
import com.healthmonitor.engine.persistence.SyncStoreLock;
import com.healthmonitor.engine.service.SyncService.Client;
import com.healthmonitor.engine.service.SyncService.GenerateMockDataRequest;
import com.healthmonitor.engine.service.SyncService.GenerationSummary;
import com.healthmonitor.engine.sync.PipelineCatalog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncCoordinatorTest {

    private static final String STRIPE_INSTANCE = "client_1_pipeline_stripe_issuing_transactions";

    private TimeController clock;
    private InMemorySyncInstanceRepository instanceRepository;
    private InMemorySyncExecutionRepository executionRepository;
    private SimpleMeterRegistry registry;
    private MonitorMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = TimeController.frozenAt(Instant.parse("2024-06-01T12:00:00Z"));
        instanceRepository = new InMemorySyncInstanceRepository();
        executionRepository = new InMemorySyncExecutionRepository();
        registry = new SimpleMeterRegistry();
        metrics = new MonitorMetrics();
        metrics.bindTo(registry);
    }

    @Nested
    class Catalog {

        @Test
        void listPipelines_shouldReturnCatalog() {
            SyncCoordinator coordinator = coordinator(new Random(7));

            assertThat(coordinator.listPipelines()).hasSize(7);
            assertThat(coordinator.getPipeline("pipeline_gusto_employees").name()).isEqualTo("Gusto Employees");
        }

        @Test
        void getPipeline_unknown_shouldThrowNotFound() {
            SyncCoordinator coordinator = coordinator(new Random(7));

            assertThatThrownBy(() -> coordinator.getPipeline("pipeline_nope"))
                .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    class MockGeneration {

        @Test
        void generateMockData_shouldBindEveryClientToEveryPipeline() {
            SyncCoordinator coordinator = coordinator(new Random(7));

            GenerationSummary summary = coordinator.generateMockData(new GenerateMockDataRequest(3, false));

            assertThat(summary.clients()).isEqualTo(3);
            assertThat(summary.instances()).isEqualTo(21);
            assertThat(coordinator.listInstances(null, null, null)).hasSize(21);
            assertThat(coordinator.listInstances("client_2", null, null)).hasSize(7);
            assertThat(coordinator.listExecutions(null, null, null, null)).hasSize(summary.executions());
            assertThat(registry.get(MonitorMetrics.MOCK_GENERATIONS).counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Generation replaces previous instances and executions")
        void generateMockData_shouldReplaceExistingData() {
            SyncCoordinator coordinator = coordinator(new Random(7));
            coordinator.generateMockData(new GenerateMockDataRequest(4, true));

            GenerationSummary summary = coordinator.generateMockData(new GenerateMockDataRequest(1, false));

            assertThat(coordinator.listInstances(null, null, null)).hasSize(7);
            assertThat(coordinator.listExecutions(null, null, null, null)).hasSize(summary.executions());
            assertThat(coordinator.listClients()).extracting(Client::id).containsExactly("client_1");
        }

        @Test
        void generateMockData_withoutFailures_shouldLeaveEveryInstanceHealthy() {
            SyncCoordinator coordinator = coordinator(new Random(11));

            coordinator.generateMockData(new GenerateMockDataRequest(5, false));

            assertThat(coordinator.listInstances(null, null, null))
                .extracting(SyncInstance::status)
                .containsOnly(SyncInstanceStatus.HEALTHY);
        }

        @Test
        void listClients_shouldBeDistinctInFirstSeenOrder() {
            SyncCoordinator coordinator = coordinator(new Random(7));
            coordinator.generateMockData(new GenerateMockDataRequest(3, false));

            List<Client> clients = coordinator.listClients();

            assertThat(clients).extracting(Client::id).containsExactly("client_1", "client_2", "client_3");
            assertThat(clients.get(0).name()).isEqualTo(PipelineCatalog.clientName(0));
        }

        @Test
        void listExecutions_shouldFilterAndLimit() {
            SyncCoordinator coordinator = coordinator(new Random(7));
            coordinator.generateMockData(new GenerateMockDataRequest(2, false));

            List<SyncExecution> executions = coordinator.listExecutions(STRIPE_INSTANCE, null, null, 5);

            assertThat(executions).hasSize(5);
            assertThat(executions).extracting(SyncExecution::instanceId).containsOnly(STRIPE_INSTANCE);
            assertThat(executions.get(0).startedAt()).isAfterOrEqualTo(executions.get(4).startedAt());
        }
    }

    @Nested
    class ManualTrigger {

        @Test
        void triggerSync_success_shouldRecordExecutionAndReschedule() {
            SyncCoordinator coordinator = coordinator(new FixedRandom(0.5));
            coordinator.generateMockData(new GenerateMockDataRequest(1, false));
            SyncInstance before = coordinator.getInstance(STRIPE_INSTANCE);
            int executionsBefore = coordinator.listExecutions(STRIPE_INSTANCE, null, null, null).size();
            clock.advanceMinutes(3);

            SyncExecution execution = coordinator.triggerSync(STRIPE_INSTANCE);

            SyncInstance after = coordinator.getInstance(STRIPE_INSTANCE);
            assertThat(execution.status()).isEqualTo(SyncExecutionStatus.SUCCESS);
            assertThat(execution.triggeredBy()).isEqualTo(SyncTrigger.MANUAL);
            assertThat(execution.startedAt()).isEqualTo(clock.now());
            assertThat(coordinator.listExecutions(STRIPE_INSTANCE, null, null, null)).hasSize(executionsBefore + 1);
            assertThat(coordinator.getExecution(execution.id())).isEqualTo(execution);

            assertThat(after.status()).isEqualTo(SyncInstanceStatus.HEALTHY);
            assertThat(after.lastSync().id()).isEqualTo(execution.id());
            assertThat(after.nextScheduledSync()).isEqualTo(clock.now().plus(before.pipeline().schedule().interval()));
            assertThat(after.recentExecutions()).hasSize(SyncInstance.MAX_RECENT_EXECUTIONS);
            assertThat(after.recentExecutions().get(0).id()).isEqualTo(execution.id());
            assertThat(after.recentExecutions().get(1)).isEqualTo(before.recentExecutions().get(0));
        }

        @Test
        void triggerSync_failure_shouldMarkInstanceFailing() {
            SyncCoordinator coordinator = coordinator(new FixedRandom(0.95));
            coordinator.generateMockData(new GenerateMockDataRequest(1, false));

            SyncExecution execution = coordinator.triggerSync(STRIPE_INSTANCE);

            assertThat(execution.status()).isEqualTo(SyncExecutionStatus.FAILED);
            assertThat(execution.results().errors()).hasSize(1);
            assertThat(coordinator.getInstance(STRIPE_INSTANCE).status()).isEqualTo(SyncInstanceStatus.FAILING);
            assertThat(coordinator.listInstances(null, null, SyncInstanceStatus.FAILING))
                .extracting(SyncInstance::id)
                .containsExactly(STRIPE_INSTANCE);
        }

        @Test
        void triggerSync_shouldRecordMetric() {
            SyncCoordinator coordinator = coordinator(new FixedRandom(0.5));
            coordinator.generateMockData(new GenerateMockDataRequest(1, false));

            coordinator.triggerSync(STRIPE_INSTANCE);

            assertThat(registry.get(MonitorMetrics.SYNC_EXECUTIONS)
                .tag("trigger", "manual")
                .tag("status", "success")
                .counter().count()).isEqualTo(1.0);
        }

        @Test
        void triggerSync_unknownInstance_shouldThrowNotFound() {
            SyncCoordinator coordinator = coordinator(new Random(7));

            assertThatThrownBy(() -> coordinator.triggerSync("client_9_pipeline_nope"))
                .isInstanceOf(NotFoundException.class);
            assertThat(coordinator.listExecutions(null, null, null, null)).isEmpty();
        }

        @Test
        void getExecution_unknown_shouldThrowNotFound() {
            SyncCoordinator coordinator = coordinator(new Random(7));

            assertThatThrownBy(() -> coordinator.getExecution(UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
        }
    }

    // ========== Helpers ==========

    private SyncCoordinator coordinator(Random random) {
        return new SyncCoordinator(
            new InMemorySyncPipelineRepository(PipelineCatalog::defaultPipelines),
            instanceRepository,
            executionRepository,
            new SyncStoreLock(),
            metrics,
            random,
            clock);
    }

    /**
     * Random whose doubles are pinned so outcome rolls are predictable.
     */
    private static class FixedRandom extends Random {

        private final double value;

        FixedRandom(double value) {
            super(42);
            this.value = value;
        }

        @Override
        public double nextDouble() {
            return value;
        }
    }
}
