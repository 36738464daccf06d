package com.healthmonitor.engine.persistence;

import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncPipeline;
import com.healthmonitor.core.model.SyncTrigger;
import com.healthmonitor.engine.sync.ExecutionSynthesizer;
import com.healthmonitor.engine.sync.ExecutionSynthesizer.ExecutionTarget;
import com.healthmonitor.engine.sync.PipelineCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySyncExecutionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private InMemorySyncExecutionRepository repository;
    private ExecutionSynthesizer synthesizer;
    private ExecutionTarget target;

    @BeforeEach
    void setUp() {
        repository = new InMemorySyncExecutionRepository();
        synthesizer = new ExecutionSynthesizer(new Random(3));
        SyncPipeline pipeline = PipelineCatalog.defaultPipelines().get(0);
        target = new ExecutionTarget("client_1_" + pipeline.id(), "client_1", PipelineCatalog.clientName(0), pipeline);
    }

    @Test
    void find_shouldReturnNewestStartFirst() {
        SyncExecution older = execution(NOW.minusSeconds(600), SyncTrigger.SCHEDULE);
        SyncExecution newer = execution(NOW, SyncTrigger.SCHEDULE);
        repository.save(newer);
        repository.save(older);

        assertThat(repository.findByInstance(target.instanceId()))
            .extracting(SyncExecution::id)
            .containsExactly(newer.id(), older.id());
    }

    @Test
    @DisplayName("Executions with the same start time come back latest insert first")
    void find_sameStartTime_shouldPreferLatestInsert() {
        for (int round = 0; round < 20; round++) {
            repository.deleteAll();
            List<SyncExecution> scheduled = List.of(
                execution(NOW, SyncTrigger.SCHEDULE),
                execution(NOW.minusSeconds(3600), SyncTrigger.SCHEDULE));
            repository.saveAll(scheduled);
            SyncExecution manual = execution(NOW, SyncTrigger.MANUAL);
            repository.save(manual);

            List<SyncExecution> history = repository.findByInstance(target.instanceId());

            assertThat(history).extracting(SyncExecution::id)
                .containsExactly(manual.id(), scheduled.get(0).id(), scheduled.get(1).id());
            assertThat(repository.findStartedAfter(NOW.minusSeconds(60)))
                .extracting(SyncExecution::id)
                .containsExactly(manual.id(), scheduled.get(0).id());
        }
    }

    @Test
    void find_shouldApplyFiltersAndLimit() {
        repository.save(execution(NOW.minusSeconds(120), SyncTrigger.SCHEDULE));
        repository.save(execution(NOW.minusSeconds(60), SyncTrigger.SCHEDULE));
        SyncExecution failed = synthesizer.synthesize(target, NOW, SyncExecutionStatus.FAILED, SyncTrigger.MANUAL);
        repository.save(failed);

        assertThat(repository.find(null, null, SyncExecutionStatus.FAILED, 0))
            .extracting(SyncExecution::id)
            .containsExactly(failed.id());
        assertThat(repository.find(target.instanceId(), target.pipeline().id(), null, 2)).hasSize(2);
        assertThat(repository.find("client_9_other", null, null, 0)).isEmpty();
        assertThat(repository.findById(failed.id())).contains(failed);
    }

    private SyncExecution execution(Instant startedAt, SyncTrigger trigger) {
        return synthesizer.synthesize(target, startedAt, SyncExecutionStatus.SUCCESS, trigger);
    }
}
