package com.healthmonitor.engine.persistence;

import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.repository.SyncExecutionRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of SyncExecutionRepository.
 * Executions sharing a start time are ordered by insertion, latest insert first.
 */
public class InMemorySyncExecutionRepository implements SyncExecutionRepository {

    private static final Comparator<StoredExecution> NEWEST_FIRST =
        Comparator.comparing((StoredExecution stored) -> stored.execution().startedAt())
            .thenComparingLong(StoredExecution::sequence)
            .reversed();

    private final Map<UUID, StoredExecution> executions = new HashMap<>();
    private long nextSequence;

    @Override
    public synchronized void save(SyncExecution execution) {
        store(execution);
    }

    @Override
    public synchronized void saveAll(List<SyncExecution> executionList) {
        for (SyncExecution execution : executionList) {
            store(execution);
        }
    }

    @Override
    public synchronized Optional<SyncExecution> findById(UUID executionId) {
        return Optional.ofNullable(executions.get(executionId)).map(StoredExecution::execution);
    }

    @Override
    public synchronized List<SyncExecution> find(
            String instanceId, String pipelineId, SyncExecutionStatus status, int limit) {
        Stream<SyncExecution> stream = executions.values().stream()
            .filter(s -> instanceId == null || s.execution().instanceId().equals(instanceId))
            .filter(s -> pipelineId == null || s.execution().pipelineId().equals(pipelineId))
            .filter(s -> status == null || s.execution().status() == status)
            .sorted(NEWEST_FIRST)
            .map(StoredExecution::execution);
        if (limit > 0) {
            stream = stream.limit(limit);
        }
        return stream.collect(Collectors.toList());
    }

    @Override
    public synchronized List<SyncExecution> findStartedAfter(Instant after) {
        return executions.values().stream()
            .filter(s -> s.execution().startedAt().isAfter(after))
            .sorted(NEWEST_FIRST)
            .map(StoredExecution::execution)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteAll() {
        executions.clear();
    }

    private void store(SyncExecution execution) {
        executions.put(execution.id(), new StoredExecution(execution, nextSequence++));
    }

    private record StoredExecution(SyncExecution execution, long sequence) {}
}
