package com.healthmonitor.engine.persistence;

import com.healthmonitor.core.model.SyncInstance;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.repository.SyncInstanceRepository;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SyncInstanceRepository.
 * Keeps insertion order so listings follow generation order (client, then pipeline).
 */
public class InMemorySyncInstanceRepository implements SyncInstanceRepository {

    private final Map<String, SyncInstance> instances = new LinkedHashMap<>();

    @Override
    public synchronized void save(SyncInstance instance) {
        instances.put(instance.id(), instance);
    }

    @Override
    public synchronized Optional<SyncInstance> findById(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public synchronized List<SyncInstance> find(String clientId, String pipelineId, SyncInstanceStatus status) {
        return instances.values().stream()
            .filter(i -> clientId == null || i.clientId().equals(clientId))
            .filter(i -> pipelineId == null || i.pipelineId().equals(pipelineId))
            .filter(i -> status == null || i.status() == status)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Map<SyncInstanceStatus, Long> countByStatus() {
        Map<SyncInstanceStatus, Long> counts = new EnumMap<>(SyncInstanceStatus.class);
        for (SyncInstanceStatus status : SyncInstanceStatus.values()) {
            counts.put(status, 0L);
        }
        for (SyncInstance instance : instances.values()) {
            counts.merge(instance.status(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public synchronized void deleteAll() {
        instances.clear();
    }
}
