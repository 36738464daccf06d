package com.healthmonitor.engine.persistence;

import com.healthmonitor.core.model.SyncPipeline;
import com.healthmonitor.core.repository.SyncPipelineRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Pipeline catalog materialized once, on first access, from a fixed definition list.
 */
public class InMemorySyncPipelineRepository implements SyncPipelineRepository {

    private final Supplier<List<SyncPipeline>> catalog;
    private volatile Map<String, SyncPipeline> pipelines;

    public InMemorySyncPipelineRepository(Supplier<List<SyncPipeline>> catalog) {
        this.catalog = catalog;
    }

    @Override
    public List<SyncPipeline> findAll() {
        return List.copyOf(pipelines().values());
    }

    @Override
    public Optional<SyncPipeline> findById(String pipelineId) {
        return Optional.ofNullable(pipelines().get(pipelineId));
    }

    private Map<String, SyncPipeline> pipelines() {
        Map<String, SyncPipeline> loaded = pipelines;
        if (loaded == null) {
            synchronized (this) {
                loaded = pipelines;
                if (loaded == null) {
                    loaded = new LinkedHashMap<>();
                    for (SyncPipeline pipeline : catalog.get()) {
                        loaded.put(pipeline.id(), pipeline);
                    }
                    pipelines = loaded;
                }
            }
        }
        return loaded;
    }
}
