package com.healthmonitor.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One client's binding of a sync pipeline.
 *
 * Primary Key: id ("{clientId}_{pipelineId}")
 *
 * Invariants:
 * - recentExecutions is newest first and holds at most {@link #MAX_RECENT_EXECUTIONS}
 * - status and stats are recomputed whenever an execution is recorded
 */
public record SyncInstance(
    String id,

    // Client
    String clientId,
    String clientName,

    // Pipeline
    String pipelineId,
    SyncPipeline pipeline,

    // Derived state
    SyncInstanceStatus status,
    boolean enabled,
    SyncExecutionSummary lastSync,
    Instant nextScheduledSync,
    Stats stats,
    List<SyncExecutionSummary> recentExecutions
) {
    public static final int MAX_RECENT_EXECUTIONS = 10;

    public SyncInstance {
        recentExecutions = List.copyOf(recentExecutions);
    }

    public static String instanceId(String clientId, SyncPipeline pipeline) {
        return clientId + "_" + pipeline.id();
    }

    /**
     * Copy with a new execution recorded at the head of the recent list.
     * The oldest entry is dropped once the list is full. Status, stats and
     * the next scheduled sync are left to the caller.
     */
    public SyncInstance withExecutionRecorded(SyncExecutionSummary execution) {
        List<SyncExecutionSummary> recent = new ArrayList<>(MAX_RECENT_EXECUTIONS);
        recent.add(execution);
        for (SyncExecutionSummary previous : recentExecutions) {
            if (recent.size() == MAX_RECENT_EXECUTIONS) {
                break;
            }
            recent.add(previous);
        }
        return toBuilder()
            .lastSync(execution)
            .recentExecutions(recent)
            .build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rolling statistics for the 24h and 7d windows.
     */
    public record Stats(
        SyncStats last24h,
        SyncStats last7d
    ) {
        public static Stats fromDay(SyncStats last24h) {
            return new Stats(last24h, last24h.weeklyEstimate());
        }
    }

    public static class Builder {
        private String id;
        private String clientId;
        private String clientName;
        private String pipelineId;
        private SyncPipeline pipeline;
        private SyncInstanceStatus status = SyncInstanceStatus.HEALTHY;
        private boolean enabled = true;
        private SyncExecutionSummary lastSync;
        private Instant nextScheduledSync;
        private Stats stats = Stats.fromDay(SyncStats.empty());
        private List<SyncExecutionSummary> recentExecutions = List.of();

        private Builder() {
        }

        private Builder(SyncInstance instance) {
            this.id = instance.id();
            this.clientId = instance.clientId();
            this.clientName = instance.clientName();
            this.pipelineId = instance.pipelineId();
            this.pipeline = instance.pipeline();
            this.status = instance.status();
            this.enabled = instance.enabled();
            this.lastSync = instance.lastSync();
            this.nextScheduledSync = instance.nextScheduledSync();
            this.stats = instance.stats();
            this.recentExecutions = instance.recentExecutions();
        }

        public Builder client(String clientId, String clientName) {
            this.clientId = clientId;
            this.clientName = clientName;
            return this;
        }

        public Builder pipeline(SyncPipeline pipeline) {
            this.pipeline = pipeline;
            this.pipelineId = pipeline.id();
            if (this.id == null && this.clientId != null) {
                this.id = instanceId(clientId, pipeline);
            }
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(SyncInstanceStatus status) {
            this.status = status;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder lastSync(SyncExecutionSummary lastSync) {
            this.lastSync = lastSync;
            return this;
        }

        public Builder nextScheduledSync(Instant nextScheduledSync) {
            this.nextScheduledSync = nextScheduledSync;
            return this;
        }

        public Builder stats(Stats stats) {
            this.stats = stats;
            return this;
        }

        public Builder recentExecutions(List<SyncExecutionSummary> recentExecutions) {
            this.recentExecutions = recentExecutions;
            return this;
        }

        public SyncInstance build() {
            return new SyncInstance(
                id, clientId, clientName, pipelineId, pipeline,
                status, enabled, lastSync, nextScheduledSync,
                stats, recentExecutions
            );
        }
    }
}
