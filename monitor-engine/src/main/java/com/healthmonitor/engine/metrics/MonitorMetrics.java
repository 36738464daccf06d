package com.healthmonitor.engine.metrics;

import com.healthmonitor.core.model.EventStatus;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncInstanceStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operational metrics for the integration health monitor.
 *
 * Metrics exposed:
 * - Events ingested and evicted
 * - Classifications by source (external, fallback, cached)
 * - Resolution transitions
 * - Sync executions by pipeline, status and trigger
 * - Event store size and sync instances by status (gauges)
 *
 * Recording is a no-op until the binder has been bound to a registry.
 */
public class MonitorMetrics implements MeterBinder {

    public static final String EVENTS_RECORDED = "monitor.events.recorded";
    public static final String EVENTS_EVICTED = "monitor.events.evicted";
    public static final String EVENT_STORE_SIZE = "monitor.events.stored";

    public static final String CLASSIFICATIONS = "monitor.classifications";
    public static final String CLASSIFICATION_DURATION = "monitor.classification.duration";
    public static final String RESOLUTION_TRANSITIONS = "monitor.resolution.transitions";

    public static final String SYNC_EXECUTIONS = "monitor.sync.executions";
    public static final String SYNC_INSTANCES = "monitor.sync.instances";
    public static final String MOCK_GENERATIONS = "monitor.sync.generations";

    private volatile MeterRegistry registry;

    private final AtomicInteger eventStoreSize = new AtomicInteger(0);
    private final Map<SyncInstanceStatus, AtomicInteger> instanceStatusGauges = new EnumMap<>(SyncInstanceStatus.class);

    public MonitorMetrics() {
        for (SyncInstanceStatus status : SyncInstanceStatus.values()) {
            instanceStatusGauges.put(status, new AtomicInteger(0));
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(EVENT_STORE_SIZE, eventStoreSize, AtomicInteger::get)
            .description("Number of events currently retained")
            .register(registry);

        instanceStatusGauges.forEach((status, gauge) ->
            Gauge.builder(SYNC_INSTANCES, gauge, AtomicInteger::get)
                .tag("status", status.value())
                .description("Number of sync instances in " + status.value() + " status")
                .register(registry));
    }

    // ========== Event Metrics ==========

    public void eventRecorded(IntegrationType integration, EventStatus status) {
        if (registry == null) {
            return;
        }
        Counter.builder(EVENTS_RECORDED)
            .tag("integration", integration.id())
            .tag("status", status.value())
            .description("Total integration events recorded")
            .register(registry)
            .increment();
    }

    public void eventEvicted(IntegrationType integration) {
        if (registry == null) {
            return;
        }
        Counter.builder(EVENTS_EVICTED)
            .tag("integration", integration.id())
            .description("Events dropped because the store was full")
            .register(registry)
            .increment();
    }

    public void resolutionTransition(String transition) {
        if (registry == null) {
            return;
        }
        Counter.builder(RESOLUTION_TRANSITIONS)
            .tag("transition", transition)
            .description("Resolution state machine transitions applied")
            .register(registry)
            .increment();
    }

    // ========== Classification Metrics ==========

    public void classified(IntegrationType integration, String source, Duration duration) {
        if (registry == null) {
            return;
        }
        Counter.builder(CLASSIFICATIONS)
            .tag("integration", integration.id())
            .tag("source", source)
            .description("Classifications served")
            .register(registry)
            .increment();

        Timer.builder(CLASSIFICATION_DURATION)
            .tag("source", source)
            .description("Time taken to serve a classification")
            .register(registry)
            .record(duration);
    }

    // ========== Sync Metrics ==========

    public void syncExecutionRecorded(SyncExecution execution) {
        if (registry == null) {
            return;
        }
        Counter.builder(SYNC_EXECUTIONS)
            .tag("pipeline", execution.pipelineId())
            .tag("status", execution.status().value())
            .tag("trigger", execution.triggeredBy().value())
            .description("Sync executions recorded")
            .register(registry)
            .increment();
    }

    public void mockDataGenerated(int clientCount, int executionCount) {
        if (registry == null) {
            return;
        }
        Counter.builder(MOCK_GENERATIONS)
            .description("Mock sync data generations")
            .register(registry)
            .increment();
        Counter.builder(SYNC_EXECUTIONS + ".generated")
            .description("Sync executions produced by mock generation")
            .register(registry)
            .increment(executionCount);
    }

    // ========== Gauge Sync ==========

    /**
     * Sync the event store gauge with the actual store size.
     */
    public void syncEventStoreSize(int size) {
        eventStoreSize.set(size);
    }

    /**
     * Sync an instance status gauge with the actual count.
     */
    public void syncInstanceStatusGauge(SyncInstanceStatus status, long count) {
        instanceStatusGauges.get(status).set((int) count);
    }
}
