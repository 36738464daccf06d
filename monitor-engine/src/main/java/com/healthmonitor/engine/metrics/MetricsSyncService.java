package com.healthmonitor.engine.metrics;

import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.core.repository.IntegrationEventRepository;
import com.healthmonitor.core.repository.SyncInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Periodically syncs gauge metrics from store state.
 */
@Component
public class MetricsSyncService {

    private static final Logger log = LoggerFactory.getLogger(MetricsSyncService.class);

    private final IntegrationEventRepository eventRepository;
    private final SyncInstanceRepository instanceRepository;
    private final MonitorMetrics monitorMetrics;

    public MetricsSyncService(
            IntegrationEventRepository eventRepository,
            SyncInstanceRepository instanceRepository,
            MonitorMetrics monitorMetrics) {
        this.eventRepository = eventRepository;
        this.instanceRepository = instanceRepository;
        this.monitorMetrics = monitorMetrics;
    }

    /**
     * Sync the event store size gauge every 15 seconds.
     */
    @Scheduled(fixedRate = 15000, initialDelay = 5000)
    public void syncEventStoreGauge() {
        monitorMetrics.syncEventStoreSize(eventRepository.size());
    }

    /**
     * Sync instance status gauges every 30 seconds.
     */
    @Scheduled(fixedRate = 30000, initialDelay = 10000)
    public void syncInstanceStatusGauges() {
        Map<SyncInstanceStatus, Long> counts = instanceRepository.countByStatus();
        counts.forEach(monitorMetrics::syncInstanceStatusGauge);
        log.debug("Synced sync instance gauges: {}", counts);
    }
}
