package com.healthmonitor.engine.health;

import com.healthmonitor.core.model.IntegrationStatus;
import com.healthmonitor.core.repository.IntegrationEventRepository;
import com.healthmonitor.engine.service.HealthService;
import com.healthmonitor.engine.service.HealthService.IntegrationHealth;
import com.healthmonitor.engine.service.HealthService.SyncSystemOverview;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Actuator view of the monitored integrations.
 * Reports:
 * - Event store fill level
 * - Integrations currently down
 * - Failing and stale sync instances
 *
 * The monitor itself stays UP when integrations are down; those are
 * reported as details, not as the monitor's own health.
 */
@Component
public class MonitorHealthIndicator implements HealthIndicator {

    private final HealthService healthService;
    private final IntegrationEventRepository eventRepository;

    public MonitorHealthIndicator(HealthService healthService, IntegrationEventRepository eventRepository) {
        this.healthService = healthService;
        this.eventRepository = eventRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        try {
            details.put("storedEvents", eventRepository.size());
            details.put("eventCapacity", eventRepository.capacity());

            List<IntegrationHealth> integrations = healthService.getAllIntegrationHealth();
            List<String> down = integrations.stream()
                .filter(i -> i.status() == IntegrationStatus.DOWN)
                .map(IntegrationHealth::id)
                .collect(Collectors.toList());
            details.put("integrationsDown", down);

            SyncSystemOverview overview = healthService.getSystemOverview();
            details.put("syncHealth", overview.status().value());
            details.put("failingInstances", overview.failingInstances());
            details.put("staleInstances", overview.staleInstances());

            if (!down.isEmpty() || overview.failingInstances() > 0) {
                details.put("warning", "Some integrations need attention");
            }

            return Health.up()
                .withDetails(details)
                .build();

        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
