package com.healthmonitor.api.rest;

import com.healthmonitor.core.exception.NotFoundException;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.engine.service.EventService;
import com.healthmonitor.engine.service.EventService.EventFilter;
import com.healthmonitor.engine.service.HealthService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for integration health.
 */
@RestController
@RequestMapping("/api/integrations")
public class IntegrationController {

    static final int RECENT_EVENTS = 20;

    private final HealthService healthService;
    private final EventService eventService;

    public IntegrationController(HealthService healthService, EventService eventService) {
        this.healthService = healthService;
        this.eventService = eventService;
    }

    /**
     * Every integration with its health.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listIntegrations() {
        return ResponseEntity.ok(Map.of("integrations", healthService.getAllIntegrationHealth()));
    }

    /**
     * Status counts plus every integration's health.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> getHealth() {
        return ResponseEntity.ok(Map.of(
            "health", healthService.getOverallHealth(),
            "integrations", healthService.getAllIntegrationHealth()
        ));
    }

    /**
     * One integration's health and its most recent events.
     */
    @GetMapping("/{integrationId}")
    public ResponseEntity<Map<String, Object>> getIntegration(@PathVariable String integrationId) {
        IntegrationType integration;
        try {
            integration = IntegrationType.fromId(integrationId);
        } catch (IllegalArgumentException e) {
            throw new NotFoundException("Integration", integrationId);
        }
        return ResponseEntity.ok(Map.of(
            "integration", healthService.getIntegrationHealth(integration),
            "recentEvents", eventService.listEvents(EventFilter.forIntegration(integration, RECENT_EVENTS))
        ));
    }
}
