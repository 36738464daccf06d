package com.healthmonitor.api.rest;

import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncInstanceStatus;
import com.healthmonitor.engine.service.HealthService;
import com.healthmonitor.engine.service.HealthService.SyncSystemOverview;
import com.healthmonitor.engine.service.SyncService;
import com.healthmonitor.engine.service.SyncService.GenerateMockDataRequest;
import com.healthmonitor.engine.service.SyncService.GenerationSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for sync pipelines, instances and executions.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncController {

    static final int DEFAULT_INSTANCE_EXECUTIONS = 20;
    static final int DEFAULT_EXECUTIONS = 50;

    private final SyncService syncService;
    private final HealthService healthService;

    public SyncController(SyncService syncService, HealthService healthService) {
        this.syncService = syncService;
        this.healthService = healthService;
    }

    /**
     * System-wide sync rollup.
     */
    @GetMapping("/overview")
    public ResponseEntity<Map<String, Object>> getOverview() {
        return ResponseEntity.ok(Map.of("overview", healthService.getSystemOverview()));
    }

    // ========== Pipelines ==========

    @GetMapping("/pipelines")
    public ResponseEntity<Map<String, Object>> listPipelines() {
        return ResponseEntity.ok(Map.of("pipelines", syncService.listPipelines()));
    }

    @GetMapping("/pipelines/{pipelineId}")
    public ResponseEntity<Map<String, Object>> getPipeline(@PathVariable String pipelineId) {
        return ResponseEntity.ok(Map.of("pipeline", syncService.getPipeline(pipelineId)));
    }

    // ========== Clients ==========

    @GetMapping("/clients")
    public ResponseEntity<Map<String, Object>> listClients() {
        return ResponseEntity.ok(Map.of("clients", syncService.listClients()));
    }

    @GetMapping("/clients/{clientId}/instances")
    public ResponseEntity<Map<String, Object>> listClientInstances(@PathVariable String clientId) {
        return ResponseEntity.ok(Map.of("instances", syncService.listInstances(clientId, null, null)));
    }

    // ========== Instances ==========

    @GetMapping("/instances")
    public ResponseEntity<Map<String, Object>> listInstances(
            @RequestParam(name = "client_id", required = false) String clientId,
            @RequestParam(name = "pipeline_id", required = false) String pipelineId,
            @RequestParam(required = false) String status) {

        SyncInstanceStatus instanceStatus = status != null ? SyncInstanceStatus.fromValue(status) : null;
        return ResponseEntity.ok(Map.of("instances", syncService.listInstances(clientId, pipelineId, instanceStatus)));
    }

    @GetMapping("/instances/{instanceId}")
    public ResponseEntity<Map<String, Object>> getInstance(@PathVariable String instanceId) {
        return ResponseEntity.ok(Map.of("instance", syncService.getInstance(instanceId)));
    }

    @GetMapping("/instances/{instanceId}/executions")
    public ResponseEntity<Map<String, Object>> listInstanceExecutions(
            @PathVariable String instanceId,
            @RequestParam(required = false) Integer limit) {

        syncService.getInstance(instanceId);
        int max = limit != null ? limit : DEFAULT_INSTANCE_EXECUTIONS;
        return ResponseEntity.ok(Map.of("executions", syncService.listExecutions(instanceId, null, null, max)));
    }

    /**
     * Run a manual sync now.
     */
    @PostMapping("/instances/{instanceId}/sync")
    public ResponseEntity<Map<String, Object>> triggerSync(@PathVariable String instanceId) {
        SyncExecution execution = syncService.triggerSync(instanceId);
        return ResponseEntity.ok(Map.of(
            "message", "Sync triggered successfully",
            "execution", execution
        ));
    }

    // ========== Executions ==========

    @GetMapping("/executions")
    public ResponseEntity<Map<String, Object>> listExecutions(
            @RequestParam(name = "instance_id", required = false) String instanceId,
            @RequestParam(name = "pipeline_id", required = false) String pipelineId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {

        SyncExecutionStatus executionStatus = status != null ? SyncExecutionStatus.fromValue(status) : null;
        int max = limit != null ? limit : DEFAULT_EXECUTIONS;
        return ResponseEntity.ok(Map.of(
            "executions", syncService.listExecutions(instanceId, pipelineId, executionStatus, max)));
    }

    @GetMapping("/executions/{executionId}")
    public ResponseEntity<Map<String, Object>> getExecution(@PathVariable UUID executionId) {
        return ResponseEntity.ok(Map.of("execution", syncService.getExecution(executionId)));
    }

    // ========== Simulation ==========

    /**
     * Replace all sync data with generated history.
     */
    @PostMapping("/simulate")
    public ResponseEntity<Map<String, Object>> simulate(@RequestBody(required = false) SimulateRequest request) {
        GenerateMockDataRequest defaults = GenerateMockDataRequest.defaults();
        GenerateMockDataRequest generate = new GenerateMockDataRequest(
            request != null && request.clientCount() != null ? request.clientCount() : defaults.clientCount(),
            request != null && request.introduceFailures() != null ? request.introduceFailures() : defaults.introduceFailures()
        );
        GenerationSummary summary = syncService.generateMockData(generate);
        SyncSystemOverview overview = healthService.getSystemOverview();

        return ResponseEntity.ok(Map.of(
            "success", true,
            "message", "Mock sync data generated",
            "overview", Map.of(
                "activeClients", overview.activeClients(),
                "totalPipelines", overview.pipelineStats().size(),
                "totalInstances", summary.instances(),
                "failingInstances", overview.failingInstances()
            )
        ));
    }

    // ========== DTOs ==========

    public record SimulateRequest(
        Integer clientCount,
        Boolean introduceFailures
    ) {}
}
