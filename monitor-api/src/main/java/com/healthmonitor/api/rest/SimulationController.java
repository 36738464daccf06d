package com.healthmonitor.api.rest;

import com.healthmonitor.engine.simulation.DemoEventSimulator;
import com.healthmonitor.engine.simulation.DemoEventSimulator.SeedResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Seeds demo integration events.
 */
@RestController
@RequestMapping("/api/simulate")
public class SimulationController {

    private final DemoEventSimulator simulator;

    public SimulationController(DemoEventSimulator simulator) {
        this.simulator = simulator;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> simulate(
            @RequestParam(defaultValue = DemoEventSimulator.DEMO_MODE) String mode,
            @RequestParam(defaultValue = "false") boolean reset) {

        SeedResult result = simulator.seed(mode, reset);
        return ResponseEntity.ok(Map.of(
            "success", true,
            "message", result.message(),
            "successCount", result.successCount(),
            "errorCount", result.errorCount()
        ));
    }
}
