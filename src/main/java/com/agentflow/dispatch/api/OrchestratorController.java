package com.agentflow.dispatch.api;

import com.agentflow.core.scheduler.OrchestrationScheduler;
import com.agentflow.core.scheduler.OrchestratorStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator control of the sweeps. Start and stop are idempotent.
 */
@RestController
@RequestMapping("/api/v1/orchestrator")
public class OrchestratorController {

    private final OrchestrationScheduler scheduler;

    public OrchestratorController(OrchestrationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        boolean changed = scheduler.start();
        return ResponseEntity.ok(Map.of("running", scheduler.isRunning(), "changed", changed));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean changed = scheduler.stop();
        return ResponseEntity.ok(Map.of("running", scheduler.isRunning(), "changed", changed));
    }

    @GetMapping("/status")
    public OrchestratorStatus status() {
        return scheduler.getStatus();
    }
}
