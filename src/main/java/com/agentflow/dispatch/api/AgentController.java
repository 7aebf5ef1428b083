package com.agentflow.dispatch.api;

import com.agentflow.core.model.Agent;
import com.agentflow.core.roster.RosterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final RosterService rosterService;

    public AgentController(RosterService rosterService) {
        this.rosterService = rosterService;
    }

    @GetMapping
    public List<Agent> list() {
        return rosterService.listAgents();
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Agent> pause(@PathVariable long id) {
        return rosterService.pauseAgent(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Agent> resume(@PathVariable long id) {
        return rosterService.resumeAgent(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }
}
