package com.agentflow.dispatch.api;

import com.agentflow.core.governor.GovernorDecision;
import com.agentflow.core.governor.GovernorService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/governor")
public class GovernorController {

    private final GovernorService governorService;

    public GovernorController(GovernorService governorService) {
        this.governorService = governorService;
    }

    /**
     * POST /api/v1/governor/audit: runs an audit now and returns its decisions.
     */
    @PostMapping("/audit")
    public List<GovernorDecision> audit() {
        return governorService.runAudit();
    }
}
