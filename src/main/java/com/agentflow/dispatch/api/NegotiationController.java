package com.agentflow.dispatch.api;

import com.agentflow.core.negotiation.Negotiation;
import com.agentflow.core.negotiation.NegotiationCoordinator;
import com.agentflow.core.negotiation.NegotiationStatus;
import com.agentflow.core.negotiation.ProposalDraft;
import com.agentflow.core.negotiation.VoteDecision;
import com.agentflow.core.negotiation.VoteResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for negotiation sessions. Sessions live in process memory.
 */
@RestController
@RequestMapping("/api/v1/negotiations")
public class NegotiationController {

    private final NegotiationCoordinator coordinator;

    public NegotiationController(NegotiationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    public ResponseEntity<?> start(@RequestBody NegotiationRequest request) {
        if (request.initiatorId() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "initiatorId is required"));
        }
        try {
            List<ProposalDraft> drafts = request.proposals() == null ? List.of() : request.proposals().stream()
                    .map(p -> new ProposalDraft(p.content(), p.terms()))
                    .toList();
            Negotiation negotiation = coordinator.startNegotiation(request.initiatorId(), request.topic(),
                    request.participantIds() == null ? List.of() : request.participantIds(), drafts);
            return ResponseEntity.status(HttpStatus.CREATED).body(negotiation);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/negotiations: sessions still open.
     */
    @GetMapping
    public List<Negotiation> active() {
        return coordinator.getActiveNegotiations();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Negotiation> get(@PathVariable String id) {
        return coordinator.getNegotiation(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/negotiations/{id}/votes: 200 when recorded, 404 for an
     * unknown session, 409 when the vote was rejected.
     */
    @PostMapping("/{id}/votes")
    public ResponseEntity<?> vote(@PathVariable String id, @RequestBody VoteRequest request) {
        if (request.agentId() == null || request.proposalId() == null || request.decision() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "agentId, proposalId and decision are required"));
        }
        VoteDecision decision;
        try {
            decision = VoteDecision.of(request.decision());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid decision: " + request.decision()));
        }

        VoteResult result = coordinator.vote(request.agentId(), id, request.proposalId(), decision,
                request.reasoning());
        if (result == VoteResult.NEGOTIATION_NOT_FOUND) {
            return ResponseEntity.notFound().build();
        }
        String status = coordinator.checkStatus(id).map(NegotiationStatus::value).orElse("unknown");
        Map<String, Object> body = Map.of("result", result.name().toLowerCase(Locale.ROOT), "status", status);
        return result.isRecorded() ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }
}
