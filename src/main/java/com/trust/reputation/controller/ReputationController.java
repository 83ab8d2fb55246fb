package com.trust.reputation.controller;

import com.trust.reputation.model.ReputationRequest;
import com.trust.reputation.model.ReputationResult;
import com.trust.reputation.service.ReputationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/reputation")
@Tag(name = "Reputation", description = "Score a trust graph snapshot")
public class ReputationController {

    private final ReputationService reputationService;

    public ReputationController(ReputationService reputationService) {
        this.reputationService = reputationService;
    }

    @Operation(summary = "Compute reputation scores for a graph snapshot",
            description = "Runs temporal, economically weighted PageRank and combines it with quality, stake and " +
                    "payment sub-scores. Returns per-node scores with percentiles and explanations, fairness " +
                    "metrics, Sybil probabilities (ranked signals, not verdicts), optional sensitivity audits " +
                    "and convergence metadata.")
    @PostMapping("/compute")
    public ResponseEntity<?> compute(@RequestBody ReputationRequest request) {
        if (request.getGraph() == null) {
            return ErrorResponses.badRequest("graph is required", "graph");
        }
        try {
            ReputationResult result = reputationService.compute(request);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        }
    }
}
