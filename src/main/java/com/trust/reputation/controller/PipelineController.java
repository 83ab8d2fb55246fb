package com.trust.reputation.controller;

import com.trust.reputation.model.PipelineRequest;
import com.trust.reputation.model.PipelineResult;
import com.trust.reputation.service.TrustPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline", description = "Score a graph and cluster the scored accounts in one call")
public class PipelineController {

    private final TrustPipelineService pipelineService;

    public PipelineController(TrustPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Operation(summary = "Score a graph, then cluster its nodes",
            description = "Each node becomes an account carrying its finalScore and Sybil probability, its " +
                    "out-edges as connections and its activity as contributions.")
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody PipelineRequest request) {
        if (request.getGraph() == null) {
            return ErrorResponses.badRequest("graph is required", "graph");
        }
        try {
            PipelineResult result = pipelineService.analyze(request);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        }
    }
}
