package com.trust.reputation.controller;

import com.trust.reputation.model.AccountPair;
import com.trust.reputation.model.Cluster;
import com.trust.reputation.model.ClusteringRequest;
import com.trust.reputation.model.ParameterSweep;
import com.trust.reputation.model.TuningRequest;
import com.trust.reputation.service.ClusteringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/clusters")
@Tag(name = "Clusters", description = "Detect groups of coordinated accounts and tune the similarity threshold")
public class ClusteringController {

    private final ClusteringService clusteringService;

    public ClusteringController(ClusteringService clusteringService) {
        this.clusteringService = clusteringService;
    }

    @Operation(summary = "Cluster accounts",
            description = "Groups accounts with the configured method (CONNECTIVITY, SIMILARITY, DBSCAN or " +
                    "HIERARCHICAL). Each cluster carries density, cohesion, a heuristic risk score and pattern tags.")
    @PostMapping
    public ResponseEntity<?> findClusters(@RequestBody ClusteringRequest request) {
        if (request.getAccounts() == null) {
            return ErrorResponses.badRequest("accounts are required", "accounts");
        }
        try {
            List<Cluster> clusters = clusteringService.findClusters(request.getAccounts(), request.getConfig());
            return ResponseEntity.ok(clusters);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        }
    }

    @Operation(summary = "List similar account pairs",
            description = "Returns every pair at or above minSimilarity with its feature breakdown, most similar first.")
    @PostMapping("/similarity")
    public ResponseEntity<?> similarPairs(@RequestBody ClusteringRequest request) {
        if (request.getAccounts() == null) {
            return ErrorResponses.badRequest("accounts are required", "accounts");
        }
        try {
            List<AccountPair> pairs = clusteringService.similarPairs(request.getAccounts(), request.getConfig());
            return ResponseEntity.ok(pairs);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        }
    }

    @Operation(summary = "Sweep the similarity threshold",
            description = "Offline tuning tool. Clusters the accounts at each threshold in the range and picks the " +
                    "one with the best silhouette, penalized for fragmentation. Cost grows with the number of steps.")
    @PostMapping("/tune")
    public ResponseEntity<?> tune(@RequestBody TuningRequest request) {
        if (request.getAccounts() == null) {
            return ErrorResponses.badRequest("accounts are required", "accounts");
        }
        try {
            ParameterSweep sweep = clusteringService.tune(request.getAccounts(), request.getConfig(),
                    request.getMinSimilarity(), request.getMaxSimilarity(), request.getStep());
            return ResponseEntity.ok(sweep);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        }
    }
}
