package com.trust.reputation.controller;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.config.FeatureWeights;
import com.trust.reputation.config.ReputationProperties;
import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.clustering.ClusteringEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View default scoring and clustering configuration and tune similarity weights")
public class ConfigController {

    private final ReputationProperties properties;

    public ConfigController(ReputationProperties properties) {
        this.properties = properties;
    }

    @Operation(summary = "Get default scoring configuration")
    @GetMapping("/scoring")
    public ResponseEntity<ScoringConfig> getScoringConfig() {
        return ResponseEntity.ok(properties.getScoring());
    }

    @Operation(summary = "Get default clustering configuration")
    @GetMapping("/clustering")
    public ResponseEntity<ClusteringConfig> getClusteringConfig() {
        return ResponseEntity.ok(properties.getClustering());
    }

    @Operation(summary = "Update similarity feature weights",
            description = "Omitted weights keep their current value. Weights must be non-negative and not all zero. " +
                    "Changes apply to later requests that use the server defaults and reset on restart.")
    @PutMapping("/clustering/feature-weights")
    public ResponseEntity<?> updateFeatureWeights(@RequestBody Map<String, Object> body) {
        FeatureWeights current = properties.getClustering().getFeatureWeights();
        FeatureWeights updated = new FeatureWeights(
                toDouble(body, "sharedConnections", current.getSharedConnections()),
                toDouble(body, "connectionOverlap", current.getConnectionOverlap()),
                toDouble(body, "temporalSimilarity", current.getTemporalSimilarity()),
                toDouble(body, "metadataSimilarity", current.getMetadataSimilarity()),
                toDouble(body, "graphDistance", current.getGraphDistance()));

        try {
            ClusteringEngine.validateFeatureWeights(updated);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        }

        properties.getClustering().setFeatureWeights(updated);
        return ResponseEntity.ok(updated);
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }
}
