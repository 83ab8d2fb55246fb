package com.trust.reputation.service;

import com.trust.reputation.config.MetricsConfig;
import com.trust.reputation.config.ReputationProperties;
import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.graph.InputValidationException;
import com.trust.reputation.engine.scoring.ReputationScorer;
import com.trust.reputation.engine.scoring.ScoreSmoother;
import com.trust.reputation.model.ReputationRequest;
import com.trust.reputation.model.ReputationResult;
import com.trust.reputation.model.ReputationScore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for reputation scoring.
 *
 * Flow:
 * 1. Resolve the scoring config (request override or server defaults)
 * 2. Build a fresh ReputationScorer for this run
 * 3. Score the snapshot, including any requested sensitivity audits
 * 4. Smooth final scores against caller-supplied history, if any
 * 5. Record metrics
 */
@Service
public class ReputationService {

    private static final Logger log = LoggerFactory.getLogger(ReputationService.class);

    static final int DEFAULT_SMOOTHING_WINDOW = 5;
    static final double DEFAULT_SMOOTHING_DECAY = 0.8;

    private final ReputationProperties properties;
    private final MetricsConfig metricsConfig;

    public ReputationService(ReputationProperties properties, MetricsConfig metricsConfig) {
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "reputation.compute", contextualName = "compute-reputation")
    public ReputationResult compute(ReputationRequest request) {
        ScoringConfig config = request.getConfig() != null ? request.getConfig() : properties.getScoring();

        ReputationResult result;
        try {
            ReputationScorer scorer = new ReputationScorer(config);
            result = scorer.score(request.getGraph(), request.getAuditNodeIds());
            if (request.getScoreHistory() != null && !request.getScoreHistory().isEmpty()) {
                applySmoothing(result, request);
            }
        } catch (InputValidationException e) {
            metricsConfig.recordValidationFailure("scoring");
            log.warn("Rejected scoring request: {} (subject={}, field={})",
                    e.getMessage(), e.getSubject(), e.getField());
            throw e;
        }

        metricsConfig.recordScoringRun(result.getMetadata().isConverged(),
                result.getMetadata().getIterations(), result.getMetadata().getNodeCount());
        if (result.getSybilProbabilities() != null) {
            int candidates = (int) result.getSybilProbabilities().values().stream()
                    .filter(p -> p >= config.getSybilReportThreshold())
                    .count();
            metricsConfig.recordSybilCandidates(candidates);
        }

        log.info("Scored {} nodes / {} edges in {}ms (iterations={}, converged={})",
                result.getMetadata().getNodeCount(), result.getMetadata().getEdgeCount(),
                result.getMetadata().getComputationTimeMs(), result.getMetadata().getIterations(),
                result.getMetadata().isConverged());
        return result;
    }

    private void applySmoothing(ReputationResult result, ReputationRequest request) {
        int window = request.getSmoothingWindow() != null ? request.getSmoothingWindow() : DEFAULT_SMOOTHING_WINDOW;
        double decay = request.getSmoothingDecay() != null ? request.getSmoothingDecay() : DEFAULT_SMOOTHING_DECAY;
        if (window < 1) {
            throw new InputValidationException("smoothingWindow must be >= 1", "request", "smoothingWindow");
        }
        if (!(decay > 0 && decay <= 1)) {
            throw new InputValidationException("smoothingDecay must be in (0, 1]", "request", "smoothingDecay");
        }
        for (Map.Entry<String, List<Double>> entry : request.getScoreHistory().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            for (Double past : entry.getValue()) {
                if (past != null && (!Double.isFinite(past) || past < 0)) {
                    throw new InputValidationException("score history must hold finite non-negative scores, was "
                            + past, entry.getKey(), "scoreHistory");
                }
            }
        }
        for (Map.Entry<String, List<Double>> entry : request.getScoreHistory().entrySet()) {
            ReputationScore score = result.getScores().get(entry.getKey());
            if (score == null) {
                log.debug("Ignoring score history for unknown node {}", entry.getKey());
                continue;
            }
            score.setSmoothedScore(ScoreSmoother.rollingAverage(score.getFinalScore(), entry.getValue(), window, decay));
        }
    }
}
