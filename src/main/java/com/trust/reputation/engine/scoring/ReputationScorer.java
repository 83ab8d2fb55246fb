package com.trust.reputation.engine.scoring;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.graph.GraphValidator;
import com.trust.reputation.engine.graph.IndexedGraph;
import com.trust.reputation.engine.pagerank.PageRankResult;
import com.trust.reputation.engine.pagerank.TeleportVector;
import com.trust.reputation.engine.pagerank.TemporalPageRank;
import com.trust.reputation.model.ComputationMetadata;
import com.trust.reputation.model.FairnessMetrics;
import com.trust.reputation.model.GraphSnapshot;
import com.trust.reputation.model.NodeAttributes;
import com.trust.reputation.model.ReputationResult;
import com.trust.reputation.model.ReputationScore;
import com.trust.reputation.model.SensitivityAudit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores one graph snapshot: temporal PageRank, hybrid sub-scores, percentiles and
 * the optional fairness, Sybil, sensitivity and deceptive-edge diagnostics.
 * <p>
 * A scorer owns its configuration and keeps no state between runs. Output is a
 * deterministic function of the snapshot and the configuration.
 */
public class ReputationScorer {

    private static final Logger log = LoggerFactory.getLogger(ReputationScorer.class);

    private final ScoringConfig config;

    public ReputationScorer(ScoringConfig config) {
        GraphValidator.validateConfig(config);
        this.config = config;
    }

    public ReputationResult score(GraphSnapshot snapshot) {
        return score(snapshot, null);
    }

    /**
     * @param auditNodeIds nodes to audit; null audits the top auditTopN when auditing is
     *                     enabled, an explicit list is audited regardless of that flag
     * @throws com.trust.reputation.engine.graph.InputValidationException on invalid input
     */
    public ReputationResult score(GraphSnapshot snapshot, Collection<String> auditNodeIds) {
        long start = System.currentTimeMillis();
        GraphValidator.validateSnapshot(snapshot, config);
        IndexedGraph graph = IndexedGraph.build(snapshot, config);
        GraphValidator.validateAuditRequest(auditNodeIds, new HashSet<>(graph.nodeIds()), config.getMaxAuditedNodes());

        int n = graph.nodeCount();
        if (n == 0) {
            return emptyResult(graph, start);
        }

        SubScoreCalculator subScores = new SubScoreCalculator(config);
        double[] quality = new double[n];
        double[] stake = new double[n];
        double[] payment = new double[n];
        double[] economic = new double[n];
        boolean[] minority = new boolean[n];
        for (int i = 0; i < n; i++) {
            NodeAttributes attrs = graph.attributes(i);
            quality[i] = subScores.qualityScore(attrs);
            stake[i] = subScores.stakeScore(attrs);
            payment[i] = subScores.paymentScore(attrs);
            economic[i] = subScores.economicSignal(stake[i], payment[i]);
            minority[i] = attrs.isMinority();
        }

        double[] teleport = TeleportVector.economicallyBiased(economic, config.getTeleportEconomicBias());
        TemporalPageRank pageRank = new TemporalPageRank(config);
        PageRankResult ranks = pageRank.compute(graph, teleport);

        FairnessAnalyzer fairness = new FairnessAnalyzer(config.getFairnessAdjustmentStrength());
        boolean adjust = config.isEnableFairnessConstraints() && config.isApplyFairnessAdjustments();
        double[] adjustedRanks = adjust ? fairness.adjustRanks(ranks.getRanks(), minority) : ranks.getRanks();
        boolean fairnessApplied = adjustedRanks != ranks.getRanks();
        double[] graphScore = new double[n];
        for (int i = 0; i < n; i++) {
            graphScore[i] = subScores.graphScore(adjustedRanks[i], n);
        }

        HybridScoreCalculator hybrid = new HybridScoreCalculator(config);
        double[] finalScore = new double[n];
        for (int i = 0; i < n; i++) {
            finalScore[i] = hybrid.finalScore(graphScore[i], quality[i], stake[i], payment[i]);
        }
        double[] percentile = PercentileRanker.percentiles(finalScore);

        Map<String, ReputationScore> scores = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            scores.put(graph.nodeId(i), ReputationScore.builder()
                    .nodeId(graph.nodeId(i))
                    .graphScore(graphScore[i])
                    .qualityScore(quality[i])
                    .stakeScore(stake[i])
                    .paymentScore(payment[i])
                    .finalScore(finalScore[i])
                    .percentile(percentile[i])
                    .explanation(explain(graph, i, graphScore[i], quality[i], stake[i], payment[i],
                            hybrid, fairnessApplied && minority[i]))
                    .build());
        }

        FairnessMetrics fairnessMetrics = config.isEnableFairnessConstraints()
                ? fairness.analyze(graph.nodeIds(), finalScore, minority)
                : null;

        Map<String, Double> sybil = null;
        if (config.isEnableSybilDetection()) {
            double[] probabilities = new SybilProbabilityEstimator(config).estimate(graph, economic);
            sybil = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                sybil.put(graph.nodeId(i), probabilities[i]);
            }
        }

        Map<String, SensitivityAudit> audits = null;
        List<Integer> auditTargets = auditTargets(graph, auditNodeIds, finalScore);
        if (!auditTargets.isEmpty()) {
            SensitivityAuditor auditor = new SensitivityAuditor(pageRank,
                    r -> toGraphScores(r, minority, fairness, adjust, subScores),
                    config.isAuditOutgoingEdges(), config.getAuditTopK());
            audits = new LinkedHashMap<>();
            for (int node : auditTargets) {
                audits.put(graph.nodeId(node), auditor.audit(graph, teleport, node, graphScore[node]));
            }
            log.debug("Sensitivity audit completed for {} nodes", auditTargets.size());
        }

        Map<String, Double> deception = null;
        if (config.isDetectDeceptiveEdges()) {
            int[] communities = new CommunityDetector().detect(graph);
            deception = new DeceptiveEdgeDetector().detect(graph, communities);
        }

        ComputationMetadata metadata = ComputationMetadata.builder()
                .nodeCount(n)
                .edgeCount(graph.edgeCount())
                .algorithm(TemporalPageRank.ALGORITHM)
                .iterations(ranks.getIterations())
                .converged(ranks.isConverged())
                .finalDelta(ranks.getFinalDelta())
                .computationTimeMs(System.currentTimeMillis() - start)
                .build();

        return ReputationResult.builder()
                .scores(scores)
                .fairnessMetrics(fairnessMetrics)
                .sybilProbabilities(sybil)
                .sensitivityAudits(audits)
                .deceptionProbabilities(deception)
                .metadata(metadata)
                .build();
    }

    public ScoringConfig getConfig() {
        return config;
    }

    private double[] toGraphScores(double[] ranks, boolean[] minority, FairnessAnalyzer fairness,
                                   boolean adjust, SubScoreCalculator subScores) {
        double[] adjusted = adjust ? fairness.adjustRanks(ranks, minority) : ranks;
        double[] result = new double[adjusted.length];
        for (int i = 0; i < adjusted.length; i++) {
            result[i] = subScores.graphScore(adjusted[i], adjusted.length);
        }
        return result;
    }

    private List<Integer> auditTargets(IndexedGraph graph, Collection<String> auditNodeIds, double[] finalScore) {
        if (auditNodeIds != null) {
            List<Integer> targets = new ArrayList<>();
            for (String id : auditNodeIds) {
                int index = graph.indexOf(id);
                if (!targets.contains(index)) {
                    targets.add(index);
                }
            }
            return targets;
        }
        if (!config.isEnableSensitivityAudit()) {
            return Collections.emptyList();
        }
        int limit = Math.min(config.getAuditTopN(), config.getMaxAuditedNodes());
        Integer[] order = new Integer[finalScore.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> -finalScore[i]).thenComparingInt(i -> i));
        return Arrays.asList(order).subList(0, Math.min(limit, order.length));
    }

    private List<String> explain(IndexedGraph graph, int node, double graphScore, double quality, double stake,
                                 double payment, HybridScoreCalculator hybrid, boolean fairnessAdjusted) {
        List<String> factors = new ArrayList<>();
        if (hybrid.isEnabled()) {
            ScoringConfig.HybridWeights w = hybrid.getWeights();
            double total = w.sum();
            List<Factor> parts = new ArrayList<>(List.of(
                    new Factor("graph", graphScore, w.getGraph() * graphScore / total),
                    new Factor("quality", quality, w.getQuality() * quality / total),
                    new Factor("stake", stake, w.getStake() * stake / total),
                    new Factor("payment", payment, w.getPayment() * payment / total)));
            // stable sort keeps the fixed order for equal contributions
            parts.sort(Comparator.comparingDouble(f -> -f.contribution()));
            for (Factor part : parts) {
                factors.add(String.format(Locale.ROOT, "%s score %.2f contributes %.2f",
                        part.name(), part.score(), part.contribution()));
            }
        } else {
            factors.add(String.format(Locale.ROOT, "graph score %.2f (hybrid scoring disabled)", graphScore));
        }

        int in = graph.incoming(node).length;
        int out = graph.outgoing(node).length;
        factors.add(in + " incoming and " + out + " outgoing edges");
        if (in == 0) {
            factors.add("no incoming endorsements; graph score comes from the teleport floor");
        }
        if (stake == 0.0 && payment == 0.0) {
            factors.add("no stake or payment history");
        }
        if (fairnessAdjusted) {
            factors.add("minority fairness adjustment applied");
        }
        return factors;
    }

    private ReputationResult emptyResult(IndexedGraph graph, long start) {
        return ReputationResult.builder()
                .scores(new LinkedHashMap<>())
                .fairnessMetrics(config.isEnableFairnessConstraints() ? FairnessMetrics.empty() : null)
                .sybilProbabilities(config.isEnableSybilDetection() ? new LinkedHashMap<>() : null)
                .sensitivityAudits(null)
                .deceptionProbabilities(config.isDetectDeceptiveEdges() ? new LinkedHashMap<>() : null)
                .metadata(ComputationMetadata.builder()
                        .nodeCount(0)
                        .edgeCount(graph.edgeCount())
                        .algorithm(TemporalPageRank.ALGORITHM)
                        .iterations(0)
                        .converged(true)
                        .finalDelta(0.0)
                        .computationTimeMs(System.currentTimeMillis() - start)
                        .build())
                .build();
    }

    private record Factor(String name, double score, double contribution) {}
}
