package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.config.FeatureWeights;
import com.trust.reputation.engine.graph.InputValidationException;
import com.trust.reputation.model.Account;
import com.trust.reputation.model.AccountAttributes;
import com.trust.reputation.model.AccountPair;
import com.trust.reputation.model.Cluster;
import com.trust.reputation.model.ClusteringMethod;
import com.trust.reputation.model.Connection;
import com.trust.reputation.model.Contribution;
import com.trust.reputation.model.ParameterSweep;
import com.trust.reputation.model.SweepMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups accounts that look coordinated. Uses the Strategy pattern: each
 * ClusteringMethod is handled by a registered ClusteringStrategy over one shared
 * similarity function.
 * <p>
 * Accounts are sorted by id before indexing, so the clusters do not depend on input
 * order. Cluster risk scores are heuristic ranking signals, not findings.
 */
public class ClusteringEngine {

    private static final Logger log = LoggerFactory.getLogger(ClusteringEngine.class);

    static final double FRAGMENTATION_PENALTY = 0.3;

    private final ClusteringConfig config;
    private final Map<ClusteringMethod, ClusteringStrategy> strategies;

    public ClusteringEngine(ClusteringConfig config) {
        this(config, List.of(
                new DbscanClusteringStrategy(),
                new ConnectivityClusteringStrategy(),
                new HierarchicalClusteringStrategy(),
                new SimilarityGraphClusteringStrategy()));
    }

    public ClusteringEngine(ClusteringConfig config, List<ClusteringStrategy> strategies) {
        validateConfig(config);
        this.config = config;
        this.strategies = new EnumMap<>(ClusteringMethod.class);
        for (ClusteringStrategy strategy : strategies) {
            this.strategies.put(strategy.getSupportedMethod(), strategy);
        }
        if (!this.strategies.containsKey(config.getMethod())) {
            throw new InputValidationException("no strategy registered for method " + config.getMethod(),
                    "config", "method");
        }
    }

    /**
     * @throws InputValidationException on duplicate or missing ids and invalid connection weights
     */
    public List<Cluster> findClusters(List<Account> accounts) {
        long start = System.currentTimeMillis();
        validateAccounts(accounts);
        if (accounts.size() < 2) {
            return new ArrayList<>();
        }
        ClusteringContext context = buildContext(accounts);
        List<Cluster> clusters = runClustering(context, config);
        log.info("Clustering method={} accounts={} clusters={} in {}ms",
                config.getMethod(), accounts.size(), clusters.size(), System.currentTimeMillis() - start);
        return clusters;
    }

    /**
     * Sweeps minSimilarity over {@code min + k * step} up to {@code max}, reusing one
     * similarity matrix, and picks the threshold with the best fragmentation-penalized
     * silhouette; the earliest step wins ties. Meant for offline tuning: its cost is the
     * number of steps times one clustering run.
     */
    public ParameterSweep findOptimalParameters(List<Account> accounts, double min, double max, double step) {
        if (!(min >= 0 && max <= 1 && min <= max)) {
            throw new InputValidationException("sweep range must satisfy 0 <= min <= max <= 1", "sweep", "range");
        }
        if (!(step > 0) || !Double.isFinite(step)) {
            throw new InputValidationException("sweep step must be > 0", "sweep", "step");
        }
        validateAccounts(accounts);

        List<SweepMetric> metrics = new ArrayList<>();
        double optimal = config.getMinSimilarity();
        if (accounts.size() < 2) {
            return ParameterSweep.builder().optimalSimilarity(optimal).metrics(metrics).build();
        }

        ClusteringContext context = buildContext(accounts);
        double bestScore = Double.NEGATIVE_INFINITY;
        int steps = (int) Math.floor((max - min) / step + 1e-9);
        for (int k = 0; k <= steps; k++) {
            double threshold = min + k * step;
            ClusteringConfig stepConfig = config.withMinSimilarity(threshold);
            if (config.getMethod() == ClusteringMethod.DBSCAN) {
                stepConfig = stepConfig.withDbscanEps(threshold);
            }
            List<int[]> groups = acceptedGroups(context, stepConfig);
            if (groups.isEmpty()) {
                log.debug("Sweep threshold {} produced no clusters", threshold);
                continue;
            }

            ClusterAssembler assembler = new ClusterAssembler(stepConfig);
            double densityTotal = 0.0;
            int memberTotal = 0;
            for (int[] group : groups) {
                densityTotal += assembler.assemble(context, group).getDensity();
                memberTotal += group.length;
            }
            double silhouette = SilhouetteScorer.score(context, groups);
            double fragmentation = Math.min(1.0, (double) groups.size() / accounts.size());
            double penalized = silhouette * (1.0 - FRAGMENTATION_PENALTY * fragmentation);

            metrics.add(SweepMetric.builder()
                    .similarity(threshold)
                    .clusterCount(groups.size())
                    .avgClusterSize((double) memberTotal / groups.size())
                    .avgDensity(densityTotal / groups.size())
                    .silhouetteScore(silhouette)
                    .penalizedScore(penalized)
                    .build());

            if (penalized > bestScore) {
                bestScore = penalized;
                optimal = threshold;
            }
        }
        log.info("Threshold sweep over {} accounts evaluated {} steps, optimal minSimilarity={}",
                accounts.size(), metrics.size(), optimal);
        return ParameterSweep.builder().optimalSimilarity(optimal).metrics(metrics).build();
    }

    /**
     * Similarity and feature breakdown of every pair at or above minSimilarity, most
     * similar first.
     */
    public List<AccountPair> similarPairs(List<Account> accounts) {
        validateAccounts(accounts);
        List<AccountPair> pairs = new ArrayList<>();
        if (accounts.size() < 2) {
            return pairs;
        }
        ClusteringContext context = buildContext(accounts);
        AccountSimilarity similarity = new AccountSimilarity(config);
        for (int i = 0; i < context.size(); i++) {
            for (int j = i + 1; j < context.size(); j++) {
                double s = context.similarity(i, j);
                if (s >= config.getMinSimilarity()) {
                    pairs.add(AccountPair.builder()
                            .account1(context.accountId(i))
                            .account2(context.accountId(j))
                            .similarity(s)
                            .features(similarity.features(context.profile(i), context.profile(j)))
                            .build());
                }
            }
        }
        pairs.sort(Comparator.comparingDouble((AccountPair p) -> -p.getSimilarity())
                .thenComparing(AccountPair::getAccount1)
                .thenComparing(AccountPair::getAccount2));
        return pairs;
    }

    public AccountPair compare(Account a, Account b) {
        validateAccounts(Arrays.asList(a, b));
        AccountSimilarity similarity = new AccountSimilarity(config);
        AccountProfile left = AccountProfile.of(a, config.getTemporalWindowMs());
        AccountProfile right = AccountProfile.of(b, config.getTemporalWindowMs());
        return AccountPair.builder()
                .account1(a.getAccountId())
                .account2(b.getAccountId())
                .similarity(similarity.similarity(left, right))
                .features(similarity.features(left, right))
                .build();
    }

    public ClusteringConfig getConfig() {
        return config;
    }

    ClusteringContext buildContext(List<Account> accounts) {
        List<Account> sorted = new ArrayList<>(accounts);
        sorted.sort(Comparator.comparing(Account::getAccountId));
        List<AccountProfile> profiles = new ArrayList<>(sorted.size());
        for (Account account : sorted) {
            profiles.add(AccountProfile.of(account, config.getTemporalWindowMs()));
        }
        AccountSimilarity similarity = new AccountSimilarity(config);
        SimilarityMatrix matrix = SimilarityMatrix.compute(profiles.size(),
                (i, j) -> similarity.similarity(profiles.get(i), profiles.get(j)),
                config.isParallelSimilarity());
        log.debug("Computed {} pairwise similarities (parallel={})",
                (long) profiles.size() * (profiles.size() - 1) / 2, config.isParallelSimilarity());
        return new ClusteringContext(profiles, matrix);
    }

    List<Cluster> runClustering(ClusteringContext context, ClusteringConfig runConfig) {
        ClusterAssembler assembler = new ClusterAssembler(runConfig);
        List<Cluster> clusters = new ArrayList<>();
        for (int[] group : acceptedGroups(context, runConfig)) {
            clusters.add(assembler.assemble(context, group));
        }
        clusters.sort(Comparator.comparingInt(Cluster::getSize).reversed()
                .thenComparing(c -> c.getAccounts().get(0)));
        for (int k = 0; k < clusters.size(); k++) {
            clusters.get(k).setClusterId("cluster-" + k);
        }
        return clusters;
    }

    // Strategy output with the oversize policy applied and undersized groups dropped
    private List<int[]> acceptedGroups(ClusteringContext context, ClusteringConfig runConfig) {
        ClusteringStrategy strategy = strategies.get(runConfig.getMethod());
        List<int[]> candidates = strategy.cluster(context, runConfig);
        double threshold = runConfig.getMethod() == ClusteringMethod.DBSCAN
                ? runConfig.getDbscanEps()
                : runConfig.getMinSimilarity();
        List<int[]> bounded = new OversizedClusterHandler(runConfig).enforce(context, candidates, threshold);
        List<int[]> accepted = new ArrayList<>(bounded.size());
        for (int[] group : bounded) {
            if (group.length >= runConfig.getMinClusterSize() && group.length <= runConfig.getMaxClusterSize()) {
                accepted.add(group);
            }
        }
        return accepted;
    }

    static void validateConfig(ClusteringConfig config) {
        if (config == null) {
            throw new InputValidationException("clustering config is required", "config", "clustering");
        }
        if (config.getMethod() == null) {
            throw new InputValidationException("method is required", "config", "method");
        }
        if (config.getMinClusterSize() < 2) {
            throw new InputValidationException("minClusterSize must be >= 2", "config", "minClusterSize");
        }
        if (config.getMinClusterSize() > config.getMaxClusterSize()) {
            throw new InputValidationException("minClusterSize must not exceed maxClusterSize",
                    "config", "minClusterSize");
        }
        requireUnitInterval(config.getMinSimilarity(), "minSimilarity");
        requireUnitInterval(config.getDbscanEps(), "dbscanEps");
        if (config.getDbscanMinPts() < 1) {
            throw new InputValidationException("dbscanMinPts must be >= 1", "config", "dbscanMinPts");
        }
        validateFeatureWeights(config.getFeatureWeights());
        if (config.getSharedConnectionsCap() < 1) {
            throw new InputValidationException("sharedConnectionsCap must be >= 1", "config", "sharedConnectionsCap");
        }
        if (config.getTemporalWindowMs() <= 0) {
            throw new InputValidationException("temporalWindowMs must be > 0", "config", "temporalWindowMs");
        }
        if (config.getRegistrationWindowMs() <= 0) {
            throw new InputValidationException("registrationWindowMs must be > 0", "config", "registrationWindowMs");
        }
        if (config.getMaxGraphDistance() < 1) {
            throw new InputValidationException("maxGraphDistance must be >= 1", "config", "maxGraphDistance");
        }
        if (config.getOversizePolicy() == null) {
            throw new InputValidationException("oversizePolicy is required", "config", "oversizePolicy");
        }
        if (!(config.getSplitThresholdStep() > 0)) {
            throw new InputValidationException("splitThresholdStep must be > 0", "config", "splitThresholdStep");
        }
    }

    public static void validateFeatureWeights(FeatureWeights weights) {
        if (weights == null) {
            throw new InputValidationException("featureWeights are required", "config", "featureWeights");
        }
        double[] values = {weights.getSharedConnections(), weights.getConnectionOverlap(),
                weights.getTemporalSimilarity(), weights.getMetadataSimilarity(), weights.getGraphDistance()};
        String[] names = {"sharedConnections", "connectionOverlap", "temporalSimilarity",
                "metadataSimilarity", "graphDistance"};
        for (int k = 0; k < values.length; k++) {
            if (!Double.isFinite(values[k]) || values[k] < 0) {
                throw new InputValidationException("feature weight " + names[k] + " must be >= 0",
                        "config", "featureWeights." + names[k]);
            }
        }
        if (weights.sum() <= 0) {
            throw new InputValidationException("feature weights must not all be zero", "config", "featureWeights");
        }
    }

    private static void requireUnitInterval(double value, String field) {
        if (!(value >= 0 && value <= 1)) {
            throw new InputValidationException(field + " must be in [0, 1], was " + value, "config", field);
        }
    }

    private static void validateAccounts(List<Account> accounts) {
        if (accounts == null) {
            throw new InputValidationException("accounts are required", "accounts", "accounts");
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < accounts.size(); i++) {
            Account account = accounts.get(i);
            if (account == null || account.getAccountId() == null) {
                throw new InputValidationException("account at index " + i + " has no id", "account#" + i,
                        "accountId");
            }
            if (!ids.add(account.getAccountId())) {
                throw new InputValidationException("duplicate account id " + account.getAccountId(),
                        account.getAccountId(), "accountId");
            }
            for (Connection connection : account.connectionsOrEmpty()) {
                if (connection == null || connection.getTarget() == null) {
                    throw new InputValidationException("connection without target", account.getAccountId(),
                            "connections");
                }
                if (!Double.isFinite(connection.getWeight()) || connection.getWeight() < 0) {
                    throw new InputValidationException("connection weight must be a finite non-negative number",
                            account.getAccountId(), "connections.weight");
                }
            }
            for (Contribution contribution : account.contributionsOrEmpty()) {
                if (contribution == null) {
                    throw new InputValidationException("contribution entry is null", account.getAccountId(),
                            "contributions");
                }
            }
            requireFinite(account.getReputation(), account.getAccountId(), "reputation");
            Double sybil = account.getSybilProbability();
            if (sybil != null && !(sybil >= 0 && sybil <= 1)) {
                throw new InputValidationException("sybilProbability must be in [0, 1], was " + sybil,
                        account.getAccountId(), "sybilProbability");
            }
            validateAttributes(account.getAccountId(), account.getAttributes());
        }
    }

    private static void validateAttributes(String accountId, AccountAttributes attrs) {
        if (attrs == null) {
            return;
        }
        requireFinite(attrs.getActivityLevel(), accountId, "attributes.activityLevel");
        requireFinite(attrs.getStake(), accountId, "attributes.stake");
        requireFinite(attrs.getPaymentHistory(), accountId, "attributes.paymentHistory");
        if (attrs.getExtensions() != null) {
            for (Map.Entry<String, Object> entry : attrs.getExtensions().entrySet()) {
                if (entry.getValue() instanceof Number n) {
                    requireFinite(n.doubleValue(), accountId, "attributes.extensions." + entry.getKey());
                }
            }
        }
    }

    private static void requireFinite(Double value, String subject, String field) {
        if (value != null && !Double.isFinite(value)) {
            throw new InputValidationException(field + " must be a finite number, was " + value, subject, field);
        }
    }
}
