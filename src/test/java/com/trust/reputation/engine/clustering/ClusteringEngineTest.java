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
import com.trust.reputation.model.OversizePolicy;
import com.trust.reputation.model.ParameterSweep;
import com.trust.reputation.model.SweepMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.trust.reputation.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ClusteringEngineTest {

    private ClusteringConfig config;

    @BeforeEach
    void setUp() {
        config = new ClusteringConfig();
    }

    // ── Sybil ring isolation ──

    @Test
    void findClusters_injectedSybilRing_isIsolatedWithHighRisk() {
        List<Cluster> clusters = new ClusteringEngine(config).findClusters(sybilRingAccounts());

        assertThat(clusters).hasSize(1);
        Cluster ring = clusters.get(0);
        assertThat(ring.getAccounts()).containsExactlyElementsOf(sybilIds());
        assertThat(ring.getSize()).isEqualTo(SYBIL_COUNT);
        assertThat(ring.getClusterId()).isEqualTo("cluster-0");
        assertThat(ring.getRiskScore()).isGreaterThan(0.5);
        assertThat(ring.getRiskScore()).isCloseTo(1.0, within(1e-9));
        assertThat(ring.getCohesion()).isEqualTo(1.0);
        assertThat(ring.getDensity()).isGreaterThan(0.9);
        assertThat(ring.getPatterns()).containsExactly(
                ClusterAssembler.SHARED_EMAIL_DOMAIN,
                ClusterAssembler.LOW_REPUTATION,
                ClusterAssembler.LARGE_CLUSTER,
                ClusterAssembler.HIGH_CONNECTIVITY,
                ClusterAssembler.TIGHTLY_KNIT);
    }

    @ParameterizedTest
    @EnumSource(ClusteringMethod.class)
    void findClusters_everyMethodIsolatesTheSybilRing(ClusteringMethod method) {
        config.setMethod(method);

        List<Cluster> clusters = new ClusteringEngine(config).findClusters(sybilRingAccounts());

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getAccounts()).containsExactlyElementsOf(sybilIds());
    }

    @Test
    void findClusters_sharedEmailDomainOnly_flagsPattern() {
        config.setMethod(ClusteringMethod.SIMILARITY);
        List<Account> accounts = List.of(
                emailOnlyAccount("a", "burner.example"),
                emailOnlyAccount("b", "burner.example"),
                emailOnlyAccount("c", "burner.example"),
                emailOnlyAccount("d", "burner.example"));

        List<Cluster> clusters = new ClusteringEngine(config).findClusters(accounts);

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getAccounts()).containsExactly("a", "b", "c", "d");
        assertThat(clusters.get(0).getPatterns())
                .containsExactly(ClusterAssembler.SHARED_EMAIL_DOMAIN, ClusterAssembler.LOW_REPUTATION);
        assertThat(clusters.get(0).getRiskScore()).isCloseTo(0.5, within(1e-9));
        assertThat(clusters.get(0).getCohesion()).isEqualTo(0.0);
    }

    @Test
    void findClusters_threeSharedDomainAccounts_belowEmailPatternMinimum() {
        List<Account> accounts = List.of(
                emailOnlyAccount("a", "burner.example"),
                emailOnlyAccount("b", "burner.example"),
                emailOnlyAccount("c", "burner.example"));

        List<Cluster> clusters = new ClusteringEngine(config).findClusters(accounts);

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getPatterns()).doesNotContain(ClusterAssembler.SHARED_EMAIL_DOMAIN);
    }

    @Test
    void findClusters_sybilProbabilitiesAddSybilSignalPattern() {
        List<Account> accounts = new ArrayList<>();
        for (String id : List.of("a", "b", "c", "d")) {
            Account account = emailOnlyAccount(id, "burner.example");
            account.setSybilProbability(0.8);
            account.setReputation(500.0);
            accounts.add(account);
        }

        Cluster cluster = new ClusteringEngine(config).findClusters(accounts).get(0);

        assertThat(cluster.getPatterns())
                .containsExactly(ClusterAssembler.SHARED_EMAIL_DOMAIN, ClusterAssembler.SYBIL_SIGNALS);
        assertThat(cluster.getRiskScore()).isCloseTo(0.5, within(1e-9));
    }

    // ── Invariants ──

    @Test
    void findClusters_inputOrderDoesNotMatter() {
        List<Account> accounts = sybilRingAccounts();
        List<Cluster> expected = new ClusteringEngine(config).findClusters(accounts);

        List<Account> shuffled = new ArrayList<>(accounts);
        Collections.shuffle(shuffled, new Random(42));
        List<Cluster> actual = new ClusteringEngine(config).findClusters(shuffled);

        assertThat(actual).isEqualTo(expected);
    }

    @Test
    void findClusters_parallelMatrixGivesSameClusters() {
        List<Cluster> serial = new ClusteringEngine(config).findClusters(sybilRingAccounts());
        config.setParallelSimilarity(true);

        assertThat(new ClusteringEngine(config).findClusters(sybilRingAccounts())).isEqualTo(serial);
    }

    @ParameterizedTest
    @EnumSource(OversizePolicy.class)
    void findClusters_everyClusterRespectsSizeBounds(OversizePolicy policy) {
        config.setMaxClusterSize(5);
        config.setOversizePolicy(policy);

        for (ClusteringMethod method : ClusteringMethod.values()) {
            config.setMethod(method);
            List<Cluster> clusters = new ClusteringEngine(config).findClusters(sybilRingAccounts());

            assertThat(clusters).allSatisfy(cluster -> {
                assertThat(cluster.getSize()).isBetween(2, 5);
                assertThat(cluster.getAccounts()).hasSize(cluster.getSize());
            });
        }
    }

    @Test
    void findClusters_truncatePolicy_keepsMostCentralMembers() {
        config.setMaxClusterSize(5);
        config.setOversizePolicy(OversizePolicy.TRUNCATE);

        List<Cluster> clusters = new ClusteringEngine(config).findClusters(sybilRingAccounts());

        // sybil-00 is slightly less similar to the rest because of its extra link
        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getAccounts())
                .containsExactly("sybil-01", "sybil-02", "sybil-03", "sybil-04", "sybil-05");
    }

    @Test
    void findClusters_rejectPolicy_dropsOversizedComponent() {
        config.setMaxClusterSize(5);
        config.setOversizePolicy(OversizePolicy.REJECT);

        assertThat(new ClusteringEngine(config).findClusters(sybilRingAccounts())).isEmpty();
    }

    @Test
    void findClusters_clustersAreDisjoint() {
        config.setMinSimilarity(0.1);
        List<Cluster> clusters = new ClusteringEngine(config).findClusters(sybilRingAccounts());

        List<String> seen = new ArrayList<>();
        for (Cluster cluster : clusters) {
            for (String id : cluster.getAccounts()) {
                assertThat(seen).doesNotContain(id);
                seen.add(id);
            }
        }
    }

    // ── Edge cases ──

    @Test
    void findClusters_fewerThanTwoAccounts_returnsEmpty() {
        ClusteringEngine engine = new ClusteringEngine(config);

        assertThat(engine.findClusters(List.of())).isEmpty();
        assertThat(engine.findClusters(List.of(account("only")))).isEmpty();
    }

    @Test
    void findClusters_accountsWithoutAnyData_formNoClusters() {
        assertThat(new ClusteringEngine(config).findClusters(List.of(account("a"), account("b")))).isEmpty();
    }

    @Test
    void findClusters_duplicateAccountId_rejected() {
        assertThatThrownBy(() -> new ClusteringEngine(config).findClusters(List.of(account("a"), account("a"))))
                .isInstanceOf(InputValidationException.class)
                .hasFieldOrPropertyWithValue("subject", "a");
    }

    @Test
    void findClusters_negativeConnectionWeight_rejected() {
        Account bad = account("a");
        bad.setConnections(List.of(Connection.builder().target("b").weight(-1.0).build()));

        assertThatThrownBy(() -> new ClusteringEngine(config).findClusters(List.of(bad, account("b"))))
                .isInstanceOf(InputValidationException.class)
                .hasFieldOrPropertyWithValue("field", "connections.weight");
    }

    @Test
    void findClusters_nullContribution_rejectedWithAccountId() {
        Account bad = account("a");
        bad.getContributions().add(null);

        assertThatThrownBy(() -> new ClusteringEngine(config).findClusters(List.of(bad, account("b"))))
                .isInstanceOf(InputValidationException.class)
                .hasFieldOrPropertyWithValue("subject", "a")
                .hasFieldOrPropertyWithValue("field", "contributions");
    }

    @Test
    void compare_nonFiniteStake_rejected() {
        Account a = account("a");
        a.setAttributes(AccountAttributes.builder().stake(Double.NaN).build());
        Account b = account("b");
        b.setAttributes(AccountAttributes.builder().stake(5.0).build());

        assertThatThrownBy(() -> new ClusteringEngine(config).compare(a, b))
                .isInstanceOf(InputValidationException.class)
                .hasFieldOrPropertyWithValue("subject", "a")
                .hasFieldOrPropertyWithValue("field", "attributes.stake");
    }

    @Test
    void findClusters_nonFiniteNumbersOnAccount_rejected() {
        Account reputation = account("a");
        reputation.setReputation(Double.NaN);
        assertThatThrownBy(() -> new ClusteringEngine(config).findClusters(List.of(reputation, account("b"))))
                .hasFieldOrPropertyWithValue("field", "reputation");

        Account sybil = account("a");
        sybil.setSybilProbability(1.5);
        assertThatThrownBy(() -> new ClusteringEngine(config).findClusters(List.of(sybil, account("b"))))
                .hasFieldOrPropertyWithValue("field", "sybilProbability");

        Account extension = account("a");
        extension.setAttributes(AccountAttributes.builder()
                .extensions(Map.of("followers", Double.POSITIVE_INFINITY))
                .build());
        assertThatThrownBy(() -> new ClusteringEngine(config).findClusters(List.of(extension, account("b"))))
                .hasFieldOrPropertyWithValue("field", "attributes.extensions.followers");
    }

    @Test
    void constructor_invalidConfig_rejected() {
        config.setMinClusterSize(1);
        assertThatThrownBy(() -> new ClusteringEngine(config))
                .hasFieldOrPropertyWithValue("field", "minClusterSize");

        ClusteringConfig zeroWeights = new ClusteringConfig();
        zeroWeights.setFeatureWeights(new FeatureWeights(0, 0, 0, 0, 0));
        assertThatThrownBy(() -> new ClusteringEngine(zeroWeights))
                .hasFieldOrPropertyWithValue("field", "featureWeights");

        ClusteringConfig badSimilarity = new ClusteringConfig();
        badSimilarity.setMinSimilarity(1.5);
        assertThatThrownBy(() -> new ClusteringEngine(badSimilarity))
                .hasFieldOrPropertyWithValue("field", "minSimilarity");
    }

    @Test
    void constructor_methodWithoutStrategy_rejected() {
        config.setMethod(ClusteringMethod.DBSCAN);

        assertThatThrownBy(() -> new ClusteringEngine(config, List.of(new ConnectivityClusteringStrategy())))
                .isInstanceOf(InputValidationException.class)
                .hasFieldOrPropertyWithValue("field", "method");
    }

    // ── Pairs and comparison ──

    @Test
    void similarPairs_sortedBySimilarityDescending() {
        List<AccountPair> pairs = new ClusteringEngine(config).similarPairs(sybilRingAccounts());

        assertThat(pairs).hasSize(SYBIL_COUNT * (SYBIL_COUNT - 1) / 2);
        for (int k = 1; k < pairs.size(); k++) {
            assertThat(pairs.get(k - 1).getSimilarity()).isGreaterThanOrEqualTo(pairs.get(k).getSimilarity());
        }
        AccountPair first = pairs.get(0);
        assertThat(first.getAccount1()).isLessThan(first.getAccount2());
        assertThat(first.getFeatures().getGraphDistance()).isEqualTo(1);
        assertThat(first.getFeatures().getSharedConnections()).isEqualTo(18);
    }

    @Test
    void compare_reportsFeatureBreakdown() {
        List<Account> accounts = sybilRingAccounts();

        AccountPair pair = new ClusteringEngine(config).compare(accounts.get(1), accounts.get(2));

        assertThat(pair.getAccount1()).isEqualTo("sybil-01");
        assertThat(pair.getFeatures().getConnectionOverlap()).isCloseTo(0.9, within(1e-12));
        assertThat(pair.getFeatures().getTemporalSimilarity()).isEqualTo(1.0);
        assertThat(pair.getFeatures().getMetadataSimilarity()).isEqualTo(1.0);
        // 0.30 + 0.25 * 0.9 + 0.10 * 0.8 + 0.20 + 0.15
        assertThat(pair.getSimilarity()).isCloseTo(0.955, within(1e-9));
    }

    // ── Threshold sweep ──

    @Test
    void findOptimalParameters_picksBestPenalizedStep() {
        ParameterSweep sweep = new ClusteringEngine(config).findOptimalParameters(sybilRingAccounts(), 0.1, 0.9, 0.1);

        assertThat(sweep.getMetrics()).isNotEmpty();
        double best = sweep.getMetrics().stream().mapToDouble(SweepMetric::getPenalizedScore).max().orElseThrow();
        SweepMetric chosen = sweep.getMetrics().stream()
                .filter(m -> m.getPenalizedScore() == best)
                .findFirst().orElseThrow();
        assertThat(sweep.getOptimalSimilarity()).isEqualTo(chosen.getSimilarity());
        assertThat(sweep.getOptimalSimilarity()).isBetween(0.1, 0.9 + 1e-9);
        for (SweepMetric metric : sweep.getMetrics()) {
            assertThat(metric.getSilhouetteScore()).isBetween(-1.0, 1.0);
            assertThat(metric.getPenalizedScore())
                    .isLessThanOrEqualTo(Math.max(0.0, metric.getSilhouetteScore()) + 1e-12);
        }
    }

    @Test
    void findOptimalParameters_noClustersAtAnyStep_keepsConfiguredThreshold() {
        ParameterSweep sweep = new ClusteringEngine(config)
                .findOptimalParameters(unrelatedAccounts(5), 0.5, 0.9, 0.1);

        assertThat(sweep.getMetrics()).isEmpty();
        assertThat(sweep.getOptimalSimilarity()).isEqualTo(0.3);
    }

    @Test
    void findOptimalParameters_invalidRange_rejected() {
        ClusteringEngine engine = new ClusteringEngine(config);

        assertThatThrownBy(() -> engine.findOptimalParameters(sybilRingAccounts(), 0.8, 0.2, 0.1))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> engine.findOptimalParameters(sybilRingAccounts(), 0.1, 0.9, 0.0))
                .hasFieldOrPropertyWithValue("field", "step");
    }
}
