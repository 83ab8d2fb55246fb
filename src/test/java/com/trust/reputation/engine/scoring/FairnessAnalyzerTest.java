package com.trust.reputation.engine.scoring;

import com.trust.reputation.model.FairnessMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FairnessAnalyzerTest {

    private FairnessAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new FairnessAnalyzer(0.2);
    }

    @Test
    void gini_equalValues_isZero() {
        assertThat(FairnessAnalyzer.gini(new double[]{3.0, 3.0, 3.0})).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void gini_allMassOnOneNode() {
        assertThat(FairnessAnalyzer.gini(new double[]{0.0, 0.0, 0.0, 1.0})).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void gini_allZero_isZero() {
        assertThat(FairnessAnalyzer.gini(new double[]{0.0, 0.0})).isEqualTo(0.0);
    }

    @Test
    void adjustRanks_liftsMinorityAndPreservesTotalMass() {
        double[] ranks = {0.4, 0.4, 0.1, 0.1};
        boolean[] minority = {false, false, true, true};

        double[] adjusted = analyzer.adjustRanks(ranks, minority);

        // factor 1 + 0.2 * (0.25 / 0.1 - 1) = 1.3, then rescaled by 1 / 1.06
        assertThat(adjusted[2]).isCloseTo(0.13 / 1.06, within(1e-12));
        assertThat(adjusted[0] + adjusted[1] + adjusted[2] + adjusted[3]).isCloseTo(1.0, within(1e-12));
        assertThat(ranks[2]).isEqualTo(0.1);
    }

    @Test
    void adjustRanks_noMinorityOrAlreadyAboveMean_returnsInputInstance() {
        double[] ranks = {0.5, 0.3, 0.2};

        assertThat(analyzer.adjustRanks(ranks, new boolean[]{false, false, false})).isSameAs(ranks);
        assertThat(analyzer.adjustRanks(ranks, new boolean[]{true, false, false})).isSameAs(ranks);
        assertThat(new FairnessAnalyzer(0.0).adjustRanks(ranks, new boolean[]{false, false, true})).isSameAs(ranks);
    }

    @Test
    void analyze_minorityAbsentFromTopDecile_reportsFullBias() {
        List<String> ids = ids(10);
        double[] scores = {100, 90, 80, 70, 60, 50, 40, 30, 20, 10};
        boolean[] minority = {false, false, false, false, false, true, true, true, true, true};

        FairnessMetrics metrics = analyzer.analyze(ids, scores, minority);

        assertThat(metrics.getMinorityRepresentation()).isEqualTo(0.0);
        assertThat(metrics.getTopDecileDiversity()).isEqualTo(0.0);
        assertThat(metrics.getBiasScore()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void analyze_balancedTopDecile_reportsNoBias() {
        List<String> ids = ids(20);
        double[] scores = new double[20];
        boolean[] minority = new boolean[20];
        for (int i = 0; i < 20; i++) {
            scores[i] = 200 - i;
            minority[i] = i % 2 == 1;
        }

        FairnessMetrics metrics = analyzer.analyze(ids, scores, minority);

        assertThat(metrics.getMinorityRepresentation()).isCloseTo(1.0, within(1e-12));
        assertThat(metrics.getTopDecileDiversity()).isCloseTo(1.0, within(1e-12));
        assertThat(metrics.getBiasScore()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void analyze_noMinorityNodes_isNeutral() {
        FairnessMetrics metrics = analyzer.analyze(ids(3), new double[]{1, 2, 3}, new boolean[3]);

        assertThat(metrics.getMinorityRepresentation()).isEqualTo(1.0);
        assertThat(metrics.getTopDecileDiversity()).isEqualTo(1.0);
        assertThat(metrics.getBiasScore()).isEqualTo(0.0);
    }

    private static List<String> ids(int n) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ids.add("node-" + i);
        }
        return ids;
    }
}
