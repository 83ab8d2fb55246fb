package com.trust.reputation.engine.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PercentileRankerTest {

    @Test
    void percentiles_distinctScores_mapToPositionOverCount() {
        double[] result = PercentileRanker.percentiles(new double[]{30.0, 10.0, 20.0, 40.0});

        assertThat(result).containsExactly(75.0, 25.0, 50.0, 100.0);
    }

    @Test
    void percentiles_tiesShareMeanPosition() {
        double[] result = PercentileRanker.percentiles(new double[]{5.0, 5.0, 1.0, 9.0});

        // 1.0 -> position 1, the two 5.0 share positions 2 and 3, 9.0 -> position 4
        assertThat(result[2]).isEqualTo(25.0);
        assertThat(result[0]).isEqualTo(62.5);
        assertThat(result[1]).isEqualTo(62.5);
        assertThat(result[3]).isEqualTo(100.0);
    }

    @Test
    void percentiles_allEqual_sumStillFixed() {
        double[] result = PercentileRanker.percentiles(new double[]{7.0, 7.0, 7.0, 7.0, 7.0});

        double sum = 0.0;
        for (double p : result) {
            sum += p;
        }
        assertThat(sum).isCloseTo(50.0 * 6, within(1e-9));
        assertThat(result).containsOnly(60.0);
    }

    @Test
    void percentiles_empty_returnsEmpty() {
        assertThat(PercentileRanker.percentiles(new double[0])).isEmpty();
    }
}
