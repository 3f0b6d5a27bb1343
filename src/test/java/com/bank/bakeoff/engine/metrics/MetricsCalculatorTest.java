package com.bank.bakeoff.engine.metrics;

import com.bank.bakeoff.model.Algorithm;
import com.bank.bakeoff.model.CandidateMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsCalculatorTest {

    @Test
    void prAuc_perfectRankingIsOne() {
        double[] scores = {0.9, 0.8, 0.1, 0.2};
        int[] y = {1, 1, 0, 0};

        assertThat(MetricsCalculator.prAuc(scores, y)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void prAuc_withoutPositivesIsZero() {
        assertThat(MetricsCalculator.prAuc(new double[] {0.3, 0.7}, new int[] {0, 0})).isZero();
    }

    @Test
    void prAuc_worstRankingIsLow() {
        double[] scores = {0.1, 0.9, 0.8, 0.7};
        int[] y = {1, 0, 0, 0};

        // Single positive ranked last: one trapezoid from precision 0 to 1/4
        assertThat(MetricsCalculator.prAuc(scores, y)).isCloseTo(0.125, within(1e-12));
    }

    @Test
    void flaggedCount_roundsAndKeepsAtLeastOne() {
        assertThat(MetricsCalculator.flaggedCount(1000, 0.005)).isEqualTo(5);
        assertThat(MetricsCalculator.flaggedCount(100, 0.001)).isEqualTo(1);
        assertThat(MetricsCalculator.flaggedCount(3, 1.0)).isEqualTo(3);
    }

    @Test
    void recallAndPrecisionAtReviewRate_useTopRows() {
        double[] scores = {1.0, 0.9, 0.8, 0.7, 0.6, 0.5, 0.4, 0.3, 0.2, 0.1};
        int[] y = {1, 0, 0, 0, 0, 1, 0, 0, 0, 0};

        assertThat(MetricsCalculator.recallAtReviewRate(scores, y, 0.2)).isCloseTo(0.5, within(1e-12));
        assertThat(MetricsCalculator.precisionAtReviewRate(scores, y, 0.2)).isCloseTo(0.5, within(1e-12));
        assertThat(MetricsCalculator.recallAtReviewRate(scores, y, 0.6)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void f1_isHarmonicMean() {
        assertThat(MetricsCalculator.f1(0.5, 1.0)).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(MetricsCalculator.f1(0.0, 0.0)).isZero();
    }

    @Test
    void stability_isOneWhenFewerThanTwoFoldsHavePositives() {
        double[] scores = {0.9, 0.1, 0.2, 0.3, 0.4, 0.5};
        int[] y = {1, 0, 0, 0, 0, 0};

        assertThat(MetricsCalculator.stability(scores, y, 0.5)).isEqualTo(1.0);
    }

    @Test
    void stability_dropsWhenFoldRecallsDiffer() {
        // Fold 1 ranks its positive first, fold 2 ranks it last, fold 3 has none
        double[] scores = {0.9, 0.1, 0.1, 0.9, 0.0, 0.0};
        int[] y = {1, 0, 1, 0, 0, 0};

        double stability = MetricsCalculator.stability(scores, y, 0.5);

        assertThat(stability).isLessThan(1.0);
        assertThat(stability).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void rankDescending_breaksTiesByRowOrder() {
        assertThat(MetricsCalculator.rankDescending(new double[] {0.5, 0.9, 0.5, 0.1}, 0, 4))
                .containsExactly(1, 0, 2, 3);
    }

    @Test
    void evaluate_carriesAlgorithmExplainability() {
        CandidateMetrics metrics = MetricsCalculator.evaluate(
                Algorithm.RANDOM_FOREST, new double[] {0.9, 0.1}, new int[] {1, 0}, 0.5);

        assertThat(metrics.getExplainability()).isEqualTo(0.8);
        assertThat(metrics.getRecallAtReviewRate()).isEqualTo(1.0);
        assertThat(metrics.getPrecisionAtReviewRate()).isEqualTo(1.0);
        assertThat(metrics.getF1()).isEqualTo(1.0);
    }
}
