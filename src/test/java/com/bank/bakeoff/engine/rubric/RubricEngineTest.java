package com.bank.bakeoff.engine.rubric;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Algorithm;
import com.bank.bakeoff.model.CandidateResult;
import com.bank.bakeoff.model.RubricConfig;
import com.bank.bakeoff.model.RubricConstraints;
import com.bank.bakeoff.model.RubricOutcome;
import com.bank.bakeoff.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bank.bakeoff.testutil.TestDataFactory.candidate;
import static com.bank.bakeoff.testutil.TestDataFactory.failedCandidate;
import static com.bank.bakeoff.testutil.TestDataFactory.metrics;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RubricEngineTest {

    private final RubricEngine engine = new RubricEngine();

    @Test
    void constraintWinnerBeatsHigherPrAucCandidate() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.LOG_REG, metrics(0.50, 0.10, 0.60)),
                candidate(1, Algorithm.RANDOM_FOREST, metrics(0.70, 0.10, 0.50)));

        RubricOutcome outcome = engine.apply(candidates, TestDataFactory.defaultRubric());

        assertThat(outcome.getChampionIndex()).isEqualTo(1);
        assertThat(outcome.getRunnerUpIndex()).isEqualTo(0);
        assertThat(outcome.isChampionMeetsConstraints()).isTrue();
        assertThat(outcome.isFallbackUsed()).isFalse();
        assertThat(outcome.getEligibleIndices()).containsExactly(1);
    }

    @Test
    void noCandidateMeetsConstraints_fallsBackToBestNonFailed() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.LOG_REG, metrics(0.30, 0.02, 0.20)),
                candidate(1, Algorithm.DECISION_TREE, metrics(0.40, 0.03, 0.30)),
                failedCandidate(2, Algorithm.GRADIENT_BOOSTED));

        RubricOutcome outcome = engine.apply(candidates, TestDataFactory.defaultRubric());

        assertThat(outcome.getChampionIndex()).isEqualTo(1);
        assertThat(outcome.isFallbackUsed()).isTrue();
        assertThat(outcome.isChampionMeetsConstraints()).isFalse();
        assertThat(outcome.getEligibleIndices()).isEmpty();
        assertThat(outcome.getScores().get(2)).isNull();
    }

    @Test
    void failedCandidateNeverWinsEvenWithBetterRecordedMetrics() {
        CandidateResult failed = failedCandidate(0, Algorithm.RANDOM_FOREST);
        failed.setMetrics(metrics(0.99, 0.99, 0.99));
        List<CandidateResult> candidates = List.of(
                failed,
                candidate(1, Algorithm.LOG_REG, metrics(0.70, 0.10, 0.50)));

        RubricOutcome outcome = engine.apply(candidates, TestDataFactory.defaultRubric());

        assertThat(outcome.getChampionIndex()).isEqualTo(1);
        assertThat(outcome.getRunnerUpIndex()).isEqualTo(-1);
    }

    @Test
    void allFailed_noChampion() {
        RubricOutcome outcome = engine.apply(
                List.of(failedCandidate(0, Algorithm.LOG_REG), failedCandidate(1, Algorithm.EXTRA_TREES)),
                TestDataFactory.defaultRubric());

        assertThat(outcome.getChampionIndex()).isEqualTo(-1);
        assertThat(outcome.getRunnerUpIndex()).isEqualTo(-1);
    }

    @Test
    void equalScores_earlierIndexWins() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.RANDOM_FOREST, metrics(0.70, 0.10, 0.50)),
                candidate(1, Algorithm.EXTRA_TREES, metrics(0.70, 0.10, 0.50)));

        RubricOutcome outcome = engine.apply(candidates, TestDataFactory.defaultRubric());

        assertThat(outcome.getChampionIndex()).isEqualTo(0);
        assertThat(outcome.getRunnerUpIndex()).isEqualTo(1);
    }

    @Test
    void apply_isDeterministic() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.LOG_REG, metrics(0.66, 0.09, 0.40)),
                candidate(1, Algorithm.RANDOM_FOREST, metrics(0.68, 0.08, 0.38)),
                candidate(2, Algorithm.GRADIENT_BOOSTED, metrics(0.67, 0.12, 0.41)));
        RubricConfig rubric = TestDataFactory.defaultRubric();

        assertThat(engine.apply(candidates, rubric)).isEqualTo(engine.apply(candidates, rubric));
    }

    @Test
    void weightedScore_sumsWeightedMetrics() {
        double score = engine.weightedScore(metrics(0.5, 0.1, 0.6), TestDataFactory.defaultRubric().getWeights());

        // 0.4*0.5 + 0.25*0.6 + 0.15*0.1 + 0.1*0.9 + 0.1*0.8
        assertThat(score).isCloseTo(0.535, within(1e-9));
    }

    @Test
    void validate_acceptsDefaultRubric() {
        engine.validate(TestDataFactory.defaultRubric(), 1.0);
    }

    @Test
    void validate_rejectsWeightsNotSummingToTotal() {
        RubricConfig rubric = rubricWithWeights(Map.of("recallAtReviewRate", 0.5, "prAuc", 0.4));

        assertThatThrownBy(() -> engine.validate(rubric, 1.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sum to 1.00");
    }

    @Test
    void validate_rejectsUnknownMetric() {
        RubricConfig rubric = rubricWithWeights(Map.of("accuracy", 1.0));

        assertThatThrownBy(() -> engine.validate(rubric, 1.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("accuracy");
    }

    @Test
    void validate_rejectsNegativeWeight() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("recallAtReviewRate", 1.2);
        weights.put("prAuc", -0.2);

        assertThatThrownBy(() -> engine.validate(rubricWithWeights(weights), 1.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void validate_rejectsMinimumOutsideUnitInterval() {
        RubricConfig rubric = TestDataFactory.defaultRubric();
        rubric.setConstraints(RubricConstraints.builder().minRecallAtReviewRate(65.0).build());

        assertThatThrownBy(() -> engine.validate(rubric, 1.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("minRecallAtReviewRate");
    }

    private static RubricConfig rubricWithWeights(Map<String, Double> weights) {
        return RubricConfig.builder()
                .constraints(new RubricConstraints())
                .weights(new LinkedHashMap<>(weights))
                .build();
    }
}
