package com.bank.bakeoff.engine.rubric;

import com.bank.bakeoff.model.Algorithm;
import com.bank.bakeoff.model.CandidateResult;
import com.bank.bakeoff.model.Narrative;
import com.bank.bakeoff.model.RubricConfig;
import com.bank.bakeoff.model.RubricOutcome;
import com.bank.bakeoff.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bank.bakeoff.testutil.TestDataFactory.candidate;
import static com.bank.bakeoff.testutil.TestDataFactory.failedCandidate;
import static com.bank.bakeoff.testutil.TestDataFactory.metrics;
import static org.assertj.core.api.Assertions.assertThat;

class NarrativeGeneratorTest {

    private final RubricEngine engine = new RubricEngine();
    private final NarrativeGenerator generator = new NarrativeGenerator();

    @Test
    void shortNarrative_namesChampionAndRunnerUp() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.LOG_REG, metrics(0.50, 0.10, 0.60)),
                candidate(1, Algorithm.RANDOM_FOREST, metrics(0.70, 0.10, 0.50)));
        RubricConfig rubric = TestDataFactory.defaultRubric();
        RubricOutcome outcome = engine.apply(candidates, rubric);

        Narrative narrative = generator.generate(candidates, outcome, rubric);

        assertThat(narrative.getNarrativeShort())
                .startsWith("Selected Random Forest as champion")
                .contains("the only candidate meeting every constraint")
                .contains("Logistic Regression")
                .doesNotContain("\n");
    }

    @Test
    void longNarrative_itemizesDifferentiatingMetrics() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.LOG_REG, metrics(0.50, 0.10, 0.60)),
                candidate(1, Algorithm.RANDOM_FOREST, metrics(0.70, 0.10, 0.50)),
                failedCandidate(2, Algorithm.EXTRA_TREES));
        RubricConfig rubric = TestDataFactory.defaultRubric();
        RubricOutcome outcome = engine.apply(candidates, rubric);

        String text = generator.generate(candidates, outcome, rubric).getNarrativeLong();

        assertThat(text).contains("### Why Random Forest over Logistic Regression");
        assertThat(text).contains("- Logistic Regression missed at least one constraint.");
        assertThat(text).contains("- **Recall @ Review Rate:** 70.0% vs 50.0% (+20.0 pts, weight 0.40)");
        assertThat(text).contains("- **PR-AUC:** 50.0% vs 60.0% (-10.0 pts, weight 0.25)");
        // Equal precision is not a differentiator
        assertThat(text).doesNotContain("- **Precision @ Review Rate:** 10.0% vs");
        assertThat(text).contains("Min Recall @ Review Rate (65.0%): PASSED (70.0%)");
        assertThat(text).contains("- **Extra-Trees** (index 2): FAILED (training blew up)");
        assertThat(text).contains("### Top Feature Importance (Champion)");
    }

    @Test
    void fallback_isExplained() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.LOG_REG, metrics(0.30, 0.02, 0.20)),
                candidate(1, Algorithm.DECISION_TREE, metrics(0.40, 0.03, 0.30)));
        RubricConfig rubric = TestDataFactory.defaultRubric();
        RubricOutcome outcome = engine.apply(candidates, rubric);

        Narrative narrative = generator.generate(candidates, outcome, rubric);

        assertThat(narrative.getNarrativeShort()).contains("no candidate met every constraint");
        assertThat(narrative.getNarrativeLong()).contains("No candidate met every constraint");
    }

    @Test
    void generate_isDeterministic() {
        List<CandidateResult> candidates = List.of(
                candidate(0, Algorithm.GRADIENT_BOOSTED, metrics(0.80, 0.20, 0.70)),
                candidate(1, Algorithm.RANDOM_FOREST, metrics(0.75, 0.15, 0.72)));
        RubricConfig rubric = TestDataFactory.defaultRubric();
        RubricOutcome outcome = engine.apply(candidates, rubric);

        assertThat(generator.generate(candidates, outcome, rubric))
                .isEqualTo(generator.generate(candidates, outcome, rubric));
    }

    @Test
    void noChampion_producesFailureNarrative() {
        List<CandidateResult> candidates = List.of(failedCandidate(0, Algorithm.LOG_REG));
        RubricConfig rubric = TestDataFactory.defaultRubric();

        Narrative narrative = generator.generate(candidates, engine.apply(candidates, rubric), rubric);

        assertThat(narrative.getNarrativeShort()).startsWith("No champion selected");
    }
}
