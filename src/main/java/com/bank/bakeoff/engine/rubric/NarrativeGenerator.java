package com.bank.bakeoff.engine.rubric;

import com.bank.bakeoff.model.CandidateMetrics;
import com.bank.bakeoff.model.CandidateResult;
import com.bank.bakeoff.model.FeatureWeight;
import com.bank.bakeoff.model.Narrative;
import com.bank.bakeoff.model.RubricConfig;
import com.bank.bakeoff.model.RubricConstraints;
import com.bank.bakeoff.model.RubricMetric;
import com.bank.bakeoff.model.RubricOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the rubric outcome as a one-line summary and a Markdown report.
 * Output depends only on its inputs.
 */
@Component
public class NarrativeGenerator {

    private static final int TOP_FEATURES = 5;

    public Narrative generate(List<CandidateResult> candidates, RubricOutcome outcome, RubricConfig rubric) {
        if (candidates.isEmpty() || outcome.getChampionIndex() < 0) {
            return new Narrative(
                    "No champion selected: no candidate trained successfully.",
                    "## Bake-off Summary\n\nThe bake-off produced no successfully trained candidate to evaluate.");
        }

        CandidateResult champion = candidates.get(outcome.getChampionIndex());
        CandidateResult runnerUp = outcome.getRunnerUpIndex() >= 0 ? candidates.get(outcome.getRunnerUpIndex()) : null;
        RubricConstraints constraints = rubric.getConstraints() != null ? rubric.getConstraints() : new RubricConstraints();

        return new Narrative(
                shortNarrative(candidates, outcome, champion, runnerUp),
                longNarrative(candidates, outcome, rubric, constraints, champion, runnerUp));
    }

    private String shortNarrative(List<CandidateResult> candidates, RubricOutcome outcome,
                                  CandidateResult champion, CandidateResult runnerUp) {
        String name = label(champion);
        String comparison = runnerUp == null ? "" : String.format(Locale.ROOT,
                " (weighted score %.3f vs %.3f for %s)",
                outcome.getScores().get(outcome.getChampionIndex()),
                outcome.getScores().get(outcome.getRunnerUpIndex()),
                label(runnerUp));

        String reason;
        if (runnerUp == null) {
            reason = "the only successfully trained candidate";
        } else if (outcome.isFallbackUsed()) {
            reason = "no candidate met every constraint, so it was ranked on weighted score alone" + comparison;
        } else if (outcome.getEligibleIndices().size() == 1) {
            reason = "the only candidate meeting every constraint" + comparison;
        } else {
            reason = "highest weighted score among " + outcome.getEligibleIndices().size()
                    + " candidates meeting every constraint" + comparison;
        }
        return String.format(Locale.ROOT, "Selected %s as champion: %s. Recall @ review rate %s, PR-AUC %s.",
                name, reason, pct(champion.getMetrics().getRecallAtReviewRate()), pct(champion.getMetrics().getPrAuc()));
    }

    private String longNarrative(List<CandidateResult> candidates, RubricOutcome outcome, RubricConfig rubric,
                                 RubricConstraints constraints, CandidateResult champion, CandidateResult runnerUp) {
        CandidateMetrics m = champion.getMetrics();
        List<String> lines = new ArrayList<>();
        lines.add("## Bake-off Summary");
        lines.add("");
        lines.add(String.format(Locale.ROOT, "**Champion:** %s (index %d of %d candidates)",
                label(champion), outcome.getChampionIndex(), candidates.size()));
        lines.add("");

        lines.add("### Champion Metrics");
        lines.add("- **PR-AUC:** " + pct(m.getPrAuc()));
        lines.add("- **Recall @ Review Rate:** " + pct(m.getRecallAtReviewRate()));
        lines.add("- **Precision @ Review Rate:** " + pct(m.getPrecisionAtReviewRate()));
        lines.add("- **F1 Score:** " + pct(m.getF1()));
        lines.add("- **Stability:** " + pct(m.getStability()));
        lines.add("- **Explainability:** " + pct(m.getExplainability()));
        lines.add("");

        lines.add("### Constraint Check");
        addConstraintLine(lines, "Min Recall @ Review Rate", constraints.getMinRecallAtReviewRate(), m.getRecallAtReviewRate());
        addConstraintLine(lines, "Min Precision @ Review Rate", constraints.getMinPrecisionAtReviewRate(), m.getPrecisionAtReviewRate());
        addConstraintLine(lines, "Min PR-AUC", constraints.getMinPrAuc(), m.getPrAuc());
        if (outcome.isFallbackUsed()) {
            lines.add("- No candidate met every constraint; all successfully trained candidates were ranked by weighted score.");
        }
        lines.add("");

        if (runnerUp != null) {
            lines.add(String.format(Locale.ROOT, "### Why %s over %s", label(champion), label(runnerUp)));
            if (!outcome.isFallbackUsed() && !outcome.getEligibleIndices().contains(outcome.getRunnerUpIndex())) {
                lines.add("- " + label(runnerUp) + " missed at least one constraint.");
            }
            Map<String, Double> weights = rubric.getWeights();
            for (Map.Entry<String, Double> entry : weights.entrySet()) {
                RubricMetric metric = RubricMetric.fromKey(entry.getKey());
                if (metric == null) continue;
                double mine = m.get(metric);
                double theirs = runnerUp.getMetrics().get(metric);
                if (Math.abs(mine - theirs) < 1e-9) continue;
                lines.add(String.format(Locale.ROOT, "- **%s:** %s vs %s (%+.1f pts, weight %.2f)",
                        metric.getLabel(), pct(mine), pct(theirs), (mine - theirs) * 100, entry.getValue()));
            }
            lines.add(String.format(Locale.ROOT, "- **Weighted score:** %.4f vs %.4f",
                    outcome.getScores().get(outcome.getChampionIndex()),
                    outcome.getScores().get(outcome.getRunnerUpIndex())));
            lines.add("");
        }

        lines.add("### All Candidates");
        for (int i = 0; i < candidates.size(); i++) {
            CandidateResult c = candidates.get(i);
            if (c.isFailed()) {
                lines.add(String.format(Locale.ROOT, "- **%s** (index %d): FAILED%s", label(c), i,
                        c.getErrorMessage() == null ? "" : " (" + c.getErrorMessage() + ")"));
                continue;
            }
            String marker = i == outcome.getChampionIndex() ? " **(Champion)**" : "";
            String miss = outcome.getEligibleIndices().contains(i) ? "" : ", constraints not met";
            CandidateMetrics cm = c.getMetrics();
            lines.add(String.format(Locale.ROOT,
                    "- **%s** (index %d)%s: score=%.4f, PR-AUC=%s, Recall=%s, Precision=%s, F1=%s%s",
                    label(c), i, marker, outcome.getScores().get(i), pct(cm.getPrAuc()),
                    pct(cm.getRecallAtReviewRate()), pct(cm.getPrecisionAtReviewRate()), pct(cm.getF1()), miss));
        }

        List<FeatureWeight> importance = champion.getImportance();
        if (importance != null && !importance.isEmpty()) {
            lines.add("");
            lines.add("### Top Feature Importance (Champion)");
            for (int i = 0; i < Math.min(TOP_FEATURES, importance.size()); i++) {
                FeatureWeight fw = importance.get(i);
                lines.add(String.format(Locale.ROOT, "- **%s:** %.2f%%", fw.getFeature(), fw.getWeight() * 100));
            }
        }

        lines.add("");
        lines.add("### Rubric Weights");
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Double> entry : rubric.getWeights().entrySet()) {
            RubricMetric metric = RubricMetric.fromKey(entry.getKey());
            parts.add(String.format(Locale.ROOT, "%s: %.2f",
                    metric != null ? metric.getLabel() : entry.getKey(), entry.getValue()));
        }
        lines.add("- " + String.join(", ", parts));

        return String.join("\n", lines);
    }

    private static void addConstraintLine(List<String> lines, String name, Double minimum, double actual) {
        if (minimum == null) return;
        lines.add(String.format(Locale.ROOT, "- %s (%s): %s (%s)",
                name, pct(minimum), actual >= minimum ? "PASSED" : "FAILED", pct(actual)));
    }

    private static String label(CandidateResult candidate) {
        return candidate.getAlgorithm().getDisplayName();
    }

    private static String pct(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100);
    }
}
