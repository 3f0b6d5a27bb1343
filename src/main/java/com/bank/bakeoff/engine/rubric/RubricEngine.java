package com.bank.bakeoff.engine.rubric;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.CandidateMetrics;
import com.bank.bakeoff.model.CandidateResult;
import com.bank.bakeoff.model.RubricConfig;
import com.bank.bakeoff.model.RubricConstraints;
import com.bank.bakeoff.model.RubricMetric;
import com.bank.bakeoff.model.RubricOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Picks the champion among evaluated candidates.
 * <p>
 * Failed candidates are never eligible. Candidates meeting every configured minimum
 * are ranked by the weighted metric sum; when none qualifies all non-failed candidates
 * are ranked instead. Equal scores go to the earlier candidate index.
 */
@Component
public class RubricEngine {

    private static final double WEIGHT_TOLERANCE = 1e-6;
    private static final double SCORE_EPSILON = 1e-12;

    public RubricOutcome apply(List<CandidateResult> candidates, RubricConfig rubric) {
        RubricConstraints constraints = rubric.getConstraints() != null
                ? rubric.getConstraints() : new RubricConstraints();

        List<Double> scores = new ArrayList<>(candidates.size());
        List<Integer> nonFailed = new ArrayList<>();
        List<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            CandidateResult candidate = candidates.get(i);
            if (candidate.isFailed() || candidate.getMetrics() == null) {
                scores.add(null);
                continue;
            }
            scores.add(weightedScore(candidate.getMetrics(), rubric.getWeights()));
            nonFailed.add(i);
            if (constraints.isSatisfiedBy(candidate.getMetrics())) {
                eligible.add(i);
            }
        }

        if (nonFailed.isEmpty()) {
            return RubricOutcome.builder()
                    .championIndex(-1)
                    .runnerUpIndex(-1)
                    .eligibleIndices(eligible)
                    .scores(scores)
                    .build();
        }

        boolean fallback = eligible.isEmpty();
        List<Integer> pool = fallback ? nonFailed : eligible;
        int champion = best(pool, scores, -1);
        int runnerUp = best(pool, scores, champion);
        if (runnerUp < 0) {
            runnerUp = best(nonFailed, scores, champion);
        }

        return RubricOutcome.builder()
                .championIndex(champion)
                .runnerUpIndex(runnerUp)
                .championMeetsConstraints(!fallback)
                .fallbackUsed(fallback)
                .eligibleIndices(eligible)
                .scores(scores)
                .build();
    }

    public double weightedScore(CandidateMetrics metrics, Map<String, Double> weights) {
        double score = 0.0;
        if (weights == null) return score;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            RubricMetric metric = RubricMetric.fromKey(entry.getKey());
            if (metric == null || entry.getValue() == null) continue;
            score += entry.getValue() * metrics.get(metric);
        }
        return score;
    }

    /**
     * Rejects unknown metric keys, negative weights, minimums outside [0,1] and
     * weights that do not add up to {@code weightTotal}.
     */
    public void validate(RubricConfig rubric, double weightTotal) {
        if (rubric == null) {
            throw new ValidationException("Rubric is required");
        }
        Map<String, Double> weights = rubric.getWeights();
        if (weights == null || weights.isEmpty()) {
            throw new ValidationException("Rubric must define at least one metric weight");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (RubricMetric.fromKey(entry.getKey()) == null) {
                throw new ValidationException("Unknown rubric metric: " + entry.getKey());
            }
            Double weight = entry.getValue();
            if (weight == null || weight < 0 || weight.isNaN()) {
                throw new ValidationException("Rubric weight for " + entry.getKey() + " must be non-negative");
            }
            sum += weight;
        }
        if (Math.abs(sum - weightTotal) > WEIGHT_TOLERANCE) {
            throw new ValidationException(String.format(
                    "Rubric weights must sum to %.2f, got %.6f", weightTotal, sum));
        }

        RubricConstraints c = rubric.getConstraints();
        if (c != null) {
            checkMinimum("minRecallAtReviewRate", c.getMinRecallAtReviewRate());
            checkMinimum("minPrecisionAtReviewRate", c.getMinPrecisionAtReviewRate());
            checkMinimum("minPrAuc", c.getMinPrAuc());
        }
    }

    private static void checkMinimum(String name, Double value) {
        if (value != null && (value < 0 || value > 1 || value.isNaN())) {
            throw new ValidationException(name + " must be within [0, 1]");
        }
    }

    private static int best(List<Integer> pool, List<Double> scores, int exclude) {
        int bestIndex = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int index : pool) {
            if (index == exclude) continue;
            double score = scores.get(index);
            if (bestIndex < 0 || score > bestScore + SCORE_EPSILON) {
                bestIndex = index;
                bestScore = score;
            }
        }
        return bestIndex;
    }
}
