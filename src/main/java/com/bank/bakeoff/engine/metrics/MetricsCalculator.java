package com.bank.bakeoff.engine.metrics;

import com.bank.bakeoff.model.Algorithm;
import com.bank.bakeoff.model.CandidateMetrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ranking metrics for imbalanced binary labels. Rankings are by descending score,
 * ties broken by row order.
 */
public final class MetricsCalculator {

    static final int STABILITY_FOLDS = 3;

    private MetricsCalculator() {}

    public static CandidateMetrics evaluate(Algorithm algorithm, double[] scores, int[] y, double reviewRate) {
        double precision = precisionAtReviewRate(scores, y, reviewRate);
        double recall = recallAtReviewRate(scores, y, reviewRate);
        return CandidateMetrics.builder()
                .prAuc(prAuc(scores, y))
                .precisionAtReviewRate(precision)
                .recallAtReviewRate(recall)
                .f1(f1(precision, recall))
                .stability(stability(scores, y, reviewRate))
                .explainability(algorithm.getExplainability())
                .build();
    }

    /**
     * Area under the precision-recall curve by the trapezoid rule, starting at (recall 0, precision 1).
     */
    public static double prAuc(double[] scores, int[] y) {
        int totalPositives = countPositives(y, 0, y.length);
        if (totalPositives == 0) return 0.0;

        int[] order = rankDescending(scores, 0, scores.length);
        double auc = 0.0;
        double prevRecall = 0.0;
        double prevPrecision = 1.0;
        int truePositives = 0;

        for (int k = 0; k < order.length; k++) {
            if (y[order[k]] == 1) truePositives++;
            double recall = (double) truePositives / totalPositives;
            double precision = (double) truePositives / (k + 1);
            auc += (recall - prevRecall) * (precision + prevPrecision) / 2.0;
            prevRecall = recall;
            prevPrecision = precision;
        }
        return clamp(auc);
    }

    public static double recallAtReviewRate(double[] scores, int[] y, double reviewRate) {
        return recallAtReviewRate(scores, y, reviewRate, 0, scores.length);
    }

    public static double precisionAtReviewRate(double[] scores, int[] y, double reviewRate) {
        int n = scores.length;
        if (n == 0) return 0.0;
        int flagged = flaggedCount(n, reviewRate);
        return (double) truePositivesInTop(scores, y, flagged, 0, n) / flagged;
    }

    public static double f1(double precision, double recall) {
        return precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
    }

    /**
     * 1 - std of recall@RR over contiguous folds that contain positives; 1.0 when fewer than two do.
     */
    public static double stability(double[] scores, int[] y, double reviewRate) {
        int n = scores.length;
        int foldSize = n / STABILITY_FOLDS;
        if (foldSize == 0) return 1.0;

        List<Double> recalls = new ArrayList<>();
        for (int fold = 0; fold < STABILITY_FOLDS; fold++) {
            int from = fold * foldSize;
            int to = fold == STABILITY_FOLDS - 1 ? n : from + foldSize;
            if (countPositives(y, from, to) > 0) {
                recalls.add(recallAtReviewRate(scores, y, reviewRate, from, to));
            }
        }
        if (recalls.size() < 2) return 1.0;

        double mean = recalls.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = recalls.stream().mapToDouble(r -> (r - mean) * (r - mean)).average().orElse(0.0);
        return clamp(1.0 - Math.sqrt(variance));
    }

    /**
     * Rows reviewed at a review rate: max(1, round(rate * n)).
     */
    public static int flaggedCount(int n, double reviewRate) {
        return Math.min(n, Math.max(1, (int) Math.round(reviewRate * n)));
    }

    /**
     * Indices of {@code scores[from, to)} sorted by descending score, ties by index.
     */
    public static int[] rankDescending(double[] scores, int from, int to) {
        Integer[] boxed = new Integer[to - from];
        for (int i = from; i < to; i++) boxed[i - from] = i;
        Arrays.sort(boxed, (a, b) -> {
            int cmp = Double.compare(scores[b], scores[a]);
            return cmp != 0 ? cmp : Integer.compare(a, b);
        });
        int[] order = new int[boxed.length];
        for (int i = 0; i < boxed.length; i++) order[i] = boxed[i];
        return order;
    }

    private static double recallAtReviewRate(double[] scores, int[] y, double reviewRate, int from, int to) {
        int positives = countPositives(y, from, to);
        if (positives == 0 || to <= from) return 0.0;
        int flagged = flaggedCount(to - from, reviewRate);
        return (double) truePositivesInTop(scores, y, flagged, from, to) / positives;
    }

    private static int truePositivesInTop(double[] scores, int[] y, int k, int from, int to) {
        int[] order = rankDescending(scores, from, to);
        int tp = 0;
        for (int i = 0; i < k && i < order.length; i++) {
            if (y[order[i]] == 1) tp++;
        }
        return tp;
    }

    private static int countPositives(int[] y, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) count += y[i];
        return count;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
