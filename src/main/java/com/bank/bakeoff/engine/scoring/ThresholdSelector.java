package com.bank.bakeoff.engine.scoring;

import com.bank.bakeoff.engine.metrics.MetricsCalculator;

import java.util.Arrays;

/**
 * Decides which rows are flagged.
 * <p>
 * Without an explicit threshold exactly {@code k = max(1, ceil(reviewRate * n))} rows are
 * flagged: the top k by descending score, ties at the boundary resolved by row order.
 * The threshold reported is the k-th ranked score. With an explicit threshold every
 * row scoring at least the threshold is flagged.
 */
public final class ThresholdSelector {

    private ThresholdSelector() {}

    public static Selection select(double[] scores, double reviewRate, Double threshold) {
        int n = scores.length;
        int[] order = MetricsCalculator.rankDescending(scores, 0, n);
        if (n == 0) {
            return new Selection(new int[0], threshold != null ? threshold : 0.0);
        }

        if (threshold != null) {
            int count = 0;
            while (count < n && scores[order[count]] >= threshold) count++;
            return new Selection(Arrays.copyOf(order, count), threshold);
        }

        int k = flaggedCount(n, reviewRate);
        return new Selection(Arrays.copyOf(order, k), scores[order[k - 1]]);
    }

    public static int flaggedCount(int n, double reviewRate) {
        if (n == 0) return 0;
        // Epsilon keeps 0.01 * 1000 at 10 instead of 11 under floating error
        int k = (int) Math.ceil(reviewRate * n - 1e-9);
        return Math.max(1, Math.min(n, k));
    }

    /**
     * @param flaggedRows flagged row indices in rank order (rank 1 first)
     */
    public record Selection(int[] flaggedRows, double thresholdUsed) {

        public boolean[] flaggedMask(int n) {
            boolean[] mask = new boolean[n];
            for (int row : flaggedRows) mask[row] = true;
            return mask;
        }
    }
}
