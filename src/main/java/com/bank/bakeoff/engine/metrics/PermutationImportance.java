package com.bank.bakeoff.engine.metrics;

import com.bank.bakeoff.engine.trainer.TrainedModel;
import com.bank.bakeoff.engine.trainer.TrainingBudget;
import com.bank.bakeoff.model.FeatureWeight;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Global feature importance as the mean drop in PR-AUC when one feature column is
 * shuffled, normalized to sum to 1 (uniform when no feature matters).
 */
public final class PermutationImportance {

    static final int REPEATS = 3;
    static final long SEED = 42L;

    private PermutationImportance() {}

    public static List<FeatureWeight> compute(TrainedModel model, double[][] x, int[] y, List<String> featureNames) {
        int d = featureNames.size();
        if (d == 0) return List.of();

        double baseline = MetricsCalculator.prAuc(model.predictAll(x), y);
        Random random = new Random(SEED);
        double[] drops = new double[d];
        int n = x.length;
        double[][] shuffled = new double[n][];
        for (int i = 0; i < n; i++) shuffled[i] = x[i].clone();

        for (int j = 0; j < d; j++) {
            double total = 0.0;
            for (int repeat = 0; repeat < REPEATS; repeat++) {
                TrainingBudget.checkInterrupted();
                int[] perm = permutation(n, random);
                for (int i = 0; i < n; i++) shuffled[i][j] = x[perm[i]][j];
                total += baseline - MetricsCalculator.prAuc(model.predictAll(shuffled), y);
            }
            for (int i = 0; i < n; i++) shuffled[i][j] = x[i][j];
            drops[j] = Math.max(0.0, total / REPEATS);
        }

        double sum = 0.0;
        for (double drop : drops) sum += drop;

        List<FeatureWeight> weights = new ArrayList<>(d);
        for (int j = 0; j < d; j++) {
            double weight = sum > 0 ? drops[j] / sum : 1.0 / d;
            weights.add(new FeatureWeight(featureNames.get(j), weight));
        }
        weights.sort(Comparator.comparingDouble(FeatureWeight::getWeight).reversed());
        return weights;
    }

    private static int[] permutation(int n, Random random) {
        int[] perm = new int[n];
        for (int i = 0; i < n; i++) perm[i] = i;
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = perm[i];
            perm[i] = perm[j];
            perm[j] = tmp;
        }
        return perm;
    }
}
