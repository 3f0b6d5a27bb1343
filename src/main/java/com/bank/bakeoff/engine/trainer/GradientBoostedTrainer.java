package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.engine.tree.BoostedTreesModel;
import com.bank.bakeoff.engine.tree.TreeBuilder;
import com.bank.bakeoff.engine.tree.TreeNode;
import com.bank.bakeoff.engine.tree.TreeOptions;
import com.bank.bakeoff.model.Algorithm;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Log-loss gradient boosting: each round fits a shallow regression tree to y - p.
 */
@Component
public class GradientBoostedTrainer implements CandidateTrainer {

    @Override
    public Algorithm getSupportedAlgorithm() {
        return Algorithm.GRADIENT_BOOSTED;
    }

    @Override
    public TrainedModel train(double[][] x, int[] y, Map<String, Object> hyperparams) {
        int nEstimators = Hyperparams.getPositiveInt(hyperparams, "nEstimators", 50);
        double learningRate = Hyperparams.getPositiveDouble(hyperparams, "learningRate", 0.1);
        TreeOptions options = options(hyperparams);
        Random random = new Random(Hyperparams.getLong(hyperparams, "seed", 42L));

        int n = x.length;
        double positives = 0;
        for (int label : y) positives += label;
        double p0 = Math.min(1 - 1e-6, Math.max(1e-6, positives / Math.max(1, n)));
        double base = Math.log(p0 / (1 - p0));

        double[] rawScores = new double[n];
        Arrays.fill(rawScores, base);
        double[] residuals = new double[n];
        int[] rows = TrainingData.allRows(n);
        List<TreeNode> trees = new ArrayList<>(Math.min(nEstimators, 1024));

        for (int round = 0; round < nEstimators; round++) {
            TrainingBudget.checkInterrupted();
            for (int i = 0; i < n; i++) {
                double p = 1.0 / (1.0 + Math.exp(-rawScores[i]));
                residuals[i] = y[i] - p;
            }
            TreeNode tree = new TreeBuilder(x, residuals, options, random).build(rows);
            trees.add(tree);
            for (int i = 0; i < n; i++) {
                rawScores[i] += learningRate * tree.predict(x[i]);
            }
        }

        return new BoostedTreesModel(base, learningRate, trees);
    }

    @Override
    public void validate(Map<String, Object> hyperparams) {
        Hyperparams.getPositiveInt(hyperparams, "nEstimators", 50);
        Hyperparams.getPositiveDouble(hyperparams, "learningRate", 0.1);
        Hyperparams.getLong(hyperparams, "seed", 42L);
        options(hyperparams);
    }

    private static TreeOptions options(Map<String, Object> hyperparams) {
        return TreeOptions.builder()
                .maxDepth(Hyperparams.getPositiveInt(hyperparams, "maxDepth", 3))
                .minSamplesSplit(Hyperparams.getPositiveInt(hyperparams, "minSamplesSplit", 5))
                .minSamplesLeaf(Hyperparams.getPositiveInt(hyperparams, "minSamplesLeaf", 2))
                .build();
    }
}
