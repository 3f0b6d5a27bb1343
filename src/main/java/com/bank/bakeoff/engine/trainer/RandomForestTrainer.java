package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.engine.tree.TreeBuilder;
import com.bank.bakeoff.engine.tree.TreeEnsembleModel;
import com.bank.bakeoff.engine.tree.TreeNode;
import com.bank.bakeoff.engine.tree.TreeOptions;
import com.bank.bakeoff.model.Algorithm;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Bagged CART trees with a random feature subset considered at every split.
 */
@Component
public class RandomForestTrainer implements CandidateTrainer {

    @Override
    public Algorithm getSupportedAlgorithm() {
        return Algorithm.RANDOM_FOREST;
    }

    @Override
    public TrainedModel train(double[][] x, int[] y, Map<String, Object> hyperparams) {
        int nEstimators = Hyperparams.getPositiveInt(hyperparams, "nEstimators", 20);
        int featureCount = x.length == 0 ? 0 : x[0].length;
        Random random = new Random(Hyperparams.getLong(hyperparams, "seed", 42L));

        TreeBuilder builder = new TreeBuilder(x, TrainingData.asTarget(y), options(hyperparams, featureCount), random);
        List<TreeNode> trees = new ArrayList<>(nEstimators);
        for (int t = 0; t < nEstimators; t++) {
            TrainingBudget.checkInterrupted();
            trees.add(builder.build(TrainingData.bootstrap(x.length, random)));
        }
        return new TreeEnsembleModel(trees);
    }

    @Override
    public void validate(Map<String, Object> hyperparams) {
        Hyperparams.getPositiveInt(hyperparams, "nEstimators", 20);
        Hyperparams.getLong(hyperparams, "seed", 42L);
        options(hyperparams, 1);
    }

    private static TreeOptions options(Map<String, Object> hyperparams, int featureCount) {
        return TreeOptions.builder()
                .maxDepth(Hyperparams.getPositiveInt(hyperparams, "maxDepth", 10))
                .minSamplesSplit(Hyperparams.getPositiveInt(hyperparams, "minSamplesSplit", 5))
                .minSamplesLeaf(Hyperparams.getPositiveInt(hyperparams, "minSamplesLeaf", 2))
                .maxFeatures(Hyperparams.resolveMaxFeatures(hyperparams, featureCount, "sqrt"))
                .build();
    }
}
