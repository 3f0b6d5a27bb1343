package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.engine.tree.DecisionTreeModel;
import com.bank.bakeoff.engine.tree.TreeBuilder;
import com.bank.bakeoff.engine.tree.TreeOptions;
import com.bank.bakeoff.model.Algorithm;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;

@Component
public class DecisionTreeTrainer implements CandidateTrainer {

    @Override
    public Algorithm getSupportedAlgorithm() {
        return Algorithm.DECISION_TREE;
    }

    @Override
    public TrainedModel train(double[][] x, int[] y, Map<String, Object> hyperparams) {
        Random random = new Random(Hyperparams.getLong(hyperparams, "seed", 42L));
        TreeBuilder builder = new TreeBuilder(x, TrainingData.asTarget(y), options(hyperparams), random);
        return new DecisionTreeModel(builder.build(TrainingData.allRows(x.length)));
    }

    @Override
    public void validate(Map<String, Object> hyperparams) {
        options(hyperparams);
        Hyperparams.getLong(hyperparams, "seed", 42L);
    }

    private static TreeOptions options(Map<String, Object> hyperparams) {
        return TreeOptions.builder()
                .maxDepth(Hyperparams.getPositiveInt(hyperparams, "maxDepth", 8))
                .minSamplesSplit(Hyperparams.getPositiveInt(hyperparams, "minSamplesSplit", 5))
                .minSamplesLeaf(Hyperparams.getPositiveInt(hyperparams, "minSamplesLeaf", 2))
                .build();
    }
}
