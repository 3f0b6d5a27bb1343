package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.engine.isolationforest.IsolationForest;
import com.bank.bakeoff.model.Algorithm;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Unsupervised baseline: labels are ignored for fitting and only used when the
 * candidate is evaluated.
 */
@Component
public class IsolationForestTrainer implements CandidateTrainer {

    @Override
    public Algorithm getSupportedAlgorithm() {
        return Algorithm.ISOLATION_FOREST;
    }

    @Override
    public TrainedModel train(double[][] x, int[] y, Map<String, Object> hyperparams) {
        IsolationForest forest = new IsolationForest();
        forest.train(x,
                Hyperparams.getPositiveInt(hyperparams, "numTrees", 100),
                Hyperparams.getPositiveInt(hyperparams, "sampleSize", 256),
                Hyperparams.getLong(hyperparams, "seed", 42L));
        return forest;
    }

    @Override
    public void validate(Map<String, Object> hyperparams) {
        Hyperparams.getPositiveInt(hyperparams, "numTrees", 100);
        Hyperparams.getPositiveInt(hyperparams, "sampleSize", 256);
        Hyperparams.getLong(hyperparams, "seed", 42L);
    }
}
