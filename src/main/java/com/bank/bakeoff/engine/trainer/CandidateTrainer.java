package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.model.Algorithm;

import java.util.Map;

/**
 * Interface for all candidate trainers.
 * Each implementation handles a specific Algorithm.
 */
public interface CandidateTrainer {

    /**
     * The algorithm this trainer handles.
     */
    Algorithm getSupportedAlgorithm();

    /**
     * Fit a model on an encoded feature matrix.
     *
     * @param x           rows of encoded features
     * @param y           binary labels aligned with {@code x}
     * @param hyperparams caller-supplied hyperparameters; missing keys use trainer defaults
     * @return the trained model
     */
    TrainedModel train(double[][] x, int[] y, Map<String, Object> hyperparams);

    /**
     * Rejects malformed or out-of-range hyperparameters before a bake-off is created.
     *
     * @throws com.bank.bakeoff.exception.ValidationException on the first bad value
     */
    void validate(Map<String, Object> hyperparams);
}
