package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Algorithm;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Map;

/**
 * Full-batch gradient descent on log-loss with an L2 penalty of strength 1/(C*n).
 */
@Component
public class LogisticRegressionTrainer implements CandidateTrainer {

    @Override
    public Algorithm getSupportedAlgorithm() {
        return Algorithm.LOG_REG;
    }

    @Override
    public TrainedModel train(double[][] x, int[] y, Map<String, Object> hyperparams) {
        double learningRate = Hyperparams.getPositiveDouble(hyperparams, "learningRate", 0.01);
        int epochs = Hyperparams.getPositiveInt(hyperparams, "epochs", 200);
        double c = regularization(hyperparams);

        int n = x.length;
        int d = n == 0 ? 0 : x[0].length;
        double lambda = c > 0 ? 1.0 / (c * n) : 0.0;

        double[] weights = new double[d];
        double bias = 0.0;
        double[] gradient = new double[d];

        for (int epoch = 0; epoch < epochs; epoch++) {
            TrainingBudget.checkInterrupted();
            Arrays.fill(gradient, 0.0);
            double biasGradient = 0.0;

            for (int i = 0; i < n; i++) {
                double z = bias;
                for (int j = 0; j < d; j++) {
                    z += weights[j] * x[i][j];
                }
                double error = LogisticRegressionModel.sigmoid(z) - y[i];
                for (int j = 0; j < d; j++) {
                    gradient[j] += error * x[i][j];
                }
                biasGradient += error;
            }

            for (int j = 0; j < d; j++) {
                weights[j] -= learningRate * (gradient[j] / n + lambda * weights[j]);
            }
            bias -= learningRate * biasGradient / n;
        }

        return new LogisticRegressionModel(weights, bias);
    }

    @Override
    public void validate(Map<String, Object> hyperparams) {
        Hyperparams.getPositiveDouble(hyperparams, "learningRate", 0.01);
        Hyperparams.getPositiveInt(hyperparams, "epochs", 200);
        regularization(hyperparams);
    }

    // C <= 0 disables the penalty
    private static double regularization(Map<String, Object> hyperparams) {
        double c = Hyperparams.getDouble(hyperparams, "C", 1.0);
        if (Double.isNaN(c)) {
            throw new ValidationException("Hyperparameter C must be numeric, got: NaN");
        }
        return c;
    }
}
