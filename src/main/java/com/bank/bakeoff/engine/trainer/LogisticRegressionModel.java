package com.bank.bakeoff.engine.trainer;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogisticRegressionModel implements TrainedModel {

    private double[] weights;
    private double bias;

    @Override
    public double predict(double[] features) {
        double z = bias;
        for (int j = 0; j < weights.length && j < features.length; j++) {
            z += weights[j] * features[j];
        }
        return sigmoid(z);
    }

    static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
