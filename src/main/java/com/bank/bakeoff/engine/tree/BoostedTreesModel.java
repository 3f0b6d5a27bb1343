package com.bank.bakeoff.engine.tree;

import com.bank.bakeoff.engine.trainer.TrainedModel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive log-odds model: sigmoid(base + learningRate * sum of tree outputs).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoostedTreesModel implements TrainedModel {

    private double basePrediction;
    private double learningRate;
    private List<TreeNode> trees = new ArrayList<>();

    public double rawScore(double[] features) {
        double f = basePrediction;
        for (TreeNode tree : trees) {
            f += learningRate * tree.predict(features);
        }
        return f;
    }

    @Override
    public double predict(double[] features) {
        return 1.0 / (1.0 + Math.exp(-rawScore(features)));
    }
}
