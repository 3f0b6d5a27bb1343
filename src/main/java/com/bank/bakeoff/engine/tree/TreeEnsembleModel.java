package com.bank.bakeoff.engine.tree;

import com.bank.bakeoff.engine.trainer.TrainedModel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Averages the positive-class probability of its trees (random forest, extra-trees).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TreeEnsembleModel implements TrainedModel {

    private List<TreeNode> trees = new ArrayList<>();

    @Override
    public double predict(double[] features) {
        if (trees.isEmpty()) return 0.0;
        double sum = 0.0;
        for (TreeNode tree : trees) {
            sum += tree.predict(features);
        }
        return sum / trees.size();
    }
}
