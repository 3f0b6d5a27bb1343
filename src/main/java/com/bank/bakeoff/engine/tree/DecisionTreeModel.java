package com.bank.bakeoff.engine.tree;

import com.bank.bakeoff.engine.trainer.TrainedModel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecisionTreeModel implements TrainedModel {

    private TreeNode root;

    @Override
    public double predict(double[] features) {
        return root.predict(features);
    }
}
