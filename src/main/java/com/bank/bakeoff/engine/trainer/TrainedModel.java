package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.engine.isolationforest.IsolationForest;
import com.bank.bakeoff.engine.tree.BoostedTreesModel;
import com.bank.bakeoff.engine.tree.DecisionTreeModel;
import com.bank.bakeoff.engine.tree.TreeEnsembleModel;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Inference capability of a trained candidate. Implementations are plain
 * Jackson beans so artifacts round-trip through JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LogisticRegressionModel.class, name = "logistic"),
        @JsonSubTypes.Type(value = DecisionTreeModel.class, name = "tree"),
        @JsonSubTypes.Type(value = TreeEnsembleModel.class, name = "ensemble"),
        @JsonSubTypes.Type(value = BoostedTreesModel.class, name = "boosted"),
        @JsonSubTypes.Type(value = IsolationForest.class, name = "isolation_forest")
})
public interface TrainedModel {

    /**
     * @param features one encoded feature vector, in artifact feature order
     * @return anomaly score in [0,1], higher is more anomalous
     */
    double predict(double[] features);

    default double[] predictAll(double[][] rows) {
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = predict(rows[i]);
        }
        return scores;
    }
}
