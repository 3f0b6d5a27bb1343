package com.bank.bakeoff.engine;

import com.bank.bakeoff.engine.features.ColumnEncoding;
import com.bank.bakeoff.engine.features.FeatureMatrixBuilder;
import com.bank.bakeoff.engine.trainer.TrainedModel;
import com.bank.bakeoff.model.Algorithm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to score new rows with a trained candidate: the model itself,
 * the training-time column encodings and the encoded feature order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelArtifact {

    private Algorithm algorithm;
    private Map<String, Object> hyperparams;
    private List<String> featureNames;
    private List<ColumnEncoding> encodings;
    private double[] featureMeans;
    private TrainedModel model;
    private int trainingRows;
    private long trainedAt;

    /** Source columns a dataset must have to be scored with this artifact. */
    public List<String> requiredColumns() {
        return FeatureMatrixBuilder.requiredColumns(encodings);
    }
}
