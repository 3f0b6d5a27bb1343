package com.bank.bakeoff.engine.features;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Encoded training data of a bake-off. Persisted as the features blob so that each
 * candidate call can train without re-reading and re-encoding the dataset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureMatrix {

    private List<String> featureNames;
    private List<ColumnEncoding> encodings;
    private String labelColumn;
    private double[][] x;
    private int[] y;

    @JsonIgnore
    public int getRowCount() {
        return x == null ? 0 : x.length;
    }

    @JsonIgnore
    public int getPositiveCount() {
        int count = 0;
        if (y != null) {
            for (int label : y) count += label;
        }
        return count;
    }

    /**
     * Column means of the encoded matrix; the baseline used for reason-code occlusion.
     */
    public double[] featureMeans() {
        int d = featureNames.size();
        double[] means = new double[d];
        if (x == null || x.length == 0) return means;
        for (double[] row : x) {
            for (int j = 0; j < d; j++) means[j] += row[j];
        }
        for (int j = 0; j < d; j++) means[j] /= x.length;
        return means;
    }
}
