package com.bank.bakeoff.engine.isolationforest;

import com.bank.bakeoff.engine.trainer.TrainedModel;
import com.bank.bakeoff.engine.trainer.TrainingBudget;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

public class IsolationForest implements TrainedModel {

    private List<IsolationTree> trees;
    private int sampleSize;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    /**
     * Train the isolation forest on an encoded feature matrix.
     *
     * @param data       training rows
     * @param numTrees   number of trees in the forest
     * @param sampleSize sub-sampling size per tree
     * @param seed       random seed for reproducibility
     */
    public void train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on an empty matrix");
        }
        this.sampleSize = Math.max(2, Math.min(sampleSize, data.length));
        int maxDepth = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));
        this.trees = new ArrayList<>(numTrees);

        Random random = new Random(seed);
        for (int i = 0; i < numTrees; i++) {
            TrainingBudget.checkInterrupted();
            double[][] sample = subsample(data, this.sampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)); above 0.5 leans anomalous.
     */
    @Override
    public double predict(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;
        return Math.pow(2.0, -avgPathLength / c);
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
}
