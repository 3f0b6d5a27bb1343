package com.bank.bakeoff.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        // One-hot and flag columns are often constant inside a sample; try a few features before giving up
        int numFeatures = data[0].length;
        for (int attempt = 0; attempt < Math.min(numFeatures, 8); attempt++) {
            int featureIdx = random.nextInt(numFeatures);
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (double[] row : data) {
                if (row[featureIdx] < min) min = row[featureIdx];
                if (row[featureIdx] > max) max = row[featureIdx];
            }
            if (min >= max) continue;

            double splitValue = min + random.nextDouble() * (max - min);
            int leftCount = 0;
            for (double[] row : data) {
                if (row[featureIdx] < splitValue) leftCount++;
            }
            double[][] leftData = new double[leftCount][];
            double[][] rightData = new double[n - leftCount][];
            int li = 0, ri = 0;
            for (double[] row : data) {
                if (row[featureIdx] < splitValue) {
                    leftData[li++] = row;
                } else {
                    rightData[ri++] = row;
                }
            }
            return IsolationNode.internalNode(featureIdx, splitValue,
                    buildNode(leftData, depth + 1, maxDepth, random),
                    buildNode(rightData, depth + 1, maxDepth, random));
        }
        return IsolationNode.externalNode(n);
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
