package com.bank.bakeoff.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    @JsonProperty("s")
    private int size; // samples that reached a leaf

    @JsonProperty("e")
    private boolean external;

    public IsolationNode() {}

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        return node;
    }

    public static IsolationNode externalNode(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        node.external = true;
        return node;
    }

    public double pathLength(double[] point, int currentDepth) {
        IsolationNode node = this;
        int depth = currentDepth;
        while (!node.external) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * c(n) = 2H(n-1) - 2(n-1)/n, the average unsuccessful-search path length of a BST.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public boolean isExternal() { return external; }
}
