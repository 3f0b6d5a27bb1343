package com.bank.bakeoff.engine.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeNode {

    @JsonProperty("f")
    private int feature;

    @JsonProperty("t")
    private double threshold;

    @JsonProperty("l")
    private TreeNode left;

    @JsonProperty("r")
    private TreeNode right;

    @JsonProperty("v")
    private double value; // leaf output: positive-class probability or regression value

    @JsonProperty("n")
    private int samples;

    public TreeNode() {}

    public static TreeNode leaf(double value, int samples) {
        TreeNode node = new TreeNode();
        node.value = value;
        node.samples = samples;
        return node;
    }

    public static TreeNode split(int feature, double threshold, TreeNode left, TreeNode right, int samples) {
        TreeNode node = new TreeNode();
        node.feature = feature;
        node.threshold = threshold;
        node.left = left;
        node.right = right;
        node.samples = samples;
        return node;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return left == null;
    }

    public double predict(double[] point) {
        TreeNode node = this;
        while (!node.isLeaf()) {
            node = point[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    public int depth() {
        if (isLeaf()) return 0;
        return 1 + Math.max(left.depth(), right.depth());
    }

    public int getFeature() { return feature; }
    public double getThreshold() { return threshold; }
    public TreeNode getLeft() { return left; }
    public TreeNode getRight() { return right; }
    public double getValue() { return value; }
    public int getSamples() { return samples; }
}
