package com.bank.bakeoff.engine.tree;

import com.bank.bakeoff.engine.trainer.TrainingBudget;

import java.util.Arrays;
import java.util.Random;

/**
 * Grows binary regression trees by minimizing the summed squared error of the children.
 * On 0/1 targets this is proportional to Gini impurity, so the same builder serves
 * classification trees (leaf value = positive fraction) and boosting residual trees.
 */
public final class TreeBuilder {

    private final double[][] x;
    private final double[] target;
    private final TreeOptions options;
    private final Random random;

    public TreeBuilder(double[][] x, double[] target, TreeOptions options, Random random) {
        this.x = x;
        this.target = target;
        this.options = options;
        this.random = random;
    }

    /**
     * @param rows row indices to grow from; may contain duplicates (bootstrap samples)
     */
    public TreeNode build(int[] rows) {
        return grow(rows, 0);
    }

    private TreeNode grow(int[] rows, int depth) {
        TrainingBudget.checkInterrupted();
        int n = rows.length;
        double sum = 0.0;
        double sumSq = 0.0;
        for (int r : rows) {
            sum += target[r];
            sumSq += target[r] * target[r];
        }
        double mean = n == 0 ? 0.0 : sum / n;
        double sse = sumSq - sum * mean;

        if (depth >= options.getMaxDepth() || n < options.getMinSamplesSplit() || sse <= 1e-12) {
            return TreeNode.leaf(mean, n);
        }

        Split best = findBestSplit(rows, sse);
        if (best == null) {
            return TreeNode.leaf(mean, n);
        }

        int leftCount = 0;
        for (int r : rows) {
            if (x[r][best.feature] <= best.threshold) leftCount++;
        }
        int[] leftRows = new int[leftCount];
        int[] rightRows = new int[n - leftCount];
        int li = 0, ri = 0;
        for (int r : rows) {
            if (x[r][best.feature] <= best.threshold) {
                leftRows[li++] = r;
            } else {
                rightRows[ri++] = r;
            }
        }

        TreeNode left = grow(leftRows, depth + 1);
        TreeNode right = grow(rightRows, depth + 1);
        return TreeNode.split(best.feature, best.threshold, left, right, n);
    }

    private Split findBestSplit(int[] rows, double parentSse) {
        int featureCount = x[rows[0]].length;
        int[] features = sampleFeatures(featureCount);

        Split best = null;
        for (int feature : features) {
            Split candidate = options.isRandomThresholds()
                    ? randomSplit(rows, feature)
                    : exhaustiveSplit(rows, feature);
            if (candidate != null && parentSse - candidate.sse > 1e-12
                    && (best == null || candidate.sse < best.sse)) {
                best = candidate;
            }
        }
        return best;
    }

    private int[] sampleFeatures(int featureCount) {
        int k = options.getMaxFeatures() <= 0 ? featureCount : Math.min(options.getMaxFeatures(), featureCount);
        int[] indices = new int[featureCount];
        for (int i = 0; i < featureCount; i++) indices[i] = i;
        if (k == featureCount) return indices;
        // Partial Fisher-Yates
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(featureCount - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return Arrays.copyOf(indices, k);
    }

    /**
     * Scans every midpoint between consecutive distinct values of the feature.
     */
    private Split exhaustiveSplit(int[] rows, int feature) {
        int n = rows.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = rows[i];
        Arrays.sort(order, (a, b) -> Double.compare(x[a][feature], x[b][feature]));

        double totalSum = 0.0, totalSumSq = 0.0;
        for (int r : rows) {
            totalSum += target[r];
            totalSumSq += target[r] * target[r];
        }

        int minLeaf = Math.max(1, options.getMinSamplesLeaf());
        double leftSum = 0.0, leftSumSq = 0.0;
        Split best = null;

        for (int i = 0; i < n - 1; i++) {
            int r = order[i];
            leftSum += target[r];
            leftSumSq += target[r] * target[r];

            double value = x[r][feature];
            double next = x[order[i + 1]][feature];
            if (value == next) continue;

            int leftN = i + 1;
            int rightN = n - leftN;
            if (leftN < minLeaf || rightN < minLeaf) continue;

            double rightSum = totalSum - leftSum;
            double rightSumSq = totalSumSq - leftSumSq;
            double sse = (leftSumSq - leftSum * leftSum / leftN) + (rightSumSq - rightSum * rightSum / rightN);
            if (best == null || sse < best.sse) {
                best = new Split(feature, (value + next) / 2.0, sse);
            }
        }
        return best;
    }

    /**
     * Extremely randomized split: one uniform threshold between the feature's min and max.
     */
    private Split randomSplit(int[] rows, int feature) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int r : rows) {
            double v = x[r][feature];
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (min >= max) return null;

        double threshold = min + random.nextDouble() * (max - min);
        int leftN = 0, rightN = 0;
        double leftSum = 0.0, leftSumSq = 0.0, rightSum = 0.0, rightSumSq = 0.0;
        for (int r : rows) {
            double t = target[r];
            if (x[r][feature] <= threshold) {
                leftN++;
                leftSum += t;
                leftSumSq += t * t;
            } else {
                rightN++;
                rightSum += t;
                rightSumSq += t * t;
            }
        }
        int minLeaf = Math.max(1, options.getMinSamplesLeaf());
        if (leftN < minLeaf || rightN < minLeaf) return null;

        double sse = (leftSumSq - leftSum * leftSum / leftN) + (rightSumSq - rightSum * rightSum / rightN);
        return new Split(feature, threshold, sse);
    }

    private record Split(int feature, double threshold, double sse) {}
}
