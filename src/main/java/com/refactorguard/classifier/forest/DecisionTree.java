package com.refactorguard.classifier.forest;

import com.refactorguard.classifier.ProbabilisticClassifier;

/**
 * Binary decision tree stored as parallel arrays indexed by node id, root at 0.
 * A node whose {@code feature} is {@link #LEAF} is a leaf; otherwise rows with
 * {@code x[feature] <= threshold} go to {@code left}, the others to {@code right}.
 * {@code positiveProbability} is the share of positive training rows that
 * reached the node.
 */
public record DecisionTree(int[] feature, double[] threshold, int[] left, int[] right,
                           double[] positiveProbability) implements ProbabilisticClassifier {

    public static final int LEAF = -1;

    @Override
    public double probabilityOfPositive(double[] x) {
        int node = 0;
        while (feature[node] != LEAF) {
            node = x[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return positiveProbability[node];
    }

    public int nodeCount() {
        return feature.length;
    }
}
