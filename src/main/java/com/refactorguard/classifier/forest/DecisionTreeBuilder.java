package com.refactorguard.classifier.forest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Grows one CART tree on gini impurity. At every split only a random subset
 * of {@code ceil(sqrt(featureCount))} features is considered.
 */
class DecisionTreeBuilder {

    private final double[][] x;
    private final int[] y;
    private final ForestParameters params;
    private final Random random;
    private final int featuresPerSplit;

    private final List<Integer> feature = new ArrayList<>();
    private final List<Double> threshold = new ArrayList<>();
    private final List<Integer> left = new ArrayList<>();
    private final List<Integer> right = new ArrayList<>();
    private final List<Double> positiveProbability = new ArrayList<>();

    DecisionTreeBuilder(double[][] x, int[] y, ForestParameters params, Random random) {
        this.x = x;
        this.y = y;
        this.params = params;
        this.random = random;
        int featureCount = x.length == 0 ? 0 : x[0].length;
        this.featuresPerSplit = Math.max(1, (int) Math.ceil(Math.sqrt(featureCount)));
    }

    DecisionTree build(int[] rows) {
        grow(rows, 0);
        return new DecisionTree(
                feature.stream().mapToInt(Integer::intValue).toArray(),
                threshold.stream().mapToDouble(Double::doubleValue).toArray(),
                left.stream().mapToInt(Integer::intValue).toArray(),
                right.stream().mapToInt(Integer::intValue).toArray(),
                positiveProbability.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private int grow(int[] rows, int depth) {
        int node = newNode(rows);
        if (params.depthBounded() && depth >= params.maxDepth()) {
            return node;
        }
        if (rows.length < params.minSamplesSplit() || isPure(rows)) {
            return node;
        }
        Split split = bestSplit(rows);
        if (split == null) {
            return node;
        }
        int[] leftRows = Arrays.stream(rows).filter(r -> x[r][split.feature] <= split.threshold).toArray();
        int[] rightRows = Arrays.stream(rows).filter(r -> x[r][split.feature] > split.threshold).toArray();

        feature.set(node, split.feature);
        threshold.set(node, split.threshold);
        left.set(node, grow(leftRows, depth + 1));
        right.set(node, grow(rightRows, depth + 1));
        return node;
    }

    private int newNode(int[] rows) {
        int positives = count(rows);
        feature.add(DecisionTree.LEAF);
        threshold.add(0.0);
        left.add(DecisionTree.LEAF);
        right.add(DecisionTree.LEAF);
        positiveProbability.add(rows.length == 0 ? 0.0 : (double) positives / rows.length);
        return feature.size() - 1;
    }

    private boolean isPure(int[] rows) {
        for (int r : rows) {
            if (y[r] != y[rows[0]]) {
                return false;
            }
        }
        return true;
    }

    /** Lowest weighted gini over the sampled features, or null when no split separates anything. */
    private Split bestSplit(int[] rows) {
        double parentGini = gini(count(rows), rows.length);
        Split best = null;
        double bestImpurity = parentGini;
        for (int f : sampleFeatures()) {
            Integer[] sorted = Arrays.stream(rows).boxed().toArray(Integer[]::new);
            Arrays.sort(sorted, Comparator.comparingDouble(r -> x[r][f]));

            int total = rows.length;
            int totalPositives = count(rows);
            int leftPositives = 0;
            for (int i = 0; i < total - 1; i++) {
                leftPositives += y[sorted[i]];
                double current = x[sorted[i]][f];
                double next = x[sorted[i + 1]][f];
                if (current == next) {
                    continue;
                }
                int leftSize = i + 1;
                int rightSize = total - leftSize;
                double impurity = (leftSize * gini(leftPositives, leftSize)
                        + rightSize * gini(totalPositives - leftPositives, rightSize)) / total;
                if (impurity < bestImpurity) {
                    bestImpurity = impurity;
                    best = new Split(f, (current + next) / 2);
                }
            }
        }
        return best;
    }

    // partial Fisher-Yates over the feature indices
    private int[] sampleFeatures() {
        int featureCount = x[0].length;
        int[] indices = new int[featureCount];
        for (int i = 0; i < featureCount; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < featuresPerSplit; i++) {
            int j = i + random.nextInt(featureCount - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return Arrays.copyOf(indices, featuresPerSplit);
    }

    private int count(int[] rows) {
        int positives = 0;
        for (int r : rows) {
            positives += y[r];
        }
        return positives;
    }

    private static double gini(int positives, int size) {
        if (size == 0) {
            return 0;
        }
        double p = (double) positives / size;
        return 1 - p * p - (1 - p) * (1 - p);
    }

    private record Split(int feature, double threshold) {
    }
}
