package com.refactorguard.classifier.forest;

import com.refactorguard.classifier.ProbabilisticClassifier;

import java.util.List;

/**
 * Bagged ensemble of {@link DecisionTree}s. The probability is the mean of
 * the trees' leaf probabilities.
 */
public record RandomForest(List<DecisionTree> trees, int featureCount) implements ProbabilisticClassifier {

    public RandomForest {
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("A forest needs at least one tree");
        }
        trees = List.copyOf(trees);
    }

    @Override
    public double probabilityOfPositive(double[] features) {
        if (features.length != featureCount) {
            throw new IllegalArgumentException(
                    "Expected " + featureCount + " features but got " + features.length);
        }
        double sum = 0;
        for (DecisionTree tree : trees) {
            sum += tree.probabilityOfPositive(features);
        }
        return sum / trees.size();
    }
}
