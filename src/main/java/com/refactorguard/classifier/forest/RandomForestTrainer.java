package com.refactorguard.classifier.forest;

import com.refactorguard.classifier.ClassifierTrainer;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fits a {@link RandomForest}: each tree is grown on a bootstrap sample of the
 * rows. The same data and parameters always give the same forest.
 */
public class RandomForestTrainer implements ClassifierTrainer<ForestParameters, RandomForest> {

    @Override
    public RandomForest fit(double[][] x, int[] y, ForestParameters params) {
        if (x.length == 0) {
            throw new IllegalArgumentException("Cannot fit a forest on zero rows");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("Got " + x.length + " rows but " + y.length + " labels");
        }
        Random random = new Random(params.seed());
        List<DecisionTree> trees = new ArrayList<>(params.nEstimators());
        for (int t = 0; t < params.nEstimators(); t++) {
            int[] sample = new int[x.length];
            for (int i = 0; i < sample.length; i++) {
                sample[i] = random.nextInt(x.length);
            }
            trees.add(new DecisionTreeBuilder(x, y, params, new Random(random.nextLong())).build(sample));
        }
        return new RandomForest(trees, x[0].length);
    }
}
