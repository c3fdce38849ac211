package com.refactorguard.classifier.forest;

import java.util.ArrayList;
import java.util.List;

/**
 * Hyperparameters of a {@link RandomForest}.
 *
 * @param nEstimators     number of trees
 * @param maxDepth        depth limit of each tree, {@link #UNBOUNDED} for none
 * @param minSamplesSplit smallest node that may still be split
 * @param seed            seed of the bootstrap and feature sampling
 */
public record ForestParameters(int nEstimators, int maxDepth, int minSamplesSplit, long seed) {

    public static final int UNBOUNDED = 0;

    private static final int[] MAX_DEPTHS = {UNBOUNDED, 5};
    private static final int[] MIN_SAMPLES_SPLITS = {2, 5};
    private static final int[] ESTIMATORS = {50, 100};

    public ForestParameters {
        if (nEstimators < 1) {
            throw new IllegalArgumentException("nEstimators must be positive: " + nEstimators);
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be 0 (unbounded) or positive: " + maxDepth);
        }
        if (minSamplesSplit < 2) {
            throw new IllegalArgumentException("minSamplesSplit must be at least 2: " + minSamplesSplit);
        }
    }

    public boolean depthBounded() {
        return maxDepth != UNBOUNDED;
    }

    /**
     * The search grid: every combination of maxDepth, minSamplesSplit and
     * nEstimators, the last one varying fastest.
     */
    public static List<ForestParameters> grid(long seed) {
        List<ForestParameters> grid = new ArrayList<>();
        for (int depth : MAX_DEPTHS) {
            for (int split : MIN_SAMPLES_SPLITS) {
                for (int estimators : ESTIMATORS) {
                    grid.add(new ForestParameters(estimators, depth, split, seed));
                }
            }
        }
        return List.copyOf(grid);
    }

    @Override
    public String toString() {
        return "nEstimators=" + nEstimators
                + ", maxDepth=" + (depthBounded() ? String.valueOf(maxDepth) : "none")
                + ", minSamplesSplit=" + minSamplesSplit;
    }
}
