package com.refactorguard.classifier;

/**
 * Fits a {@link ProbabilisticClassifier} for one set of hyperparameters.
 *
 * @param <P> hyperparameter type
 * @param <M> fitted model type
 */
public interface ClassifierTrainer<P, M extends ProbabilisticClassifier> {

    /**
     * @param x      one feature row per example
     * @param y      labels, 0 or 1, aligned with {@code x}
     */
    M fit(double[][] x, int[] y, P params);
}
