package com.refactorguard.classifier;

/**
 * A fitted binary classifier. Implementations are immutable and safe for
 * concurrent use.
 */
public interface ProbabilisticClassifier {

    /** Probability, in [0, 1], that {@code features} belongs to the positive class. */
    double probabilityOfPositive(double[] features);

    default int predict(double[] features) {
        return probabilityOfPositive(features) > 0.5 ? 1 : 0;
    }
}
