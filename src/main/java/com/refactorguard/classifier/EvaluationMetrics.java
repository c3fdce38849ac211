package com.refactorguard.classifier;

/**
 * Held-out scores of a fitted model. A ratio whose denominator is 0 is
 * reported as 0.
 */
public record EvaluationMetrics(double accuracy, double precision, double recall, int testSize) {

    public static EvaluationMetrics score(int[] actual, int[] predicted) {
        int truePositives = 0;
        int falsePositives = 0;
        int falseNegatives = 0;
        int correct = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] == predicted[i]) {
                correct++;
            }
            if (predicted[i] == 1 && actual[i] == 1) {
                truePositives++;
            } else if (predicted[i] == 1) {
                falsePositives++;
            } else if (actual[i] == 1) {
                falseNegatives++;
            }
        }
        return new EvaluationMetrics(
                ratio(correct, actual.length),
                ratio(truePositives, truePositives + falsePositives),
                ratio(truePositives, truePositives + falseNegatives),
                actual.length);
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0 : (double) numerator / denominator;
    }
}
