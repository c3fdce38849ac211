package com.refactorguard.classifier;

import com.refactorguard.classifier.forest.ForestParameters;
import com.refactorguard.classifier.forest.RandomForest;

import java.util.List;

/**
 * A trained risk model as persisted: the forest plus what it was trained on.
 * Immutable, so one instance is shared by all worker threads.
 */
public record RiskModel(
        int formatVersion,
        List<String> featureSchema,
        ForestParameters parameters,
        EvaluationMetrics evaluation,
        RandomForest forest
) implements ProbabilisticClassifier {

    public static final int FORMAT_VERSION = 1;

    public RiskModel {
        featureSchema = List.copyOf(featureSchema);
    }

    public static RiskModel of(List<String> featureSchema, ForestParameters parameters,
                               EvaluationMetrics evaluation, RandomForest forest) {
        return new RiskModel(FORMAT_VERSION, featureSchema, parameters, evaluation, forest);
    }

    @Override
    public double probabilityOfPositive(double[] features) {
        return forest.probabilityOfPositive(features);
    }
}
