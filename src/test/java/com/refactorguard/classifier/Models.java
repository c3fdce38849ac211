package com.refactorguard.classifier;

import com.refactorguard.classifier.forest.ForestParameters;
import com.refactorguard.classifier.forest.RandomForest;
import com.refactorguard.classifier.forest.RandomForestTrainer;
import com.refactorguard.features.FeatureVector;

/** Tiny fitted models over the real feature schema. */
final class Models {

    static final ForestParameters PARAMETERS = new ForestParameters(50, 3, 2, 1);

    private Models() {
    }

    /** Positive exactly when {@code length_after} is 0. */
    static RiskModel lengthAfterModel() {
        int width = FeatureVector.SCHEMA.size();
        int lengthAfter = FeatureVector.SCHEMA.indexOf(FeatureVector.LENGTH_AFTER);
        double[][] x = new double[8][width];
        int[] y = new int[8];
        for (int i = 0; i < x.length; i++) {
            y[i] = i % 2;
            x[i][lengthAfter] = y[i] == 1 ? 0 : 1 + i;
        }
        RandomForest forest = new RandomForestTrainer().fit(x, y, PARAMETERS);
        return RiskModel.of(FeatureVector.SCHEMA, PARAMETERS, new EvaluationMetrics(1, 1, 1, 2), forest);
    }
}
