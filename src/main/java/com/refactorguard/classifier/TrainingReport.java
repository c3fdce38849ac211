package com.refactorguard.classifier;

import com.refactorguard.classifier.forest.ForestParameters;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder
public class TrainingReport {
    private final RiskModel model;
    private final ForestParameters bestParameters;
    private final double crossValidationAccuracy;
    private final int trainingSize;
    private final Duration elapsed;

    public EvaluationMetrics getEvaluation() {
        return model.evaluation();
    }

    @Override
    public String toString() {
        EvaluationMetrics m = getEvaluation();
        return String.format("Best parameters: %s%n"
                        + "Cross-validation accuracy: %.2f%n"
                        + "Model Performance: Accuracy=%.2f, Precision=%.2f, Recall=%.2f (train %d, test %d, %d ms)",
                bestParameters, crossValidationAccuracy,
                m.accuracy(), m.precision(), m.recall(),
                trainingSize, m.testSize(), elapsed.toMillis());
    }
}
