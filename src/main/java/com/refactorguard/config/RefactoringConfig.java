package com.refactorguard.config;

import com.refactorguard.classifier.RiskGate;
import com.refactorguard.transform.BranchBodyPolicy;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Settings of one run. Passed explicitly into the core; nothing below the
 * command line reads global configuration.
 */
@Value
@Builder(toBuilder = true)
public class RefactoringConfig {

    @Builder.Default
    double riskThreshold = RiskGate.DEFAULT_THRESHOLD;

    /** Consult the risk model before accepting a rewrite. */
    @Builder.Default
    boolean riskGateEnabled = false;

    @Builder.Default
    Path modelPath = Path.of("models", "risk-model.json");

    @Builder.Default
    BranchBodyPolicy branchBodyPolicy = BranchBodyPolicy.PLACEHOLDER;

    @Builder.Default
    boolean verbose = false;

    @Builder.Default
    Path outputDir = Path.of("refactored_code");

    @Builder.Default
    int threads = Runtime.getRuntime().availableProcessors();

    public static RefactoringConfig defaults() {
        return builder().build();
    }
}
