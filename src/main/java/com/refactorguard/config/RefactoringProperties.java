package com.refactorguard.config;

import com.refactorguard.classifier.RiskGate;
import com.refactorguard.transform.BranchBodyPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * {@code refactoring.*} settings from {@code application.yml}, the environment
 * or the command line.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "refactoring")
public class RefactoringProperties {

    private double riskThreshold = RiskGate.DEFAULT_THRESHOLD;
    private boolean riskGateEnabled = false;
    private String modelPath = "models/risk-model.json";
    private BranchBodyPolicy branchBodyPolicy = BranchBodyPolicy.PLACEHOLDER;
    private boolean verbose = false;
    private String outputDir = "refactored_code";
    /** Worker threads; 0 or less means one per available processor. */
    private int threads = 0;

    public RefactoringConfig toConfig() {
        return RefactoringConfig.builder()
                .riskThreshold(riskThreshold)
                .riskGateEnabled(riskGateEnabled)
                .modelPath(Path.of(modelPath))
                .branchBodyPolicy(branchBodyPolicy)
                .verbose(verbose)
                .outputDir(Path.of(outputDir))
                .threads(threads > 0 ? threads : Runtime.getRuntime().availableProcessors())
                .build();
    }
}
