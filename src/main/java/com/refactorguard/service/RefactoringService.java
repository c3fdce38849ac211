package com.refactorguard.service;

import com.refactorguard.classifier.ModelNotFoundException;
import com.refactorguard.classifier.RiskClassifier;
import com.refactorguard.classifier.RiskGate;
import com.refactorguard.classifier.RiskModelStore;
import com.refactorguard.classifier.SchemaMismatchException;
import com.refactorguard.config.RefactoringConfig;
import com.refactorguard.detector.IssueReport;
import com.refactorguard.detector.PatternDetectors;
import com.refactorguard.features.FeatureExtractor;
import com.refactorguard.parser.ParseFailureException;
import com.refactorguard.parser.SourceParser;
import com.refactorguard.parser.SyntaxTree;
import com.refactorguard.transform.TransformationOrchestrator;
import com.refactorguard.transform.TransformationResult;
import com.refactorguard.util.UnifiedDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The per-file pipeline: parse, detect, rewrite, and, when enabled, let the
 * risk gate decide whether the rewrite is kept.
 * <p>
 * Safe to share between worker threads. A missing model switches the gate off
 * for the rest of the run, with a single warning.
 */
public class RefactoringService {

    private static final Logger log = LoggerFactory.getLogger(RefactoringService.class);

    private final RefactoringConfig config;
    private final SourceParser parser;
    private final PatternDetectors detectors;
    private final TransformationOrchestrator orchestrator;
    private final RiskClassifier classifier;
    private final RiskGate gate;
    private final AtomicBoolean gateActive;

    public RefactoringService(RefactoringConfig config,
                              SourceParser parser,
                              PatternDetectors detectors,
                              TransformationOrchestrator orchestrator,
                              RiskClassifier classifier,
                              RiskGate gate) {
        this.config = config;
        this.parser = parser;
        this.detectors = detectors;
        this.orchestrator = orchestrator;
        this.classifier = classifier;
        this.gate = gate;
        this.gateActive = new AtomicBoolean(config.isRiskGateEnabled() && classifier != null);
    }

    public static RefactoringService create(RefactoringConfig config,
                                            SourceParser parser,
                                            FeatureExtractor extractor,
                                            RiskModelStore store) {
        RiskClassifier classifier = config.isRiskGateEnabled()
                ? new RiskClassifier(extractor, store, config.getModelPath())
                : null;
        return new RefactoringService(
                config,
                parser,
                PatternDetectors.standard(),
                TransformationOrchestrator.standard(parser, config.getBranchBodyPolicy()),
                classifier,
                new RiskGate(config.getRiskThreshold()));
    }

    public FileOutcome process(String name, String source) {
        return process(name, source, outputNameOf(name));
    }

    /**
     * @param outputName where the result will be written, used as the target name of the diff
     */
    public FileOutcome process(String name, String source, String outputName) {
        SyntaxTree tree;
        try {
            tree = parser.parse(name, source);
        } catch (ParseFailureException e) {
            log.warn("Skipping {}: {}", name, e.getMessage());
            return unchanged(name, source, FileOutcome.Status.PARSE_FAILURE)
                    .error(e.getMessage())
                    .build();
        }

        IssueReport issues = detectors.detect(tree);
        if (issues.isEmpty()) {
            log.debug("No issues found in {}.", name);
            return unchanged(name, source, FileOutcome.Status.UNCHANGED).build();
        }

        TransformationResult result = orchestrator.transform(tree);
        if (!result.isChanged()) {
            return unchanged(name, source, FileOutcome.Status.UNCHANGED)
                    .issues(issues)
                    .rewrites(result.getLog())
                    .build();
        }

        double risk = Double.NaN;
        if (gateActive.get()) {
            try {
                risk = classifier.riskOf(source, result.getSource());
            } catch (ModelNotFoundException e) {
                if (gateActive.compareAndSet(true, false)) {
                    log.warn("No ML model file found at {}. Proceeding without error filtering.", e.getPath());
                }
            } catch (SchemaMismatchException e) {
                log.error("Cannot classify {}: {}", name, e.getMessage());
                return unchanged(name, source, FileOutcome.Status.CLASSIFICATION_FAILED)
                        .issues(issues)
                        .rewrites(result.getLog())
                        .error(e.getMessage())
                        .build();
            }
        }

        if (!Double.isNaN(risk)) {
            String probability = String.format("%.2f", risk);
            if (!gate.accepts(risk)) {
                log.warn("Refactoring on {} deemed risky (prob={}). Skipping.", name, probability);
                return unchanged(name, source, FileOutcome.Status.REJECTED_BY_GATE)
                        .issues(issues)
                        .rewrites(result.getLog())
                        .risk(risk)
                        .build();
            }
            log.debug("Refactoring on {} accepted (prob={}).", name, probability);
        }

        return FileOutcome.builder()
                .name(name)
                .status(FileOutcome.Status.REFACTORED)
                .originalSource(source)
                .source(result.getSource())
                .issues(issues)
                .rewrites(result.getLog())
                .risk(risk)
                .diff(UnifiedDiff.of(source, result.getSource(), name, outputName))
                .build();
    }

    private String outputNameOf(String name) {
        Path fileName = Path.of(name).getFileName();
        return config.getOutputDir().resolve(fileName == null ? name : fileName.toString()).toString();
    }

    public boolean isGateActive() {
        return gateActive.get();
    }

    private static FileOutcome.FileOutcomeBuilder unchanged(String name, String source, FileOutcome.Status status) {
        return FileOutcome.builder()
                .name(name)
                .status(status)
                .originalSource(source)
                .source(source);
    }
}
