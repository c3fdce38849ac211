package com.refactorguard.detector;

import com.refactorguard.detector.patterns.ConditionalChainDetector;
import com.refactorguard.detector.patterns.LoopToCollectionDetector;
import com.refactorguard.detector.patterns.NestedConditionalDetector;
import com.refactorguard.parser.SyntaxTree;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Registry of the detectors, kept in report order.
 */
public class PatternDetectors {

    private final List<PatternDetector> detectors;

    public PatternDetectors(List<PatternDetector> detectors) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(PatternDetector::kind))
                .collect(Collectors.toUnmodifiableList());
    }

    public static PatternDetectors standard() {
        return new PatternDetectors(List.of(
                new LoopToCollectionDetector(),
                new NestedConditionalDetector(),
                new ConditionalChainDetector()
        ));
    }

    public List<PatternDetector> getDetectors() {
        return detectors;
    }

    public IssueReport detect(SyntaxTree tree) {
        IssueReport report = new IssueReport();
        for (PatternDetector detector : detectors) {
            report.addAll(detector.kind(), detector.detect(tree));
        }
        return report;
    }
}
