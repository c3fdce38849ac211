package com.refactorguard.service;

import com.refactorguard.classifier.ModelNotFoundException;
import com.refactorguard.classifier.RiskClassifier;
import com.refactorguard.classifier.RiskGate;
import com.refactorguard.classifier.SchemaMismatchException;
import com.refactorguard.config.RefactoringConfig;
import com.refactorguard.detector.PatternDetectors;
import com.refactorguard.parser.SourceParser;
import com.refactorguard.transform.BranchBodyPolicy;
import com.refactorguard.transform.TransformationOrchestrator;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RefactoringServiceTest {

    private static final String LOOP = """
            import java.util.List;

            class T {
                List<Integer> doubled(List<Integer> items, List<Integer> result) {
                    for (int i : items) {
                        result.add(i * 2);
                    }
                    return result;
                }
            }
            """;

    private final SourceParser parser = new SourceParser();
    private final RiskClassifier classifier = mock(RiskClassifier.class);

    private RefactoringService service(boolean gateEnabled) {
        RefactoringConfig config = RefactoringConfig.builder()
                .riskGateEnabled(gateEnabled)
                .outputDir(Path.of("out"))
                .build();
        return new RefactoringService(config, parser, PatternDetectors.standard(),
                TransformationOrchestrator.standard(parser, BranchBodyPolicy.PLACEHOLDER),
                classifier, new RiskGate(config.getRiskThreshold()));
    }

    @Test
    void refactorsWithoutConsultingDisabledGate() {
        FileOutcome outcome = service(false).process("src/T.java", LOOP);

        assertThat(outcome.getStatus()).isEqualTo(FileOutcome.Status.REFACTORED);
        assertThat(outcome.isChanged()).isTrue();
        assertThat(outcome.getSource()).contains(".stream()").doesNotContain("for (int i");
        assertThat(outcome.getOriginalSource()).isSameAs(LOOP);
        assertThat(outcome.risk()).isEmpty();
        assertThat(outcome.getIssues().isEmpty()).isFalse();
        assertThat(outcome.getDiff()).startsWith("--- src/T.java\n+++ out/T.java\n");
        verifyNoInteractions(classifier);
    }

    @Test
    void riskyRewriteKeepsOriginal() throws Exception {
        when(classifier.riskOf(eq(LOOP), anyString())).thenReturn(0.9);

        FileOutcome outcome = service(true).process("T.java", LOOP);

        assertThat(outcome.getStatus()).isEqualTo(FileOutcome.Status.REJECTED_BY_GATE);
        assertThat(outcome.getSource()).isSameAs(LOOP);
        assertThat(outcome.risk()).hasValue(0.9);
        assertThat(outcome.getRewrites()).isNotEmpty();
        assertThat(outcome.toString()).contains("risk=0.90");
    }

    @Test
    void safeRewriteIsKept() throws Exception {
        when(classifier.riskOf(eq(LOOP), anyString())).thenReturn(0.1);

        FileOutcome outcome = service(true).process("T.java", LOOP);

        assertThat(outcome.getStatus()).isEqualTo(FileOutcome.Status.REFACTORED);
        assertThat(outcome.risk()).hasValue(0.1);
        assertThat(outcome.getDiff()).contains("+");
    }

    @Test
    void missingModelSwitchesGateOffOnce() throws Exception {
        when(classifier.riskOf(anyString(), anyString())).thenThrow(new ModelNotFoundException(Path.of("m.json")));
        RefactoringService service = service(true);

        FileOutcome first = service.process("A.java", LOOP);
        FileOutcome second = service.process("B.java", LOOP);

        assertThat(first.getStatus()).isEqualTo(FileOutcome.Status.REFACTORED);
        assertThat(second.getStatus()).isEqualTo(FileOutcome.Status.REFACTORED);
        assertThat(service.isGateActive()).isFalse();
        verify(classifier, times(1)).riskOf(anyString(), anyString());
    }

    @Test
    void incompatibleModelFailsTheFile() throws Exception {
        when(classifier.riskOf(anyString(), anyString())).thenThrow(new SchemaMismatchException("wrong features"));

        FileOutcome outcome = service(true).process("T.java", LOOP);

        assertThat(outcome.getStatus()).isEqualTo(FileOutcome.Status.CLASSIFICATION_FAILED);
        assertThat(outcome.getSource()).isSameAs(LOOP);
        assertThat(outcome.getError()).isEqualTo("wrong features");
    }

    @Test
    void unparseableFileIsReportedAndKept() {
        String broken = "class T { void m( { }";

        FileOutcome outcome = service(true).process("T.java", broken);

        assertThat(outcome.getStatus()).isEqualTo(FileOutcome.Status.PARSE_FAILURE);
        assertThat(outcome.getSource()).isSameAs(broken);
        assertThat(outcome.getError()).isNotBlank();
        verifyNoInteractions(classifier);
    }

    @Test
    void cleanFileIsUnchanged() {
        String clean = "class T { int twice(int x) { return x * 2; } }";

        FileOutcome outcome = service(true).process("T.java", clean);

        assertThat(outcome.getStatus()).isEqualTo(FileOutcome.Status.UNCHANGED);
        assertThat(outcome.getIssues().isEmpty()).isTrue();
        assertThat(outcome.getDiff()).isEmpty();
        verifyNoInteractions(classifier);
    }

    @Test
    void declinedRewritesLeaveFileUnchanged() {
        String chain = """
                class T {
                    void m(int x) {
                        if (x == 1) {
                            a();
                        } else if (x == 1) {
                            b();
                        } else if (x == 3) {
                            c();
                        }
                    }
                }
                """;

        FileOutcome outcome = service(true).process("T.java", chain);

        assertThat(outcome.getStatus()).isEqualTo(FileOutcome.Status.UNCHANGED);
        assertThat(outcome.getIssues().isEmpty()).isFalse();
        assertThat(outcome.getRewrites()).singleElement().satisfies(entry -> assertThat(entry.applied()).isFalse());
        verifyNoInteractions(classifier);
    }
}
