package com.refactorguard.detector;

import org.junit.jupiter.api.Test;

import static com.refactorguard.detector.DetectorTestSupport.method;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

class PatternDetectorsTest {

    @Test
    void detectorsAreKeptInReportOrder() {
        assertThat(PatternDetectors.standard().getDetectors())
                .extracting(PatternDetector::kind)
                .containsExactly(DetectorKind.LOOP_TO_COLLECTION,
                        DetectorKind.NESTED_CONDITIONAL,
                        DetectorKind.CONDITIONAL_CHAIN);
    }

    @Test
    void reportGroupsByKindBeforeLine() {
        IssueReport report = PatternDetectors.standard().detect(method("""
                if (x == 1) {
                    a();
                } else if (x == 2) {
                    b();
                } else if (x == 3) {
                    c();
                }
                if (p) {
                    if (q) {
                        d();
                    }
                }
                for (int i : items) {
                    out.add(i);
                }"""));

        assertThat(report.size()).isEqualTo(3);
        assertThat(report.all())
                .extracting(Issue::detectorKind, Issue::line)
                .containsExactly(
                        tuple(DetectorKind.LOOP_TO_COLLECTION, 15),
                        tuple(DetectorKind.NESTED_CONDITIONAL, 10),
                        tuple(DetectorKind.CONDITIONAL_CHAIN, 3));
        assertThat(report.of(DetectorKind.NESTED_CONDITIONAL)).hasSize(1);
    }

    @Test
    void cleanSourceGivesEmptyReport() {
        IssueReport report = PatternDetectors.standard().detect(method("int a = 1;"));

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.all()).isEmpty();
    }
}
