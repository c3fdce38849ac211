package com.refactorguard.transform;

import com.refactorguard.detector.DetectorKind;
import com.refactorguard.parser.SourcePosition;

import java.util.List;

/**
 * One rule invocation in the orchestrator's log.
 *
 * @param reason {@code null} for applied rewrites
 * @param notes  information an applied rewrite dropped
 */
public record RewriteRecord(
        SourcePosition position,
        DetectorKind kind,
        boolean applied,
        MismatchReason reason,
        String detail,
        List<String> notes
) {

    static RewriteRecord ofApplied(SourcePosition position, DetectorKind kind, List<String> notes) {
        return new RewriteRecord(position, kind, true, null, kind.message(), List.copyOf(notes));
    }

    static RewriteRecord ofSkipped(SourcePosition position, DetectorKind kind, TransformOutcome.Unchanged outcome) {
        return new RewriteRecord(position, kind, false, outcome.reason(), outcome.detail(), List.of());
    }

    @Override
    public String toString() {
        return (applied ? "Applied " : "Skipped ") + kind + " at line " + position.line() + ": " + detail;
    }
}
