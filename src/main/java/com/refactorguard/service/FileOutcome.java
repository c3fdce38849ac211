package com.refactorguard.service;

import com.refactorguard.detector.IssueReport;
import com.refactorguard.transform.RewriteRecord;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.OptionalDouble;

/**
 * What happened to one program unit. {@link #getSource()} is the text to
 * write out: the rewritten text when the status is {@link Status#REFACTORED},
 * the original text otherwise.
 */
@Getter
@Builder
public class FileOutcome {

    public enum Status {
        /** Nothing to rewrite. */
        UNCHANGED,
        REFACTORED,
        /** Rewrites applied but judged too risky; original kept. */
        REJECTED_BY_GATE,
        PARSE_FAILURE,
        /** The stored model does not fit; original kept. */
        CLASSIFICATION_FAILED
    }

    private final String name;
    private final Status status;
    private final String originalSource;
    private final String source;
    @Builder.Default
    private final IssueReport issues = IssueReport.empty();
    @Builder.Default
    private final List<RewriteRecord> rewrites = List.of();
    /** Risk estimate, NaN when the gate was not consulted. */
    @Builder.Default
    private final double risk = Double.NaN;
    @Builder.Default
    private final String diff = "";
    private final String error;

    public OptionalDouble risk() {
        return Double.isNaN(risk) ? OptionalDouble.empty() : OptionalDouble.of(risk);
    }

    public boolean isChanged() {
        return status == Status.REFACTORED;
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        result.append(name).append(": ").append(status);
        if (status == Status.REFACTORED) {
            long applied = rewrites.stream().filter(RewriteRecord::applied).count();
            result.append(" (").append(applied).append(applied == 1 ? " rewrite" : " rewrites").append(")");
        }
        risk().ifPresent(p -> result.append(String.format(" risk=%.2f", p)));
        if (error != null) {
            result.append(" - ").append(error);
        }
        return result.toString();
    }
}
