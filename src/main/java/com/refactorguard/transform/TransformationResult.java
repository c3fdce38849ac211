package com.refactorguard.transform;

import com.refactorguard.parser.SyntaxTree;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Result of one orchestrator pass:
 *  - the rewritten tree (a separate copy, the input tree is untouched)
 *  - its source text
 *  - the log of every rule invocation
 */
@AllArgsConstructor
@Getter
public class TransformationResult {
    private final SyntaxTree tree;
    private final String source;
    private final List<RewriteRecord> log;

    public long appliedCount() {
        return log.stream().filter(RewriteRecord::applied).count();
    }

    public boolean isChanged() {
        return appliedCount() > 0;
    }
}
