package com.refactorguard.transform;

import com.github.javaparser.ast.stmt.Statement;

import java.util.List;
import java.util.Set;

/**
 * Result of one rule invocation: either replacement statements or the reason
 * the node was left alone. Rules never throw to signal a mismatch.
 */
public interface TransformOutcome {

    boolean isReplaced();

    static TransformOutcome replaced(Statement statement, Set<String> requiredImports) {
        return new Replaced(List.of(statement), requiredImports, List.of());
    }

    static TransformOutcome unchanged(MismatchReason reason, String detail) {
        return new Unchanged(reason, detail);
    }

    /**
     * @param statements      replacement, spliced in place of the matched statement
     * @param requiredImports imports the replacement relies on
     * @param notes           information lost by the rewrite, surfaced as warnings
     */
    record Replaced(List<Statement> statements, Set<String> requiredImports, List<String> notes)
            implements TransformOutcome {

        public Replaced {
            if (statements.isEmpty()) {
                throw new IllegalArgumentException("A replacement needs at least one statement");
            }
            statements = List.copyOf(statements);
            requiredImports = Set.copyOf(requiredImports);
            notes = List.copyOf(notes);
        }

        @Override
        public boolean isReplaced() {
            return true;
        }
    }

    record Unchanged(MismatchReason reason, String detail) implements TransformOutcome {

        @Override
        public boolean isReplaced() {
            return false;
        }
    }
}
