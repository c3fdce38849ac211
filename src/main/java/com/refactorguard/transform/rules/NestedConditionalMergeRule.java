package com.refactorguard.transform.rules;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.parser.Statements;
import com.refactorguard.transform.MismatchReason;
import com.refactorguard.transform.TransformOutcome;
import com.refactorguard.transform.TransformationRule;

import java.util.List;
import java.util.Set;

/**
 * Merges {@code if (a) { if (b) body }} into {@code if (a && b) body}.
 * The outer {@code else} is kept. An inner {@code else} would be lost, so such
 * pairs are declined.
 */
public class NestedConditionalMergeRule implements TransformationRule {

    @Override
    public DetectorKind kind() {
        return DetectorKind.NESTED_CONDITIONAL;
    }

    @Override
    public TransformOutcome apply(Node node) {
        if (!(node instanceof IfStmt outer)) {
            return TransformOutcome.unchanged(MismatchReason.UNSUPPORTED_NODE,
                    "Expected an if-statement but got " + node.getClass().getSimpleName() + ".");
        }

        List<Statement> body = Statements.bodyOf(outer.getThenStmt());
        if (body.size() != 1 || !body.get(0).isIfStmt()) {
            return TransformOutcome.unchanged(MismatchReason.BODY_NOT_CONDITIONAL,
                    "The if-node does not contain a nested if-statement as a single body element.");
        }

        IfStmt inner = body.get(0).asIfStmt();
        if (inner.getElseStmt().isPresent()) {
            return TransformOutcome.unchanged(MismatchReason.INNER_HAS_ELSE_BRANCH,
                    "The nested if-statement has its own else-branch, merging would drop it.");
        }

        Expression combined = new BinaryExpr(
                Expressions.asConjunct(outer.getCondition().clone()),
                Expressions.asConjunct(inner.getCondition().clone()),
                BinaryExpr.Operator.AND);
        IfStmt merged = new IfStmt(
                combined,
                inner.getThenStmt().clone(),
                outer.getElseStmt().map(Statement::clone).orElse(null));
        return TransformOutcome.replaced(merged, Set.of());
    }
}
