package com.refactorguard.transform.rules;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.detector.patterns.LoopToCollectionDetector;
import com.refactorguard.parser.Statements;
import com.refactorguard.transform.MismatchReason;
import com.refactorguard.transform.TransformOutcome;
import com.refactorguard.transform.TransformationRule;

import java.util.List;
import java.util.Set;

/**
 * Turns an appending for-each loop into a stream collection:
 * <pre>
 *   for (int i : range) {            result = range.stream()
 *       result.add(i * 2);     -->            .map(i -> i * 2)
 *   }                                         .collect(Collectors.toList());
 * </pre>
 */
public class LoopToComprehensionRule implements TransformationRule {

    static final String COLLECTORS_IMPORT = "java.util.stream.Collectors";

    @Override
    public DetectorKind kind() {
        return DetectorKind.LOOP_TO_COLLECTION;
    }

    @Override
    public TransformOutcome apply(Node node) {
        if (!(node instanceof ForEachStmt loop)) {
            return TransformOutcome.unchanged(MismatchReason.UNSUPPORTED_NODE,
                    "Expected a for-each loop but got " + node.getClass().getSimpleName() + ".");
        }

        List<Statement> body = Statements.bodyOf(loop.getBody());
        if (body.size() != 1) {
            return TransformOutcome.unchanged(MismatchReason.BODY_NOT_SINGLE_STATEMENT,
                    "The for-loop does not match the expected pattern (single statement in body).");
        }

        Statement stmt = body.get(0);
        if (!stmt.isExpressionStmt() || !stmt.asExpressionStmt().getExpression().isMethodCallExpr()) {
            return TransformOutcome.unchanged(MismatchReason.NOT_APPEND_CALL,
                    "The for-loop body does not contain an append call.");
        }

        MethodCallExpr call = stmt.asExpressionStmt().getExpression().asMethodCallExpr();
        if (!LoopToCollectionDetector.APPEND_METHODS.contains(call.getNameAsString())
                || call.getArguments().size() != 1
                || call.getScope().isEmpty()) {
            return TransformOutcome.unchanged(MismatchReason.NOT_APPEND_CALL,
                    "The for-loop body does not contain a valid append call.");
        }

        Expression receiver = call.getScope().get();
        if (!receiver.isNameExpr()) {
            return TransformOutcome.unchanged(MismatchReason.RECEIVER_NOT_IDENTIFIER,
                    "The append call is not on a simple variable.");
        }

        String resultName = receiver.asNameExpr().getNameAsString();
        String itemName = loop.getVariableDeclarator().getNameAsString();
        Expression appended = call.getArgument(0).clone();
        Expression iterable = Expressions.asScope(loop.getIterable().clone());

        MethodCallExpr mapped = new MethodCallExpr(
                new MethodCallExpr(iterable, "stream"),
                "map",
                new NodeList<>(Expressions.lambda(itemName, appended)));
        MethodCallExpr collected = new MethodCallExpr(
                mapped,
                "collect",
                new NodeList<>(new MethodCallExpr(new NameExpr("Collectors"), "toList")));

        Statement assignment = new ExpressionStmt(
                new AssignExpr(new NameExpr(resultName), collected, AssignExpr.Operator.ASSIGN));
        return TransformOutcome.replaced(assignment, Set.of(COLLECTORS_IMPORT));
    }
}
