package com.refactorguard.features;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;

import java.util.ArrayList;
import java.util.List;

/**
 * McCabe complexity, averaged over the callables of a snippet.
 */
final class CyclomaticComplexity {

    private CyclomaticComplexity() {
    }

    static double average(Node root) {
        List<Node> callables = new ArrayList<>();
        root.walk(node -> {
            if (isCallable(node)) {
                callables.add(node);
            }
        });
        if (callables.isEmpty()) {
            // loose statements: one implicit callable, if it decides anything
            int decisions = decisions(root);
            return decisions == 0 ? 0 : 1 + decisions;
        }
        return callables.stream().mapToInt(c -> 1 + decisions(c)).average().orElse(0);
    }

    private static boolean isCallable(Node node) {
        return node instanceof CallableDeclaration || node instanceof InitializerDeclaration;
    }

    /** Decision points below {@code callable}, not counting nested callables. */
    private static int decisions(Node callable) {
        int count = 0;
        for (Node child : callable.getChildNodes()) {
            if (isCallable(child)) {
                continue;
            }
            count += weight(child) + decisions(child);
        }
        return count;
    }

    private static int weight(Node node) {
        if (node instanceof IfStmt
                || node instanceof ForStmt
                || node instanceof ForEachStmt
                || node instanceof WhileStmt
                || node instanceof DoStmt
                || node instanceof CatchClause
                || node instanceof ConditionalExpr) {
            return 1;
        }
        if (node instanceof SwitchEntry entry) {
            return entry.getLabels().size();
        }
        if (node instanceof BinaryExpr binary) {
            BinaryExpr.Operator op = binary.getOperator();
            return op == BinaryExpr.Operator.AND || op == BinaryExpr.Operator.OR ? 1 : 0;
        }
        return 0;
    }
}
