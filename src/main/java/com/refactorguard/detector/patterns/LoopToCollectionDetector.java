package com.refactorguard.detector.patterns;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.detector.PatternDetector;
import com.refactorguard.parser.NodeKind;
import com.refactorguard.parser.Statements;

import java.util.List;
import java.util.Set;

/**
 * For-each loops whose body only feeds a collection:
 * <pre>
 *   for (T item : items) { result.add(f(item)); }
 *   for (T item : items) { total += item; }
 * </pre>
 */
public class LoopToCollectionDetector implements PatternDetector {

    public static final Set<String> APPEND_METHODS = Set.of("add");

    @Override
    public DetectorKind kind() {
        return DetectorKind.LOOP_TO_COLLECTION;
    }

    @Override
    public NodeKind siteKind() {
        return NodeKind.LOOP;
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof ForEachStmt loop)) {
            return false;
        }
        List<Statement> body = Statements.bodyOf(loop.getBody());
        if (body.size() != 1 || !body.get(0).isExpressionStmt()) {
            return false;
        }
        Expression expr = body.get(0).asExpressionStmt().getExpression();
        return isAppendCall(expr) || isCombineAssignment(expr);
    }

    static boolean isAppendCall(Expression expr) {
        if (!(expr instanceof MethodCallExpr call)) {
            return false;
        }
        return APPEND_METHODS.contains(call.getNameAsString())
                && call.getArguments().size() == 1
                && call.getScope().filter(Expression::isNameExpr).isPresent();
    }

    // x += e, x -= e, ...
    static boolean isCombineAssignment(Expression expr) {
        return expr instanceof AssignExpr assign
                && assign.getOperator() != AssignExpr.Operator.ASSIGN;
    }
}
