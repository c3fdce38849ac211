package com.refactorguard.transform.rules;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.type.UnknownType;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node builders shared by the rules.
 */
final class Expressions {

    private Expressions() {
    }

    /** Parenthesizes {@code expr} unless it can be the scope of a method call as is. */
    static Expression asScope(Expression expr) {
        if (expr instanceof NameExpr
                || expr instanceof FieldAccessExpr
                || expr instanceof MethodCallExpr
                || expr instanceof ArrayAccessExpr
                || expr instanceof ObjectCreationExpr
                || expr instanceof EnclosedExpr
                || expr instanceof ThisExpr) {
            return expr;
        }
        return new EnclosedExpr(expr);
    }

    /** Parenthesizes {@code expr} when it binds looser than {@code &&}. */
    static Expression asConjunct(Expression expr) {
        boolean looser = (expr instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.OR)
                || expr instanceof ConditionalExpr
                || expr instanceof AssignExpr
                || expr instanceof LambdaExpr;
        return looser ? new EnclosedExpr(expr) : expr;
    }

    static LambdaExpr lambda(String parameter, Expression body) {
        return new LambdaExpr(
                new NodeList<>(new Parameter(new UnknownType(), parameter)),
                new ExpressionStmt(body),
                false);
    }

    /** {@code () -> body} */
    static LambdaExpr supplier(Expression body) {
        return new LambdaExpr(new NodeList<>(), new ExpressionStmt(body), true);
    }

    /** {@code () -> { ... }} */
    static LambdaExpr closure(BlockStmt body) {
        return new LambdaExpr(new NodeList<>(), body, true);
    }

    static LambdaExpr noOp() {
        return closure(new BlockStmt());
    }

    /**
     * First of {@code base}, {@code base2}, {@code base3}, ... that no name in
     * the tree containing {@code anchor} uses yet.
     */
    static String freshName(Node anchor, String base) {
        Set<String> taken = anchor.findRootNode().findAll(SimpleName.class).stream()
                .map(SimpleName::getIdentifier)
                .collect(Collectors.toSet());
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.contains(base + suffix)) {
            suffix++;
        }
        return base + suffix;
    }
}
