package com.refactorguard.parser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.IfStmt;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed classification of JavaParser nodes into the kinds the detectors,
 * rules and feature extractor reason about. Consumers switch over this enum
 * without a default branch, so a new kind breaks compilation until every
 * consumer handles it.
 */
public enum NodeKind {
    LOOP,
    CONDITIONAL,
    CALL,
    ASSIGNMENT,
    BINARY_OP,
    COMPARISON,
    IDENTIFIER,
    CONSTANT,
    BLOCK,
    LAMBDA,
    MAPPING,
    OTHER;

    private static final Set<BinaryExpr.Operator> COMPARISONS = EnumSet.of(
            BinaryExpr.Operator.EQUALS,
            BinaryExpr.Operator.NOT_EQUALS,
            BinaryExpr.Operator.LESS,
            BinaryExpr.Operator.LESS_EQUALS,
            BinaryExpr.Operator.GREATER,
            BinaryExpr.Operator.GREATER_EQUALS
    );

    private static final Set<String> MAP_FACTORIES = Set.of("of", "ofEntries", "copyOf");

    public static NodeKind of(Node node) {
        if (node instanceof ForEachStmt) {
            return LOOP;
        }
        if (node instanceof IfStmt) {
            return CONDITIONAL;
        }
        if (node instanceof MethodCallExpr call) {
            return isMapFactory(call) ? MAPPING : CALL;
        }
        if (node instanceof AssignExpr) {
            return ASSIGNMENT;
        }
        if (node instanceof BinaryExpr binary) {
            return COMPARISONS.contains(binary.getOperator()) ? COMPARISON : BINARY_OP;
        }
        if (node instanceof NameExpr) {
            return IDENTIFIER;
        }
        if (node instanceof LiteralExpr) {
            return CONSTANT;
        }
        if (node instanceof BlockStmt) {
            return BLOCK;
        }
        if (node instanceof LambdaExpr) {
            return LAMBDA;
        }
        return OTHER;
    }

    // Map.of(...), Map.ofEntries(...), Map.copyOf(...)
    private static boolean isMapFactory(MethodCallExpr call) {
        return MAP_FACTORIES.contains(call.getNameAsString())
                && call.getScope()
                .filter(scope -> scope.isNameExpr() && "Map".equals(scope.asNameExpr().getNameAsString()))
                .isPresent();
    }
}
