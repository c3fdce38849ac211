package com.refactorguard.detector.patterns;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.detector.PatternDetector;
import com.refactorguard.parser.NodeKind;
import com.refactorguard.parser.Statements;

import java.util.Optional;

/**
 * Heads of {@code if / else if} chains that compare one identifier against
 * literals:
 * <pre>
 *   if (x == 1) a(); else if (x == 2) b(); else if (x == 3) c(); else d();
 * </pre>
 * Reported only from {@value #MIN_CHAIN_LENGTH} equality branches on; the
 * trailing plain {@code else} does not count. The {@code else if} links of a
 * chain are not chain heads themselves.
 */
public class ConditionalChainDetector implements PatternDetector {

    public static final int MIN_CHAIN_LENGTH = 3;

    @Override
    public DetectorKind kind() {
        return DetectorKind.CONDITIONAL_CHAIN;
    }

    @Override
    public NodeKind siteKind() {
        return NodeKind.CONDITIONAL;
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof IfStmt ifStmt)) {
            return false;
        }
        return isChainHead(ifStmt) && chainLength(ifStmt) >= MIN_CHAIN_LENGTH;
    }

    /**
     * Number of equality branches starting at {@code head}, or 0 when any
     * {@code else if} in the chain breaks the shape.
     */
    public static int chainLength(IfStmt head) {
        Optional<String> subject = subjectOf(head);
        if (subject.isEmpty()) {
            return 0;
        }
        int length = 0;
        IfStmt current = head;
        while (current != null) {
            if (!subject.equals(subjectOf(current))) {
                return 0;
            }
            length++;
            Optional<Statement> alternative = current.getElseStmt();
            current = alternative.filter(Statement::isIfStmt).map(Statement::asIfStmt).orElse(null);
        }
        return length;
    }

    /** The compared identifier when the condition reads {@code name == literal}. */
    public static Optional<String> subjectOf(IfStmt ifStmt) {
        Expression condition = ifStmt.getCondition();
        if (!(condition instanceof BinaryExpr comparison)
                || comparison.getOperator() != BinaryExpr.Operator.EQUALS) {
            return Optional.empty();
        }
        if (!comparison.getLeft().isNameExpr() || !isConstant(comparison.getRight())) {
            return Optional.empty();
        }
        return Optional.of(comparison.getLeft().asNameExpr().getNameAsString());
    }

    /** Literal usable as a map key; {@code null} is not. */
    public static boolean isConstant(Expression expr) {
        return expr.isLiteralExpr() && !expr.isNullLiteralExpr();
    }

    private static boolean isChainHead(IfStmt ifStmt) {
        return ifStmt.getParentNode()
                .filter(IfStmt.class::isInstance)
                .map(IfStmt.class::cast)
                .filter(parent -> Statements.isElseBranchOf(ifStmt, parent))
                .map(parent -> subjectOf(parent).isEmpty() || !subjectOf(parent).equals(subjectOf(ifStmt)))
                .orElse(true);
    }
}
