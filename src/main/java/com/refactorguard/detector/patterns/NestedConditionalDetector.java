package com.refactorguard.detector.patterns;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.detector.PatternDetector;
import com.refactorguard.parser.NodeKind;
import com.refactorguard.parser.Statements;

import java.util.List;

/**
 * An {@code if} whose body is nothing but another {@code if}. Checks one
 * level only; a deeper nest shows up again once the outer pair is merged.
 */
public class NestedConditionalDetector implements PatternDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.NESTED_CONDITIONAL;
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
        List<Statement> body = Statements.bodyOf(ifStmt.getThenStmt());
        return body.size() == 1 && body.get(0).isIfStmt();
    }
}
