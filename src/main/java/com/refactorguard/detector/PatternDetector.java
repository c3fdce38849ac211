package com.refactorguard.detector;

import com.github.javaparser.ast.Node;
import com.refactorguard.parser.NodeKind;
import com.refactorguard.parser.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless, read-only scanner for one anti-pattern.
 */
public interface PatternDetector {

    DetectorKind kind();

    /** The only node kind this detector can match. */
    NodeKind siteKind();

    /** Site predicate, shared with the orchestrator to pick rewrite candidates. */
    boolean matches(Node node);

    /**
     * Walks the whole tree in pre-order, visiting every node once.
     */
    default List<Issue> detect(SyntaxTree tree) {
        List<Issue> issues = new ArrayList<>();
        tree.getCompilationUnit().walk(Node.TreeTraversal.PREORDER, node -> {
            if (matches(node)) {
                issues.add(Issue.at(node, kind()));
            }
        });
        return issues;
    }
}
