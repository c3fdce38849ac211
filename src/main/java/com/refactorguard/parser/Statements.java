package com.refactorguard.parser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.List;

public final class Statements {

    private Statements() {
    }

    /**
     * The ordered statement sequence of a loop/if body: a block's statements,
     * or the single statement itself when written without braces.
     */
    public static List<Statement> bodyOf(Statement body) {
        if (body instanceof BlockStmt block) {
            return block.getStatements();
        }
        return List.of(body);
    }

    /** True when {@code node} sits in the {@code else} slot of {@code parent}. */
    public static boolean isElseBranchOf(Node node, IfStmt parent) {
        return parent.getElseStmt().filter(e -> e == node).isPresent();
    }
}
