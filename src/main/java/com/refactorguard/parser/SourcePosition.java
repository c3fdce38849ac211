package com.refactorguard.parser;

import com.github.javaparser.ast.Node;

/**
 * Line/column tag of a node, 1-based as JavaParser reports them.
 * Nodes created by a rewrite carry no range and map to {@link #UNKNOWN}.
 */
public record SourcePosition(int line, int column) {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    public static SourcePosition of(Node node) {
        return node.getBegin()
                .map(p -> new SourcePosition(p.line, p.column))
                .orElse(UNKNOWN);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
