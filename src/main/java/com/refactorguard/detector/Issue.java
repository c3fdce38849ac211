package com.refactorguard.detector;

import com.github.javaparser.ast.Node;
import com.refactorguard.parser.SourcePosition;

/**
 * A candidate site reported by a detector. Carries no reference to the tree.
 */
public record Issue(SourcePosition position, String message, DetectorKind detectorKind) {

    public static Issue at(Node node, DetectorKind kind) {
        return new Issue(SourcePosition.of(node), kind.message(), kind);
    }

    public int line() {
        return position.line();
    }

    @Override
    public String toString() {
        return "Line " + position.line() + ": " + message;
    }
}
