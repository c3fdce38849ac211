package com.refactorguard.transform;

import com.github.javaparser.ast.Node;
import com.refactorguard.detector.DetectorKind;

/**
 * Pure rewrite for one anti-pattern. Implementations re-validate the shape
 * themselves, never mutate the node they are given, and only place clones in
 * the replacement.
 */
public interface TransformationRule {

    DetectorKind kind();

    TransformOutcome apply(Node node);
}
