package com.refactorguard.transform;

/**
 * Why a rule declined to rewrite a node.
 */
public enum MismatchReason {
    UNSUPPORTED_NODE,
    BODY_NOT_SINGLE_STATEMENT,
    NOT_APPEND_CALL,
    RECEIVER_NOT_IDENTIFIER,
    BODY_NOT_CONDITIONAL,
    INNER_HAS_ELSE_BRANCH,
    NOT_EQUALITY_COMPARISON,
    SUBJECT_NOT_IDENTIFIER,
    SUBJECT_NOT_SHARED,
    COMPARATOR_NOT_CONSTANT,
    DUPLICATE_CONSTANT,
    KEY_TYPE_MISMATCH,
    NO_EQUALITY_BRANCH,
    BRANCH_BODY_NOT_EXPRESSION
}
