package com.refactorguard.detector;

/**
 * The anti-patterns the engine knows about. Declaration order is the order
 * issues are reported in.
 */
public enum DetectorKind {
    LOOP_TO_COLLECTION("For-loop can be converted to a list comprehension."),
    NESTED_CONDITIONAL("Nested if-statements can be merged."),
    CONDITIONAL_CHAIN("If-elif-else chain can be replaced with a dictionary.");

    private final String message;

    DetectorKind(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
