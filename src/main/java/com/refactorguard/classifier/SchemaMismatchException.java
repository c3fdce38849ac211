package com.refactorguard.classifier;

/**
 * The persisted model was trained on different features, or written in a
 * different format, than this build extracts.
 */
public class SchemaMismatchException extends RuntimeException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
