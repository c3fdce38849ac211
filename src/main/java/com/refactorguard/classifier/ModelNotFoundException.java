package com.refactorguard.classifier;

import java.nio.file.Path;

/**
 * No model is loaded and none is persisted at the configured location.
 */
public class ModelNotFoundException extends Exception {

    private final Path path;

    public ModelNotFoundException(Path path) {
        super("No trained model found at " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
