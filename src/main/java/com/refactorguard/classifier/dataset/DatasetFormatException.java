package com.refactorguard.classifier.dataset;

/**
 * The training CSV lacks a required column or holds a label other than 0 or 1.
 */
public class DatasetFormatException extends RuntimeException {

    public DatasetFormatException(String message) {
        super(message);
    }
}
