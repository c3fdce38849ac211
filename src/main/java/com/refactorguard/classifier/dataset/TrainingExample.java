package com.refactorguard.classifier.dataset;

/**
 * One labelled rewrite: {@code errorIntroduced} is 1 when the rewrite broke
 * the code.
 */
public record TrainingExample(String codeBefore, String codeAfter, int errorIntroduced) {
}
